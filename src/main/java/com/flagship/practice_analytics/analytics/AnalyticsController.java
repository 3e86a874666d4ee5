package com.flagship.practice_analytics.analytics;

import com.flagship.practice_analytics.analytics.dto.DebtorAnalyticsResponse;
import com.flagship.practice_analytics.analytics.dto.TaskBalancesResponse;
import com.flagship.practice_analytics.analytics.dto.WipGraphResponse;
import com.flagship.practice_analytics.observability.CorrelationContext;
import com.flagship.practice_analytics.scope.AnalyticsScope;
import com.flagship.practice_analytics.wip.Resolution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Read-only analytics endpoints.
 *
 * The optional resolution parameter (low, standard, high) picks how many points
 * each graph series is downsampled to.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AnalyticsController {

    private final WipAnalyticsService wipAnalyticsService;
    private final DebtorAnalyticsService debtorAnalyticsService;

    @GetMapping("/clients/{clientId}/analytics/graphs")
    public ResponseEntity<WipGraphResponse> getClientGraphs(
            @PathVariable("clientId") UUID clientId,
            @RequestParam(value = "resolution", required = false) String resolution) {

        CorrelationContext.tagScope(AnalyticsScope.client(clientId));
        log.info("Received client graph request: resolution={}", resolution);
        return ResponseEntity.ok(wipAnalyticsService.getClientGraphs(clientId, Resolution.fromParam(resolution)));
    }

    @GetMapping("/groups/{groupCode}/analytics/graphs")
    public ResponseEntity<WipGraphResponse> getGroupGraphs(
            @PathVariable("groupCode") String groupCode,
            @RequestParam(value = "resolution", required = false) String resolution) {

        CorrelationContext.tagScope(AnalyticsScope.group(groupCode));
        log.info("Received group graph request: resolution={}", resolution);
        return ResponseEntity.ok(wipAnalyticsService.getGroupGraphs(groupCode, Resolution.fromParam(resolution)));
    }

    @GetMapping("/tasks/{taskId}/analytics/graphs")
    public ResponseEntity<WipGraphResponse> getTaskGraphs(
            @PathVariable("taskId") UUID taskId,
            @RequestParam(value = "resolution", required = false) String resolution) {

        CorrelationContext.tagScope(AnalyticsScope.task(taskId));
        log.info("Received task graph request: resolution={}", resolution);
        return ResponseEntity.ok(wipAnalyticsService.getTaskGraphs(taskId, Resolution.fromParam(resolution)));
    }

    @GetMapping("/tasks/{taskId}/balances")
    public ResponseEntity<TaskBalancesResponse> getTaskBalances(@PathVariable("taskId") UUID taskId) {
        CorrelationContext.tagScope(AnalyticsScope.task(taskId));
        return ResponseEntity.ok(wipAnalyticsService.getTaskBalances(taskId));
    }

    @GetMapping("/clients/{clientId}/debtors")
    public ResponseEntity<DebtorAnalyticsResponse> getClientDebtors(@PathVariable("clientId") UUID clientId) {
        CorrelationContext.tagScope(AnalyticsScope.client(clientId));
        return ResponseEntity.ok(debtorAnalyticsService.getClientDebtors(clientId));
    }
}
