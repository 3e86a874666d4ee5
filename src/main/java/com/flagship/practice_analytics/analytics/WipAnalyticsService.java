package com.flagship.practice_analytics.analytics;

import com.flagship.practice_analytics.analytics.dto.TaskBalancesResponse;
import com.flagship.practice_analytics.analytics.dto.WipGraphResponse;
import com.flagship.practice_analytics.cache.AnalyticsCache;
import com.flagship.practice_analytics.observability.AnalyticsMetrics;
import com.flagship.practice_analytics.scope.AnalyticsScope;
import com.flagship.practice_analytics.scope.ClientInfo;
import com.flagship.practice_analytics.scope.GroupInfo;
import com.flagship.practice_analytics.scope.ScopeNotFoundException;
import com.flagship.practice_analytics.scope.ScopeRepository;
import com.flagship.practice_analytics.scope.ScopeType;
import com.flagship.practice_analytics.scope.TaskInfo;
import com.flagship.practice_analytics.serviceline.MasterServiceLine;
import com.flagship.practice_analytics.serviceline.ServiceLinePartitioner;
import com.flagship.practice_analytics.serviceline.ServiceLineRepository;
import com.flagship.practice_analytics.wip.BalanceAggregator;
import com.flagship.practice_analytics.wip.DailyMetric;
import com.flagship.practice_analytics.wip.OpeningBalanceCalculator;
import com.flagship.practice_analytics.wip.Resolution;
import com.flagship.practice_analytics.wip.ResolutionPolicy;
import com.flagship.practice_analytics.wip.TimeSeriesDownsampler;
import com.flagship.practice_analytics.wip.TypeSum;
import com.flagship.practice_analytics.wip.WipBalanceCalculator;
import com.flagship.practice_analytics.wip.WipGraphData;
import com.flagship.practice_analytics.wip.WipTransaction;
import com.flagship.practice_analytics.wip.WipTransactionSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Builds WIP graphs and balances for clients, groups and tasks.
 *
 * Graphs cover a rolling window ending today. Every series starts from the
 * cumulative balance of everything dated before the window, so the running
 * balance on the last day equals the all-time balance. Client and group graphs
 * are also split by master service line; task graphs are not.
 */
@Service
@Slf4j
public class WipAnalyticsService {

    private static final String OPERATION_GRAPHS = "wip_graphs";
    private static final String OPERATION_BALANCES = "task_balances";

    private final ScopeRepository scopeRepository;
    private final WipTransactionSource transactionSource;
    private final ServiceLineRepository serviceLineRepository;
    private final BalanceAggregator aggregator;
    private final OpeningBalanceCalculator openingBalanceCalculator;
    private final TimeSeriesDownsampler downsampler;
    private final ResolutionPolicy resolutionPolicy;
    private final WipBalanceCalculator balanceCalculator;
    private final AnalyticsCache cache;
    private final AnalyticsMetrics metrics;
    private final Clock clock;
    private final int windowMonths;

    public WipAnalyticsService(ScopeRepository scopeRepository,
                               WipTransactionSource transactionSource,
                               ServiceLineRepository serviceLineRepository,
                               BalanceAggregator aggregator,
                               OpeningBalanceCalculator openingBalanceCalculator,
                               TimeSeriesDownsampler downsampler,
                               ResolutionPolicy resolutionPolicy,
                               WipBalanceCalculator balanceCalculator,
                               AnalyticsCache cache,
                               AnalyticsMetrics metrics,
                               Clock clock,
                               @Value("${analytics.graph.window-months:24}") int windowMonths) {
        this.scopeRepository = scopeRepository;
        this.transactionSource = transactionSource;
        this.serviceLineRepository = serviceLineRepository;
        this.aggregator = aggregator;
        this.openingBalanceCalculator = openingBalanceCalculator;
        this.downsampler = downsampler;
        this.resolutionPolicy = resolutionPolicy;
        this.balanceCalculator = balanceCalculator;
        this.cache = cache;
        this.metrics = metrics;
        this.clock = clock;
        this.windowMonths = windowMonths;
    }

    public WipGraphResponse getClientGraphs(UUID clientId, Resolution resolution) {
        ClientInfo client = scopeRepository.findClient(clientId)
            .orElseThrow(() -> new ScopeNotFoundException(ScopeType.CLIENT, clientId.toString()));

        AnalyticsScope scope = AnalyticsScope.client(clientId);
        return cached(scope, resolution, () -> buildServiceLineGraphs(
            scope, resolution, client.getClientCode(), client.getClientName(), null));
    }

    public WipGraphResponse getGroupGraphs(String groupCode, Resolution resolution) {
        AnalyticsScope scope = AnalyticsScope.group(groupCode);
        GroupInfo group = scopeRepository.findGroup(groupCode)
            .orElseThrow(() -> new ScopeNotFoundException(ScopeType.GROUP, groupCode));

        return cached(scope, resolution, () -> buildServiceLineGraphs(
            scope, resolution, group.getGroupCode(), group.getGroupDesc(), group.getClientCount()));
    }

    /**
     * Task graphs take their opening balance from per-type sums computed by the
     * source instead of loading every historical row.
     */
    public WipGraphResponse getTaskGraphs(UUID taskId, Resolution resolution) {
        TaskInfo task = scopeRepository.findTask(taskId)
            .orElseThrow(() -> new ScopeNotFoundException(ScopeType.TASK, taskId.toString()));

        AnalyticsScope scope = AnalyticsScope.task(taskId);
        return cached(scope, resolution, () -> {
            LocalDate endDate = LocalDate.now(clock);
            LocalDate startDate = endDate.minusMonths(windowMonths);
            int targetPoints = resolutionPolicy.targetPoints(resolution);

            List<TypeSum> typeSums = transactionSource.sumByTypeBefore(scope, startDate);
            BigDecimal openingBalance = openingBalanceCalculator.fromTypeSums(typeSums);
            List<WipTransaction> periodTransactions = transactionSource.findInWindow(scope, startDate, endDate);
            metrics.recordTransactionsProcessed(OPERATION_GRAPHS, periodTransactions.size());

            WipGraphData overall = downsample(aggregator.aggregate(periodTransactions, openingBalance), targetPoints);

            return WipGraphResponse.builder()
                .scopeType(ScopeType.TASK)
                .scopeId(taskId.toString())
                .code(task.getTaskCode())
                .name(task.getTaskDesc())
                .startDate(startDate)
                .endDate(endDate)
                .resolution(resolution.paramValue())
                .overall(overall)
                .byMasterServiceLine(Collections.emptyMap())
                .masterServiceLines(Collections.emptyList())
                .build();
        });
    }

    /**
     * Current WIP balance of a task split into its components. Always computed
     * from the full history, never cached.
     */
    public TaskBalancesResponse getTaskBalances(UUID taskId) {
        TaskInfo task = scopeRepository.findTask(taskId)
            .orElseThrow(() -> new ScopeNotFoundException(ScopeType.TASK, taskId.toString()));

        long startTime = System.currentTimeMillis();
        List<WipTransaction> transactions = transactionSource.findAll(AnalyticsScope.task(taskId));
        metrics.recordTransactionsProcessed(OPERATION_BALANCES, transactions.size());

        TaskBalancesResponse response = TaskBalancesResponse.builder()
            .taskId(task.getTaskId())
            .taskCode(task.getTaskCode())
            .taskDesc(task.getTaskDesc())
            .balances(balanceCalculator.calculate(transactions))
            .build();

        long duration = System.currentTimeMillis() - startTime;
        metrics.recordGenerationLatency(OPERATION_BALANCES, ScopeType.TASK.name(), duration);
        log.info("Task balances computed: transactions={}, duration={}ms", transactions.size(), duration);
        return response;
    }

    private WipGraphResponse buildServiceLineGraphs(AnalyticsScope scope,
                                                    Resolution resolution,
                                                    String code,
                                                    String name,
                                                    Integer clientCount) {
        LocalDate endDate = LocalDate.now(clock);
        LocalDate startDate = endDate.minusMonths(windowMonths);
        int targetPoints = resolutionPolicy.targetPoints(resolution);

        List<WipTransaction> openingTransactions = transactionSource.findBefore(scope, startDate);
        List<WipTransaction> periodTransactions = transactionSource.findInWindow(scope, startDate, endDate);
        metrics.recordTransactionsProcessed(OPERATION_GRAPHS, openingTransactions.size() + periodTransactions.size());

        BigDecimal openingBalance = openingBalanceCalculator.fromTransactions(openingTransactions);
        WipGraphData overall = aggregator.aggregate(periodTransactions, openingBalance);

        Map<String, String> externalToMaster = serviceLineRepository.findExternalToMasterMappings();
        Map<String, List<WipTransaction>> openingByMaster = ServiceLinePartitioner.partition(
            openingTransactions, WipTransaction::getServiceLineCode, externalToMaster);
        Map<String, List<WipTransaction>> periodByMaster = ServiceLinePartitioner.partition(
            periodTransactions, WipTransaction::getServiceLineCode, externalToMaster);

        // Only service lines with activity in the window get a series
        Map<String, WipGraphData> byMasterServiceLine = new LinkedHashMap<>();
        periodByMaster.forEach((masterCode, transactions) -> {
            BigDecimal lineOpening = openingBalanceCalculator.fromTransactions(
                openingByMaster.getOrDefault(masterCode, Collections.emptyList()));
            byMasterServiceLine.put(masterCode,
                downsample(aggregator.aggregate(transactions, lineOpening), targetPoints));
        });

        List<MasterServiceLine> masterServiceLines =
            serviceLineRepository.findMasterServiceLines(byMasterServiceLine.keySet());

        return WipGraphResponse.builder()
            .scopeType(scope.getType())
            .scopeId(scope.getIdentifier())
            .code(code)
            .name(name)
            .clientCount(clientCount)
            .startDate(startDate)
            .endDate(endDate)
            .resolution(resolution.paramValue())
            .overall(downsample(overall, targetPoints))
            .byMasterServiceLine(byMasterServiceLine)
            .masterServiceLines(masterServiceLines)
            .build();
    }

    private WipGraphData downsample(WipGraphData graph, int targetPoints) {
        List<DailyMetric> daily = graph.getDailyMetrics();
        List<DailyMetric> sampled = downsampler.downsample(daily, targetPoints);
        metrics.recordDownsample(daily.size(), sampled.size());
        return graph.withDailyMetrics(sampled);
    }

    private WipGraphResponse cached(AnalyticsScope scope,
                                    Resolution resolution,
                                    Supplier<WipGraphResponse> builder) {
        String key = AnalyticsCache.graphKey(scope, resolution);
        return cache.get(key, WipGraphResponse.class).orElseGet(() -> {
            long startTime = System.currentTimeMillis();
            WipGraphResponse response = builder.get();
            cache.put(key, response);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordGenerationLatency(OPERATION_GRAPHS, scope.getType().name(), duration);
            log.info("WIP graphs generated: resolution={}, days={}, serviceLines={}, duration={}ms",
                    resolution.paramValue(),
                    response.getOverall().getDailyMetrics().size(),
                    response.getByMasterServiceLine().size(),
                    duration);
            return response;
        });
    }
}
