package com.flagship.practice_analytics.analytics;

import com.flagship.practice_analytics.analytics.dto.DebtorAnalyticsResponse;
import com.flagship.practice_analytics.cache.AnalyticsCache;
import com.flagship.practice_analytics.debtor.DebtorAnalyzer;
import com.flagship.practice_analytics.debtor.DebtorMetrics;
import com.flagship.practice_analytics.debtor.DebtorTransaction;
import com.flagship.practice_analytics.debtor.DebtorTransactionSource;
import com.flagship.practice_analytics.observability.AnalyticsMetrics;
import com.flagship.practice_analytics.scope.AnalyticsScope;
import com.flagship.practice_analytics.scope.ClientInfo;
import com.flagship.practice_analytics.scope.ScopeNotFoundException;
import com.flagship.practice_analytics.scope.ScopeRepository;
import com.flagship.practice_analytics.scope.ScopeType;
import com.flagship.practice_analytics.serviceline.MasterServiceLine;
import com.flagship.practice_analytics.serviceline.ServiceLineRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Debtor balances, aging and payment speed of a client.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DebtorAnalyticsService {

    private static final String OPERATION = "client_debtors";

    private final ScopeRepository scopeRepository;
    private final DebtorTransactionSource transactionSource;
    private final ServiceLineRepository serviceLineRepository;
    private final DebtorAnalyzer analyzer;
    private final AnalyticsCache cache;
    private final AnalyticsMetrics metrics;
    private final Clock clock;

    public DebtorAnalyticsResponse getClientDebtors(UUID clientId) {
        ClientInfo client = scopeRepository.findClient(clientId)
            .orElseThrow(() -> new ScopeNotFoundException(ScopeType.CLIENT, clientId.toString()));

        String key = AnalyticsCache.debtorsKey(AnalyticsScope.client(clientId));
        return cache.get(key, DebtorAnalyticsResponse.class).orElseGet(() -> {
            long startTime = System.currentTimeMillis();
            DebtorAnalyticsResponse response = analyze(client);
            cache.put(key, response);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordGenerationLatency(OPERATION, ScopeType.CLIENT.name(), duration);
            log.info("Debtor analytics generated: transactions={}, serviceLines={}, duration={}ms",
                    response.getTransactionCount(), response.getByMasterServiceLine().size(), duration);
            return response;
        });
    }

    private DebtorAnalyticsResponse analyze(ClientInfo client) {
        LocalDate today = LocalDate.now(clock);
        List<DebtorTransaction> transactions = transactionSource.findByClient(client.getClientId());
        metrics.recordTransactionsProcessed(OPERATION, transactions.size());

        Map<String, String> externalToMaster = serviceLineRepository.findExternalToMasterMappings();
        DebtorMetrics overall = analyzer.analyze(transactions, today);
        Map<String, DebtorMetrics> byMasterServiceLine =
            analyzer.analyzeByServiceLine(transactions, externalToMaster, today);
        List<MasterServiceLine> masterServiceLines =
            serviceLineRepository.findMasterServiceLines(byMasterServiceLine.keySet());

        Instant lastUpdated = transactions.stream()
            .map(DebtorTransaction::getUpdatedAt)
            .filter(Objects::nonNull)
            .max(Instant::compareTo)
            .orElse(null);

        return DebtorAnalyticsResponse.builder()
            .clientId(client.getClientId())
            .clientCode(client.getClientCode())
            .clientName(client.getClientName())
            .asOf(today)
            .overall(overall)
            .byMasterServiceLine(byMasterServiceLine)
            .masterServiceLines(masterServiceLines)
            .transactionCount(transactions.size())
            .lastUpdated(lastUpdated)
            .build();
    }
}
