package com.flagship.practice_analytics.wip;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns a set of WIP transactions into a daily series with a running WIP balance.
 *
 * Algorithm:
 * 1. Group transactions by calendar day (input order does not matter)
 * 2. Accumulate each amount into its category for that day
 * 3. Walk the days in ascending order with a running total seeded at the opening balance
 *
 * WIP Balance = Opening Balance + Production + Adjustments + Disbursements + Provisions - Billing
 *
 * Amounts are used as-is. Fees are positive magnitudes and are subtracted here.
 * Days whose transactions are all UNKNOWN still appear, with zero totals.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BalanceAggregator {

    private final TransactionCategorizer categorizer;

    /**
     * Aggregates transactions with a zero opening balance.
     */
    public WipGraphData aggregate(Collection<WipTransaction> transactions) {
        return aggregate(transactions, BigDecimal.ZERO);
    }

    /**
     * Aggregates transactions into daily metrics.
     *
     * @param transactions transactions of the window, in any order
     * @param openingBalance WIP balance before the window; null is read as zero
     * @return daily metrics sorted by date plus the window summary
     */
    public WipGraphData aggregate(Collection<WipTransaction> transactions, BigDecimal openingBalance) {
        BigDecimal opening = openingBalance != null ? openingBalance : BigDecimal.ZERO;

        // TreeMap keeps the days in ascending order
        Map<LocalDate, CategoryTotals> days = new TreeMap<>();
        int unknownCount = 0;

        for (WipTransaction transaction : transactions) {
            CategoryTotals daily = days.computeIfAbsent(transaction.getDate(), date -> new CategoryTotals());
            TransactionCategory category = categorizer.categorize(transaction);
            if (!daily.add(category, transaction.amountOrZero())) {
                unknownCount++;
            }
        }

        if (unknownCount > 0) {
            log.debug("Excluded {} transactions with unrecognized type codes from WIP totals", unknownCount);
        }

        CategoryTotals totals = new CategoryTotals();
        List<DailyMetric> dailyMetrics = new ArrayList<>(days.size());
        BigDecimal cumulativeBalance = opening;

        for (Map.Entry<LocalDate, CategoryTotals> day : days.entrySet()) {
            CategoryTotals daily = day.getValue();
            cumulativeBalance = cumulativeBalance.add(daily.wipChange());
            totals.addAll(daily);

            dailyMetrics.add(DailyMetric.builder()
                .date(day.getKey())
                .production(daily.production())
                .adjustments(daily.adjustments())
                .disbursements(daily.disbursements())
                .billing(daily.billing())
                .provisions(daily.provisions())
                .wipBalance(cumulativeBalance)
                .build());
        }

        AggregateSummary summary = AggregateSummary.builder()
            .totalProduction(totals.production())
            .totalAdjustments(totals.adjustments())
            .totalDisbursements(totals.disbursements())
            .totalBilling(totals.billing())
            .totalProvisions(totals.provisions())
            .currentWipBalance(cumulativeBalance)
            .build();

        return WipGraphData.builder()
            .dailyMetrics(dailyMetrics)
            .summary(summary)
            .build();
    }
}
