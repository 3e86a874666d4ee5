package com.flagship.practice_analytics.wip;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.Locale;

/**
 * Builds the per-component WIP balance of a set of transactions.
 *
 * Adjustments are split by their subtype: TIME adjustments, DISB adjustments,
 * and everything else. Unknown codes are excluded like everywhere else, so
 * netWip always matches the opening balance formula over the same rows.
 */
@Component
@RequiredArgsConstructor
public class WipBalanceCalculator {

    private final TransactionCategorizer categorizer;

    public WipBalanceBreakdown calculate(Collection<WipTransaction> transactions) {
        BigDecimal time = BigDecimal.ZERO;
        BigDecimal timeAdjustments = BigDecimal.ZERO;
        BigDecimal disbursements = BigDecimal.ZERO;
        BigDecimal disbursementAdjustments = BigDecimal.ZERO;
        BigDecimal otherAdjustments = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        BigDecimal provision = BigDecimal.ZERO;
        Instant lastUpdated = null;

        for (WipTransaction transaction : transactions) {
            BigDecimal amount = transaction.amountOrZero();

            switch (categorizer.categorize(transaction)) {
                case TIME -> time = time.add(amount);
                case DISBURSEMENT -> disbursements = disbursements.add(amount);
                case FEE -> fees = fees.add(amount);
                case PROVISION -> provision = provision.add(amount);
                case ADJUSTMENT -> {
                    String subType = transaction.getSubTypeCode() == null
                        ? "" : transaction.getSubTypeCode().toUpperCase(Locale.ROOT);
                    if (subType.contains("TIME")) {
                        timeAdjustments = timeAdjustments.add(amount);
                    } else if (subType.contains("DISB")) {
                        disbursementAdjustments = disbursementAdjustments.add(amount);
                    } else {
                        otherAdjustments = otherAdjustments.add(amount);
                    }
                }
                case UNKNOWN -> {
                    // excluded from balances
                }
            }

            Instant updatedAt = transaction.getUpdatedAt();
            if (updatedAt != null && (lastUpdated == null || updatedAt.isAfter(lastUpdated))) {
                lastUpdated = updatedAt;
            }
        }

        BigDecimal grossWip = time
            .add(timeAdjustments)
            .add(disbursements)
            .add(disbursementAdjustments)
            .add(otherAdjustments)
            .subtract(fees);

        return WipBalanceBreakdown.builder()
            .time(time)
            .timeAdjustments(timeAdjustments)
            .disbursements(disbursements)
            .disbursementAdjustments(disbursementAdjustments)
            .otherAdjustments(otherAdjustments)
            .fees(fees)
            .provision(provision)
            .grossWip(grossWip)
            .netWip(grossWip.add(provision))
            .lastUpdated(lastUpdated)
            .build();
    }
}
