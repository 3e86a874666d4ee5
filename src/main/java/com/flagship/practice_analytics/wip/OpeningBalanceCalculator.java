package com.flagship.practice_analytics.wip;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;

/**
 * Computes the WIP balance accumulated before a reporting window.
 *
 * Uses the same categorization and sign rules as {@link BalanceAggregator},
 * collapsed to a single scalar:
 * opening = production + adjustments + disbursements + provisions - billing
 *
 * Two inputs are supported and must agree on equivalent data:
 * - raw transactions dated before the cutoff
 * - sums already grouped by type at the source (the faster path for large scopes)
 */
@Component
@RequiredArgsConstructor
public class OpeningBalanceCalculator {

    private final TransactionCategorizer categorizer;

    /**
     * Opening balance from raw transactions. The caller filters them to the
     * period strictly before the window start.
     */
    public BigDecimal fromTransactions(Collection<WipTransaction> transactions) {
        CategoryTotals totals = new CategoryTotals();
        for (WipTransaction transaction : transactions) {
            totals.add(categorizer.categorize(transaction), transaction.amountOrZero());
        }
        return totals.wipChange();
    }

    /**
     * Opening balance from per-type sums keyed by type code.
     */
    public BigDecimal fromTypeSums(Map<String, BigDecimal> sumsByType) {
        CategoryTotals totals = new CategoryTotals();
        sumsByType.forEach((typeCode, amount) ->
            totals.add(categorizer.categorize(typeCode), amount != null ? amount : BigDecimal.ZERO));
        return totals.wipChange();
    }

    /**
     * Opening balance from per-(type, subtype) sums, so fee subtypes are honoured
     * exactly as they are for raw transactions.
     */
    public BigDecimal fromTypeSums(Collection<TypeSum> typeSums) {
        CategoryTotals totals = new CategoryTotals();
        for (TypeSum sum : typeSums) {
            BigDecimal amount = sum.getAmount() != null ? sum.getAmount() : BigDecimal.ZERO;
            totals.add(categorizer.categorize(sum.getTypeCode(), sum.getSubTypeCode()), amount);
        }
        return totals.wipChange();
    }
}
