package com.flagship.practice_analytics.wip;

import java.math.BigDecimal;

/**
 * Mutable per-category accumulator.
 * Working state of a single aggregation call; never shared between calls.
 */
final class CategoryTotals {

    private BigDecimal production = BigDecimal.ZERO;
    private BigDecimal adjustments = BigDecimal.ZERO;
    private BigDecimal disbursements = BigDecimal.ZERO;
    private BigDecimal billing = BigDecimal.ZERO;
    private BigDecimal provisions = BigDecimal.ZERO;

    /**
     * Adds an amount to the total of its category. UNKNOWN amounts are dropped.
     *
     * @return true if the amount was counted
     */
    boolean add(TransactionCategory category, BigDecimal amount) {
        switch (category) {
            case TIME -> production = production.add(amount);
            case ADJUSTMENT -> adjustments = adjustments.add(amount);
            case DISBURSEMENT -> disbursements = disbursements.add(amount);
            case FEE -> billing = billing.add(amount);
            case PROVISION -> provisions = provisions.add(amount);
            case UNKNOWN -> {
                return false;
            }
        }
        return true;
    }

    void addAll(CategoryTotals other) {
        production = production.add(other.production);
        adjustments = adjustments.add(other.adjustments);
        disbursements = disbursements.add(other.disbursements);
        billing = billing.add(other.billing);
        provisions = provisions.add(other.provisions);
    }

    /**
     * Net WIP movement: everything except billing adds to WIP, billing reduces it.
     */
    BigDecimal wipChange() {
        return production
            .add(adjustments)
            .add(disbursements)
            .add(provisions)
            .subtract(billing);
    }

    BigDecimal production() {
        return production;
    }

    BigDecimal adjustments() {
        return adjustments;
    }

    BigDecimal disbursements() {
        return disbursements;
    }

    BigDecimal billing() {
        return billing;
    }

    BigDecimal provisions() {
        return provisions;
    }
}
