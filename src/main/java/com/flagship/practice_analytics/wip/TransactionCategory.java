package com.flagship.practice_analytics.wip;

/**
 * Semantic category of a WIP transaction.
 *
 * Categories are mutually exclusive: a transaction belongs to exactly one of them,
 * so at most one of the {@code isX()} flags is ever true. UNKNOWN transactions are
 * counted but never contribute to a category total or to the WIP balance.
 */
public enum TransactionCategory {
    TIME,
    ADJUSTMENT,
    DISBURSEMENT,
    FEE,
    PROVISION,
    UNKNOWN;

    public boolean isTime() {
        return this == TIME;
    }

    public boolean isAdjustment() {
        return this == ADJUSTMENT;
    }

    public boolean isDisbursement() {
        return this == DISBURSEMENT;
    }

    public boolean isFee() {
        return this == FEE;
    }

    public boolean isProvision() {
        return this == PROVISION;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
