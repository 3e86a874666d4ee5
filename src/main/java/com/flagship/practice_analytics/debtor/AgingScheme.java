package com.flagship.practice_analytics.debtor;

/**
 * Boundaries used to age debtor balances.
 *
 * SIXTY_DAY:  current 0-60, 61-90, 91-120, 120+
 * THIRTY_DAY: current 0-30, 31-60, 61-90, 91-120, 120+
 *
 * Future-dated transactions (negative age) count as current.
 */
public enum AgingScheme {
    SIXTY_DAY(60),
    THIRTY_DAY(30);

    private final int currentUpToDays;

    AgingScheme(int currentUpToDays) {
        this.currentUpToDays = currentUpToDays;
    }

    public AgingBucket bucketFor(long daysOutstanding) {
        if (daysOutstanding <= currentUpToDays) {
            return AgingBucket.CURRENT;
        }
        if (daysOutstanding <= 60) {
            return AgingBucket.DAYS_31_60;
        }
        if (daysOutstanding <= 90) {
            return AgingBucket.DAYS_61_90;
        }
        if (daysOutstanding <= 120) {
            return AgingBucket.DAYS_91_120;
        }
        return AgingBucket.DAYS_120_PLUS;
    }

    public boolean hasThirtyToSixtyBucket() {
        return this == THIRTY_DAY;
    }
}
