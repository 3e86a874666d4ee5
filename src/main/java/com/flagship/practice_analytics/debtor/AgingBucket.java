package com.flagship.practice_analytics.debtor;

/**
 * Day-range partitions of outstanding debtor balance.
 * DAYS_31_60 exists only under {@link AgingScheme#THIRTY_DAY}.
 */
public enum AgingBucket {
    CURRENT,
    DAYS_31_60,
    DAYS_61_90,
    DAYS_91_120,
    DAYS_120_PLUS
}
