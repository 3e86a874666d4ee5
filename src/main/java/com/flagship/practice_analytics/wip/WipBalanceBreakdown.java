package com.flagship.practice_analytics.wip;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * WIP balance of a task split by component.
 *
 * grossWip = time + timeAdjustments + disbursements + disbursementAdjustments
 *            + otherAdjustments - fees
 * netWip   = grossWip + provision
 */
@Value
@Builder
public class WipBalanceBreakdown {
    BigDecimal time;
    BigDecimal timeAdjustments;
    BigDecimal disbursements;
    BigDecimal disbursementAdjustments;
    BigDecimal otherAdjustments;
    BigDecimal fees;
    BigDecimal provision;
    BigDecimal grossWip;
    BigDecimal netWip;
    Instant lastUpdated;
}
