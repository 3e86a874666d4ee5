package com.flagship.practice_analytics.wip;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Grand totals over an aggregation window.
 * currentWipBalance always equals the wipBalance of the last daily metric,
 * or the opening balance when the window had no transactions.
 */
@Value
@Builder
@Jacksonized
public class AggregateSummary {
    BigDecimal totalProduction;
    BigDecimal totalAdjustments;
    BigDecimal totalDisbursements;
    BigDecimal totalBilling;
    BigDecimal totalProvisions;
    BigDecimal currentWipBalance;
}
