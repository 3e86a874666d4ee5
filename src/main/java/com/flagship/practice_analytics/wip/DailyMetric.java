package com.flagship.practice_analytics.wip;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Category totals for one calendar day plus the cumulative WIP balance at the end of it.
 *
 * Invariant: wipBalance = previous day's wipBalance + production + adjustments
 * + disbursements + provisions - billing.
 */
@Value
@Builder
@Jacksonized
public class DailyMetric {

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate date;

    BigDecimal production;
    BigDecimal adjustments;
    BigDecimal disbursements;
    BigDecimal billing;
    BigDecimal provisions;
    BigDecimal wipBalance;

    /**
     * True when any category total is non-zero, i.e. the day had financial activity
     * rather than only a carried-forward balance.
     */
    @JsonIgnore
    public boolean isActive() {
        return isNonZero(production)
            || isNonZero(adjustments)
            || isNonZero(disbursements)
            || isNonZero(billing)
            || isNonZero(provisions);
    }

    private static boolean isNonZero(BigDecimal value) {
        return value != null && value.signum() != 0;
    }
}
