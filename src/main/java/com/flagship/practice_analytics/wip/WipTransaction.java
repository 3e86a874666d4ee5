package com.flagship.practice_analytics.wip;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A single WIP ledger row.
 *
 * Read-only input to the engine. A row may be linked to a client, a task or both;
 * callers resolve which rows belong to a scope before handing them over.
 */
@Value
@Builder
public class WipTransaction {
    LocalDate date;
    BigDecimal amount;
    String typeCode;
    String subTypeCode;
    UUID clientId;
    UUID taskId;
    String serviceLineCode;
    Instant updatedAt;

    /**
     * Amount with a missing value read as zero.
     */
    public BigDecimal amountOrZero() {
        return amount != null ? amount : BigDecimal.ZERO;
    }
}
