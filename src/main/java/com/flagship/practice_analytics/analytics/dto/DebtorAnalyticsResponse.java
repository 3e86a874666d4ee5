package com.flagship.practice_analytics.analytics.dto;

import com.flagship.practice_analytics.debtor.DebtorMetrics;
import com.flagship.practice_analytics.serviceline.MasterServiceLine;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Debtor balances and recoverability metrics of a client, overall and per
 * master service line. Aging is relative to asOf.
 */
@Value
@Builder
@Jacksonized
public class DebtorAnalyticsResponse {
    UUID clientId;
    String clientCode;
    String clientName;
    LocalDate asOf;
    DebtorMetrics overall;
    Map<String, DebtorMetrics> byMasterServiceLine;
    List<MasterServiceLine> masterServiceLines;
    int transactionCount;
    Instant lastUpdated;
}
