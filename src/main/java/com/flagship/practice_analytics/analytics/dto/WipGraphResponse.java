package com.flagship.practice_analytics.analytics.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.practice_analytics.scope.ScopeType;
import com.flagship.practice_analytics.serviceline.MasterServiceLine;
import com.flagship.practice_analytics.wip.WipGraphData;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * WIP graph payload for a client, group or task.
 *
 * overall covers the whole scope; byMasterServiceLine holds one series per master
 * service line (empty for tasks). All series are downsampled to the requested
 * resolution, summaries are computed before downsampling.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WipGraphResponse {
    ScopeType scopeType;
    String scopeId;
    String code;
    String name;
    Integer clientCount;
    LocalDate startDate;
    LocalDate endDate;
    String resolution;
    WipGraphData overall;
    Map<String, WipGraphData> byMasterServiceLine;
    List<MasterServiceLine> masterServiceLines;
}
