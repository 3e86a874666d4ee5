package com.flagship.practice_analytics.analytics.dto;

import com.flagship.practice_analytics.wip.WipBalanceBreakdown;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * WIP balance breakdown of a single task.
 */
@Value
@Builder
public class TaskBalancesResponse {
    UUID taskId;
    String taskCode;
    String taskDesc;
    WipBalanceBreakdown balances;
}
