package com.flagship.practice_analytics.wip;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Daily WIP series with its summary. Output of {@link BalanceAggregator}.
 */
@Value
@Builder
@Jacksonized
public class WipGraphData {
    @With
    List<DailyMetric> dailyMetrics;
    AggregateSummary summary;
}
