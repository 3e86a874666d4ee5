package com.flagship.practice_analytics.debtor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Debtor balance split by age. The buckets are mutually exclusive and together
 * hold every transaction amount exactly once.
 *
 * days31_60 is null under the sixty-day scheme.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgingBuckets {

    AgingScheme scheme;

    BigDecimal current;

    @JsonProperty("days31_60")
    BigDecimal days31To60;

    @JsonProperty("days61_90")
    BigDecimal days61To90;

    @JsonProperty("days91_120")
    BigDecimal days91To120;

    BigDecimal days120Plus;

    public static AgingBuckets of(AgingScheme scheme, Map<AgingBucket, BigDecimal> totals) {
        Map<AgingBucket, BigDecimal> values = new EnumMap<>(AgingBucket.class);
        values.putAll(totals);
        return AgingBuckets.builder()
            .scheme(scheme)
            .current(values.getOrDefault(AgingBucket.CURRENT, BigDecimal.ZERO))
            .days31To60(scheme.hasThirtyToSixtyBucket()
                ? values.getOrDefault(AgingBucket.DAYS_31_60, BigDecimal.ZERO) : null)
            .days61To90(values.getOrDefault(AgingBucket.DAYS_61_90, BigDecimal.ZERO))
            .days91To120(values.getOrDefault(AgingBucket.DAYS_91_120, BigDecimal.ZERO))
            .days120Plus(values.getOrDefault(AgingBucket.DAYS_120_PLUS, BigDecimal.ZERO))
            .build();
    }

    /**
     * Sum of all buckets; equals the total balance of the aged transactions.
     */
    @JsonIgnore
    public BigDecimal getTotal() {
        BigDecimal total = current.add(days61To90).add(days91To120).add(days120Plus);
        return days31To60 != null ? total.add(days31To60) : total;
    }
}
