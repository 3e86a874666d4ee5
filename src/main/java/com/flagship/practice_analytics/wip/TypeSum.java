package com.flagship.practice_analytics.wip;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Amount summed at the source per (type, subtype).
 * Row shape of the pre-aggregated opening balance query.
 */
@Value
public class TypeSum {
    String typeCode;
    String subTypeCode;
    BigDecimal amount;

    public static TypeSum of(String typeCode, BigDecimal amount) {
        return new TypeSum(typeCode, null, amount);
    }
}
