package com.flagship.practice_analytics.debtor;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Balance-weighted payment days of paid and outstanding invoices.
 */
@Value
public class PaymentSpeed {
    BigDecimal avgPaymentDaysPaid;
    BigDecimal avgPaymentDaysOutstanding;
}
