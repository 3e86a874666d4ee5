package com.flagship.practice_analytics.debtor;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Recoverability figures for a set of debtor transactions.
 *
 * avgPaymentDaysPaid is null when no invoice has a matched payment, while
 * avgPaymentDaysOutstanding is 0 when nothing is outstanding. Consumers rely on
 * the difference: "no data" versus "nothing overdue".
 */
@Value
@Builder
@Jacksonized
public class DebtorMetrics {
    BigDecimal totalBalance;
    AgingBuckets aging;
    BigDecimal avgPaymentDaysPaid;
    BigDecimal avgPaymentDaysOutstanding;
    int transactionCount;
    int invoiceCount;
}
