package com.flagship.practice_analytics.debtor;

import com.flagship.practice_analytics.serviceline.ServiceLinePartitioner;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Debtor aging and payment-speed analytics.
 *
 * "Today" is always passed in by the caller, so results are reproducible and
 * cacheable for a given day.
 *
 * Payment matching, per invoice number:
 * - the earliest invoice-like transaction gives the invoice date and amount
 * - the earliest payment-like transaction dated on or after the invoice date is the payment
 * Partial payments are not modelled. Transactions without an invoice number still
 * count towards the balance and aging, but not towards payment speed.
 */
@Component
public class DebtorAnalyzer {

    private static final int AVERAGE_SCALE = 2;

    private final AgingScheme defaultScheme;

    public DebtorAnalyzer(@Value("${analytics.debtor.aging-scheme:SIXTY_DAY}") AgingScheme defaultScheme) {
        this.defaultScheme = defaultScheme;
    }

    public AgingScheme getDefaultScheme() {
        return defaultScheme;
    }

    /**
     * Analyzes transactions with the configured aging scheme.
     */
    public DebtorMetrics analyze(Collection<DebtorTransaction> transactions, LocalDate today) {
        return analyze(transactions, today, defaultScheme);
    }

    public DebtorMetrics analyze(Collection<DebtorTransaction> transactions, LocalDate today, AgingScheme scheme) {
        BigDecimal totalBalance = BigDecimal.ZERO;
        int invoiceCount = 0;

        for (DebtorTransaction transaction : transactions) {
            totalBalance = totalBalance.add(transaction.amountOrZero());
            if (transaction.isInvoice()) {
                invoiceCount++;
            }
        }

        PaymentSpeed paymentSpeed = paymentSpeed(transactions, today);

        return DebtorMetrics.builder()
            .totalBalance(totalBalance)
            .aging(aging(transactions, today, scheme))
            .avgPaymentDaysPaid(paymentSpeed.getAvgPaymentDaysPaid())
            .avgPaymentDaysOutstanding(paymentSpeed.getAvgPaymentDaysOutstanding())
            .transactionCount(transactions.size())
            .invoiceCount(invoiceCount)
            .build();
    }

    /**
     * Analyzes each master service line separately.
     *
     * @param externalToMaster external service line code to master code
     * @return metrics keyed by master code, UNKNOWN for unmapped codes
     */
    public Map<String, DebtorMetrics> analyzeByServiceLine(Collection<DebtorTransaction> transactions,
                                                           Map<String, String> externalToMaster,
                                                           LocalDate today) {
        Map<String, List<DebtorTransaction>> groups = ServiceLinePartitioner.partition(
            transactions, DebtorTransaction::getServiceLineCode, externalToMaster);

        Map<String, DebtorMetrics> result = new LinkedHashMap<>();
        groups.forEach((masterCode, group) -> result.put(masterCode, analyze(group, today)));
        return result;
    }

    public AgingBuckets aging(Collection<DebtorTransaction> transactions, LocalDate today) {
        return aging(transactions, today, defaultScheme);
    }

    /**
     * Puts each transaction's signed amount into exactly one age bucket.
     */
    public AgingBuckets aging(Collection<DebtorTransaction> transactions, LocalDate today, AgingScheme scheme) {
        Map<AgingBucket, BigDecimal> totals = new EnumMap<>(AgingBucket.class);
        for (DebtorTransaction transaction : transactions) {
            long daysOutstanding = ChronoUnit.DAYS.between(transaction.getDate(), today);
            totals.merge(scheme.bucketFor(daysOutstanding), transaction.amountOrZero(), BigDecimal::add);
        }
        return AgingBuckets.of(scheme, totals);
    }

    /**
     * Balance-weighted average days to pay (paid invoices) and days outstanding
     * (unpaid invoices).
     */
    public PaymentSpeed paymentSpeed(Collection<DebtorTransaction> transactions, LocalDate today) {
        Map<String, List<DebtorTransaction>> byInvoice = new LinkedHashMap<>();
        for (DebtorTransaction transaction : transactions) {
            if (transaction.hasInvoiceNumber()) {
                byInvoice.computeIfAbsent(transaction.getInvoiceNumber(), k -> new ArrayList<>()).add(transaction);
            }
        }

        BigDecimal paidWeightedDays = BigDecimal.ZERO;
        BigDecimal paidAmount = BigDecimal.ZERO;
        BigDecimal outstandingWeightedDays = BigDecimal.ZERO;
        BigDecimal outstandingAmount = BigDecimal.ZERO;

        for (List<DebtorTransaction> group : byInvoice.values()) {
            group.sort(Comparator.comparing(DebtorTransaction::getDate));

            Optional<DebtorTransaction> invoice = group.stream()
                .filter(DebtorTransaction::isInvoice)
                .findFirst();
            if (invoice.isEmpty()) {
                continue;
            }

            LocalDate invoiceDate = invoice.get().getDate();
            BigDecimal weight = invoice.get().amountOrZero().abs();

            Optional<DebtorTransaction> payment = group.stream()
                .filter(DebtorTransaction::isPayment)
                .filter(t -> !t.getDate().isBefore(invoiceDate))
                .findFirst();

            if (payment.isPresent()) {
                long daysToPay = ChronoUnit.DAYS.between(invoiceDate, payment.get().getDate());
                paidWeightedDays = paidWeightedDays.add(weight.multiply(BigDecimal.valueOf(daysToPay)));
                paidAmount = paidAmount.add(weight);
            } else {
                long daysOutstanding = ChronoUnit.DAYS.between(invoiceDate, today);
                outstandingWeightedDays = outstandingWeightedDays.add(weight.multiply(BigDecimal.valueOf(daysOutstanding)));
                outstandingAmount = outstandingAmount.add(weight);
            }
        }

        BigDecimal avgPaid = paidAmount.signum() > 0
            ? paidWeightedDays.divide(paidAmount, AVERAGE_SCALE, RoundingMode.HALF_UP)
            : null;
        BigDecimal avgOutstanding = outstandingAmount.signum() > 0
            ? outstandingWeightedDays.divide(outstandingAmount, AVERAGE_SCALE, RoundingMode.HALF_UP)
            : BigDecimal.ZERO;

        return new PaymentSpeed(avgPaid, avgOutstanding);
    }
}
