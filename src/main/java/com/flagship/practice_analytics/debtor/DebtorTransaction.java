package com.flagship.practice_analytics.debtor;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;

/**
 * A receivables ledger row.
 * Receipts are negative, invoices and credit notes positive.
 */
@Value
@Builder
public class DebtorTransaction {
    LocalDate date;
    BigDecimal amount;
    String entryType;
    String invoiceNumber;
    String serviceLineCode;
    Instant updatedAt;

    public BigDecimal amountOrZero() {
        return amount != null ? amount : BigDecimal.ZERO;
    }

    /**
     * Invoice-like entry: the entry type mentions "inv" (which covers "invoice").
     */
    public boolean isInvoice() {
        return normalizedEntryType().contains("inv");
    }

    /**
     * Payment-like entry: the entry type mentions "payment" or "receipt" and is not invoice-like.
     */
    public boolean isPayment() {
        String entry = normalizedEntryType();
        return !isInvoice() && (entry.contains("payment") || entry.contains("receipt"));
    }

    public boolean hasInvoiceNumber() {
        return invoiceNumber != null && !invoiceNumber.isBlank();
    }

    private String normalizedEntryType() {
        return entryType == null ? "" : entryType.toLowerCase(Locale.ROOT);
    }
}
