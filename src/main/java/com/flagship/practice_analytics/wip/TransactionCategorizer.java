package com.flagship.practice_analytics.wip;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps a transaction's type code (TType) and optional subtype (TranType) to a
 * {@link TransactionCategory}.
 *
 * Rules:
 * 1. A recognized time, disbursement, adjustment or provision code decides on its own.
 *    A fee write-down posted as ADJ stays an adjustment.
 * 2. Otherwise a subtype carrying a fee token (FEE, BILL, INVOICE) as a whole word makes
 *    the transaction a fee. Some billing rows arrive with a generic TType.
 * 3. Otherwise a fee code is a fee and anything else is UNKNOWN. Unknown codes never throw.
 *
 * Codes are compared trimmed and case-insensitively.
 */
@Component
public class TransactionCategorizer {

    static final Set<String> TIME_CODES = Set.of("T", "TI", "TIM", "TIME");
    static final Set<String> DISBURSEMENT_CODES = Set.of("D", "DI", "DIS", "DISB");
    static final Set<String> FEE_CODES = Set.of("F", "FEE");
    static final Set<String> ADJUSTMENT_CODES = Set.of("ADJ");
    static final Set<String> PROVISION_CODES = Set.of("P", "PRO", "PROV");

    static final Set<String> FEE_SUBTYPE_TOKENS = Set.of("FEE", "BILL", "INVOICE");

    private static final Pattern WORD_SEPARATOR = Pattern.compile("[^A-Z0-9]+");

    /**
     * Categorizes a transaction by its primary type code only.
     */
    public TransactionCategory categorize(String typeCode) {
        return categorize(typeCode, null);
    }

    /**
     * Categorizes a transaction by its type code and subtype.
     *
     * @param typeCode primary classification code, may be null
     * @param subTypeCode refinement code, may be null
     * @return the single category of the transaction, never null
     */
    public TransactionCategory categorize(String typeCode, String subTypeCode) {
        String code = normalize(typeCode);
        if (TIME_CODES.contains(code)) {
            return TransactionCategory.TIME;
        }
        if (DISBURSEMENT_CODES.contains(code)) {
            return TransactionCategory.DISBURSEMENT;
        }
        if (ADJUSTMENT_CODES.contains(code)) {
            return TransactionCategory.ADJUSTMENT;
        }
        if (PROVISION_CODES.contains(code)) {
            return TransactionCategory.PROVISION;
        }
        if (FEE_CODES.contains(code) || hasFeeSubtype(subTypeCode)) {
            return TransactionCategory.FEE;
        }
        return TransactionCategory.UNKNOWN;
    }

    public TransactionCategory categorize(WipTransaction transaction) {
        return categorize(transaction.getTypeCode(), transaction.getSubTypeCode());
    }

    private boolean hasFeeSubtype(String subTypeCode) {
        for (String word : WORD_SEPARATOR.split(normalize(subTypeCode))) {
            if (FEE_SUBTYPE_TOKENS.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(String code) {
        return code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
    }
}
