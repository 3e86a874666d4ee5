package com.flagship.practice_analytics.debtor;

import java.util.List;
import java.util.UUID;

/**
 * Supplies the receivables transactions of a client.
 */
public interface DebtorTransactionSource {

    List<DebtorTransaction> findByClient(UUID clientId);
}
