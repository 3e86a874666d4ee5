package com.flagship.practice_analytics.wip;

import com.flagship.practice_analytics.scope.AnalyticsScope;

import java.time.LocalDate;
import java.util.List;

/**
 * Supplies WIP transactions already filtered to a scope.
 *
 * Implementations resolve the client/task linkage of the scope; the engine does no
 * further filtering, deduplication or authorization.
 */
public interface WipTransactionSource {

    /**
     * Transactions dated within [from, to], both inclusive.
     */
    List<WipTransaction> findInWindow(AnalyticsScope scope, LocalDate from, LocalDate to);

    /**
     * Transactions dated strictly before the cutoff.
     */
    List<WipTransaction> findBefore(AnalyticsScope scope, LocalDate cutoff);

    /**
     * Amounts dated strictly before the cutoff, summed per (type, subtype) at the source.
     */
    List<TypeSum> sumByTypeBefore(AnalyticsScope scope, LocalDate cutoff);

    /**
     * Every transaction of the scope, regardless of date.
     */
    List<WipTransaction> findAll(AnalyticsScope scope);
}
