package com.flagship.practice_analytics.serviceline;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Groups items by the master service line their external service line code maps to.
 */
public final class ServiceLinePartitioner {

    public static final String UNKNOWN = "UNKNOWN";

    private ServiceLinePartitioner() {
        // Utility class
    }

    /**
     * Partitions items by master service line, keeping first-seen order of the groups
     * and the original order inside each group. Codes without a mapping go to UNKNOWN.
     */
    public static <T> Map<String, List<T>> partition(Collection<T> items,
                                                     Function<T, String> serviceLineOf,
                                                     Map<String, String> externalToMaster) {
        Map<String, List<T>> groups = new LinkedHashMap<>();
        for (T item : items) {
            String masterCode = masterCodeOf(serviceLineOf.apply(item), externalToMaster);
            groups.computeIfAbsent(masterCode, k -> new ArrayList<>()).add(item);
        }
        return groups;
    }

    public static String masterCodeOf(String serviceLineCode, Map<String, String> externalToMaster) {
        if (serviceLineCode == null) {
            return UNKNOWN;
        }
        String masterCode = externalToMaster.get(serviceLineCode);
        return masterCode != null ? masterCode : UNKNOWN;
    }
}
