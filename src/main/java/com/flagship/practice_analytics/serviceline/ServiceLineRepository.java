package com.flagship.practice_analytics.serviceline;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Service line reference data.
 */
public interface ServiceLineRepository {

    /**
     * Mapping of external service line codes to master service line codes.
     */
    Map<String, String> findExternalToMasterMappings();

    /**
     * Master service lines with the given codes, in display order.
     */
    List<MasterServiceLine> findMasterServiceLines(Collection<String> codes);
}
