package com.flagship.practice_analytics.scope;

import java.util.Optional;
import java.util.UUID;

/**
 * Looks up the entities an analytics scope refers to.
 */
public interface ScopeRepository {

    Optional<ClientInfo> findClient(UUID clientId);

    /**
     * Finds a group by code. A group with no clients is reported as absent.
     */
    Optional<GroupInfo> findGroup(String groupCode);

    Optional<TaskInfo> findTask(UUID taskId);
}
