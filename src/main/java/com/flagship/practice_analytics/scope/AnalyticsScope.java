package com.flagship.practice_analytics.scope;

import lombok.Value;

import java.util.Locale;
import java.util.UUID;

/**
 * Identifies the set of transactions an analytics call works on.
 *
 * CLIENT and GROUP scopes include every transaction linked to the client(s)
 * OR to any of their tasks, because some fee rows carry only a task link.
 * A TASK scope includes the rows linked to that task.
 */
@Value
public class AnalyticsScope {
    ScopeType type;
    String identifier;

    public static AnalyticsScope client(UUID clientId) {
        return new AnalyticsScope(ScopeType.CLIENT, clientId.toString());
    }

    public static AnalyticsScope group(String groupCode) {
        if (groupCode == null || groupCode.isBlank()) {
            throw new IllegalArgumentException("Group code is required");
        }
        return new AnalyticsScope(ScopeType.GROUP, groupCode);
    }

    public static AnalyticsScope task(UUID taskId) {
        return new AnalyticsScope(ScopeType.TASK, taskId.toString());
    }

    /**
     * Identifier as a UUID. Only valid for CLIENT and TASK scopes.
     */
    public UUID uuid() {
        if (type == ScopeType.GROUP) {
            throw new IllegalStateException("Group scopes are identified by code, not UUID");
        }
        return UUID.fromString(identifier);
    }

    /**
     * Stable key fragment, e.g. {@code client:1b2c...}.
     */
    public String key() {
        return type.name().toLowerCase(Locale.ROOT) + ":" + identifier;
    }
}
