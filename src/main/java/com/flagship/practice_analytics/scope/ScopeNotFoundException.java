package com.flagship.practice_analytics.scope;

/**
 * Thrown when a client, group or task requested for analytics does not exist.
 */
public class ScopeNotFoundException extends RuntimeException {

    private final ScopeType scopeType;
    private final String identifier;

    public ScopeNotFoundException(ScopeType scopeType, String identifier) {
        super(String.format("%s not found: %s", label(scopeType), identifier));
        this.scopeType = scopeType;
        this.identifier = identifier;
    }

    public ScopeType getScopeType() {
        return scopeType;
    }

    public String getIdentifier() {
        return identifier;
    }

    private static String label(ScopeType scopeType) {
        return switch (scopeType) {
            case CLIENT -> "Client";
            case GROUP -> "Group";
            case TASK -> "Task";
        };
    }
}
