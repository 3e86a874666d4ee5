package com.flagship.practice_analytics.scope;

/**
 * Level at which WIP transactions are selected.
 */
public enum ScopeType {
    CLIENT,
    GROUP,
    TASK
}
