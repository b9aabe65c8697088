package com.comparo.core.model;

/**
 * Lifecycle of one target within a comparison.
 */
public enum TargetStatus {
    PENDING,
    STREAMING,
    COMPLETE,
    ERRORED;

    public boolean isTerminal() {
        return this == COMPLETE || this == ERRORED;
    }
}
