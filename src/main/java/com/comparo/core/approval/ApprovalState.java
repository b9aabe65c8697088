package com.comparo.core.approval;

/**
 * Lifecycle of one gated tool call:
 * {@code PROPOSED -> APPROVED -> EXECUTED} or {@code PROPOSED -> DENIED -> SKIPPED}.
 */
public enum ApprovalState {
    PROPOSED,
    APPROVED,
    DENIED,
    EXECUTED,
    SKIPPED;

    public boolean isResolved() {
        return this != PROPOSED;
    }
}
