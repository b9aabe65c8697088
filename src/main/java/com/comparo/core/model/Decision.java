package com.comparo.core.model;

/**
 * Outcome requested by an {@link ApprovalDecision}.
 */
public enum Decision {
    APPROVE,
    DENY
}
