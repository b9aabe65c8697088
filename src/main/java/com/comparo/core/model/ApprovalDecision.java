package com.comparo.core.model;

import java.io.Serializable;

/**
 * An external approve/deny decision for pending tool calls.
 * <p>
 * {@code targetId} is either one target or {@link #ALL_TARGETS}; {@code toolCallId} is either
 * one call or {@link #ALL_PENDING}.
 */
public record ApprovalDecision(
    String requestId,
    String targetId,
    String toolCallId,
    Decision decision
) implements Serializable {

    public static final String ALL_TARGETS = "all";
    public static final String ALL_PENDING = "all-pending";

    public ApprovalDecision {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId is required");
        }
        if (decision == null) {
            throw new IllegalArgumentException("decision is required");
        }
        targetId = targetId == null || targetId.isBlank() ? ALL_TARGETS : targetId;
        toolCallId = toolCallId == null || toolCallId.isBlank() ? ALL_PENDING : toolCallId;
    }

    public static ApprovalDecision approveAll(String requestId) {
        return new ApprovalDecision(requestId, ALL_TARGETS, ALL_PENDING, Decision.APPROVE);
    }

    public static ApprovalDecision denyAll(String requestId) {
        return new ApprovalDecision(requestId, ALL_TARGETS, ALL_PENDING, Decision.DENY);
    }

    public static ApprovalDecision forTarget(String requestId, String targetId, Decision decision) {
        return new ApprovalDecision(requestId, targetId, ALL_PENDING, decision);
    }

    public boolean appliesToAllTargets() {
        return ALL_TARGETS.equals(targetId);
    }

    public boolean appliesToAllPending() {
        return ALL_PENDING.equals(toolCallId);
    }
}
