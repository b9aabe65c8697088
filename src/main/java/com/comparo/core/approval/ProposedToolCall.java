package com.comparo.core.approval;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of a gated tool call.
 *
 * @param requestId  owning request
 * @param targetId   target that proposed the call
 * @param toolCallId id within the target's invocation
 * @param toolName   tool name
 * @param arguments  parsed arguments
 * @param state      current approval state
 * @param proposedAt when the call was proposed
 */
public record ProposedToolCall(
    String requestId,
    String targetId,
    String toolCallId,
    String toolName,
    Map<String, Object> arguments,
    ApprovalState state,
    Instant proposedAt
) {}
