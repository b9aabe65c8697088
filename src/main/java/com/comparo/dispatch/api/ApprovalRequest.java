package com.comparo.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/comparisons/{id}/approvals.
 *
 * @param targetId   one target, or "all"; nullable, defaults to all
 * @param toolCallId one tool call, or "all-pending"; nullable, defaults to all pending
 * @param decision   "approve" or "deny"
 */
public record ApprovalRequest(
    @JsonProperty("target_id") String targetId,
    @JsonProperty("tool_call_id") String toolCallId,
    String decision
) {}
