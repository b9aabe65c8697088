package com.comparo.core.pipeline;

import com.comparo.core.approval.ApprovalOutcome;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lets a pipeline ask whether one of its tool calls may run, and report that it ran.
 */
public interface ToolApprovalHandle {

    /**
     * Proposes a tool call. The returned future completes once an external decision
     * (or cancellation) resolves it; the pipeline must not execute the tool before then.
     */
    CompletableFuture<ApprovalOutcome> requestApproval(String toolCallId, String toolName,
                                                       Map<String, Object> arguments);

    /**
     * Reports that an approved tool call finished executing.
     */
    void toolExecuted(String toolCallId);
}
