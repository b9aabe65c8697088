package com.comparo.core.approval;

/**
 * How a proposed tool call was resolved, as seen by the pipeline waiting on it.
 */
public enum ApprovalOutcome {
    APPROVED,
    DENIED
}
