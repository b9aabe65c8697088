package com.comparo.core.model;

/**
 * Status of a tool call as seen by the aggregate.
 */
public enum ToolCallStatus {
    PENDING,
    APPROVED,
    DENIED,
    EXECUTED
}
