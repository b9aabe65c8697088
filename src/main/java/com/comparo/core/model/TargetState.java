package com.comparo.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of one target's progress within an aggregate.
 *
 * @param targetId        the target
 * @param status          lifecycle status
 * @param accumulatedText text streamed so far (or the final response)
 * @param toolCalls       tool calls in the order they were proposed
 * @param error           error message, null unless {@code status == ERRORED}
 * @param complete        true once a terminal event has been applied
 * @param lastUpdate      when the last event for this target was applied
 * @param completedAt     when the terminal event was applied, null while running
 */
public record TargetState(
    String targetId,
    TargetStatus status,
    String accumulatedText,
    List<ToolCallRecord> toolCalls,
    String error,
    boolean complete,
    Instant lastUpdate,
    Instant completedAt
) implements Serializable {

    public TargetState {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }
}
