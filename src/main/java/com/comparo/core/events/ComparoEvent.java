package com.comparo.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a comparison runs, used for SSE streaming and CLI output.
 *
 * @param eventType event type (e.g. "comparison.started", "target.delta", "target.completed")
 * @param requestId the logical request this event belongs to
 * @param targetId  the target this event relates to (nullable for request-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record ComparoEvent(
    String eventType,
    String requestId,
    String targetId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String COMPARISON_STARTED = "comparison.started";
    public static final String TARGET_DELTA = "target.delta";
    public static final String TARGET_TOOL_PENDING = "target.tool_pending";
    public static final String TARGET_TOOL_RESOLVED = "target.tool_resolved";
    public static final String TARGET_COMPLETED = "target.completed";
    public static final String TARGET_FAILED = "target.failed";
    public static final String COMPARISON_COMPLETED = "comparison.completed";

    public static ComparoEvent of(String eventType, String requestId, String targetId, Map<String, Object> payload) {
        return new ComparoEvent(eventType, requestId, targetId, payload == null ? Map.of() : payload, Instant.now());
    }

    public boolean isTerminalForRequest() {
        return COMPARISON_COMPLETED.equals(eventType);
    }
}
