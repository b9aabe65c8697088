package com.comparo.core.aggregate;

import com.comparo.core.model.ToolCallRecord;

import java.time.Instant;

/**
 * One observation about one target's invocation, produced by the dispatch adapter and applied
 * to the aggregate. {@link Type#COMPLETE} and {@link Type#ERROR} are terminal.
 *
 * @param type      event kind
 * @param targetId  target the event belongs to
 * @param text      delta text, or final text for COMPLETE (null keeps the streamed text)
 * @param toolCall  tool call for TOOL_PENDING / TOOL_RESOLVED
 * @param error     error message for ERROR
 * @param timestamp when the event was produced
 */
public record TargetEvent(
    Type type,
    String targetId,
    String text,
    ToolCallRecord toolCall,
    String error,
    Instant timestamp
) {

    public enum Type {
        DELTA,
        TOOL_PENDING,
        TOOL_RESOLVED,
        COMPLETE,
        ERROR
    }

    public static TargetEvent delta(String targetId, String text) {
        return new TargetEvent(Type.DELTA, targetId, text, null, null, Instant.now());
    }

    public static TargetEvent toolPending(String targetId, ToolCallRecord toolCall) {
        return new TargetEvent(Type.TOOL_PENDING, targetId, null, toolCall, null, Instant.now());
    }

    public static TargetEvent toolResolved(String targetId, ToolCallRecord toolCall) {
        return new TargetEvent(Type.TOOL_RESOLVED, targetId, null, toolCall, null, Instant.now());
    }

    public static TargetEvent complete(String targetId) {
        return complete(targetId, null);
    }

    public static TargetEvent complete(String targetId, String finalText) {
        return new TargetEvent(Type.COMPLETE, targetId, finalText, null, null, Instant.now());
    }

    public static TargetEvent error(String targetId, String message) {
        return new TargetEvent(Type.ERROR, targetId, null, null, message, Instant.now());
    }

    public boolean isTerminal() {
        return type == Type.COMPLETE || type == Type.ERROR;
    }
}
