package com.comparo.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A single user message plus history, dispatched to one or more targets under a shared id.
 * Immutable once created; the history list is an unmodifiable copy.
 *
 * @param requestId unique id shared by every target of this comparison
 * @param message   normalized (trimmed) user message
 * @param history   prior turns, oldest first
 * @param createdAt when the request was cloned
 */
public record LogicalRequest(
    String requestId,
    String message,
    List<ChatTurn> history,
    Instant createdAt
) implements Serializable {

    public LogicalRequest {
        history = history == null ? List.of() : List.copyOf(history);
    }
}
