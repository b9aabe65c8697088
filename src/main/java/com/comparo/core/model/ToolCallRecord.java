package com.comparo.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool call proposed by one target.
 *
 * @param toolCallId     id unique within the target's invocation
 * @param name           tool name
 * @param status         current status
 * @param arguments      parsed arguments, empty when unknown
 * @param displayMessage human-readable summary for the approval prompt
 */
public record ToolCallRecord(
    String toolCallId,
    String name,
    ToolCallStatus status,
    Map<String, Object> arguments,
    String displayMessage
) implements Serializable {

    public ToolCallRecord {
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public ToolCallRecord withStatus(ToolCallStatus newStatus) {
        return new ToolCallRecord(toolCallId, name, newStatus, arguments, displayMessage);
    }
}
