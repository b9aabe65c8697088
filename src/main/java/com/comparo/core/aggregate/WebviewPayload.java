package com.comparo.core.aggregate;

import com.comparo.core.model.ResponseStats;
import com.comparo.core.model.ToolCallRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Presentation projection of an aggregate, serialized as-is to REST and SSE clients.
 * Errored targets carry an empty response and an entry in {@code errors}; only targets with tool
 * calls appear in {@code toolCalls}.
 */
public record WebviewPayload(
    String requestId,
    String message,
    Map<String, String> responses,
    Map<String, String> errors,
    Map<String, List<ToolCallRecord>> toolCalls,
    List<String> selectedTargets,
    Instant timestamp,
    ResponseStats stats,
    @JsonProperty("isComplete") boolean complete
) {}
