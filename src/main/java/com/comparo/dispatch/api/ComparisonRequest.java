package com.comparo.dispatch.api;

import com.comparo.core.model.ChatTurn;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/comparisons.
 *
 * @param message                  the user message
 * @param history                  prior turns; nullable
 * @param targets                  targets to compare; nullable, defaults to the current selection
 * @param applyPromptModifications whether stored per-target prompt modifications apply; nullable, defaults to true
 */
public record ComparisonRequest(
    String message,
    List<ChatTurn> history,
    List<String> targets,
    @JsonProperty("apply_prompt_modifications") Boolean applyPromptModifications
) {}
