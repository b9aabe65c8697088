package com.comparo.core.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Transforms the rendered prompt messages of one target's invocation.
 */
@FunctionalInterface
public interface PromptModifier extends UnaryOperator<List<ChatTurn>> {
}
