package com.comparo.core.model;

import java.util.List;
import java.util.function.Consumer;

/**
 * Receives the rendered prompt messages of one target's invocation before any modifier runs.
 */
@FunctionalInterface
public interface RenderObserver extends Consumer<List<ChatTurn>> {
}
