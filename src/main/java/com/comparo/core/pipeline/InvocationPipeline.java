package com.comparo.core.pipeline;

import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * The shared underlying pipeline that turns one invocation into streamed model output.
 * <p>
 * Implementations must run the current {@link PromptRenderHook} while constructing the prompt,
 * report text through the listener, route every tool call through
 * {@link InvocationContext#requestToolApproval} before executing it, and complete the returned
 * future exactly once (normally on success, exceptionally on failure).
 */
public interface InvocationPipeline {

    CompletableFuture<Void> invoke(InvocationContext context, InvocationListener listener);

    PromptRenderHook renderHook();

    /**
     * Atomically replaces the render hook with {@code update.apply(current)}.
     *
     * @return the hook in effect after the update
     */
    PromptRenderHook updateRenderHook(UnaryOperator<PromptRenderHook> update);
}
