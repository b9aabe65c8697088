package com.comparo.core.pipeline;

/**
 * Receives streamed output from one pipeline invocation.
 * Completion and failure are reported through the future returned by
 * {@link InvocationPipeline#invoke}.
 */
public interface InvocationListener {

    /**
     * Called for each text chunk, in the order the model produced them.
     */
    void onDelta(String text);
}
