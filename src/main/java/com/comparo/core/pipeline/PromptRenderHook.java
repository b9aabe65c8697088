package com.comparo.core.pipeline;

import com.comparo.core.model.ChatTurn;

import java.util.List;

/**
 * The pipeline's single, process-wide prompt construction hook. It is called once per
 * invocation with the messages the pipeline rendered and returns the messages to send.
 */
@FunctionalInterface
public interface PromptRenderHook {

    PromptRenderHook IDENTITY = (context, rendered) -> rendered;

    List<ChatTurn> render(InvocationContext context, List<ChatTurn> rendered);
}
