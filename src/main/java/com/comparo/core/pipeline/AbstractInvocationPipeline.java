package com.comparo.core.pipeline;

import com.comparo.core.model.ChatTurn;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Holds the shared render hook and performs prompt construction for concrete pipelines.
 */
public abstract class AbstractInvocationPipeline implements InvocationPipeline {

    private final AtomicReference<PromptRenderHook> renderHook = new AtomicReference<>(PromptRenderHook.IDENTITY);

    @Override
    public PromptRenderHook renderHook() {
        return renderHook.get();
    }

    @Override
    public PromptRenderHook updateRenderHook(UnaryOperator<PromptRenderHook> update) {
        return renderHook.updateAndGet(update);
    }

    /**
     * Renders history followed by the user message, then runs the shared hook.
     */
    protected List<ChatTurn> renderPrompt(InvocationContext context) {
        List<ChatTurn> rendered = new ArrayList<>(context.history().size() + 1);
        rendered.addAll(context.history());
        rendered.add(ChatTurn.user(context.message()));
        List<ChatTurn> result = renderHook.get().render(context, List.copyOf(rendered));
        return result == null ? List.of() : result;
    }
}
