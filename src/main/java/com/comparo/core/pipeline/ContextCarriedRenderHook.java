package com.comparo.core.pipeline;

import com.comparo.core.model.ChatTurn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Wraps a pipeline's shared render hook so that every invocation applies its own render
 * observer and prompt modifier. The wrapper holds no per-invocation state: both are looked
 * up on the {@link InvocationContext} passed in, so concurrent invocations on the same hook
 * cannot see each other's configuration.
 */
public final class ContextCarriedRenderHook implements PromptRenderHook {

    private static final Logger log = LoggerFactory.getLogger(ContextCarriedRenderHook.class);

    private final PromptRenderHook delegate;

    private ContextCarriedRenderHook(PromptRenderHook delegate) {
        this.delegate = delegate;
    }

    /**
     * Wraps the pipeline's hook unless it is already wrapped. Safe to call from every dispatch.
     *
     * @return the installed wrapper
     */
    public static ContextCarriedRenderHook installOn(InvocationPipeline pipeline) {
        PromptRenderHook installed = pipeline.updateRenderHook(current -> {
            if (current instanceof ContextCarriedRenderHook) {
                return current;
            }
            log.debug("Installing context-carried render hook on {}", pipeline.getClass().getSimpleName());
            return new ContextCarriedRenderHook(current);
        });
        return (ContextCarriedRenderHook) installed;
    }

    @Override
    public List<ChatTurn> render(InvocationContext context, List<ChatTurn> rendered) {
        List<ChatTurn> base = delegate.render(context, rendered);
        context.renderObserver().ifPresent(observer -> observer.accept(base));
        return context.promptModifier()
                .map(modifier -> modifier.apply(base))
                .orElse(base);
    }
}
