package com.comparo.core.pipeline;

import com.comparo.core.approval.ApprovalOutcome;
import com.comparo.core.dispatch.DispatchDescriptor;
import com.comparo.core.model.ChatTurn;
import com.comparo.core.model.PromptModifier;
import com.comparo.core.model.RenderObserver;
import org.springframework.ai.chat.model.ToolContext;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Identifies one in-flight pipeline invocation. The pipeline threads this object through its
 * own call graph, and every shared extension point reads the invocation's configuration from
 * here rather than from anything captured when the extension point was installed.
 */
public final class InvocationContext {

    /** Key under which the context travels inside a Spring AI {@link ToolContext}. */
    public static final String TOOL_CONTEXT_KEY = "comparo.invocationContext";

    private final DispatchDescriptor descriptor;
    private final ToolApprovalHandle approvals;
    private final AtomicInteger toolCallSequence = new AtomicInteger();

    public InvocationContext(DispatchDescriptor descriptor, ToolApprovalHandle approvals) {
        this.descriptor = descriptor;
        this.approvals = approvals;
    }

    /**
     * Extracts the invocation context carried by a Spring AI tool context.
     */
    public static Optional<InvocationContext> from(ToolContext toolContext) {
        if (toolContext == null || toolContext.getContext() == null) {
            return Optional.empty();
        }
        Object value = toolContext.getContext().get(TOOL_CONTEXT_KEY);
        return value instanceof InvocationContext context ? Optional.of(context) : Optional.empty();
    }

    public DispatchDescriptor descriptor() {
        return descriptor;
    }

    public String requestId() {
        return descriptor.requestId();
    }

    public String targetId() {
        return descriptor.targetId();
    }

    public String message() {
        return descriptor.message();
    }

    public List<ChatTurn> history() {
        return descriptor.history();
    }

    public Optional<PromptModifier> promptModifier() {
        return descriptor.optionalPromptModifier();
    }

    public Optional<RenderObserver> renderObserver() {
        return descriptor.optionalRenderObserver();
    }

    public CancellationSignal cancellation() {
        return descriptor.cancellation();
    }

    public boolean isCancelled() {
        return descriptor.cancellation().isCancelled();
    }

    /**
     * Allocates an id for the next tool call of this invocation.
     */
    public String nextToolCallId(String toolName) {
        return descriptor.targetId() + ":" + toolName + ":" + toolCallSequence.incrementAndGet();
    }

    public CompletableFuture<ApprovalOutcome> requestToolApproval(String toolCallId, String toolName,
                                                                  Map<String, Object> arguments) {
        return approvals.requestApproval(toolCallId, toolName, arguments);
    }

    public void toolExecuted(String toolCallId) {
        approvals.toolExecuted(toolCallId);
    }

    /** Spring AI tool context carrying this invocation. */
    public Map<String, Object> toToolContext() {
        return Map.of(TOOL_CONTEXT_KEY, this);
    }

    @Override
    public String toString() {
        return "InvocationContext[" + descriptor.requestId() + "/" + descriptor.targetId() + "]";
    }
}
