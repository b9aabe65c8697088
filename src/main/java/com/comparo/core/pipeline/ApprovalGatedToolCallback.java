package com.comparo.core.pipeline;

import com.comparo.core.approval.ApprovalOutcome;
import com.comparo.core.approval.ToolCallFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.ai.tool.metadata.ToolMetadata;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * Wraps a tool so that it only runs after its invocation's approval gate says so.
 * <p>
 * The model's tool loop calls this on a worker thread; the call blocks until the proposal is
 * decided or the invocation is cancelled. A denied call returns a short explanation to the model
 * instead of running the tool; a tool that throws is reported to the model the same way and still
 * counts as executed.
 */
public class ApprovalGatedToolCallback implements ToolCallback {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGatedToolCallback.class);

    private final ToolCallback delegate;
    private final ToolCallFormatter formatter;

    public ApprovalGatedToolCallback(ToolCallback delegate, ToolCallFormatter formatter) {
        this.delegate = delegate;
        this.formatter = formatter;
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return delegate.getToolDefinition();
    }

    @Override
    public ToolMetadata getToolMetadata() {
        return delegate.getToolMetadata();
    }

    @Override
    public String call(String toolInput) {
        return call(toolInput, null);
    }

    @Override
    public String call(String toolInput, ToolContext toolContext) {
        String toolName = getToolDefinition().name();
        Optional<InvocationContext> found = InvocationContext.from(toolContext);
        if (found.isEmpty()) {
            log.warn("Tool {} called outside a comparison invocation; refusing", toolName);
            return deniedMessage(toolName);
        }
        InvocationContext context = found.get();
        String toolCallId = context.nextToolCallId(toolName);
        Map<String, Object> arguments = formatter.parseArguments(toolInput);

        ApprovalOutcome outcome;
        try {
            outcome = context.requestToolApproval(toolCallId, toolName, arguments).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted waiting for approval of {} ({})", toolCallId, context);
            return deniedMessage(toolName);
        } catch (ExecutionException e) {
            log.warn("Approval of {} failed: {}", toolCallId, e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return deniedMessage(toolName);
        }

        if (outcome != ApprovalOutcome.APPROVED) {
            log.info("Tool call {} denied", toolCallId);
            return deniedMessage(toolName);
        }

        log.info("Executing approved tool call {}", toolCallId);
        try {
            return delegate.call(toolInput);
        } catch (RuntimeException e) {
            log.warn("Tool call {} ({}) failed: {}", toolCallId, toolName, e.getMessage(), e);
            return failedMessage(toolName, e);
        } finally {
            context.toolExecuted(toolCallId);
        }
    }

    private static String failedMessage(String toolName, RuntimeException error) {
        String reason = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return "The tool '" + toolName + "' failed: " + reason;
    }

    private static String deniedMessage(String toolName) {
        return "The user denied permission to run the tool '" + toolName + "'. Continue without its result.";
    }
}
