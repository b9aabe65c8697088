package com.comparo.core.pipeline;

import com.comparo.core.model.ChatTurn;
import com.comparo.core.model.TargetDescriptor;
import com.comparo.core.selection.TargetCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.tool.ToolCallback;
import reactor.core.Disposable;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Production pipeline that streams each invocation through a Spring AI {@link ChatClient}.
 * <p>
 * The target id selects the model; sampling settings come from the target's catalog entry.
 * Tools are offered to every invocation, each wrapped in an {@link ApprovalGatedToolCallback}
 * that finds the invocation through the Spring AI tool context.
 */
public class ChatClientInvocationPipeline extends AbstractInvocationPipeline {

    private static final Logger log = LoggerFactory.getLogger(ChatClientInvocationPipeline.class);

    private final ChatClient chatClient;
    private final TargetCatalog catalog;
    private final ToolCallback[] tools;

    public ChatClientInvocationPipeline(ChatClient chatClient, TargetCatalog catalog, List<ApprovalGatedToolCallback> tools) {
        this.chatClient = chatClient;
        this.catalog = catalog;
        this.tools = tools.toArray(new ToolCallback[0]);
    }

    @Override
    public CompletableFuture<Void> invoke(InvocationContext context, InvocationListener listener) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        List<ChatTurn> turns = renderPrompt(context);
        if (turns.isEmpty()) {
            done.completeExceptionally(new IllegalStateException("Rendered prompt is empty"));
            return done;
        }

        log.info("Streaming {} message(s) to {} with {} tool(s)", turns.size(), context.targetId(), tools.length);
        ChatClient.ChatClientRequestSpec spec = chatClient.prompt()
                .messages(toMessages(turns))
                .options(optionsFor(context.targetId()));
        if (tools.length > 0) {
            spec = spec.toolCallbacks(tools).toolContext(context.toToolContext());
        }

        Disposable subscription = spec.stream().content().subscribe(
                listener::onDelta,
                done::completeExceptionally,
                () -> done.complete(null));

        CancellationSignal.Registration registration = context.cancellation().onCancel(() -> {
            subscription.dispose();
            done.completeExceptionally(new CancellationException("Cancelled"));
        });
        done.whenComplete((ignored, error) -> registration.unregister());
        return done;
    }

    ChatOptions optionsFor(String targetId) {
        TargetDescriptor target = catalog.find(targetId)
                .orElse(new TargetDescriptor(targetId, targetId, null, null, null, null));
        return ChatOptions.builder()
                .model(target.id())
                .temperature(target.temperature())
                .maxTokens(target.maxTokens())
                .topP(target.topP())
                .build();
    }

    static List<Message> toMessages(List<ChatTurn> turns) {
        return turns.stream().map(ChatClientInvocationPipeline::toMessage).toList();
    }

    private static Message toMessage(ChatTurn turn) {
        return switch (turn.role()) {
            case SYSTEM -> new SystemMessage(turn.text());
            case ASSISTANT -> new AssistantMessage(turn.text());
            case USER -> new UserMessage(turn.text());
        };
    }
}
