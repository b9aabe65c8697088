package com.comparo.core.dispatch;

import com.comparo.core.approval.ApprovalGate;
import com.comparo.core.model.ChatTurn;
import com.comparo.core.model.PromptModifier;
import com.comparo.core.model.RenderObserver;
import com.comparo.core.pipeline.CancellationSignal;

import java.util.List;
import java.util.Optional;

/**
 * Immutable per-target dispatch record. Each descriptor is handed to exactly one adapter
 * invocation and carries that invocation's request-local configuration.
 *
 * @param requestId      id shared by every target of the logical request
 * @param targetId       the target this descriptor is for
 * @param message        the user message
 * @param history        this descriptor's own copy of the history
 * @param promptModifier nullable transform of the rendered prompt
 * @param renderObserver nullable observer of the rendered prompt
 * @param approvalGate   nullable gate for tool calls; without one every tool call is denied
 * @param cancellation   request-scoped cancellation signal
 */
public record DispatchDescriptor(
    String requestId,
    String targetId,
    String message,
    List<ChatTurn> history,
    PromptModifier promptModifier,
    RenderObserver renderObserver,
    ApprovalGate approvalGate,
    CancellationSignal cancellation
) {

    public DispatchDescriptor {
        history = history == null ? List.of() : List.copyOf(history);
        cancellation = cancellation == null ? new CancellationSignal() : cancellation;
    }

    public Optional<PromptModifier> optionalPromptModifier() {
        return Optional.ofNullable(promptModifier);
    }

    public Optional<RenderObserver> optionalRenderObserver() {
        return Optional.ofNullable(renderObserver);
    }
}
