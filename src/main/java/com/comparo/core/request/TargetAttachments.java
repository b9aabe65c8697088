package com.comparo.core.request;

import com.comparo.core.approval.ApprovalGate;
import com.comparo.core.model.PromptModifier;
import com.comparo.core.model.RenderObserver;
import com.comparo.core.pipeline.CancellationSignal;

/**
 * Request-local configuration attached to one target's descriptor.
 *
 * @param promptModifier optional transform of the rendered prompt; null keeps the target default
 * @param renderObserver optional observer of the rendered prompt
 * @param approvalGate   gate that decides this target's tool calls; null denies every tool call
 * @param cancellation   signal shared by every target of the request
 */
public record TargetAttachments(
    PromptModifier promptModifier,
    RenderObserver renderObserver,
    ApprovalGate approvalGate,
    CancellationSignal cancellation
) {

    public TargetAttachments {
        cancellation = cancellation == null ? new CancellationSignal() : cancellation;
    }

    public static TargetAttachments none() {
        return new TargetAttachments(null, null, null, null);
    }
}
