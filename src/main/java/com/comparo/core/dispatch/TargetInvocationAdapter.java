package com.comparo.core.dispatch;

import com.comparo.core.aggregate.TargetEvent;
import com.comparo.core.approval.ApprovalGate;
import com.comparo.core.approval.ApprovalOutcome;
import com.comparo.core.approval.ToolCallFormatter;
import com.comparo.core.logging.MdcContext;
import com.comparo.core.model.ToolCallRecord;
import com.comparo.core.model.ToolCallStatus;
import com.comparo.core.pipeline.CancellationSignal;
import com.comparo.core.pipeline.ContextCarriedRenderHook;
import com.comparo.core.pipeline.InvocationContext;
import com.comparo.core.pipeline.InvocationListener;
import com.comparo.core.pipeline.InvocationPipeline;
import com.comparo.core.pipeline.ToolApprovalHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Runs one descriptor through the shared {@link InvocationPipeline} and turns the pipeline's
 * callbacks into {@link TargetEvent}s for that descriptor's target.
 * <p>
 * Every dispatch gets its own {@link InvocationContext}; the pipeline's render hook is wrapped
 * once and reads the prompt modifier and render observer from that context, so concurrent
 * dispatches never see each other's configuration. Each dispatch emits exactly one terminal
 * event, and nothing else after it.
 */
@Component
public class TargetInvocationAdapter {

    private static final Logger log = LoggerFactory.getLogger(TargetInvocationAdapter.class);

    static final String CANCELLED = "Cancelled";

    private final InvocationPipeline pipeline;
    private final ToolCallFormatter formatter;

    public TargetInvocationAdapter(InvocationPipeline pipeline, ToolCallFormatter formatter) {
        this.pipeline = pipeline;
        this.formatter = formatter;
    }

    /**
     * Starts the invocation for one target.
     *
     * @param descriptor the target's descriptor
     * @param sink       receives the target's events in pipeline order
     * @return a future completed after the terminal event was delivered; never completes exceptionally
     */
    public CompletableFuture<Void> dispatch(DispatchDescriptor descriptor, Consumer<TargetEvent> sink) {
        ContextCarriedRenderHook.installOn(pipeline);

        EventForwarder forwarder = new EventForwarder(descriptor, sink);
        CancellationSignal.Registration registration = descriptor.cancellation().onCancel(forwarder::cancelled);
        if (forwarder.isTerminated()) {
            return forwarder.done;
        }

        InvocationContext context = new InvocationContext(descriptor, forwarder);
        CompletableFuture<Void> invocation;
        try {
            invocation = pipeline.invoke(context, forwarder);
        } catch (RuntimeException e) {
            log.error("Pipeline rejected invocation for {}/{}: {}",
                    descriptor.requestId(), descriptor.targetId(), e.getMessage(), e);
            registration.unregister();
            forwarder.failed(e);
            return forwarder.done;
        }
        if (invocation == null) {
            registration.unregister();
            forwarder.failed(new IllegalStateException("Pipeline returned no result"));
            return forwarder.done;
        }

        invocation.whenComplete((ignored, error) -> {
            registration.unregister();
            if (error != null) {
                forwarder.failed(unwrap(error));
            } else {
                forwarder.completed();
            }
        });
        return forwarder.done;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Listener and approval handle for one dispatch. Emission is serialized on the instance so
     * events keep pipeline order and nothing follows the terminal event.
     */
    private final class EventForwarder implements InvocationListener, ToolApprovalHandle {

        private final DispatchDescriptor descriptor;
        private final Consumer<TargetEvent> sink;
        private final ConcurrentHashMap<String, ToolCallRecord> toolCalls = new ConcurrentHashMap<>();
        private final CompletableFuture<Void> done = new CompletableFuture<>();
        private boolean terminated;

        EventForwarder(DispatchDescriptor descriptor, Consumer<TargetEvent> sink) {
            this.descriptor = descriptor;
            this.sink = sink;
        }

        @Override
        public void onDelta(String text) {
            if (text != null && !text.isEmpty()) {
                emit(TargetEvent.delta(descriptor.targetId(), text));
            }
        }

        /**
         * A target that already finished or was cancelled gets an immediate denial and nothing is
         * registered. Otherwise the proposal is registered with the gate before announcing it, so a
         * decision taken while the pending event is being handled already finds the call. The
         * resolution is announced after the pending event even when the gate answers immediately,
         * and never on the deciding thread, which may itself be inside another target's event
         * delivery.
         */
        @Override
        public CompletableFuture<ApprovalOutcome> requestApproval(String toolCallId, String toolName,
                                                                  Map<String, Object> arguments) {
            if (isTerminated() || descriptor.cancellation().isCancelled()) {
                log.info("Denying tool call {} of finished target {}/{}",
                        toolCallId, descriptor.requestId(), descriptor.targetId());
                return CompletableFuture.completedFuture(ApprovalOutcome.DENIED);
            }
            ToolCallRecord record = new ToolCallRecord(toolCallId, toolName, ToolCallStatus.PENDING,
                    arguments, formatter.displayMessage(toolName, arguments == null ? Map.of() : arguments));
            toolCalls.put(toolCallId, record);

            ApprovalGate gate = descriptor.approvalGate();
            if (gate == null) {
                log.warn("No approval gate for {}/{}; denying tool call {}",
                        descriptor.requestId(), descriptor.targetId(), toolCallId);
                if (emit(TargetEvent.toolPending(descriptor.targetId(), record))) {
                    emit(TargetEvent.toolResolved(descriptor.targetId(), record.withStatus(ToolCallStatus.DENIED)));
                }
                return CompletableFuture.completedFuture(ApprovalOutcome.DENIED);
            }

            CompletableFuture<ApprovalOutcome> proposal =
                    gate.propose(descriptor.requestId(), descriptor.targetId(), toolCallId, toolName, arguments);
            emit(TargetEvent.toolPending(descriptor.targetId(), record));
            return proposal.thenApplyAsync(outcome -> {
                MdcContext.setTarget(descriptor.requestId(), descriptor.targetId());
                try {
                    ToolCallStatus status = outcome == ApprovalOutcome.APPROVED
                            ? ToolCallStatus.APPROVED : ToolCallStatus.DENIED;
                    emit(TargetEvent.toolResolved(descriptor.targetId(), record.withStatus(status)));
                    if (outcome == ApprovalOutcome.DENIED) {
                        gate.markSkipped(descriptor.requestId(), toolCallId);
                    }
                    log.debug("Tool call {} resolved as {}", toolCallId, status);
                    return outcome;
                } finally {
                    MdcContext.clear();
                }
            });
        }

        @Override
        public void toolExecuted(String toolCallId) {
            ToolCallRecord record = toolCalls.get(toolCallId);
            if (record == null) {
                log.warn("Executed tool call {} was never proposed by {}", toolCallId, descriptor.targetId());
                return;
            }
            ApprovalGate gate = descriptor.approvalGate();
            if (gate != null) {
                gate.markExecuted(descriptor.requestId(), toolCallId);
            }
            emit(TargetEvent.toolResolved(descriptor.targetId(), record.withStatus(ToolCallStatus.EXECUTED)));
        }

        void completed() {
            terminate(TargetEvent.complete(descriptor.targetId()));
        }

        void failed(Throwable error) {
            String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
            log.warn("Target {} of {} failed: {}", descriptor.targetId(), descriptor.requestId(), message);
            terminate(TargetEvent.error(descriptor.targetId(), message));
        }

        void cancelled() {
            if (terminate(TargetEvent.error(descriptor.targetId(), CANCELLED))) {
                log.info("Target {} of {} cancelled", descriptor.targetId(), descriptor.requestId());
            }
            ApprovalGate gate = descriptor.approvalGate();
            if (gate != null) {
                gate.cancelTarget(descriptor.requestId(), descriptor.targetId());
            }
        }

        synchronized boolean isTerminated() {
            return terminated;
        }

        private synchronized boolean emit(TargetEvent event) {
            if (terminated) {
                return false;
            }
            deliver(event);
            return true;
        }

        private boolean terminate(TargetEvent event) {
            synchronized (this) {
                if (terminated) {
                    return false;
                }
                terminated = true;
                deliver(event);
            }
            done.complete(null);
            return true;
        }

        private void deliver(TargetEvent event) {
            try {
                sink.accept(event);
            } catch (RuntimeException e) {
                log.warn("Event sink failed on {} for {}: {}", event.type(), descriptor.targetId(), e.getMessage(), e);
            }
        }
    }
}
