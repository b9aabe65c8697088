package com.comparo.core.dispatch;

import com.comparo.core.aggregate.AggregatedResponse;
import com.comparo.core.aggregate.ResponseAggregator;
import com.comparo.core.aggregate.TargetEvent;
import com.comparo.core.approval.ApprovalGate;
import com.comparo.core.approval.ProposedToolCall;
import com.comparo.core.config.ComparoProperties;
import com.comparo.core.events.ComparoEvent;
import com.comparo.core.events.EventBus;
import com.comparo.core.logging.MdcContext;
import com.comparo.core.metrics.ComparoMetrics;
import com.comparo.core.model.ApprovalDecision;
import com.comparo.core.model.LogicalRequest;
import com.comparo.core.model.PromptModifier;
import com.comparo.core.model.TargetState;
import com.comparo.core.model.ToolCallRecord;
import com.comparo.core.request.InvalidRequestException;
import com.comparo.core.request.RequestCloner;
import com.comparo.core.request.TargetAttachments;
import com.comparo.core.pipeline.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fans one logical request out to several targets and aggregates their streams.
 * <p>
 * Each target runs on the bounded target executor. Every event a target produces is applied to
 * the aggregate first and then forwarded to the caller's callbacks and the {@link EventBus}.
 * The returned future completes once every target has reached a terminal state.
 */
@Service
public class ComparisonOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ComparisonOrchestrator.class);

    private final RequestCloner cloner;
    private final ResponseAggregator aggregator;
    private final ApprovalGate approvalGate;
    private final TargetInvocationAdapter adapter;
    private final EventBus eventBus;
    private final ComparoMetrics metrics;
    private final ExecutorService targetExecutor;
    private final ScheduledExecutorService timeoutScheduler;
    private final Duration timeout;

    private final ConcurrentHashMap<String, ComparisonRun> activeRuns = new ConcurrentHashMap<>();

    @Autowired
    public ComparisonOrchestrator(RequestCloner cloner, ResponseAggregator aggregator, ApprovalGate approvalGate,
                                  TargetInvocationAdapter adapter, EventBus eventBus, ComparoMetrics metrics,
                                  @Qualifier("targetExecutor") ExecutorService targetExecutor,
                                  @Qualifier("comparisonTimeoutScheduler") ScheduledExecutorService timeoutScheduler,
                                  ComparoProperties properties) {
        this(cloner, aggregator, approvalGate, adapter, eventBus, metrics, targetExecutor, timeoutScheduler,
                Duration.ofSeconds(properties.getDispatch().getTimeoutSeconds()));
    }

    ComparisonOrchestrator(RequestCloner cloner, ResponseAggregator aggregator, ApprovalGate approvalGate,
                           TargetInvocationAdapter adapter, EventBus eventBus, ComparoMetrics metrics,
                           ExecutorService targetExecutor, ScheduledExecutorService timeoutScheduler,
                           Duration timeout) {
        this.cloner = cloner;
        this.aggregator = aggregator;
        this.approvalGate = approvalGate;
        this.adapter = adapter;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.targetExecutor = targetExecutor;
        this.timeoutScheduler = timeoutScheduler;
        this.timeout = timeout;
    }

    /**
     * Starts a comparison without waiting for any target.
     *
     * @param request         the validated logical request
     * @param targetIds       targets to invoke, in display order
     * @param promptModifiers per-target prompt modifiers; a missing entry keeps the target default
     * @param callbacks       caller hooks, may be null
     * @param cancellation    request cancellation, may be null
     * @return a future completed with the final snapshot once every target has finished
     * @throws InvalidRequestException if the request or target list is invalid
     * @throws com.comparo.core.request.DuplicateRequestException if the request id is already running
     */
    public CompletableFuture<AggregatedResponse.Snapshot> sendToMultipleTargets(
            LogicalRequest request, List<String> targetIds, Map<String, PromptModifier> promptModifiers,
            ComparisonCallbacks callbacks, CancellationSignal cancellation) {

        if (!cloner.validateRequest(request)) {
            throw new InvalidRequestException("Request failed validation"
                    + (request == null ? "" : ": " + request.requestId()));
        }
        String requestId = request.requestId();
        CancellationSignal requestSignal = cancellation == null ? new CancellationSignal() : cancellation;
        ComparisonCallbacks hooks = callbacks == null ? ComparisonCallbacks.NONE : callbacks;
        Map<String, PromptModifier> modifiers = promptModifiers == null ? Map.of() : promptModifiers;

        Map<String, CancellationSignal> targetSignals = new LinkedHashMap<>();
        List<DispatchDescriptor> descriptors = cloner.createParallelRequests(request, targetIds, targetId -> {
            CancellationSignal targetSignal = requestSignal.child();
            targetSignals.put(targetId, targetSignal);
            return new TargetAttachments(
                    modifiers.get(targetId),
                    rendered -> hooks.onPromptRendered(targetId, rendered),
                    approvalGate,
                    targetSignal);
        });

        aggregator.startAggregation(requestId, request.message(), targetIds);
        ComparisonRun run = new ComparisonRun(requestId, requestSignal, Map.copyOf(targetSignals), hooks);
        activeRuns.put(requestId, run);
        requestSignal.onCancel(() -> approvalGate.cancelRequest(requestId));

        MdcContext.setRequest(requestId);
        try {
            log.info("Dispatching {} to {} target(s): {}", requestId, targetIds.size(), targetIds);
            metrics.recordComparisonStarted(targetIds.size());
            eventBus.publish(ComparoEvent.of(ComparoEvent.COMPARISON_STARTED, requestId, null,
                    Map.of("message", request.message(), "targets", List.copyOf(targetIds))));

            if (!timeout.isZero() && !timeout.isNegative()) {
                run.timeoutTask = timeoutScheduler.schedule(() -> {
                    if (!run.completed.get()) {
                        log.warn("Comparison {} timed out after {}s, cancelling", requestId, timeout.toSeconds());
                        requestSignal.cancel();
                    }
                }, timeout.toMillis(), TimeUnit.MILLISECONDS);
            }

            for (DispatchDescriptor descriptor : descriptors) {
                try {
                    targetExecutor.execute(() -> runTarget(run, descriptor));
                } catch (RejectedExecutionException e) {
                    log.error("Executor rejected target {} of {}", descriptor.targetId(), requestId, e);
                    run.accept(TargetEvent.error(descriptor.targetId(), "Dispatch rejected: " + e.getMessage()));
                }
            }
        } finally {
            MdcContext.clear();
        }
        return run.result;
    }

    /**
     * Applies an approve/deny decision to the request's pending tool calls.
     *
     * @return number of tool calls resolved
     */
    public int decide(ApprovalDecision decision) {
        int resolved = approvalGate.decide(decision);
        metrics.recordApprovalDecision(decision.decision().name().toLowerCase(), resolved);
        return resolved;
    }

    /**
     * Cancels every target of a running request.
     *
     * @return false if the request is not running
     */
    public boolean cancel(String requestId) {
        ComparisonRun run = activeRuns.get(requestId);
        if (run == null) {
            return false;
        }
        log.info("Cancelling comparison {}", requestId);
        run.cancellation.cancel();
        return true;
    }

    /**
     * Cancels one target of a running request; the others continue.
     *
     * @return false if the request is not running or does not include the target
     */
    public boolean cancelTarget(String requestId, String targetId) {
        ComparisonRun run = activeRuns.get(requestId);
        if (run == null) {
            return false;
        }
        CancellationSignal signal = run.targetSignals.get(targetId);
        if (signal == null) {
            return false;
        }
        log.info("Cancelling target {} of {}", targetId, requestId);
        signal.cancel();
        return true;
    }

    /**
     * Drops all state held for a request. A request still running is cancelled first.
     */
    public void release(String requestId) {
        ComparisonRun run = activeRuns.remove(requestId);
        if (run != null && !run.completed.get()) {
            run.cancellation.cancel();
        }
        aggregator.release(requestId);
        approvalGate.release(requestId);
        eventBus.forget(requestId);
    }

    public Optional<AggregatedResponse.Snapshot> snapshot(String requestId) {
        return aggregator.getAggregation(requestId);
    }

    /** Tool calls proposed so far for a request, grouped by target. */
    public Map<String, List<ProposedToolCall>> pendingToolState(String requestId) {
        return approvalGate.pendingToolState(requestId);
    }

    public boolean isActive(String requestId) {
        return activeRuns.containsKey(requestId);
    }

    public Set<String> activeRequestIds() {
        return Set.copyOf(activeRuns.keySet());
    }

    private void runTarget(ComparisonRun run, DispatchDescriptor descriptor) {
        MdcContext.setTarget(descriptor.requestId(), descriptor.targetId());
        try {
            log.debug("Invoking target {}", descriptor.targetId());
            adapter.dispatch(descriptor, run::accept).join();
        } catch (RuntimeException e) {
            log.error("Target {} of {} ended abnormally: {}", descriptor.targetId(), descriptor.requestId(),
                    e.getMessage(), e);
            run.accept(TargetEvent.error(descriptor.targetId(), e.getMessage() == null
                    ? e.getClass().getSimpleName() : e.getMessage()));
        } finally {
            MdcContext.clear();
        }
    }

    private void publish(String requestId, TargetEvent event) {
        String type;
        Map<String, Object> payload = new LinkedHashMap<>();
        switch (event.type()) {
            case DELTA -> {
                type = ComparoEvent.TARGET_DELTA;
                payload.put("text", event.text());
            }
            case TOOL_PENDING -> {
                type = ComparoEvent.TARGET_TOOL_PENDING;
                putToolCall(payload, event.toolCall());
            }
            case TOOL_RESOLVED -> {
                type = ComparoEvent.TARGET_TOOL_RESOLVED;
                putToolCall(payload, event.toolCall());
            }
            case COMPLETE -> type = ComparoEvent.TARGET_COMPLETED;
            default -> {
                type = ComparoEvent.TARGET_FAILED;
                payload.put("error", event.error());
            }
        }
        eventBus.publish(new ComparoEvent(type, requestId, event.targetId(), payload, event.timestamp()));
    }

    private static void putToolCall(Map<String, Object> payload, ToolCallRecord toolCall) {
        if (toolCall == null) {
            return;
        }
        payload.put("toolCallId", toolCall.toolCallId());
        payload.put("tool", toolCall.name());
        payload.put("status", toolCall.status().name());
        payload.put("displayMessage", toolCall.displayMessage());
        payload.put("arguments", toolCall.arguments());
    }

    private void recordTargetMetrics(AggregatedResponse.Snapshot snapshot, TargetEvent event) {
        TargetState state = snapshot.target(event.targetId());
        if (state == null || state.completedAt() == null) {
            return;
        }
        String outcome = event.type() == TargetEvent.Type.COMPLETE ? "completed"
                : TargetInvocationAdapter.CANCELLED.equals(event.error()) ? "cancelled" : "failed";
        metrics.recordTargetResult(event.targetId(), outcome,
                Duration.between(snapshot.startTime(), state.completedAt()).toMillis());
    }

    private void recordToolMetrics(TargetEvent event) {
        if (event.type() == TargetEvent.Type.TOOL_PENDING) {
            metrics.recordToolProposed(event.toolCall().name());
        } else if (event.type() == TargetEvent.Type.TOOL_RESOLVED) {
            metrics.recordToolResolution(event.toolCall().status().name().toLowerCase());
        }
    }

    /**
     * State for one running comparison, captured by its targets' event sinks.
     */
    private final class ComparisonRun {

        final String requestId;
        final CancellationSignal cancellation;
        final Map<String, CancellationSignal> targetSignals;
        final ComparisonCallbacks callbacks;
        final CompletableFuture<AggregatedResponse.Snapshot> result = new CompletableFuture<>();
        final AtomicBoolean completed = new AtomicBoolean(false);
        volatile ScheduledFuture<?> timeoutTask;
        private final Queue<TargetEvent> pending = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean draining = new AtomicBoolean(false);

        ComparisonRun(String requestId, CancellationSignal cancellation,
                      Map<String, CancellationSignal> targetSignals, ComparisonCallbacks callbacks) {
            this.requestId = requestId;
            this.cancellation = cancellation;
            this.targetSignals = targetSignals;
            this.callbacks = callbacks;
        }

        /**
         * Queues an event and drains the queue unless another thread already is. Applying an
         * event, publishing it and running the callbacks happen in one step per event, so
         * subscribers see events in the order the aggregate applied them and the completion
         * event always comes last. Callbacks run without any lock held.
         */
        void accept(TargetEvent event) {
            pending.add(event);
            do {
                if (!draining.compareAndSet(false, true)) {
                    return;
                }
                try {
                    TargetEvent next;
                    while ((next = pending.poll()) != null) {
                        try {
                            apply(next);
                        } catch (RuntimeException e) {
                            log.error("Failed to apply {} of {} for {}", next.type(), next.targetId(), requestId, e);
                        }
                    }
                } finally {
                    draining.set(false);
                }
            } while (!pending.isEmpty());
        }

        private void apply(TargetEvent event) {
            Optional<AggregatedResponse.Snapshot> updated = aggregator.updateResponse(requestId, event);
            if (updated.isEmpty()) {
                return;
            }
            AggregatedResponse.Snapshot snapshot = updated.get();
            publish(requestId, event);
            if (event.isTerminal()) {
                recordTargetMetrics(snapshot, event);
            } else if (event.toolCall() != null) {
                recordToolMetrics(event);
            }
            try {
                callbacks.onDelta(snapshot, event);
            } catch (RuntimeException e) {
                log.warn("onDelta callback failed for {}: {}", requestId, e.getMessage(), e);
            }
            if (snapshot.complete() && completed.compareAndSet(false, true)) {
                finish(snapshot);
            }
        }

        private void finish(AggregatedResponse.Snapshot snapshot) {
            ScheduledFuture<?> task = timeoutTask;
            if (task != null) {
                task.cancel(false);
            }
            long elapsedMs = snapshot.elapsed() == null ? 0 : snapshot.elapsed().toMillis();
            log.info("Comparison {} complete in {}ms: {} succeeded, {} failed", requestId, elapsedMs,
                    snapshot.stats().successCount(), snapshot.stats().errorCount());
            metrics.recordComparisonDuration(elapsedMs);
            eventBus.publish(ComparoEvent.of(ComparoEvent.COMPARISON_COMPLETED, requestId, null, Map.of(
                    "successCount", snapshot.stats().successCount(),
                    "errorCount", snapshot.stats().errorCount(),
                    "durationMs", elapsedMs)));
            try {
                callbacks.onComplete(snapshot);
            } catch (RuntimeException e) {
                log.warn("onComplete callback failed for {}: {}", requestId, e.getMessage(), e);
            }
            result.complete(snapshot);
        }
    }
}
