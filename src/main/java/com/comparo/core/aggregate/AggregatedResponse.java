package com.comparo.core.aggregate;

import com.comparo.core.model.ResponseStats;
import com.comparo.core.model.TargetState;
import com.comparo.core.model.TargetStatus;
import com.comparo.core.model.ToolCallRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable aggregate of every target's progress for one logical request.
 * All mutation goes through {@link #apply}, which is synchronized; readers get {@link Snapshot}s.
 */
public final class AggregatedResponse {

    private final String requestId;
    private final String originalMessage;
    private final List<String> targetIds;
    private final Instant startTime;
    private final Clock clock;
    private final Set<String> pendingTargets;
    private final Set<String> completedTargets = new LinkedHashSet<>();
    private final Map<String, MutableTargetState> perTarget = new LinkedHashMap<>();
    private Instant endTime;
    private boolean complete;

    AggregatedResponse(String requestId, String originalMessage, List<String> targetIds, Clock clock) {
        this.requestId = requestId;
        this.originalMessage = originalMessage;
        this.targetIds = List.copyOf(targetIds);
        this.clock = clock;
        this.startTime = clock.instant();
        this.pendingTargets = new LinkedHashSet<>(targetIds);
        for (String targetId : targetIds) {
            perTarget.put(targetId, new MutableTargetState(targetId, startTime));
        }
    }

    public String requestId() {
        return requestId;
    }

    /**
     * Applies one event. Events for unknown targets and events for a target that already
     * reached a terminal state leave the aggregate unchanged.
     *
     * @return the snapshot after the event
     */
    synchronized Snapshot apply(TargetEvent event) {
        MutableTargetState target = perTarget.get(event.targetId());
        if (target == null || target.complete) {
            return snapshot();
        }
        Instant now = clock.instant();
        target.lastUpdate = now;
        switch (event.type()) {
            case DELTA -> {
                if (event.text() != null) {
                    target.text.append(event.text());
                }
                target.status = TargetStatus.STREAMING;
            }
            case TOOL_PENDING -> {
                if (event.toolCall() != null) {
                    target.upsertToolCall(event.toolCall());
                }
            }
            case TOOL_RESOLVED -> {
                if (event.toolCall() != null) {
                    target.updateToolCallStatus(event.toolCall());
                }
            }
            case COMPLETE -> {
                if (event.text() != null) {
                    target.text.setLength(0);
                    target.text.append(event.text());
                }
                target.status = TargetStatus.COMPLETE;
                markTerminal(target, now);
            }
            case ERROR -> {
                target.error = event.error() == null ? "Unknown error" : event.error();
                target.status = TargetStatus.ERRORED;
                markTerminal(target, now);
            }
        }
        return snapshot();
    }

    /**
     * Terminates every pending target with the given error. Used to force completion.
     */
    synchronized Snapshot forceComplete(String reason) {
        Instant now = clock.instant();
        for (String targetId : new ArrayList<>(pendingTargets)) {
            MutableTargetState target = perTarget.get(targetId);
            target.error = reason;
            target.status = TargetStatus.ERRORED;
            target.lastUpdate = now;
            markTerminal(target, now);
        }
        return snapshot();
    }

    private void markTerminal(MutableTargetState target, Instant now) {
        target.complete = true;
        target.completedAt = now;
        pendingTargets.remove(target.targetId);
        completedTargets.add(target.targetId);
        if (pendingTargets.isEmpty() && !complete) {
            complete = true;
            endTime = now;
        }
    }

    public synchronized Snapshot snapshot() {
        Map<String, TargetState> states = new LinkedHashMap<>();
        perTarget.forEach((id, state) -> states.put(id, state.freeze()));
        return new Snapshot(
                requestId,
                originalMessage,
                targetIds,
                List.copyOf(pendingTargets),
                List.copyOf(completedTargets),
                Collections.unmodifiableMap(states),
                computeStats(),
                complete,
                startTime,
                endTime);
    }

    private ResponseStats computeStats() {
        int success = 0;
        int errors = 0;
        long totalLength = 0;
        Long fastest = null;
        Long slowest = null;
        for (MutableTargetState state : perTarget.values()) {
            if (state.status == TargetStatus.ERRORED) {
                errors++;
            } else if (state.status == TargetStatus.COMPLETE) {
                success++;
                totalLength += state.text.length();
                long elapsed = Duration.between(startTime, state.completedAt).toMillis();
                fastest = fastest == null ? elapsed : Math.min(fastest, elapsed);
                slowest = slowest == null ? elapsed : Math.max(slowest, elapsed);
            }
        }
        double average = success == 0 ? 0.0 : (double) totalLength / success;
        return new ResponseStats(success, errors, pendingTargets.size(), average, fastest, slowest);
    }

    /**
     * Immutable view of an aggregate at one point in time.
     *
     * @param requestId        the logical request
     * @param originalMessage  the user message every target received
     * @param targetIds        targets in the order aggregation started with
     * @param pendingTargets   targets without a terminal event
     * @param completedTargets targets with a terminal event, in completion order
     * @param perTarget        per-target state, in start order
     * @param stats            summary statistics
     * @param complete         true once every target is terminal
     * @param startTime        when aggregation started
     * @param endTime          when the last target became terminal, null before
     */
    public record Snapshot(
        String requestId,
        String originalMessage,
        List<String> targetIds,
        List<String> pendingTargets,
        List<String> completedTargets,
        Map<String, TargetState> perTarget,
        ResponseStats stats,
        boolean complete,
        Instant startTime,
        Instant endTime
    ) {

        public TargetState target(String targetId) {
            return perTarget.get(targetId);
        }

        public Duration elapsed() {
            return endTime == null ? null : Duration.between(startTime, endTime);
        }
    }

    private static final class MutableTargetState {
        final String targetId;
        final StringBuilder text = new StringBuilder();
        final List<ToolCallRecord> toolCalls = new ArrayList<>();
        TargetStatus status = TargetStatus.PENDING;
        String error;
        boolean complete;
        Instant lastUpdate;
        Instant completedAt;

        MutableTargetState(String targetId, Instant created) {
            this.targetId = targetId;
            this.lastUpdate = created;
        }

        void upsertToolCall(ToolCallRecord call) {
            for (int i = 0; i < toolCalls.size(); i++) {
                if (toolCalls.get(i).toolCallId().equals(call.toolCallId())) {
                    toolCalls.set(i, call);
                    return;
                }
            }
            toolCalls.add(call);
        }

        void updateToolCallStatus(ToolCallRecord call) {
            for (int i = 0; i < toolCalls.size(); i++) {
                if (toolCalls.get(i).toolCallId().equals(call.toolCallId())) {
                    toolCalls.set(i, toolCalls.get(i).withStatus(call.status()));
                    return;
                }
            }
            toolCalls.add(call);
        }

        TargetState freeze() {
            return new TargetState(targetId, status, text.toString(), toolCalls, error, complete,
                    lastUpdate, completedAt);
        }
    }
}
