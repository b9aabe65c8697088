package com.comparo.core.aggregate;

import com.comparo.core.model.TargetState;
import com.comparo.core.model.ToolCallRecord;
import com.comparo.core.request.DuplicateRequestException;
import com.comparo.core.request.InvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks N asynchronously completing target streams under one request id.
 * <p>
 * Each request has its own {@link AggregatedResponse}; updates for one request are serialized on
 * that aggregate while different requests proceed independently. Updates for unknown or released
 * requests are ignored rather than raised, since late events from cancelled targets are expected.
 */
@Service
public class ResponseAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResponseAggregator.class);

    private final ConcurrentHashMap<String, AggregatedResponse> activeAggregations = new ConcurrentHashMap<>();
    private final Clock clock;
    private volatile boolean disposed;

    public ResponseAggregator() {
        this(Clock.systemUTC());
    }

    ResponseAggregator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Starts tracking a request with every target pending.
     *
     * @throws InvalidRequestException   if no targets are given
     * @throws DuplicateRequestException if the request is already tracked
     */
    public AggregatedResponse.Snapshot startAggregation(String requestId, String originalMessage, List<String> targetIds) {
        if (targetIds == null || targetIds.isEmpty()) {
            throw new InvalidRequestException("Cannot aggregate a request with no targets");
        }
        if (disposed) {
            throw new IllegalStateException("Aggregator has been disposed");
        }
        AggregatedResponse aggregation = new AggregatedResponse(requestId, originalMessage, targetIds, clock);
        if (activeAggregations.putIfAbsent(requestId, aggregation) != null) {
            throw new DuplicateRequestException(requestId);
        }
        log.info("Started aggregation for {} across {} target(s)", requestId, targetIds.size());
        return aggregation.snapshot();
    }

    /**
     * Applies one target event.
     *
     * @return the snapshot after the update, or empty if the request is not tracked
     */
    public Optional<AggregatedResponse.Snapshot> updateResponse(String requestId, TargetEvent event) {
        AggregatedResponse aggregation = activeAggregations.get(requestId);
        if (aggregation == null) {
            log.debug("Ignoring {} for untracked request {}", event.type(), requestId);
            return Optional.empty();
        }
        AggregatedResponse.Snapshot snapshot = aggregation.apply(event);
        if (event.isTerminal()) {
            log.debug("Target {} of {} finished: {} ({} pending)", event.targetId(), requestId,
                    event.type(), snapshot.pendingTargets().size());
        }
        return Optional.of(snapshot);
    }

    public Optional<AggregatedResponse.Snapshot> getAggregation(String requestId) {
        return Optional.ofNullable(activeAggregations.get(requestId)).map(AggregatedResponse::snapshot);
    }

    /**
     * Marks every still pending target as errored, then stops tracking the request.
     *
     * @return the final snapshot, or empty if the request is not tracked
     */
    public Optional<AggregatedResponse.Snapshot> completeAggregation(String requestId) {
        AggregatedResponse aggregation = activeAggregations.remove(requestId);
        if (aggregation == null) {
            return Optional.empty();
        }
        return Optional.of(aggregation.forceComplete("Aggregation completed before target finished"));
    }

    public void release(String requestId) {
        if (activeAggregations.remove(requestId) != null) {
            log.debug("Released aggregation {}", requestId);
        }
    }

    public Set<String> activeRequestIds() {
        return Set.copyOf(activeAggregations.keySet());
    }

    /** Drops every aggregation; later updates are ignored and new aggregations are refused. */
    public void dispose() {
        disposed = true;
        activeAggregations.clear();
    }

    /**
     * Projects a snapshot into the presentation format.
     */
    public static WebviewPayload toWebviewFormat(AggregatedResponse.Snapshot snapshot) {
        Map<String, String> responses = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        Map<String, List<ToolCallRecord>> toolCalls = new LinkedHashMap<>();
        for (Map.Entry<String, TargetState> entry : snapshot.perTarget().entrySet()) {
            TargetState state = entry.getValue();
            if (state.error() != null) {
                errors.put(entry.getKey(), state.error());
                responses.put(entry.getKey(), "");
            } else {
                responses.put(entry.getKey(), state.accumulatedText());
            }
            if (!state.toolCalls().isEmpty()) {
                toolCalls.put(entry.getKey(), state.toolCalls());
            }
        }
        return new WebviewPayload(
                snapshot.requestId(),
                snapshot.originalMessage(),
                Collections.unmodifiableMap(responses),
                Collections.unmodifiableMap(errors),
                Collections.unmodifiableMap(toolCalls),
                snapshot.targetIds(),
                snapshot.endTime() != null ? snapshot.endTime() : snapshot.startTime(),
                snapshot.stats(),
                snapshot.complete());
    }
}
