package com.comparo.core.request;

import com.comparo.core.dispatch.DispatchDescriptor;
import com.comparo.core.model.ChatTurn;
import com.comparo.core.model.LogicalRequest;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;

/**
 * Produces immutable request snapshots and one dispatch descriptor per target, so every
 * target receives exactly the same input and no two targets share mutable data.
 */
@Component
public class RequestCloner {

    /** Requests older than this are rejected by {@link #validateRequest}. */
    static final Duration MAX_REQUEST_AGE = Duration.ofHours(24);

    /** Clock skew tolerated for requests stamped slightly in the future. */
    static final Duration MAX_CLOCK_SKEW = Duration.ofSeconds(1);

    private final Clock clock;

    public RequestCloner() {
        this(Clock.systemUTC());
    }

    RequestCloner(Clock clock) {
        this.clock = clock;
    }

    /**
     * Snapshots a user message and its history under a fresh request id.
     *
     * @param message the user's message; trimmed, must not be blank
     * @param history prior turns; null is treated as empty
     * @return the immutable request
     * @throws InvalidRequestException if the message is blank or a history entry is malformed
     */
    public LogicalRequest cloneRequest(String message, List<ChatTurn> history) {
        if (message == null || message.isBlank()) {
            throw new InvalidRequestException("Message must not be empty");
        }
        List<ChatTurn> turns = history == null ? List.of() : history;
        for (int i = 0; i < turns.size(); i++) {
            ChatTurn turn = turns.get(i);
            if (turn == null || !turn.isWellFormed()) {
                throw new InvalidRequestException("History entry " + i + " is missing its role or text");
            }
        }
        return new LogicalRequest(generateRequestId(), message.trim(), new ArrayList<>(turns), clock.instant());
    }

    /**
     * Creates one descriptor per target with no prompt modifier, observer or approval gate.
     */
    public List<DispatchDescriptor> createParallelRequests(LogicalRequest request, List<String> targetIds) {
        return createParallelRequests(request, targetIds, targetId -> TargetAttachments.none());
    }

    /**
     * Creates exactly one descriptor per target, in the order given.
     *
     * @param request     the request every target receives
     * @param targetIds   non-empty, duplicate-free target ids
     * @param attachments supplies each target's request-local configuration
     * @throws InvalidRequestException if the target list is empty or contains duplicates
     */
    public List<DispatchDescriptor> createParallelRequests(LogicalRequest request, List<String> targetIds,
                                                           Function<String, TargetAttachments> attachments) {
        if (request == null) {
            throw new InvalidRequestException("Request is required");
        }
        if (targetIds == null || targetIds.isEmpty()) {
            throw new InvalidRequestException("At least one target is required");
        }
        Set<String> seen = new HashSet<>();
        for (String targetId : targetIds) {
            if (targetId == null || targetId.isBlank()) {
                throw new InvalidRequestException("Target ids must not be blank");
            }
            if (!seen.add(targetId)) {
                throw new InvalidRequestException("Duplicate target id: " + targetId);
            }
        }

        List<DispatchDescriptor> descriptors = new ArrayList<>(targetIds.size());
        for (String targetId : targetIds) {
            TargetAttachments attached = attachments.apply(targetId);
            if (attached == null) {
                attached = TargetAttachments.none();
            }
            descriptors.add(new DispatchDescriptor(
                    request.requestId(),
                    targetId,
                    request.message(),
                    new ArrayList<>(request.history()),
                    attached.promptModifier(),
                    attached.renderObserver(),
                    attached.approvalGate(),
                    attached.cancellation()));
        }
        return List.copyOf(descriptors);
    }

    /**
     * Cheap precondition check used before dispatch.
     *
     * @return true iff the message is non-blank, history is well-formed and the request is fresh
     */
    public boolean validateRequest(LogicalRequest request) {
        if (request == null || request.message() == null || request.message().isBlank()) {
            return false;
        }
        if (request.requestId() == null || request.requestId().isBlank()) {
            return false;
        }
        for (ChatTurn turn : request.history()) {
            if (turn == null || !turn.isWellFormed()) {
                return false;
            }
        }
        Instant createdAt = request.createdAt();
        if (createdAt == null) {
            return false;
        }
        Instant now = clock.instant();
        return !createdAt.isBefore(now.minus(MAX_REQUEST_AGE)) && !createdAt.isAfter(now.plus(MAX_CLOCK_SKEW));
    }

    /**
     * Two requests are equivalent when they carry the same message and the same history.
     */
    public boolean areRequestsEquivalent(LogicalRequest first, LogicalRequest second) {
        return first.message().equals(second.message()) && first.history().equals(second.history());
    }

    private String generateRequestId() {
        String timestamp = Long.toString(clock.millis(), 36);
        String random = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return "req_" + timestamp + "_" + random.substring(0, Math.min(6, random.length()));
    }
}
