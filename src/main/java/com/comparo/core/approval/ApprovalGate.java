package com.comparo.core.approval;

import com.comparo.core.config.ComparoProperties;
import com.comparo.core.model.ApprovalDecision;
import com.comparo.core.model.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Suspends tool calls until an external approve/deny decision resolves them.
 * <p>
 * A proposal returns a future that the proposing pipeline waits on. Decisions are scoped by
 * request, then by target ({@link ApprovalDecision#ALL_TARGETS} or one target), then by tool call
 * ({@link ApprovalDecision#ALL_PENDING} or one call). Resolving an already resolved or unknown
 * call is a no-op. Futures are completed outside the gate's lock so that waiting pipelines can
 * resume and report back without contending with the decision that released them.
 * <p>
 * Once a request is released its id is remembered for a while; proposals arriving for it later
 * are denied on arrival and never recreate its state.
 */
@Service
public class ApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

    /** Released request ids remembered to deny late proposals. */
    static final int RELEASED_MEMORY = 1024;

    private final ConcurrentHashMap<String, RequestApprovals> requests = new ConcurrentHashMap<>();
    private final Set<String> released = Collections.newSetFromMap(Collections.synchronizedMap(
            new LinkedHashMap<String, Boolean>(16, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                    return size() > RELEASED_MEMORY;
                }
            }));
    private final boolean stickyApproveAll;
    private final Set<String> autoApprovedTools;
    private final Clock clock;

    public ApprovalGate(ComparoProperties properties) {
        this(properties.getApproval().isStickyApproveAll(),
                Set.copyOf(properties.getApproval().getAutoApproveTools()),
                Clock.systemUTC());
    }

    ApprovalGate(boolean stickyApproveAll, Set<String> autoApprovedTools, Clock clock) {
        this.stickyApproveAll = stickyApproveAll;
        this.autoApprovedTools = autoApprovedTools;
        this.clock = clock;
    }

    /**
     * Registers a tool call and returns a future completed when it is decided.
     * Proposing the same call twice returns the original future. A call proposed for a
     * cancelled or released request, or for a cancelled target, is denied immediately.
     */
    public CompletableFuture<ApprovalOutcome> propose(String requestId, String targetId, String toolCallId,
                                                      String toolName, Map<String, Object> arguments) {
        RequestApprovals approvals = openRequest(requestId);
        if (approvals == null) {
            log.info("Denying tool call {} of released request {}", toolCallId, requestId);
            return CompletableFuture.completedFuture(ApprovalOutcome.DENIED);
        }
        synchronized (approvals) {
            if (approvals.released) {
                log.info("Denying tool call {} of released request {}", toolCallId, requestId);
                return CompletableFuture.completedFuture(ApprovalOutcome.DENIED);
            }
            GatedCall existing = approvals.calls.get(toolCallId);
            if (existing != null) {
                return existing.future;
            }
            GatedCall call = new GatedCall(requestId, targetId, toolCallId, toolName, arguments, clock.instant());
            approvals.calls.put(toolCallId, call);

            if (approvals.cancelled || approvals.cancelledTargets.contains(targetId)) {
                log.debug("Denying tool call {} of cancelled {}/{}", toolCallId, requestId, targetId);
                call.state = ApprovalState.DENIED;
                call.future.complete(ApprovalOutcome.DENIED);
            } else if (autoApprovedTools.contains(toolName)) {
                log.info("Auto-approving tool {} for {}/{}", toolName, requestId, targetId);
                call.state = ApprovalState.APPROVED;
                call.future.complete(ApprovalOutcome.APPROVED);
            } else if (stickyApproveAll && approvals.approvedAll) {
                log.debug("Approving tool call {} under standing approve-all for {}", toolCallId, requestId);
                call.state = ApprovalState.APPROVED;
                call.future.complete(ApprovalOutcome.APPROVED);
            } else {
                log.info("Tool call {} ({}) proposed by {}/{} awaiting decision",
                        toolCallId, toolName, requestId, targetId);
            }
            return call.future;
        }
    }

    /**
     * Applies a decision to every proposed call it covers.
     *
     * @return number of calls this decision resolved
     */
    public int decide(ApprovalDecision decision) {
        RequestApprovals approvals = requests.get(decision.requestId());
        if (approvals == null) {
            log.debug("Decision for unknown request {} ignored", decision.requestId());
            return 0;
        }
        boolean approve = decision.decision() == Decision.APPROVE;
        List<GatedCall> resolved = new ArrayList<>();
        synchronized (approvals) {
            if (approve && decision.appliesToAllTargets() && decision.appliesToAllPending()) {
                approvals.approvedAll = true;
            }
            for (GatedCall call : approvals.calls.values()) {
                if (call.state != ApprovalState.PROPOSED || !covers(decision, call)) {
                    continue;
                }
                call.state = approve ? ApprovalState.APPROVED : ApprovalState.DENIED;
                resolved.add(call);
            }
        }
        ApprovalOutcome outcome = approve ? ApprovalOutcome.APPROVED : ApprovalOutcome.DENIED;
        resolved.forEach(call -> call.future.complete(outcome));
        log.info("Decision {} for {}/{}/{} resolved {} tool call(s)", decision.decision(),
                decision.requestId(), decision.targetId(), decision.toolCallId(), resolved.size());
        return resolved.size();
    }

    /** Records that an approved call ran. */
    public void markExecuted(String requestId, String toolCallId) {
        transition(requestId, toolCallId, ApprovalState.APPROVED, ApprovalState.EXECUTED);
    }

    /** Records that a denied call was not run. */
    public void markSkipped(String requestId, String toolCallId) {
        transition(requestId, toolCallId, ApprovalState.DENIED, ApprovalState.SKIPPED);
    }

    /**
     * Denies every outstanding proposal of a request; later proposals are denied on arrival.
     *
     * @return number of proposals denied
     */
    public int cancelRequest(String requestId) {
        RequestApprovals approvals = openRequest(requestId);
        if (approvals == null) {
            return 0;
        }
        List<GatedCall> denied = new ArrayList<>();
        synchronized (approvals) {
            approvals.cancelled = true;
            denyProposed(approvals, null, denied);
        }
        denied.forEach(call -> call.future.complete(ApprovalOutcome.DENIED));
        if (!denied.isEmpty()) {
            log.info("Cancelled request {}: denied {} pending tool call(s)", requestId, denied.size());
        }
        return denied.size();
    }

    /**
     * Denies every outstanding proposal of one target; its later proposals are denied on arrival.
     *
     * @return number of proposals denied
     */
    public int cancelTarget(String requestId, String targetId) {
        RequestApprovals approvals = openRequest(requestId);
        if (approvals == null) {
            return 0;
        }
        List<GatedCall> denied = new ArrayList<>();
        synchronized (approvals) {
            approvals.cancelledTargets.add(targetId);
            denyProposed(approvals, targetId, denied);
        }
        denied.forEach(call -> call.future.complete(ApprovalOutcome.DENIED));
        return denied.size();
    }

    /**
     * Drops all state for a request. Outstanding proposals are denied, and so is every later one.
     */
    public void release(String requestId) {
        released.add(requestId);
        RequestApprovals approvals = requests.remove(requestId);
        if (approvals == null) {
            return;
        }
        List<GatedCall> denied = new ArrayList<>();
        synchronized (approvals) {
            approvals.released = true;
            denyProposed(approvals, null, denied);
        }
        denied.forEach(call -> call.future.complete(ApprovalOutcome.DENIED));
    }

    public Optional<ApprovalState> stateOf(String requestId, String toolCallId) {
        RequestApprovals approvals = requests.get(requestId);
        if (approvals == null) {
            return Optional.empty();
        }
        synchronized (approvals) {
            GatedCall call = approvals.calls.get(toolCallId);
            return call == null ? Optional.empty() : Optional.of(call.state);
        }
    }

    /**
     * Current tool calls of a request grouped by target, in proposal order.
     */
    public Map<String, List<ProposedToolCall>> pendingToolState(String requestId) {
        RequestApprovals approvals = requests.get(requestId);
        if (approvals == null) {
            return Map.of();
        }
        Map<String, List<ProposedToolCall>> byTarget = new LinkedHashMap<>();
        synchronized (approvals) {
            for (GatedCall call : approvals.calls.values()) {
                byTarget.computeIfAbsent(call.targetId, k -> new ArrayList<>()).add(call.view());
            }
        }
        byTarget.replaceAll((target, calls) -> Collections.unmodifiableList(calls));
        return Collections.unmodifiableMap(byTarget);
    }

    /** Number of calls of a request still awaiting a decision. */
    public int pendingCount(String requestId) {
        RequestApprovals approvals = requests.get(requestId);
        if (approvals == null) {
            return 0;
        }
        synchronized (approvals) {
            return (int) approvals.calls.values().stream()
                    .filter(call -> call.state == ApprovalState.PROPOSED)
                    .count();
        }
    }

    /** State of a live request, created on first use; null once the request was released. */
    private RequestApprovals openRequest(String requestId) {
        return requests.compute(requestId, (id, existing) ->
                existing != null || released.contains(id) ? existing : new RequestApprovals(id));
    }

    private static boolean covers(ApprovalDecision decision, GatedCall call) {
        boolean targetMatches = decision.appliesToAllTargets() || decision.targetId().equals(call.targetId);
        boolean callMatches = decision.appliesToAllPending() || decision.toolCallId().equals(call.toolCallId);
        return targetMatches && callMatches;
    }

    private static void denyProposed(RequestApprovals approvals, String targetId, List<GatedCall> denied) {
        for (GatedCall call : approvals.calls.values()) {
            if (call.state == ApprovalState.PROPOSED && (targetId == null || targetId.equals(call.targetId))) {
                call.state = ApprovalState.DENIED;
                denied.add(call);
            }
        }
    }

    private void transition(String requestId, String toolCallId, ApprovalState from, ApprovalState to) {
        RequestApprovals approvals = requests.get(requestId);
        if (approvals == null) {
            return;
        }
        synchronized (approvals) {
            GatedCall call = approvals.calls.get(toolCallId);
            if (call == null) {
                return;
            }
            if (call.state == from) {
                call.state = to;
            } else if (call.state != to) {
                log.warn("Tool call {} of {} is {}, cannot move to {}", toolCallId, requestId, call.state, to);
            }
        }
    }

    private static final class RequestApprovals {
        final String requestId;
        final Map<String, GatedCall> calls = new LinkedHashMap<>();
        final Set<String> cancelledTargets = new HashSet<>();
        boolean cancelled;
        boolean approvedAll;
        boolean released;

        RequestApprovals(String requestId) {
            this.requestId = requestId;
        }
    }

    private static final class GatedCall {
        final String requestId;
        final String targetId;
        final String toolCallId;
        final String toolName;
        final Map<String, Object> arguments;
        final Instant proposedAt;
        final CompletableFuture<ApprovalOutcome> future = new CompletableFuture<>();
        ApprovalState state = ApprovalState.PROPOSED;

        GatedCall(String requestId, String targetId, String toolCallId, String toolName,
                  Map<String, Object> arguments, Instant proposedAt) {
            this.requestId = requestId;
            this.targetId = targetId;
            this.toolCallId = toolCallId;
            this.toolName = toolName;
            this.arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
            this.proposedAt = proposedAt;
        }

        ProposedToolCall view() {
            return new ProposedToolCall(requestId, targetId, toolCallId, toolName, arguments, state, proposedAt);
        }
    }
}
