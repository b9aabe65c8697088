package com.comparo.dispatch.api;

import com.comparo.core.aggregate.ResponseAggregator;
import com.comparo.core.aggregate.WebviewPayload;
import com.comparo.core.approval.ProposedToolCall;
import com.comparo.core.dispatch.ComparisonCallbacks;
import com.comparo.core.dispatch.ComparisonOrchestrator;
import com.comparo.core.model.ApprovalDecision;
import com.comparo.core.model.Decision;
import com.comparo.core.model.LogicalRequest;
import com.comparo.core.model.PromptModifier;
import com.comparo.core.request.DuplicateRequestException;
import com.comparo.core.request.InvalidRequestException;
import com.comparo.core.request.RequestCloner;
import com.comparo.core.selection.PromptModificationStore;
import com.comparo.core.selection.TargetCatalog;
import com.comparo.core.selection.TargetSelectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST controller for running comparisons and deciding their tool calls.
 */
@RestController
@RequestMapping("/api/v1/comparisons")
public class ComparisonController {

    private static final Logger log = LoggerFactory.getLogger(ComparisonController.class);

    /** Number of finished comparisons kept for GET after their state is released. */
    static final int RECENT_RESULTS = 50;

    private final RequestCloner requestCloner;
    private final ComparisonOrchestrator orchestrator;
    private final TargetSelectionService selectionService;
    private final TargetCatalog catalog;
    private final PromptModificationStore modificationStore;
    private final SseStreamingService sseStreamingService;

    /** Most recent finished comparisons, oldest evicted first. */
    private final Map<String, WebviewPayload> recentResults = Collections.synchronizedMap(
            new LinkedHashMap<>(16, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, WebviewPayload> eldest) {
                    return size() > RECENT_RESULTS;
                }
            });

    public ComparisonController(RequestCloner requestCloner,
                                ComparisonOrchestrator orchestrator,
                                TargetSelectionService selectionService,
                                TargetCatalog catalog,
                                PromptModificationStore modificationStore,
                                SseStreamingService sseStreamingService) {
        this.requestCloner = requestCloner;
        this.orchestrator = orchestrator;
        this.selectionService = selectionService;
        this.catalog = catalog;
        this.modificationStore = modificationStore;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/comparisons: Start a comparison. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> submitComparison(@RequestBody ComparisonRequest body) {
        LogicalRequest request = requestCloner.cloneRequest(body.message(), body.history());

        List<String> targets = body.targets() == null || body.targets().isEmpty()
                ? selectionService.selectedTargets()
                : body.targets();
        List<String> unknown = targets.stream().filter(id -> !catalog.contains(id)).toList();
        if (!unknown.isEmpty()) {
            throw new InvalidRequestException("Unknown targets: " + String.join(", ", unknown));
        }

        Map<String, PromptModifier> modifiers = Boolean.FALSE.equals(body.applyPromptModifications())
                ? Map.of()
                : modificationStore.modifiersFor(targets);

        String requestId = request.requestId();
        orchestrator.sendToMultipleTargets(request, targets, modifiers, ComparisonCallbacks.NONE, null)
                .thenAccept(snapshot -> {
                    recentResults.put(requestId, ResponseAggregator.toWebviewFormat(snapshot));
                    orchestrator.release(requestId);
                });
        log.info("Accepted comparison {} for targets {}", requestId, targets);

        return ResponseEntity.accepted().body(Map.of(
                "request_id", requestId,
                "status", "RUNNING",
                "targets", targets));
    }

    /**
     * GET /api/v1/comparisons: Running and recently finished comparisons.
     */
    @GetMapping
    public ResponseEntity<List<WebviewPayload>> listComparisons() {
        List<WebviewPayload> result = new ArrayList<>();
        for (String requestId : orchestrator.activeRequestIds()) {
            orchestrator.snapshot(requestId).map(ResponseAggregator::toWebviewFormat).ifPresent(result::add);
        }
        synchronized (recentResults) {
            result.addAll(recentResults.values());
        }
        return ResponseEntity.ok(result);
    }

    /**
     * GET /api/v1/comparisons/{id}: Current state of one comparison.
     */
    @GetMapping("/{id}")
    public ResponseEntity<WebviewPayload> getComparison(@PathVariable String id) {
        WebviewPayload finished = recentResults.get(id);
        if (finished != null) {
            return ResponseEntity.ok(finished);
        }
        return orchestrator.snapshot(id)
                .map(ResponseAggregator::toWebviewFormat)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/comparisons/{id}/events: SSE stream of a running comparison.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        if (!orchestrator.isActive(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    /**
     * POST /api/v1/comparisons/{id}/approvals: Approve or deny pending tool calls.
     */
    @PostMapping("/{id}/approvals")
    public ResponseEntity<Map<String, Object>> decide(@PathVariable String id, @RequestBody ApprovalRequest body) {
        if (!orchestrator.isActive(id)) {
            return ResponseEntity.notFound().build();
        }
        Decision decision = parseDecision(body.decision());
        int resolved = orchestrator.decide(new ApprovalDecision(id, body.targetId(), body.toolCallId(), decision));
        return ResponseEntity.ok(Map.of(
                "request_id", id,
                "decision", decision.name(),
                "resolved", resolved));
    }

    /**
     * GET /api/v1/comparisons/{id}/tools: Tool calls proposed so far, by target.
     */
    @GetMapping("/{id}/tools")
    public ResponseEntity<Map<String, List<ProposedToolCall>>> toolState(@PathVariable String id) {
        if (!orchestrator.isActive(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(orchestrator.pendingToolState(id));
    }

    /**
     * POST /api/v1/comparisons/{id}/cancel: Cancel every target.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancelComparison(@PathVariable String id) {
        if (!orchestrator.cancel(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("request_id", id, "status", "CANCELLING"));
    }

    /**
     * POST /api/v1/comparisons/{id}/targets/{targetId}/cancel: Cancel one target.
     */
    @PostMapping("/{id}/targets/{targetId}/cancel")
    public ResponseEntity<Map<String, String>> cancelTarget(@PathVariable String id, @PathVariable String targetId) {
        if (!orchestrator.cancelTarget(id, targetId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("request_id", id, "target_id", targetId, "status", "CANCELLING"));
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, String>> handleInvalid(InvalidRequestException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(DuplicateRequestException.class)
    public ResponseEntity<Map<String, String>> handleDuplicate(DuplicateRequestException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }

    private static Decision parseDecision(String value) {
        if (value == null) {
            throw new InvalidRequestException("Decision is required");
        }
        try {
            return Decision.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Invalid decision: " + value);
        }
    }
}
