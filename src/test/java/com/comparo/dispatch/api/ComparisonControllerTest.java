package com.comparo.dispatch.api;

import com.comparo.core.aggregate.AggregatedResponse;
import com.comparo.core.approval.ApprovalState;
import com.comparo.core.approval.ProposedToolCall;
import com.comparo.core.dispatch.ComparisonOrchestrator;
import com.comparo.core.model.ApprovalDecision;
import com.comparo.core.model.Decision;
import com.comparo.core.model.LogicalRequest;
import com.comparo.core.model.PromptModifier;
import com.comparo.core.model.ResponseStats;
import com.comparo.core.model.TargetState;
import com.comparo.core.model.TargetStatus;
import com.comparo.core.request.DuplicateRequestException;
import com.comparo.core.request.InvalidRequestException;
import com.comparo.core.request.RequestCloner;
import com.comparo.core.selection.PromptModificationStore;
import com.comparo.core.selection.TargetCatalog;
import com.comparo.core.selection.TargetSelectionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ComparisonController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ComparisonControllerTest {

    private static final String REQUEST_ID = "req_lx2k_a1b2c3";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private RequestCloner requestCloner;

    @MockitoBean
    private ComparisonOrchestrator orchestrator;

    @MockitoBean
    private TargetSelectionService selectionService;

    @MockitoBean
    private TargetCatalog catalog;

    @MockitoBean
    private PromptModificationStore modificationStore;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    @BeforeEach
    void setUp() {
        when(requestCloner.cloneRequest(any(), any()))
                .thenReturn(new LogicalRequest(REQUEST_ID, "Explain recursion", List.of(), Instant.now()));
        when(catalog.contains(any())).thenAnswer(inv -> !"claude-x".equals(inv.getArgument(0)));
        when(selectionService.selectedTargets()).thenReturn(List.of("gpt-4o", "gpt-4o-mini"));
        when(orchestrator.sendToMultipleTargets(any(), anyList(), anyMap(), any(), isNull()))
                .thenReturn(new CompletableFuture<>());
    }

    private static AggregatedResponse.Snapshot runningSnapshot() {
        Instant now = Instant.now();
        Map<String, TargetState> perTarget = new LinkedHashMap<>();
        perTarget.put("gpt-4o", new TargetState("gpt-4o", TargetStatus.STREAMING, "Recursion is", List.of(),
                null, false, now, null));
        return new AggregatedResponse.Snapshot(REQUEST_ID, "Explain recursion", List.of("gpt-4o"),
                List.of("gpt-4o"), List.of(), perTarget, ResponseStats.initial(1), false, now, null);
    }

    // ── POST /api/v1/comparisons ─────────────────────────────────────

    @Test
    @DisplayName("POST /comparisons returns 202 Accepted with request_id")
    void submitComparison() throws Exception {
        String body = objectMapper.writeValueAsString(
                new ComparisonRequest("Explain recursion", null, List.of("gpt-4o", "o4-mini"), null));

        mockMvc.perform(post("/api/v1/comparisons")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.request_id").value(REQUEST_ID))
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.targets", hasSize(2)));

        verify(modificationStore).modifiersFor(List.of("gpt-4o", "o4-mini"));
    }

    @Test
    @DisplayName("POST /comparisons without targets uses the current selection")
    @SuppressWarnings("unchecked")
    void submitUsesSelection() throws Exception {
        mockMvc.perform(post("/api/v1/comparisons")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Hi\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.targets[0]").value("gpt-4o"));

        ArgumentCaptor<List<String>> targets = ArgumentCaptor.forClass(List.class);
        verify(orchestrator).sendToMultipleTargets(any(), targets.capture(), anyMap(), any(), isNull());
        assertEquals(List.of("gpt-4o", "gpt-4o-mini"), targets.getValue());
    }

    @Test
    @DisplayName("POST /comparisons can skip stored prompt modifications")
    void submitWithoutModifications() throws Exception {
        mockMvc.perform(post("/api/v1/comparisons")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Hi\",\"apply_prompt_modifications\":false}"))
                .andExpect(status().isAccepted());

        verify(modificationStore, never()).modifiersFor(any());
        verify(orchestrator).sendToMultipleTargets(any(), anyList(), eq(Map.<String, PromptModifier>of()), any(), isNull());
    }

    @Test
    @DisplayName("POST /comparisons with an unknown target returns 400")
    void submitUnknownTarget() throws Exception {
        mockMvc.perform(post("/api/v1/comparisons")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Hi\",\"targets\":[\"gpt-4o\",\"claude-x\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown targets: claude-x"));
    }

    @Test
    @DisplayName("POST /comparisons with an empty message returns 400")
    void submitEmptyMessage() throws Exception {
        when(requestCloner.cloneRequest(any(), any())).thenThrow(new InvalidRequestException("Message must not be empty"));

        mockMvc.perform(post("/api/v1/comparisons")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Message must not be empty"));
    }

    @Test
    @DisplayName("POST /comparisons for a running request id returns 409")
    void submitDuplicate() throws Exception {
        when(orchestrator.sendToMultipleTargets(any(), anyList(), anyMap(), any(), isNull()))
                .thenThrow(new DuplicateRequestException(REQUEST_ID));

        mockMvc.perform(post("/api/v1/comparisons")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Hi\"}"))
                .andExpect(status().isConflict());
    }

    // ── GET /api/v1/comparisons ──────────────────────────────────────

    @Test
    @DisplayName("GET /comparisons/{id} returns the running comparison")
    void getRunning() throws Exception {
        when(orchestrator.snapshot(REQUEST_ID)).thenReturn(Optional.of(runningSnapshot()));

        mockMvc.perform(get("/api/v1/comparisons/" + REQUEST_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requestId").value(REQUEST_ID))
                .andExpect(jsonPath("$.responses['gpt-4o']").value("Recursion is"))
                .andExpect(jsonPath("$.isComplete").value(false));
    }

    @Test
    @DisplayName("GET /comparisons/{id} for an unknown id returns 404")
    void getUnknown() throws Exception {
        when(orchestrator.snapshot("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/comparisons/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /comparisons lists running comparisons")
    void list() throws Exception {
        when(orchestrator.activeRequestIds()).thenReturn(Set.of(REQUEST_ID));
        when(orchestrator.snapshot(REQUEST_ID)).thenReturn(Optional.of(runningSnapshot()));

        mockMvc.perform(get("/api/v1/comparisons"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].selectedTargets[0]").value("gpt-4o"));
    }

    @Test
    @DisplayName("GET /comparisons/{id}/events for an unknown id returns 404")
    void eventsUnknown() throws Exception {
        when(orchestrator.isActive("nope")).thenReturn(false);

        mockMvc.perform(get("/api/v1/comparisons/nope/events"))
                .andExpect(status().isNotFound());
    }

    // ── approvals and tools ──────────────────────────────────────────

    @Test
    @DisplayName("POST /comparisons/{id}/approvals applies the decision")
    void approve() throws Exception {
        when(orchestrator.isActive(REQUEST_ID)).thenReturn(true);
        when(orchestrator.decide(any())).thenReturn(2);

        mockMvc.perform(post("/api/v1/comparisons/" + REQUEST_ID + "/approvals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target_id\":\"gpt-4o\",\"decision\":\"approve\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.decision").value("APPROVE"))
                .andExpect(jsonPath("$.resolved").value(2));

        verify(orchestrator).decide(new ApprovalDecision(REQUEST_ID, "gpt-4o", ApprovalDecision.ALL_PENDING,
                Decision.APPROVE));
    }

    @Test
    @DisplayName("POST /comparisons/{id}/approvals with an invalid decision returns 400")
    void approveInvalid() throws Exception {
        when(orchestrator.isActive(REQUEST_ID)).thenReturn(true);

        mockMvc.perform(post("/api/v1/comparisons/" + REQUEST_ID + "/approvals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decision\":\"maybe\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid decision: maybe"));
    }

    @Test
    @DisplayName("POST /comparisons/{id}/approvals for a finished comparison returns 404")
    void approveUnknown() throws Exception {
        when(orchestrator.isActive(REQUEST_ID)).thenReturn(false);

        mockMvc.perform(post("/api/v1/comparisons/" + REQUEST_ID + "/approvals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decision\":\"deny\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /comparisons/{id}/tools returns tool calls by target")
    void tools() throws Exception {
        when(orchestrator.isActive(REQUEST_ID)).thenReturn(true);
        when(orchestrator.pendingToolState(REQUEST_ID)).thenReturn(Map.of("gpt-4o", List.of(
                new ProposedToolCall(REQUEST_ID, "gpt-4o", "gpt-4o:read_file:1", "read_file",
                        Map.of("filePath", "pom.xml"), ApprovalState.PROPOSED, Instant.now()))));

        mockMvc.perform(get("/api/v1/comparisons/" + REQUEST_ID + "/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['gpt-4o'][0].toolName").value("read_file"))
                .andExpect(jsonPath("$['gpt-4o'][0].state").value("PROPOSED"));
    }

    // ── cancellation ─────────────────────────────────────────────────

    @Test
    @DisplayName("POST /comparisons/{id}/cancel cancels a running comparison")
    void cancel() throws Exception {
        when(orchestrator.cancel(REQUEST_ID)).thenReturn(true);

        mockMvc.perform(post("/api/v1/comparisons/" + REQUEST_ID + "/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLING"));
    }

    @Test
    @DisplayName("POST /comparisons/{id}/targets/{targetId}/cancel for an unknown target returns 404")
    void cancelUnknownTarget() throws Exception {
        when(orchestrator.cancelTarget(REQUEST_ID, "o4-mini")).thenReturn(false);

        mockMvc.perform(post("/api/v1/comparisons/" + REQUEST_ID + "/targets/o4-mini/cancel"))
                .andExpect(status().isNotFound());
    }
}
