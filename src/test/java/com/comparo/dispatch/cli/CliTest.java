package com.comparo.dispatch.cli;

import com.comparo.core.aggregate.AggregatedResponse;
import com.comparo.core.aggregate.ResponseAggregator;
import com.comparo.core.aggregate.TargetEvent;
import com.comparo.core.dispatch.ComparisonCallbacks;
import com.comparo.core.dispatch.ComparisonOrchestrator;
import com.comparo.core.model.ApprovalDecision;
import com.comparo.core.model.Decision;
import com.comparo.core.model.LogicalRequest;
import com.comparo.core.model.TargetDescriptor;
import com.comparo.core.model.ToolCallRecord;
import com.comparo.core.model.ToolCallStatus;
import com.comparo.core.request.InvalidRequestException;
import com.comparo.core.request.RequestCloner;
import com.comparo.core.selection.PromptModificationStore;
import com.comparo.core.selection.TargetSelectionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the picocli commands, run without a Spring context.
 */
class CliTest {

    private static final String REQUEST_ID = "req_test_1";

    private RequestCloner cloner;
    private ComparisonOrchestrator orchestrator;
    private TargetSelectionService selection;
    private PromptModificationStore store;

    record CliResult(int exitCode, String output) {}

    @BeforeEach
    void setUp() {
        cloner = mock(RequestCloner.class);
        orchestrator = mock(ComparisonOrchestrator.class);
        selection = mock(TargetSelectionService.class);
        store = mock(PromptModificationStore.class);

        when(cloner.cloneRequest(anyString(), anyList()))
                .thenAnswer(inv -> new LogicalRequest(REQUEST_ID, inv.getArgument(0), List.of(), Instant.now()));
        when(selection.selectedTargets()).thenReturn(List.of("gpt-4o", "claude-sonnet"));
        when(store.modifiersFor(anyList())).thenReturn(Map.of());
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == CompareCommand.class) {
                    return (K) new CompareCommand(cloner, orchestrator, selection, store);
                }
                if (cls == TargetsCommand.class) {
                    return (K) new TargetsCommand(selection, store);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true, StandardCharsets.UTF_8);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new ComparoCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static AggregatedResponse.Snapshot finishedSnapshot(boolean secondFails) {
        ResponseAggregator aggregator = new ResponseAggregator();
        aggregator.startAggregation(REQUEST_ID, "hello", List.of("gpt-4o", "claude-sonnet"));
        aggregator.updateResponse(REQUEST_ID, TargetEvent.delta("gpt-4o", "Hi from gpt"));
        aggregator.updateResponse(REQUEST_ID, TargetEvent.complete("gpt-4o"));
        if (secondFails) {
            aggregator.updateResponse(REQUEST_ID, TargetEvent.error("claude-sonnet", "rate limited"));
        } else {
            aggregator.updateResponse(REQUEST_ID, TargetEvent.delta("claude-sonnet", "Hi from claude"));
            aggregator.updateResponse(REQUEST_ID, TargetEvent.complete("claude-sonnet"));
        }
        return aggregator.completeAggregation(REQUEST_ID).orElseThrow();
    }

    private void stubComparison(AggregatedResponse.Snapshot result) {
        when(orchestrator.sendToMultipleTargets(any(), anyList(), any(), any(), isNull()))
                .thenReturn(CompletableFuture.completedFuture(result));
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("compare"));
            assertTrue(result.output().contains("targets"));
            assertTrue(result.output().contains("help"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Comparo 0.1.0"));
        }

        @Test
        @DisplayName("compare --help describes the tools option")
        void compareHelp() {
            CliResult result = execute("compare", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--tools"));
            assertTrue(result.output().contains("--target"));
        }
    }

    @Nested
    @DisplayName("targets")
    class TargetsTests {

        @Test
        @DisplayName("lists the catalog and marks selected targets and custom prompts")
        void listsCatalog() {
            when(selection.availableTargets()).thenReturn(List.of(
                    new TargetDescriptor("gpt-4o", "GPT-4o", "openai", null, null, null),
                    new TargetDescriptor("local-llama", "Llama 3", "ollama", 0.2, 512, null)));
            when(selection.isSelected("gpt-4o")).thenReturn(true);
            when(store.hasModification("local-llama")).thenReturn(true);

            CliResult result = execute("targets");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("* gpt-4o"));
            assertTrue(result.output().contains("local-llama"));
            assertTrue(result.output().contains("[custom prompt]"));
        }
    }

    @Nested
    @DisplayName("compare")
    class CompareTests {

        @Test
        @DisplayName("prints every answer and exits 0 when all targets complete")
        void allTargetsComplete() {
            stubComparison(finishedSnapshot(false));

            CliResult result = execute("compare", "hello");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Hi from gpt"));
            assertTrue(result.output().contains("Hi from claude"));
            verify(orchestrator).release(REQUEST_ID);
        }

        @Test
        @DisplayName("exits 1 when a target errors")
        void erroredTarget() {
            stubComparison(finishedSnapshot(true));

            CliResult result = execute("compare", "hello");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("rate limited"));
            verify(orchestrator).release(REQUEST_ID);
        }

        @Test
        @DisplayName("exits 2 on an invalid request and never dispatches")
        void invalidRequest() {
            when(cloner.cloneRequest(anyString(), anyList()))
                    .thenThrow(new InvalidRequestException("Message must not be empty"));

            CliResult result = execute("compare", "   ");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Message must not be empty"));
            verify(orchestrator, never()).sendToMultipleTargets(any(), anyList(), any(), any(), any());
            verify(orchestrator, never()).release(anyString());
        }

        @Test
        @DisplayName("exits 1 and still releases when the comparison future fails")
        void failedFuture() {
            when(orchestrator.sendToMultipleTargets(any(), anyList(), any(), any(), isNull()))
                    .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("executor shut down")));

            CliResult result = execute("compare", "hello");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("executor shut down"));
            verify(orchestrator).release(REQUEST_ID);
        }

        @Test
        @DisplayName("explicit targets override the default selection")
        @SuppressWarnings("unchecked")
        void explicitTargets() {
            stubComparison(finishedSnapshot(false));

            execute("compare", "hello", "-t", "gpt-4o", "--target", "claude-sonnet");

            ArgumentCaptor<List<String>> targets = ArgumentCaptor.forClass(List.class);
            verify(orchestrator).sendToMultipleTargets(any(), targets.capture(), any(), any(), isNull());
            assertEquals(List.of("gpt-4o", "claude-sonnet"), targets.getValue());
            verify(selection, never()).selectedTargets();
        }

        @Test
        @DisplayName("--no-prompt-modifications skips the store")
        void noPromptModifications() {
            stubComparison(finishedSnapshot(false));

            execute("compare", "hello", "--no-prompt-modifications");

            verify(store, never()).modifiersFor(anyList());
            verify(orchestrator).sendToMultipleTargets(any(), anyList(), isNull(), any(), isNull());
        }
    }

    @Nested
    @DisplayName("compare tool policy")
    class ToolPolicyTests {

        private final ToolCallRecord pending = new ToolCallRecord(
                "call_1", "read_file", ToolCallStatus.PENDING, Map.of("filePath", "a.txt"), "Read a.txt");

        private void stubComparisonWithToolCall() {
            when(orchestrator.sendToMultipleTargets(any(), anyList(), any(), any(), isNull()))
                    .thenAnswer(inv -> {
                        ComparisonCallbacks callbacks = inv.getArgument(3);
                        AggregatedResponse.Snapshot snapshot = finishedSnapshot(false);
                        callbacks.onDelta(snapshot, TargetEvent.toolPending("gpt-4o", pending));
                        return CompletableFuture.completedFuture(snapshot);
                    });
        }

        @Test
        @DisplayName("tool calls are denied by default")
        void deniedByDefault() {
            stubComparisonWithToolCall();

            CliResult result = execute("compare", "hello");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Read a.txt"));
            verify(orchestrator).decide(new ApprovalDecision(REQUEST_ID, "gpt-4o", "call_1", Decision.DENY));
        }

        @Test
        @DisplayName("--tools approve approves each proposed call")
        void approvePolicy() {
            stubComparisonWithToolCall();

            execute("compare", "hello", "--tools", "approve");

            verify(orchestrator).decide(new ApprovalDecision(REQUEST_ID, "gpt-4o", "call_1", Decision.APPROVE));
        }

        @Test
        @DisplayName("an unknown policy is rejected before dispatch")
        void unknownPolicy() {
            CliResult result = execute("compare", "hello", "--tools", "maybe");

            assertFalse(result.exitCode() == 0);
            verify(orchestrator, never()).sendToMultipleTargets(any(), anyList(), any(), any(), any());
        }
    }
}
