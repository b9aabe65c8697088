package com.comparo.dispatch.cli;

import com.comparo.core.aggregate.AggregatedResponse;
import com.comparo.core.aggregate.TargetEvent;
import com.comparo.core.dispatch.ComparisonCallbacks;
import com.comparo.core.dispatch.ComparisonOrchestrator;
import com.comparo.core.model.ApprovalDecision;
import com.comparo.core.model.Decision;
import com.comparo.core.model.LogicalRequest;
import com.comparo.core.model.TargetState;
import com.comparo.core.request.ComparisonException;
import com.comparo.core.request.RequestCloner;
import com.comparo.core.selection.PromptModificationStore;
import com.comparo.core.selection.TargetSelectionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;

/**
 * CLI command: comparo compare "&lt;message&gt;" -t a -t b
 * <p>
 * Sends the message to every target, waits for all of them and prints the answers side by side.
 * Tool calls are answered by the {@code --tools} policy since the CLI does not prompt.
 */
@Command(name = "compare", mixinStandardHelpOptions = true, description = "Compare answers from several targets")
@Component
public class CompareCommand implements Callable<Integer> {

    enum ToolPolicy { APPROVE, DENY }

    @Parameters(index = "0", description = "The message to send")
    private String message;

    @Option(names = {"--target", "-t"}, description = "Target id (repeatable); defaults to the configured selection")
    private List<String> targets;

    @Option(names = "--tools", description = "How tool calls are answered: ${COMPLETION-CANDIDATES}",
            defaultValue = "DENY", converter = ToolPolicyConverter.class)
    private ToolPolicy toolPolicy;

    @Option(names = "--no-prompt-modifications", description = "Ignore stored per-target prompt modifications")
    private boolean ignoreModifications;

    private final RequestCloner requestCloner;
    private final ComparisonOrchestrator orchestrator;
    private final TargetSelectionService selectionService;
    private final PromptModificationStore modificationStore;

    public CompareCommand(RequestCloner requestCloner, ComparisonOrchestrator orchestrator,
                          TargetSelectionService selectionService, PromptModificationStore modificationStore) {
        this.requestCloner = requestCloner;
        this.orchestrator = orchestrator;
        this.selectionService = selectionService;
        this.modificationStore = modificationStore;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<String> chosen = targets == null || targets.isEmpty() ? selectionService.selectedTargets() : targets;
        AggregatedResponse.Snapshot result;
        String requestId = null;
        try {
            LogicalRequest request = requestCloner.cloneRequest(message, List.of());
            requestId = request.requestId();
            ConsoleOutput.info("Comparing " + String.join(", ", chosen) + " (" + requestId + ")");
            result = orchestrator.sendToMultipleTargets(request, chosen,
                    ignoreModifications ? null : modificationStore.modifiersFor(chosen),
                    new ConsoleCallbacks(requestId), null).join();
        } catch (ComparisonException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        } catch (CompletionException e) {
            ConsoleOutput.error("Comparison failed: " + (e.getCause() == null ? e.getMessage() : e.getCause().getMessage()));
            return 1;
        } finally {
            if (requestId != null) {
                orchestrator.release(requestId);
            }
        }

        for (TargetState state : result.perTarget().values()) {
            ConsoleOutput.response(state);
        }
        ConsoleOutput.stats(result.stats());
        return result.stats().errorCount() == 0 ? 0 : 1;
    }

    private final class ConsoleCallbacks implements ComparisonCallbacks {

        private final String requestId;

        ConsoleCallbacks(String requestId) {
            this.requestId = requestId;
        }

        @Override
        public void onDelta(AggregatedResponse.Snapshot snapshot, TargetEvent event) {
            switch (event.type()) {
                case TOOL_PENDING -> {
                    ConsoleOutput.toolCall(event.targetId(), event.toolCall());
                    Decision decision = toolPolicy == ToolPolicy.APPROVE ? Decision.APPROVE : Decision.DENY;
                    orchestrator.decide(new ApprovalDecision(requestId, event.targetId(),
                            event.toolCall().toolCallId(), decision));
                }
                case TOOL_RESOLVED -> ConsoleOutput.toolCall(event.targetId(), event.toolCall());
                case COMPLETE, ERROR -> ConsoleOutput.targetFinished(snapshot.target(event.targetId()));
                default -> { }
            }
        }
    }

    public static class ToolPolicyConverter implements ITypeConverter<ToolPolicy> {
        @Override
        public ToolPolicy convert(String value) {
            return ToolPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
