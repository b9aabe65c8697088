package com.comparo.dispatch.cli;

import com.comparo.core.model.TargetDescriptor;
import com.comparo.core.selection.PromptModificationStore;
import com.comparo.core.selection.TargetSelectionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: comparo targets
 * <p>
 * Lists the target catalog and marks the default selection.
 */
@Command(name = "targets", mixinStandardHelpOptions = true, description = "List available targets")
@Component
public class TargetsCommand implements Runnable {

    private final TargetSelectionService selectionService;
    private final PromptModificationStore modificationStore;

    public TargetsCommand(TargetSelectionService selectionService, PromptModificationStore modificationStore) {
        this.selectionService = selectionService;
        this.modificationStore = modificationStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        for (TargetDescriptor target : selectionService.availableTargets()) {
            String marker = selectionService.isSelected(target.id()) ? "*" : " ";
            String prompt = modificationStore.hasModification(target.id()) ? " [custom prompt]" : "";
            System.out.printf(" %s %-24s %-28s %s%s%n", marker, target.id(), target.name(), target.provider(), prompt);
        }
        System.out.println();
        ConsoleOutput.info("* = selected by default");
    }
}
