package com.comparo.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Comparo.
 * Routes to subcommands: compare, targets.
 */
@Command(
        name = "comparo",
        mixinStandardHelpOptions = true,
        version = "Comparo 0.1.0",
        description = "Send one chat message to several models and compare their answers",
        subcommands = {
                CompareCommand.class,
                TargetsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ComparoCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
