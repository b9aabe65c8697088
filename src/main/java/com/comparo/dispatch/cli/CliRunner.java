package com.comparo.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Runs the picocli command tree inside the Spring Boot lifecycle.
 * Skipped in serve mode, where the embedded web server owns the process.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final String SERVE = "serve";

    private final ComparoCommand comparoCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ComparoCommand comparoCommand, IFactory factory) {
        this.comparoCommand = comparoCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (Arrays.asList(args).contains(SERVE)) {
            return;
        }
        exitCode = new CommandLine(comparoCommand, factory)
                .setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
                    log.error("Command '{}' failed", commandLine.getCommandName(), ex);
                    ConsoleOutput.error(commandLine.getCommandName() + " failed: " + ex.getMessage());
                    return 1;
                })
                .execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
