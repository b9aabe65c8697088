package com.comparo.dispatch.cli;

import com.comparo.core.model.ResponseStats;
import com.comparo.core.model.TargetState;
import com.comparo.core.model.TargetStatus;
import com.comparo.core.model.ToolCallRecord;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Comparo CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) COMPARO v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [COMPARO]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void toolCall(String targetId, ToolCallRecord call) {
        String color = switch (call.status()) {
            case PENDING -> "yellow";
            case APPROVED, EXECUTED -> "green";
            case DENIED -> "red";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(magenta) [TOOL " + targetId + "]|@ " + call.displayMessage()
                        + " @|fg(" + color + ") " + call.status() + "|@"));
    }

    public static void targetFinished(TargetState state) {
        if (state.status() == TargetStatus.ERRORED) {
            error(state.targetId() + " failed: " + state.error());
        } else {
            success(state.targetId() + " finished (" + state.accumulatedText().length() + " chars)");
        }
    }

    public static void response(TargetState state) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(blue) === " + state.targetId() + " ===|@"));
        if (state.status() == TargetStatus.ERRORED) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) " + state.error() + "|@"));
        } else {
            System.out.println(state.accumulatedText());
        }
    }

    public static void stats(ResponseStats stats) {
        System.out.println();
        info(String.format("%d succeeded, %d failed | avg length %.0f chars | fastest %s | slowest %s",
                stats.successCount(), stats.errorCount(), stats.averageResponseLength(),
                formatMs(stats.fastestResponseMs()), formatMs(stats.slowestResponseMs())));
    }

    private static String formatMs(Long ms) {
        return ms == null ? "-" : String.format("%.1fs", ms / 1000.0);
    }
}
