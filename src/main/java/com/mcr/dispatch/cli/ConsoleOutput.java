package com.mcr.dispatch.cli;

import com.mcr.core.deduction.ScoredProof;
import com.mcr.core.refine.RefinementAttempt;
import picocli.CommandLine;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the MCR CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) MCR v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [MCR]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void fact(String clause) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) +|@ " + clause));
    }

    public static void proof(ScoredProof proof) {
        String probability = String.format(Locale.ROOT, "%.2f", proof.probability());
        String color = proof.probability() >= 0.5 ? "fg(green)" : "fg(yellow)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " [" + probability + "]|@ " + proof.query() + " -> " + proof.proof()));
    }

    public static void history(List<RefinementAttempt> history) {
        for (RefinementAttempt attempt : history) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(yellow) iteration " + attempt.iteration() + "|@ " + attempt.error()));
        }
    }

    public static void watchEvent(String eventType, Map<String, Object> payload) {
        String prefix = switch (eventType) {
            case "session.created" -> "@|fg(cyan) [SESSION]|@";
            case "assert.completed" -> "@|fg(green),bold [ASSERT]|@";
            case "query.completed" -> "@|fg(green),bold [QUERY]|@";
            case "refinement.failed" -> "@|fg(red),bold [REFINE]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + payload));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
