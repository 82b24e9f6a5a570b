package com.workhub.dispatch.cli;

import com.workhub.core.model.AgentOutcome;
import com.workhub.core.model.EntityCategory;
import picocli.CommandLine;

import java.util.List;
import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the WorkHub CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) WORKHUB AGENT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WORKHUB]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void outcome(AgentOutcome outcome, boolean actionSucceeded) {
        String confidence = String.format("%.2f", outcome.confidence());
        String confidenceColor = outcome.confidence() < 0.5 ? "fg(red)" : "fg(green)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold MESSAGE " + outcome.message().messageId() + "|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Intent:   @|fg(blue) " + outcome.intent().label() + "|@ (@|" + confidenceColor + " "
                        + confidence + "|@, " + outcome.classificationSource().name().toLowerCase(Locale.ROOT) + ")"));
        System.out.println("  Action:   " + outcome.action().label()
                + (actionSucceeded ? "" : " (failed)"));
        for (EntityCategory category : EntityCategory.values()) {
            List<String> values = outcome.entities().get(category);
            if (!values.isEmpty()) {
                System.out.println("  " + category.key() + ": " + String.join(", ", values));
            }
        }
        if (outcome.requiresManagerAttention()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red),bold [MANAGER ALERTED]|@"));
        }
        System.out.println("──────────────────────────────────");
        System.out.println(outcome.responseText());
    }
}
