package com.tariffwise.dispatch.cli;

import com.tariffwise.core.model.CandidateClassification;
import com.tariffwise.core.model.FinalPayload;
import com.tariffwise.core.model.OrchestrationSummary;
import com.tariffwise.core.reference.TariffCodes;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold,fg(yellow) TARIFFWISE v0.1.0|@"));
        rule();
    }

    public static void rule() {
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) [TARIFFWISE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) x|@ " + message));
    }

    public static void candidate(CandidateClassification c) {
        String color = switch (c.getStatus()) {
            case VALID -> "fg(green)";
            case CORRECTED, UNVERIFIED -> "fg(yellow)";
            default -> "fg(red)";
        };
        String code = c.hasCode() ? TariffCodes.format(c.getCode()) : "-";
        StringBuilder line = new StringBuilder("  @|" + color + " " + c.getStatus() + "|@ ")
                .append(code).append("  ").append(c.getItemDescription())
                .append(" (").append(c.getConfidence()).append(", ").append(c.getSource()).append(')');
        if (c.isCorrected()) {
            line.append(" corrected from ").append(TariffCodes.format(c.getOriginalCode()));
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line.toString()));
    }

    public static void status(FinalPayload payload) {
        rule();
        String color = switch (payload.status()) {
            case CLASSIFIED -> "fg(green)";
            case CLASSIFIED_WITH_WARNINGS -> "fg(yellow)";
            default -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Status:|@ @|" + color + " " + payload.status() + "|@"));
        OrchestrationSummary o = payload.orchestration();
        if (o.modelInvoked()) {
            System.out.println("  Model: " + o.provider() + (o.providerSwitched() ? " (after switch)" : "")
                    + ", " + o.rounds() + " round(s), " + formatDuration(o.elapsedMs())
                    + String.format(", $%.4f", o.costUsd()));
        } else {
            System.out.println("  Model: not called (answered from memory)");
        }
        if (payload.attempt() != null && payload.attempt().threadKey() != null) {
            System.out.println("  Thread: " + payload.attempt().threadKey()
                    + " attempt " + payload.attempt().attemptNumber());
        }
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
