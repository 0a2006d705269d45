package com.foresight.dispatch.cli;

import com.foresight.core.model.Analysis;
import com.foresight.core.model.Priority;
import com.foresight.core.model.Recommendation;
import com.foresight.core.model.RecommendationStatus;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output for the Foresight CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) FORESIGHT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FORESIGHT]|@ " + message));
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

    public static void analysis(Analysis analysis) {
        var sections = analysis.sections();
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold ANALYSIS " + analysis.id() + "|@"));
        System.out.println("──────────────────────────────────");
        System.out.println("  Created:      " + analysis.createdAt());
        System.out.println("  Duration:     " + formatDuration(analysis.executionTimeMs()));
        System.out.println("  Sources:      " + (analysis.capabilitiesUsed().isEmpty()
                ? "-" : String.join(", ", analysis.capabilitiesUsed())));
        section("OVERVIEW", sections.overview());
        section("CONDITIONS", sections.conditions());
        section("RISK", sections.risk());
        section("OPPORTUNITIES", sections.opportunities());
    }

    public static void recommendations(List<Recommendation> recommendations) {
        System.out.println();
        if (recommendations.isEmpty()) {
            info("No recommendations.");
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold RECOMMENDATIONS (" + recommendations.size() + ")|@"));
        for (var r : recommendations) {
            recommendation(r);
        }
    }

    public static void recommendation(Recommendation r) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + priority(r.priority()) + " " + status(r.status()) + " @|bold " + r.capabilityType() + "|@"
                        + String.format(" (%.0f%%)", r.confidence() * 100)));
        System.out.println("      id:      " + r.id());
        System.out.println("      trigger: " + r.triggerPhrase());
        if (r.reasoning() != null && !r.reasoning().isBlank()) {
            System.out.println("      why:     " + r.reasoning());
        }
        if (r.result() != null) {
            System.out.println("      result:  " + r.result().text());
        }
        if (r.error() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "      @|fg(red) error:|@   " + r.error()
                            + (r.errorKind() != null ? " [" + r.errorKind().value() + "]" : "")));
        }
    }

    private static void section(String title, String body) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(yellow) " + title + "|@"));
        System.out.println("  " + (body == null || body.isBlank() ? "-" : body));
    }

    private static String priority(Priority priority) {
        return switch (priority) {
            case HIGH -> "@|fg(red),bold [HIGH]|@  ";
            case MEDIUM -> "@|fg(yellow) [MEDIUM]|@";
            case LOW -> "@|fg(white) [LOW]|@   ";
        };
    }

    private static String status(RecommendationStatus status) {
        String color = switch (status) {
            case COMPLETED -> "fg(green)";
            case FAILED, REJECTED -> "fg(red)";
            case EXECUTING -> "fg(blue)";
            case PENDING -> "fg(white)";
        };
        return "@|" + color + " " + status.value() + "|@";
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
