package com.zero.dispatch.cli;

import com.zero.core.model.AnalyzerState;
import com.zero.core.model.AnalyzerStatus;
import com.zero.core.model.FreshnessLevel;
import com.zero.core.model.JobSnapshot;
import com.zero.core.model.JobStatus;
import picocli.CommandLine;

import java.time.Duration;
import java.util.List;

/**
 * ANSI-colored terminal output utilities for the zero CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) ZERO v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ZERO]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void plan(List<List<String>> waves) {
        for (int i = 0; i < waves.size(); i++) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|bold,fg(yellow) [WAVE " + (i + 1) + "]|@ " + String.join(", ", waves.get(i))));
        }
    }

    public static void watchEvent(String eventType, String analyzerId, String detail) {
        String prefix = switch (eventType) {
            case "job.queued", "job.started" -> "@|fg(cyan) [JOB]|@";
            case "wave.started", "wave.completed" -> "@|bold,fg(yellow) [WAVE]|@";
            case "analyzer.started" -> "@|fg(blue) [RUN]|@";
            case "analyzer.cached" -> "@|fg(green) [CACHED]|@";
            case "analyzer.completed" -> "@|fg(green) [DONE]|@";
            case "analyzer.failed" -> "@|fg(red) [FAILED]|@";
            case "analyzer.skipped" -> "@|fg(magenta) [SKIPPED]|@";
            case "job.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "job.failed" -> "@|fg(red),bold [ERROR]|@";
            case "job.cancelled" -> "@|fg(yellow),bold [CANCELLED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        String subject = analyzerId != null ? analyzerId + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject + detail));
    }

    public static void jobSummary(JobSnapshot snapshot) {
        System.out.println(RULE);
        String color = switch (snapshot.status()) {
            case DONE -> "fg(green)";
            case ERROR -> "fg(red)";
            case CANCELLED -> "fg(yellow)";
            default -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Job " + snapshot.id() + "|@ @|" + color + " " + snapshot.status() + "|@"));
        snapshot.analyzers().forEach((id, state) -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + analyzerLine(id, state))));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  Analyzers: @|fg(green) %d done|@, @|fg(red) %d failed|@, %d skipped",
                snapshot.countIn(AnalyzerStatus.DONE),
                snapshot.countIn(AnalyzerStatus.FAILED),
                snapshot.countIn(AnalyzerStatus.SKIPPED))));
        if (snapshot.status() == JobStatus.ERROR && snapshot.error() != null) {
            error(snapshot.error());
        }
    }

    public static void freshness(String analyzerId, FreshnessLevel level, Duration age, Duration ttl, boolean ok) {
        String color = switch (level) {
            case FRESH -> "fg(green)";
            case STALE -> "fg(yellow)";
            case VERY_STALE, EXPIRED -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %-22s @|%s %-10s|@ age %-8s ttl %-8s%s",
                analyzerId, color, level.label(), formatDuration(age), formatDuration(ttl),
                ok ? "" : " (last run failed)")));
    }

    private static String analyzerLine(String id, AnalyzerState state) {
        return switch (state.status()) {
            case DONE -> "@|fg(green) DONE   |@ " + id
                    + (state.cached() ? " (cached)" : " (" + formatDuration(Duration.ofMillis(state.durationMs())) + ")");
            case FAILED -> "@|fg(red) FAILED |@ " + id + ": " + state.error();
            case SKIPPED -> "@|fg(magenta) SKIPPED|@ " + id + ": " + state.skipReason();
            default -> state.status() + " " + id;
        };
    }

    static String formatDuration(Duration duration) {
        long ms = duration.toMillis();
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        long minutes = seconds / 60;
        if (minutes < 60) return minutes + "m " + (seconds % 60) + "s";
        long hours = minutes / 60;
        if (hours < 48) return hours + "h " + (minutes % 60) + "m";
        return (hours / 24) + "d " + (hours % 24) + "h";
    }
}
