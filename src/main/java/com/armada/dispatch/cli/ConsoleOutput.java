package com.armada.dispatch.cli;

import com.armada.core.engine.ExecutionProgress;
import com.armada.core.engine.ExecutionResult;
import com.armada.core.events.ArmadaEvent;
import com.armada.core.model.ChangeType;
import com.armada.core.quota.QuotaStatus;
import picocli.CommandLine;

import java.time.Duration;

/**
 * ANSI-colored terminal output utilities for Armada CLI.
 */
public class ConsoleOutput {

    static final String SEPARATOR = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ARMADA v0.1.0|@"));
        System.out.println(SEPARATOR);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ARMADA]|@ " + message));
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

    public static void fileChange(ChangeType type, String path) {
        String symbol = switch (type) {
            case CREATE -> "@|fg(green) +|@";
            case MODIFY -> "@|fg(yellow) ~|@";
            case DELETE -> "@|fg(red) -|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  " + symbol + " " + path));
    }

    public static void progress(ExecutionProgress progress) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [" + progress.stage().toUpperCase() + "]|@ "
                        + progress.tasksCompleted() + "/" + progress.tasksTotal()
                        + (progress.message() != null ? " " + progress.message() : "")));
    }

    public static void event(ArmadaEvent event) {
        String prefix = switch (event.eventType()) {
            case "mission.created", "mission.started", "mission.phase_changed" -> "@|fg(cyan) [MISSION]|@";
            case "task.started", "task.completed" -> "@|fg(blue) [TASK]|@";
            case "task.failed", "task.timed_out", "task.cancelled" -> "@|fg(red) [TASK]|@";
            case "agent.created", "agent.retired" -> "@|fg(magenta) [AGENT]|@";
            case "branch.created", "branch.merged", "branch.abandoned" -> "@|fg(yellow) [BRANCH]|@";
            case "conflict.detected", "conflict.resolved" -> "@|bold,fg(yellow) [CONFLICT]|@";
            case "quota.warning", "quota.critical", "quota.exceeded" -> "@|fg(red),bold [QUOTA]|@";
            case "mission.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "mission.failed", "mission.cancelled" -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.subjectId() != null ? event.subjectId() : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject));
    }

    public static void quota(QuotaStatus status) {
        String color = switch (status.state()) {
            case OK -> "fg(green)";
            case WARNING -> "fg(yellow)";
            case CRITICAL, EXCEEDED -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %-12s @|%s %-9s|@ %5.1f%%  resets in %s",
                status.provider(), color, status.state(), status.ratio() * 100,
                formatDuration(status.resetIn().toMillis()))));
    }

    public static void result(ExecutionResult result) {
        System.out.println(SEPARATOR);
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Execution " + result.executionId() + "|@"));
        System.out.println("  Tasks: " + result.tasksCompleted() + "/" + result.tasksTotal());
        if (result.impact() != null) {
            System.out.println("  Risk: " + result.impact().riskLevel() + " (" + result.impact().riskScore() + ")");
        }
        if (!result.mergedChanges().isEmpty()) {
            System.out.println("  Files:");
            result.mergedChanges().forEach(c -> fileChange(c.type(), c.path()));
        }
        if (!result.manualResolutions().isEmpty()) {
            warn(result.manualResolutions().size() + " conflict(s) need manual resolution:");
            result.manualResolutions().forEach(r -> System.out.println("    " + r.path()));
        }
        if (result.verification() != null && !result.verification().valid()) {
            error("Verification: " + result.verification().summary());
            result.verification().details().forEach(d -> System.out.println("    - " + d));
        }
        System.out.println("  Duration: " + formatDuration(result.durationMs()));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        if (seconds < 3600) return (seconds / 60) + "m " + (seconds % 60) + "s";
        Duration d = Duration.ofSeconds(seconds);
        return d.toHours() + "h " + d.toMinutesPart() + "m";
    }
}
