package com.maestro.dispatch.cli;

import com.maestro.core.events.MaestroEvent;
import com.maestro.core.model.PipelineStatus;
import com.maestro.core.model.StageStatus;
import com.maestro.core.model.ValidationCheck;
import picocli.CommandLine;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the Maestro CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) MAESTRO v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [MAESTRO]|@ " + message));
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

    public static void status(PipelineStatus status) {
        switch (status) {
            case COMPLETED -> success("Status: " + status);
            case FAILED -> error("Status: " + status);
            case PAUSED -> warn("Status: " + status);
            default -> info("Status: " + status);
        }
    }

    public static String stageStatus(StageStatus status) {
        String color = switch (status) {
            case COMPLETED -> "fg(green)";
            case SKIPPED -> "fg(white)";
            case IN_PROGRESS -> "fg(cyan)";
            case FAILED -> "fg(red)";
            case PENDING -> "faint";
        };
        return CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + status.name().toLowerCase() + "|@");
    }

    public static void check(ValidationCheck check) {
        String mark = check.passed() ? "@|fg(green) PASS|@" : "@|fg(red) FAIL|@";
        String severity = check.passed() ? "" : " (" + check.severity().name().toLowerCase() + ")";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + mark + " " + check.name() + severity + " - " + check.message()));
    }

    /** One line per pipeline event, printed live while the pipeline runs. */
    public static void event(MaestroEvent event) {
        String prefix = switch (event.eventType()) {
            case "stage.started", "stage.completed" -> "@|fg(blue) [STAGE]|@";
            case "stage.retry", "stage.degraded" -> "@|fg(yellow) [RETRY]|@";
            case "stage.failed", "agent.failed" -> "@|fg(red) [FAILED]|@";
            case "debate.round.completed", "debate.contention.scored", "debate.synthesized" -> "@|fg(magenta) [DEBATE]|@";
            case "step.completed" -> "@|fg(magenta) [STEP]|@";
            case "checkpoint.created", "checkpoint.restored", "checkpoint.deleted" -> "@|fg(cyan) [CHECKPOINT]|@";
            case "pipeline.paused" -> "@|fg(yellow),bold [PAUSED]|@";
            case "pipeline.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "compliance.violation" -> "@|fg(red),bold [COMPLIANCE]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String stage = event.stageId() != null ? event.stageId() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + stage + format(event.payload())));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    private static String format(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) return "";
        return payload.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" "));
    }
}
