package com.reqflow.dispatch.cli;

import com.reqflow.core.events.WorkflowEvent;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Reqflow CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) REQFLOW v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [REQFLOW]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * Prints one stream event on a single line.
     */
    public static void event(WorkflowEvent event) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(format(event)));
    }

    static String format(WorkflowEvent event) {
        Map<String, Object> p = event.payload();
        String seq = "#" + event.sequenceNumber();
        return switch (event.kind()) {
            case WORKFLOW_STATUS -> "@|bold,fg(yellow) [PHASE]|@ " + seq + " " + p.get("phase")
                    + (p.containsKey("reason") ? " (" + p.get("reason") + ": " + p.getOrDefault("detail", "") + ")" : "");
            case AGENT_MESSAGE -> p.containsKey("itemId")
                    ? "@|fg(blue) [" + p.get("phase") + "]|@ " + seq + " " + p.get("itemId") + " "
                            + verdict(String.valueOf(p.get("verdict")))
                            + (p.containsKey("score") ? " score=" + p.get("score") : "")
                            + " (" + p.get("completed") + "/" + p.get("total") + ")"
                            + (p.containsKey("detail") ? " " + p.get("detail") : "")
                    : "@|fg(blue) [" + p.getOrDefault("type", "message") + "]|@ " + seq + " " + p;
            case QUESTION -> "@|fg(magenta) [QUESTION " + p.get("priority") + "]|@ " + seq + " "
                    + p.get("questionId") + " " + p.get("prompt") + " " + p.get("options");
            case WORKFLOW_RESULT -> "@|bold [RESULT]|@ " + seq + " " + p.get("phase")
                    + " passed=" + p.get("passed") + " failed=" + p.get("failed") + " errored=" + p.get("errored");
        };
    }

    /**
     * Prints the final per-item table from a {@code workflow_result} payload.
     */
    @SuppressWarnings("unchecked")
    public static void summary(Map<String, Object> resultPayload) {
        System.out.println("──────────────────────────────────");
        var items = (List<Map<String, Object>>) resultPayload.getOrDefault("items", List.of());
        for (Map<String, Object> item : items) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("  %-14s %s %s",
                    item.get("id"), verdict(String.valueOf(item.get("verdict"))), item.get("text"))));
        }
    }

    private static String verdict(String verdict) {
        return switch (verdict) {
            case "pass" -> "@|fg(green) PASS |@";
            case "fail" -> "@|fg(red) FAIL |@";
            case "error" -> "@|fg(red),bold ERROR|@";
            default -> "@|fg(white) " + verdict + "|@";
        };
    }
}
