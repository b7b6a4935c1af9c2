package com.agentdock.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import picocli.CommandLine;

import java.util.Iterator;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the agentdock CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AGENTDOCK v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AGENTDOCK]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /** Colors a task or repository status by outcome. */
    public static String status(String status) {
        String color = switch (status) {
            case "done" -> "fg(green)";
            case "error" -> "fg(red)";
            case "canceled" -> "fg(magenta)";
            case "running", "ready", "preparing" -> "fg(cyan)";
            default -> "fg(white)";
        };
        return CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + status + "|@");
    }

    /** Renders one event from the task feed. Agent output is printed raw. */
    public static void event(JsonNode event) {
        String type = event.path("type").asText();
        String repoId = event.path("repoId").asText(null);
        String scope = repoId != null ? " " + repoId : "";

        if ("log".equals(type)) {
            String text = event.path("text").asText("");
            if ("stderr".equals(event.path("stream").asText())) {
                System.err.print(text);
            } else {
                System.out.print(text);
            }
            System.out.flush();
            return;
        }

        String prefix = switch (type) {
            case "task_created", "task_status" -> "@|fg(cyan),bold [TASK]|@";
            case "repo_status", "repo_exit" -> "@|fg(blue) [REPO" + scope + "]|@";
            case "diff_ready", "diff_error" -> "@|fg(yellow) [DIFF" + scope + "]|@";
            case "promote_status", "promote_skip", "pr_created" -> "@|fg(green) [PROMOTE" + scope + "]|@";
            case "promote_error", "task_error", "repo_error" -> "@|fg(red),bold [ERROR" + scope + "]|@";
            case "stdin" -> "@|fg(magenta) [STDIN" + scope + "]|@";
            default -> "@|fg(white) [" + type + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + details(event)));
    }

    private static String details(JsonNode event) {
        StringBuilder sb = new StringBuilder();
        Iterator<Map.Entry<String, JsonNode>> fields = event.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            switch (field.getKey()) {
                case "seq", "ts", "taskId", "type", "repoId" -> { }
                default -> {
                    if (sb.length() > 0) sb.append(' ');
                    JsonNode value = field.getValue();
                    sb.append(field.getKey()).append('=')
                            .append(value.isValueNode() ? value.asText() : value.toString());
                }
            }
        }
        return sb.toString();
    }

    public static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
