package com.agentdeck.dispatch.cli;

import com.agentdeck.core.events.AgentEvent;
import com.agentdeck.core.model.Conversation;
import com.agentdeck.core.permission.PermissionDecision;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the AgentDeck CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AGENTDECK v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AGENTDECK]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void agent(String name, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [" + name + "]|@ " + message));
    }

    public static void decision(PermissionDecision decision) {
        String color = switch (decision.behavior()) {
            case ALLOW -> "fg(green)";
            case DENY -> "fg(red)";
            case ASK -> "fg(yellow)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold," + color + " " + decision.behavior() + "|@ " + decision.reason()
                        + " @|faint (" + decision.source() + ")|@"));
        if (decision.matchedPattern() != null) {
            System.out.println("  matched:   " + decision.matchedPattern().source());
        }
        if (decision.suggestedPattern() != null) {
            System.out.println("  suggested: " + decision.suggestedPattern());
        }
    }

    /**
     * One line per event; streaming message updates are left to the final message.
     */
    public static void event(AgentEvent event) {
        String who = event.agentName() != null ? event.agentName() : "network";
        Object payload = event.payload();
        String data = switch (event.type()) {
            case TOOL_USE -> event.payload().get("toolName") + " " + event.payload().get("input");
            case TOOL_RESULT -> Boolean.TRUE.equals(event.payload().get("isError"))
                    ? "@|fg(red) failed|@ " + abbreviate(String.valueOf(event.payload().get("content")))
                    : abbreviate(String.valueOf(event.payload().get("content")));
            case PERMISSION_REQUEST -> "@|fg(yellow) needs approval for|@ " + event.payload().get("toolName");
            case PERMISSION_TIMEOUT -> "@|fg(red) approval timed out for|@ " + event.payload().get("toolName");
            case ERROR -> "@|fg(red) " + event.payload().get("message") + "|@";
            case AGENT_SPAWNED -> "@|fg(magenta) spawned|@ " + event.payload().get("agentType");
            case AGENT_TERMINATED -> "@|fg(magenta) terminated|@";
            case DONE -> "@|fg(green),bold done|@";
            case ABORTED -> "@|fg(red),bold aborted|@";
            case STATUS -> String.valueOf(event.payload().get("status"));
            default -> String.valueOf(payload);
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [" + who + "]|@ @|faint " + event.type().wireName() + "|@ " + data));
    }

    public static void usage(Conversation c) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Usage|@"));
        System.out.printf("  Tokens: %d in, %d out, %d cache read, %d cache created%n",
                c.totalInputTokens(), c.totalOutputTokens(), c.totalCacheReadTokens(), c.totalCacheCreationTokens());
        System.out.printf("  Context: %d tokens%n", c.currentContextTokens());
        System.out.printf("  Cost: $%.4f%n", c.totalCostUsd());
    }

    static String abbreviate(String text) {
        String oneLine = text.replace('\n', ' ').strip();
        return oneLine.length() <= 120 ? oneLine : oneLine.substring(0, 117) + "...";
    }
}
