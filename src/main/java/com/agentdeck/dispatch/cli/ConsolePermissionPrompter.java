package com.agentdeck.dispatch.cli;

import com.agentdeck.core.permission.RememberScope;
import com.agentdeck.session.PermissionPrompter;
import com.agentdeck.session.PermissionRequest;
import com.agentdeck.session.PermissionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Asks for tool approvals on the terminal, one prompt at a time.
 * <p>
 * Answers: {@code y} allows once, {@code s} allows for the session, {@code a}
 * always allows the suggested pattern, anything else denies.
 */
public class ConsolePermissionPrompter implements PermissionPrompter, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConsolePermissionPrompter.class);

    private final BufferedReader in;
    private final PrintStream out;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "console-prompt");
        thread.setDaemon(true);
        return thread;
    });

    public ConsolePermissionPrompter(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public CompletableFuture<PermissionResponse> prompt(PermissionRequest request) {
        return CompletableFuture.supplyAsync(() -> ask(request), executor);
    }

    PermissionResponse ask(PermissionRequest request) {
        out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) Allow " + request.toolName() + "?|@ " + request.input()));
        if (request.suggestedPattern() != null) {
            out.println("  pattern: " + request.suggestedPattern());
        }
        out.print("  [y]es / [s]ession / [a]lways / [n]o: ");
        out.flush();
        String answer;
        try {
            answer = in.readLine();
        } catch (IOException e) {
            log.warn("Could not read permission answer: {}", e.getMessage());
            return PermissionResponse.deny("No answer");
        }
        if (answer == null) {
            return PermissionResponse.deny("No answer");
        }
        return switch (answer.trim().toLowerCase(Locale.ROOT)) {
            case "y", "yes" -> PermissionResponse.allowOnce();
            case "s", "session" -> PermissionResponse.allow(RememberScope.SESSION);
            case "a", "always" -> PermissionResponse.allow(RememberScope.ALWAYS);
            default -> PermissionResponse.deny("Denied by user");
        };
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
