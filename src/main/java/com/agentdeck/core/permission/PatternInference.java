package com.agentdeck.core.permission;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives a reusable permission pattern from one concrete invocation, for
 * "remember this decision".
 */
public final class PatternInference {

    private PatternInference() {}

    public static String inferPattern(ToolInput input) {
        String toolName = input.toolName();
        return switch (input.grammar()) {
            case BASH -> inferBash(input.string("command"));
            case PATH -> inferPath(toolName, input.string("file_path"));
            case WEB_FETCH -> inferWebFetch(input.string("url"));
            case WEB_SEARCH -> "WebSearch";
            case GENERIC -> toolName;
        };
    }

    /**
     * Leading words of the first non-{@code cd} command, stopping at a flag or a
     * path: {@code npm run test --watch} becomes {@code Bash(npm run test:*)}.
     */
    static String inferBash(String command) {
        if (command == null || command.isBlank()) {
            return "Bash(*)";
        }
        var parsed = BashCommandParser.parse(command);
        String main = parsed.stream()
                .filter(p -> p.type() != BashCommandParser.CommandType.CD)
                .map(BashCommandParser.ParsedCommand::command)
                .findFirst()
                .orElse(parsed.isEmpty() ? "" : parsed.get(0).command());
        if (main.isBlank()) {
            return "Bash(*)";
        }

        List<String> words = new ArrayList<>();
        for (String part : BashCommandParser.normalizeWhitespace(main).split(" ")) {
            if (part.startsWith("-")) {
                break;
            }
            if (part.startsWith("/") || part.startsWith("./") || part.startsWith("~/") || part.startsWith("..")) {
                if (words.isEmpty()) {
                    words.add(part);
                }
                break;
            }
            words.add(part);
        }
        return words.isEmpty() ? "Bash(*)" : "Bash(" + String.join(" ", words) + ":*)";
    }

    static String inferPath(String toolName, String filePath) {
        if (filePath == null || filePath.isEmpty()) {
            return toolName + "(*)";
        }
        String normalized = PathGlob.normalize(filePath);
        int slash = normalized.lastIndexOf('/');
        if (slash < 0) {
            return toolName + "(**)";
        }
        if (slash == 0) {
            // A file directly under the root gets an exact rule, never "/**"
            return toolName + "(" + normalized + ")";
        }
        return toolName + "(" + normalized.substring(0, slash) + "/**)";
    }

    static String inferWebFetch(String url) {
        if (url == null || url.isBlank()) {
            return "WebFetch(*)";
        }
        try {
            String host = new URI(url.trim()).getHost();
            return host == null || host.isEmpty() ? "WebFetch(*)" : "WebFetch(domain:" + host + ")";
        } catch (URISyntaxException e) {
            return "WebFetch(*)";
        }
    }
}
