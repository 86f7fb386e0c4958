package com.agentdeck.core.permission;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a shell command line into the commands it runs.
 * <p>
 * Recognises {@code &&}, {@code ||}, {@code ;}, a lone {@code &}, newlines and pipes
 * ({@code |} and {@code |&}) outside of quotes.
 * Pipes bind tighter than the other operators, so every stage of a multi-stage
 * pipeline is reported as {@link CommandType#PIPELINE_PART}.
 */
public final class BashCommandParser {

    public enum CommandType { SIMPLE, CD, PIPELINE_PART }

    public record ParsedCommand(String command, CommandType type) {}

    private BashCommandParser() {}

    public static List<ParsedCommand> parse(String command) {
        List<ParsedCommand> result = new ArrayList<>();
        if (command == null || command.isBlank()) {
            return result;
        }
        for (String segment : split(command, false)) {
            List<String> stages = split(segment, true);
            boolean pipeline = stages.stream().filter(s -> !s.isBlank()).count() > 1;
            for (String stage : stages) {
                String trimmed = stage.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                result.add(new ParsedCommand(trimmed, typeOf(trimmed, pipeline)));
            }
        }
        return result;
    }

    /**
     * True when a {@code cd} command targets the working directory or a directory below it.
     * {@code cd} without an argument or into the home directory counts as outside.
     */
    public static boolean isCdWithinWorkingDir(String cdCommand, String workingDir) {
        if (workingDir == null) {
            return false;
        }
        String[] parts = cdCommand.trim().split("\\s+");
        if (parts.length < 2 || !"cd".equals(parts[0])) {
            return false;
        }
        String target = unquote(parts[1]);
        if (target.startsWith("~") || target.equals("-")) {
            return false;
        }
        Path base = Path.of(workingDir).normalize();
        Path resolved = target.startsWith("/") ? Path.of(target).normalize() : base.resolve(target).normalize();
        return resolved.startsWith(base);
    }

    /**
     * True when the command contains {@code $(...)}, backticks, or process substitution
     * ({@code <(...)}, {@code >(...)}) outside single quotes.
     */
    public static boolean hasCommandSubstitution(String command) {
        boolean inSingle = false;
        for (int i = 0; i < command.length(); i++) {
            char c = command.charAt(i);
            char next = i + 1 < command.length() ? command.charAt(i + 1) : '\0';
            if (c == '\'') {
                inSingle = !inSingle;
            } else if (!inSingle) {
                if (c == '`' || (next == '(' && (c == '$' || c == '<' || c == '>'))) {
                    return true;
                }
            }
        }
        return false;
    }

    /** Collapses runs of whitespace to single spaces and trims. */
    public static String normalizeWhitespace(String command) {
        return command == null ? "" : command.trim().replaceAll("\\s+", " ");
    }

    private static CommandType typeOf(String command, boolean pipeline) {
        String first = command.split("\\s+", 2)[0];
        if ("cd".equals(first)) {
            return CommandType.CD;
        }
        return pipeline ? CommandType.PIPELINE_PART : CommandType.SIMPLE;
    }

    /**
     * Splits on pipes when {@code pipes} is set, otherwise on {@code &&}, {@code ||},
     * {@code ;}, a lone {@code &} and newlines. Quoted and escaped characters never split,
     * nor does the {@code &} of {@code &>}, {@code >&}, {@code <&} or {@code |&}.
     */
    private static List<String> split(String command, boolean pipes) {
        List<String> parts = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        boolean inSingle = false;
        boolean inDouble = false;
        for (int i = 0; i < command.length(); i++) {
            char c = command.charAt(i);
            char next = i + 1 < command.length() ? command.charAt(i + 1) : '\0';
            if (c == '\\' && !inSingle && i + 1 < command.length()) {
                buffer.append(c).append(next);
                i++;
                continue;
            }
            if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            } else if (!inSingle && !inDouble) {
                if (pipes) {
                    if (c == '|' && next == '|') {
                        buffer.append("||");
                        i++;
                        continue;
                    }
                    if (c == '|') {
                        parts.add(buffer.toString());
                        buffer.setLength(0);
                        if (next == '&') {
                            i++;
                        }
                        continue;
                    }
                } else if (c == ';' || c == '\n' || (c == '&' && next == '&') || (c == '|' && next == '|')) {
                    parts.add(buffer.toString());
                    buffer.setLength(0);
                    if (c != ';' && c != '\n') {
                        i++;
                    }
                    continue;
                } else if (c == '&' && next != '>' && !isRedirectionAmpersand(command, i)) {
                    parts.add(buffer.toString());
                    buffer.setLength(0);
                    continue;
                }
            }
            buffer.append(c);
        }
        parts.add(buffer.toString());
        return parts;
    }

    private static boolean isRedirectionAmpersand(String command, int index) {
        if (index == 0) {
            return false;
        }
        char previous = command.charAt(index - 1);
        return previous == '>' || previous == '<' || previous == '|';
    }

    private static String unquote(String value) {
        if (value.length() >= 2
                && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
