package com.agentdeck.core.permission;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Read-only shell commands that may run without asking.
 * <p>
 * A command is never safe when it writes to a file through a redirection
 * ({@code >}, {@code >>}, {@code 2>}, {@code &>}, {@code N>}); only duplicating
 * a descriptor ({@code 2>&1}) or discarding into {@code /dev/null} is tolerated.
 */
public final class SafeCommands {

    private static final Set<String> SAFE_COMMANDS = Set.of(
            "ls", "pwd", "which", "whoami", "tree",
            "cat", "head", "tail", "less", "more",
            "find", "grep", "egrep", "fgrep", "rg",
            "ps", "stat", "file", "wc", "du", "df",
            "env", "printenv", "echo",
            "sort", "uniq", "cut", "awk", "sed", "jq", "tr", "column", "nl",
            "git", "npm", "dart", "pip");

    private static final Map<String, Set<String>> SAFE_SUBCOMMANDS = Map.of(
            "git", Set.of("status", "log", "diff", "show", "branch", "remote", "rev-parse", "describe",
                    "ls-files", "ls-tree", "ls-remote", "blame", "shortlog", "reflog", "cat-file", "rev-list"),
            "npm", Set.of("list", "ls", "view", "show", "info", "search", "outdated", "doctor", "version", "help"),
            "dart", Set.of("analyze", "doc", "info", "help", "version"),
            "pip", Set.of("list", "show", "search", "check", "help"));

    /** Subcommands that change state when given arguments; only these arguments keep them read-only. */
    private static final Map<String, Set<String>> LISTING_ARGUMENTS = Map.of(
            "git branch", Set.of("-a", "-r", "-v", "-vv", "-l", "--all", "--remotes", "--list", "--show-current"),
            "git remote", Set.of("-v", "--verbose", "show", "get-url"),
            "git reflog", Set.of("show"),
            "npm version", Set.of("--json"));

    /** Filters that only transform what is piped into them. */
    private static final Set<String> OUTPUT_FILTERS = Set.of(
            "head", "tail", "grep", "egrep", "fgrep", "sed", "awk", "cut", "sort", "uniq",
            "wc", "tr", "less", "more", "cat", "column", "nl", "jq");

    // sed commands that run a shell (e) or write a file (w, W), including the s///w and s///e flags
    private static final Pattern SED_EXEC_OR_WRITE = Pattern.compile("(?:^|[\\s;'\"/}0-9$])[eEwW](?:\\s|$|[;'\"}])");

    // awk output redirection: print > "file", print | "cmd"
    private static final Pattern AWK_PRINT_REDIRECT = Pattern.compile("\\bprintf?\\b[^;}]*>");

    private SafeCommands() {}

    public static boolean isCommandSafe(String command) {
        String trimmed = BashCommandParser.normalizeWhitespace(command);
        if (trimmed.isEmpty() || BashCommandParser.hasCommandSubstitution(trimmed)) {
            return false;
        }
        String[] parts = trimmed.split(" ");
        String name = parts[0];
        if (!SAFE_COMMANDS.contains(name)) {
            return false;
        }
        // env runs its arguments as a command
        if ("env".equals(name) && parts.length > 1) {
            return false;
        }
        Set<String> subcommands = SAFE_SUBCOMMANDS.get(name);
        if (subcommands != null) {
            if (parts.length < 2 || !subcommands.contains(parts[1])) {
                return false;
            }
            Set<String> listing = LISTING_ARGUMENTS.get(name + " " + parts[1]);
            if (listing != null && !listing.containsAll(Arrays.asList(parts).subList(2, parts.length))) {
                return false;
            }
        }
        return !hasDangerousFlags(name, trimmed);
    }

    public static boolean isSafeOutputFilter(String command) {
        String trimmed = BashCommandParser.normalizeWhitespace(command);
        if (trimmed.isEmpty() || BashCommandParser.hasCommandSubstitution(trimmed)) {
            return false;
        }
        String name = trimmed.split(" ")[0];
        return OUTPUT_FILTERS.contains(name) && !hasDangerousFlags(name, trimmed);
    }

    /**
     * True when the command redirects output into a file. {@code >&N}, {@code >&-} and
     * targets of {@code /dev/null} do not count.
     */
    static boolean writesToFile(String command) {
        boolean inSingle = false;
        boolean inDouble = false;
        int length = command.length();
        for (int i = 0; i < length; i++) {
            char c = command.charAt(i);
            if (c == '\\' && !inSingle) {
                i++;
            } else if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            } else if (c == '>' && !inSingle && !inDouble) {
                int j = i + 1;
                if (j < length && (command.charAt(j) == '>' || command.charAt(j) == '|')) {
                    j++;
                }
                if (j < length && command.charAt(j) == '&') {
                    int digits = j + 1;
                    while (digits < length && Character.isDigit(command.charAt(digits))) {
                        digits++;
                    }
                    boolean closes = digits < length && command.charAt(digits) == '-';
                    if (digits > j + 1 || closes) {
                        i = closes ? digits : digits - 1;
                        continue;
                    }
                    j++;
                }
                while (j < length && command.charAt(j) == ' ') {
                    j++;
                }
                int end = j;
                while (end < length && " ;|&<>".indexOf(command.charAt(end)) < 0) {
                    end++;
                }
                String target = command.substring(j, end).replace("\"", "").replace("'", "");
                if (!"/dev/null".equals(target)) {
                    return true;
                }
                i = end - 1;
            }
        }
        return false;
    }

    private static boolean hasDangerousFlags(String name, String command) {
        if (writesToFile(command)) {
            return true;
        }
        List<String> words = Arrays.asList(command.split(" "));
        if ("find".equals(name) && words.stream().anyMatch(w -> w.startsWith("-delete") || w.startsWith("-exec")
                || w.startsWith("-ok") || w.startsWith("-fprint") || w.equals("-fls"))) {
            return true;
        }
        if ("sed".equals(name)) {
            String script = command.substring(name.length());
            return script.contains(" -i") || script.contains("--in-place")
                    || SED_EXEC_OR_WRITE.matcher(script).find();
        }
        // awk can shell out with system(), pipes, or print into files
        return "awk".equals(name) && (command.contains("system(") || command.contains("|")
                || AWK_PRINT_REDIRECT.matcher(command).find());
    }
}
