package com.agentdeck.core.permission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A parsed allow or deny rule of the form {@code ToolName} or {@code ToolName(arg)}.
 * <p>
 * The tool part is an exact name, or a regex alternation when it contains {@code |}.
 * The argument is compiled once per grammar it can apply to; matching never re-parses
 * the source text.
 */
public final class PermissionPattern {

    private static final Logger log = LoggerFactory.getLogger(PermissionPattern.class);

    private final String source;
    private final String toolName;
    private final Pattern toolAlternation;
    private final String argument;
    private final Map<ToolGrammar, ArgumentMatcher> matchers;

    private PermissionPattern(String source, String toolName, Pattern toolAlternation,
                              String argument, Map<ToolGrammar, ArgumentMatcher> matchers) {
        this.source = source;
        this.toolName = toolName;
        this.toolAlternation = toolAlternation;
        this.argument = argument;
        this.matchers = matchers;
    }

    /**
     * Parses pattern text.
     *
     * @throws InvalidPermissionPatternException if the text is not a valid pattern
     */
    public static PermissionPattern parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidPermissionPatternException("Empty permission pattern");
        }
        String source = text.trim();
        String tool = source;
        String argument = null;
        int open = source.indexOf('(');
        if (open >= 0) {
            if (!source.endsWith(")")) {
                throw new InvalidPermissionPatternException("Unbalanced parentheses in '" + source + "'");
            }
            tool = source.substring(0, open).trim();
            argument = source.substring(open + 1, source.length() - 1);
        } else if (source.indexOf(')') >= 0) {
            throw new InvalidPermissionPatternException("Unbalanced parentheses in '" + source + "'");
        }
        if (tool.isEmpty()) {
            throw new InvalidPermissionPatternException("Missing tool name in '" + source + "'");
        }

        Pattern alternation = null;
        if (tool.contains("|")) {
            try {
                alternation = Pattern.compile(tool);
            } catch (PatternSyntaxException e) {
                throw new InvalidPermissionPatternException("Invalid tool alternation in '" + source + "'", e);
            }
        }

        Map<ToolGrammar, ArgumentMatcher> matchers = new EnumMap<>(ToolGrammar.class);
        if (argument != null) {
            if (alternation == null) {
                matchers.put(ToolGrammar.forTool(tool), ArgumentMatcher.compile(ToolGrammar.forTool(tool), argument));
            } else {
                compileForEveryGrammar(source, argument, matchers);
            }
        }
        return new PermissionPattern(source, tool, alternation, argument, matchers);
    }

    /**
     * Parses pattern text, logging and returning empty for invalid input so one bad
     * stored rule cannot break evaluation of the others.
     */
    public static Optional<PermissionPattern> tryParse(String text) {
        try {
            return Optional.of(parse(text));
        } catch (InvalidPermissionPatternException e) {
            log.warn("Ignoring invalid permission pattern '{}': {}", text, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean matches(ToolInput input) {
        String candidateTool = input.toolName();
        if (candidateTool == null || !matchesToolName(candidateTool)) {
            return false;
        }
        ToolGrammar grammar = input.grammar();
        if (grammar == ToolGrammar.PATH) {
            String path = input.filePath();
            if (path != null && PathGlob.containsTraversal(path)) {
                return false;
            }
        }
        if (argument == null) {
            return true;
        }
        ArgumentMatcher matcher = matchers.get(grammar);
        if (matcher == null) {
            return false;
        }
        if (grammar == ToolGrammar.GENERIC) {
            return matchesGeneric(matcher, input);
        }
        String value = input.argument();
        return value != null && matcher.matches(value);
    }

    public boolean matchesToolName(String candidate) {
        if (toolAlternation != null) {
            return toolAlternation.matcher(candidate).matches();
        }
        return toolName.equals(candidate);
    }

    public String source() {
        return source;
    }

    public String toolName() {
        return toolName;
    }

    public Optional<String> argument() {
        return Optional.ofNullable(argument);
    }

    /**
     * Tools without a grammar: {@code *} matches anything, {@code ()} only an input
     * with no non-empty values, any other argument an input value equal to it.
     */
    private boolean matchesGeneric(ArgumentMatcher matcher, ToolInput input) {
        if (ArgumentMatcher.WILDCARD.equals(argument)) {
            return true;
        }
        if (argument.isEmpty()) {
            return input.hasOnlyEmptyValues();
        }
        return input.values().values().stream()
                .anyMatch(v -> v != null && matcher.matches(v.toString()));
    }

    private static void compileForEveryGrammar(String source, String argument,
                                               Map<ToolGrammar, ArgumentMatcher> matchers) {
        for (ToolGrammar grammar : ToolGrammar.values()) {
            try {
                matchers.put(grammar, ArgumentMatcher.compile(grammar, argument));
            } catch (InvalidPermissionPatternException e) {
                log.debug("Pattern '{}' has no valid {} argument: {}", source, grammar, e.getMessage());
            }
        }
        if (matchers.isEmpty()) {
            throw new InvalidPermissionPatternException("Argument of '" + source + "' is valid for no tool");
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PermissionPattern other && source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    @Override
    public String toString() {
        return source;
    }
}
