package com.agentdeck.core.permission;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Tests the grammar-specific argument of a tool invocation against a pattern argument.
 * Implementations receive a non-null value; a missing field never reaches them.
 */
@FunctionalInterface
public interface ArgumentMatcher {

    String WILDCARD = "*";

    boolean matches(String value);

    /**
     * Compiles the argument text of a pattern for one grammar.
     *
     * @throws InvalidPermissionPatternException if the argument is not valid for the grammar
     */
    static ArgumentMatcher compile(ToolGrammar grammar, String argument) {
        if (WILDCARD.equals(argument)) {
            return value -> true;
        }
        if (argument.isEmpty()) {
            return String::isEmpty;
        }
        return switch (grammar) {
            case BASH -> bash(argument);
            case PATH -> path(argument);
            case WEB_FETCH -> webFetch(argument);
            case WEB_SEARCH -> webSearch(argument);
            case GENERIC -> argument::equals;
        };
    }

    /**
     * {@code prefix:*} is a literal prefix, anything else an exact command. Commands
     * joined with {@code &&}, {@code ;}, {@code &} or pipes match only if every part matches.
     */
    private static ArgumentMatcher bash(String argument) {
        boolean prefix = argument.endsWith(":*");
        String literal = BashCommandParser.normalizeWhitespace(
                prefix ? argument.substring(0, argument.length() - 2) : argument);
        if (literal.isEmpty()) {
            throw new InvalidPermissionPatternException("Empty Bash prefix in '" + argument + "'");
        }
        ArgumentMatcher single = prefix
                ? command -> !BashCommandParser.hasCommandSubstitution(command)
                        && (command.equals(literal) || command.startsWith(literal))
                : literal::equals;
        return command -> {
            var parts = BashCommandParser.parse(command);
            if (parts.isEmpty()) {
                return false;
            }
            return parts.stream()
                    .allMatch(p -> single.matches(BashCommandParser.normalizeWhitespace(p.command())));
        };
    }

    private static ArgumentMatcher path(String argument) {
        Pattern glob = PathGlob.compile(argument);
        return value -> !PathGlob.containsTraversal(value)
                && glob.matcher(PathGlob.normalize(value)).matches();
    }

    private static ArgumentMatcher webFetch(String argument) {
        if (!argument.startsWith("domain:")) {
            return argument::equals;
        }
        String domain = argument.substring("domain:".length()).toLowerCase(Locale.ROOT);
        if (domain.isEmpty() || domain.startsWith(".")) {
            throw new InvalidPermissionPatternException("Invalid domain in '" + argument + "'");
        }
        return url -> {
            String host = host(url);
            return host != null && (host.equals(domain) || host.endsWith("." + domain));
        };
    }

    private static ArgumentMatcher webSearch(String argument) {
        if (!argument.startsWith("query:")) {
            return argument::equals;
        }
        try {
            Pattern query = Pattern.compile(argument.substring("query:".length()));
            return value -> query.matcher(value).find();
        } catch (PatternSyntaxException e) {
            throw new InvalidPermissionPatternException("Invalid query regex in '" + argument + "'", e);
        }
    }

    private static String host(String url) {
        try {
            String host = new URI(url.trim()).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
