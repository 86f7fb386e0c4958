package com.agentdeck.core.permission;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Path normalisation, traversal detection and glob compilation for file-tool patterns.
 */
public final class PathGlob {

    private PathGlob() {}

    /**
     * Uses forward slashes, collapses repeated slashes (so {@code //root} equals
     * {@code /root}) and drops a trailing slash.
     */
    public static String normalize(String path) {
        String normalized = path.replace('\\', '/').replaceAll("/{2,}", "/");
        if (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    /**
     * True when the path, or its once or twice percent-decoded form, has a {@code ..} segment.
     */
    public static boolean containsTraversal(String path) {
        String current = path;
        for (int round = 0; round < 3; round++) {
            if (hasDotDotSegment(current)) {
                return true;
            }
            String decoded = percentDecode(current);
            if (decoded.equals(current)) {
                return false;
            }
            current = decoded;
        }
        return hasDotDotSegment(current);
    }

    /**
     * Compiles a glob: {@code **} crosses directories, {@code *} and {@code ?} stay
     * within one segment. A trailing {@code /**} also matches the directory itself.
     */
    public static Pattern compile(String glob) {
        String normalized = normalize(glob);
        boolean recursiveSuffix = normalized.endsWith("/**");
        String body = recursiveSuffix ? normalized.substring(0, normalized.length() - 3) : normalized;

        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '*') {
                if (i + 1 < body.length() && body.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i++;
                } else {
                    regex.append("[^/]*");
                }
            } else if (c == '?') {
                regex.append("[^/]");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        if (recursiveSuffix) {
            regex.append("(?:/.*)?");
        }
        return Pattern.compile(regex.toString());
    }

    private static boolean hasDotDotSegment(String path) {
        for (String segment : path.replace('\\', '/').split("/")) {
            if ("..".equals(segment)) {
                return true;
            }
        }
        return false;
    }

    private static String percentDecode(String value) {
        if (value.indexOf('%') < 0) {
            return value;
        }
        try {
            return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // Malformed escapes: judge the raw text only
            return value;
        }
    }
}
