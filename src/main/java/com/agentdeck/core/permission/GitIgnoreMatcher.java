package com.agentdeck.core.permission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Rules of a project's top-level {@code .gitignore}.
 * <p>
 * Supports comments, {@code !} negation, {@code *}, {@code ?} and {@code **} wildcards,
 * a trailing {@code /} for directories and a leading or inner {@code /} for rules
 * anchored at the project root. Later rules override earlier ones.
 */
public final class GitIgnoreMatcher {

    private static final Logger log = LoggerFactory.getLogger(GitIgnoreMatcher.class);

    static final String FILE_NAME = ".gitignore";

    private final Path projectRoot;
    private final List<Rule> rules;
    private final FileStamp stamp;

    private record Rule(Pattern pattern, boolean negated) {}

    private GitIgnoreMatcher(Path projectRoot, List<Rule> rules, FileStamp stamp) {
        this.projectRoot = projectRoot;
        this.rules = rules;
        this.stamp = stamp;
    }

    /**
     * Reads {@code <projectRoot>/.gitignore}. A missing or unreadable file ignores nothing.
     */
    public static GitIgnoreMatcher load(Path projectRoot) {
        Path root = projectRoot.toAbsolutePath().normalize();
        Path file = root.resolve(FILE_NAME);
        FileStamp stamp = FileStamp.of(file);
        if (!stamp.exists()) {
            return new GitIgnoreMatcher(root, List.of(), stamp);
        }
        try {
            return new GitIgnoreMatcher(root, parse(Files.readString(file, StandardCharsets.UTF_8)), stamp);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return new GitIgnoreMatcher(root, List.of(), stamp);
        }
    }

    /** Rules from {@code .gitignore} text, for a project at {@code projectRoot}. */
    static GitIgnoreMatcher of(Path projectRoot, String content) {
        return new GitIgnoreMatcher(projectRoot.toAbsolutePath().normalize(), parse(content), FileStamp.NONE);
    }

    /** True when the file on disk changed since these rules were read. */
    public boolean isStale() {
        return !Objects.equals(stamp, FileStamp.of(projectRoot.resolve(FILE_NAME)));
    }

    /**
     * True when a file is ignored. Relative paths are taken from the project root;
     * paths outside the project are never ignored.
     */
    public boolean isIgnored(String filePath) {
        if (rules.isEmpty() || filePath == null || filePath.isBlank()) {
            return false;
        }
        Path path = Path.of(filePath);
        Path absolute = (path.isAbsolute() ? path : projectRoot.resolve(path)).normalize();
        if (!absolute.startsWith(projectRoot) || absolute.equals(projectRoot)) {
            return false;
        }
        String relative = projectRoot.relativize(absolute).toString().replace('\\', '/');
        boolean ignored = false;
        for (Rule rule : rules) {
            if (rule.pattern().matcher(relative).matches()) {
                ignored = !rule.negated();
            }
        }
        return ignored;
    }

    public int ruleCount() {
        return rules.size();
    }

    private static List<Rule> parse(String content) {
        List<Rule> rules = new ArrayList<>();
        for (String raw : content.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            boolean negated = line.startsWith("!");
            if (negated) {
                line = line.substring(1);
            }
            boolean directoryOnly = line.endsWith("/");
            if (directoryOnly) {
                line = line.substring(0, line.length() - 1);
            }
            boolean leadingSlash = line.startsWith("/");
            if (leadingSlash) {
                line = line.substring(1);
            }
            if (line.isEmpty()) {
                continue;
            }
            boolean anchored = leadingSlash || line.contains("/");
            String body = toRegex(line);
            // A directory rule only matches what lies below the directory
            String tail = directoryOnly ? "/.*" : "(?:/.*)?";
            String head = anchored ? "" : "(?:.*/)?";
            rules.add(new Rule(Pattern.compile(head + body + tail), negated));
        }
        return List.copyOf(rules);
    }

    private static String toRegex(String pattern) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '*') {
                if (i + 1 < pattern.length() && pattern.charAt(i + 1) == '*') {
                    i++;
                    if (i + 1 < pattern.length() && pattern.charAt(i + 1) == '/') {
                        regex.append("(?:.*/)?");
                        i++;
                    } else {
                        regex.append(".*");
                    }
                } else {
                    regex.append("[^/]*");
                }
            } else if (c == '?') {
                regex.append("[^/]");
            } else if (c == '\\' && i + 1 < pattern.length()) {
                regex.append(Pattern.quote(String.valueOf(pattern.charAt(++i))));
            } else if (Character.isLetterOrDigit(c) || c == '/' || c == '-' || c == '_') {
                regex.append(c);
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }
}
