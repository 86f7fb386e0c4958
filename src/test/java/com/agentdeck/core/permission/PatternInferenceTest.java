package com.agentdeck.core.permission;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PatternInferenceTest {

    private static String infer(String tool, Map<String, Object> input) {
        return PatternInference.inferPattern(new ToolInput(tool, input));
    }

    @Test
    @DisplayName("Bash keeps leading words up to the first flag or path")
    void bash() {
        assertEquals("Bash(npm run test:*)", infer("Bash", Map.of("command", "npm run test --watch")));
        assertEquals("Bash(git commit:*)", infer("Bash", Map.of("command", "git commit -m 'x'")));
        assertEquals("Bash(cat:*)", infer("Bash", Map.of("command", "cat /etc/hosts")));
        assertEquals("Bash(./gradlew:*)", infer("Bash", Map.of("command", "./gradlew build")));
    }

    @Test
    @DisplayName("Bash skips a leading cd")
    void bashAfterCd() {
        assertEquals("Bash(make:*)", infer("Bash", Map.of("command", "cd sub && make -j4")));
    }

    @Test
    @DisplayName("Bash without a command falls back to a wildcard")
    void bashEmpty() {
        assertEquals("Bash(*)", infer("Bash", Map.of()));
        assertEquals("Bash(*)", infer("Bash", Map.of("command", "--help")));
    }

    @Test
    @DisplayName("file tools get the parent directory")
    void paths() {
        assertEquals("Write(/work/src/**)", infer("Write", Map.of("file_path", "/work/src/A.java")));
        assertEquals("Edit(/notes.md)", infer("Edit", Map.of("file_path", "/notes.md")));
        assertEquals("Read(**)", infer("Read", Map.of("file_path", "notes.md")));
        assertEquals("Read(*)", infer("Read", Map.of()));
    }

    @Test
    @DisplayName("web tools get a domain or the bare tool")
    void web() {
        assertEquals("WebFetch(domain:docs.oracle.com)", infer("WebFetch", Map.of("url", "https://docs.oracle.com/en/java")));
        assertEquals("WebFetch(*)", infer("WebFetch", Map.of("url", "not a url")));
        assertEquals("WebSearch", infer("WebSearch", Map.of("query", "jdk 17")));
    }

    @Test
    @DisplayName("other tools get the bare tool name")
    void generic() {
        assertEquals("mcp__db__query", infer("mcp__db__query", Map.of("sql", "select 1")));
    }

    @Test
    @DisplayName("inferred patterns match the invocation they came from")
    void inferredMatches() {
        ToolInput input = new ToolInput("Bash", Map.of("command", "docker compose up -d"));
        assertTrue(PermissionPattern.parse(PatternInference.inferPattern(input)).matches(input));

        ToolInput write = new ToolInput("Write", Map.of("file_path", "/work/out/report.txt"));
        assertTrue(PermissionPattern.parse(PatternInference.inferPattern(write)).matches(write));
    }
}
