package com.agentdeck.core.permission;

import java.util.Set;

/**
 * The argument grammar a tool's permission patterns use, and the input field it reads.
 */
public enum ToolGrammar {
    BASH("command"),
    PATH("file_path"),
    WEB_FETCH("url"),
    WEB_SEARCH("query"),
    GENERIC(null);

    private static final Set<String> PATH_TOOLS = Set.of("Read", "Write", "Edit", "MultiEdit");

    private final String field;

    ToolGrammar(String field) {
        this.field = field;
    }

    /** The input field the argument is matched against; null for {@link #GENERIC}. */
    public String field() {
        return field;
    }

    public static ToolGrammar forTool(String toolName) {
        if (toolName == null) {
            return GENERIC;
        }
        if ("Bash".equals(toolName)) {
            return BASH;
        }
        if (PATH_TOOLS.contains(toolName)) {
            return PATH;
        }
        if ("WebFetch".equals(toolName)) {
            return WEB_FETCH;
        }
        if ("WebSearch".equals(toolName)) {
            return WEB_SEARCH;
        }
        return GENERIC;
    }
}
