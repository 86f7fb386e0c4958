package com.agentdeck.core.permission;

import java.util.Map;

/**
 * A tool invocation as seen by the permission engine.
 *
 * @param toolName the tool the agent wants to run
 * @param values   the tool's input parameters
 */
public record ToolInput(String toolName, Map<String, Object> values) {

    public ToolInput {
        values = values == null ? Map.of() : values;
    }

    public ToolGrammar grammar() {
        return ToolGrammar.forTool(toolName);
    }

    /**
     * The string value of a field, or null when the field is absent or null.
     */
    public String string(String field) {
        Object value = values.get(field);
        return value == null ? null : value.toString();
    }

    /**
     * The value the tool's grammar constrains, or null when it is missing.
     */
    public String argument() {
        String field = grammar().field();
        return field == null ? null : string(field);
    }

    /** True when every input value is null or an empty string. */
    public boolean hasOnlyEmptyValues() {
        return values.values().stream().allMatch(v -> v == null || v.toString().isEmpty());
    }

    public String filePath() {
        return grammar() == ToolGrammar.PATH ? string("file_path") : null;
    }
}
