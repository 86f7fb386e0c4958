package com.agentdeck.core.permission;

import java.util.Collection;
import java.util.Map;

/**
 * The allow-list rule on its own: allow when any pattern matches, otherwise ask.
 */
public final class PermissionPolicy {

    private PermissionPolicy() {}

    public static PermissionDecision checkPermission(String toolName, Map<String, Object> toolInput,
                                                     Collection<PermissionPattern> patterns) {
        ToolInput input = new ToolInput(toolName, toolInput);
        PermissionPattern match = firstMatch(input, patterns);
        if (match != null) {
            return PermissionDecision.allow("Matched " + match.source(), DecisionSource.ALLOW_LIST, match);
        }
        return PermissionDecision.ask("No rule allows " + toolName, PatternInference.inferPattern(input));
    }

    static PermissionPattern firstMatch(ToolInput input, Collection<PermissionPattern> patterns) {
        for (PermissionPattern pattern : patterns) {
            if (pattern.matches(input)) {
                return pattern;
            }
        }
        return null;
    }
}
