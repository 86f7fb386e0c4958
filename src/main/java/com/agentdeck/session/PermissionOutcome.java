package com.agentdeck.session;

import java.util.Map;

/**
 * The answer written back to the agent for one {@code can_use_tool} request.
 */
public record PermissionOutcome(boolean allowed, String message, Map<String, Object> updatedInput) {

    public static PermissionOutcome allow(Map<String, Object> input) {
        return new PermissionOutcome(true, null, input);
    }

    public static PermissionOutcome deny(String message) {
        return new PermissionOutcome(false, message, null);
    }
}
