package com.agentdeck.session;

import com.agentdeck.core.permission.RememberScope;

import java.util.Map;

/**
 * A human's answer to a {@link PermissionRequest}.
 *
 * @param pattern      pattern to remember instead of the suggested one, or null
 * @param updatedInput replacement tool input, or null to run the tool as requested
 */
public record PermissionResponse(
    boolean allow,
    RememberScope remember,
    String pattern,
    String message,
    Map<String, Object> updatedInput
) {

    public PermissionResponse {
        remember = remember == null ? RememberScope.ONCE : remember;
    }

    public static PermissionResponse allowOnce() {
        return new PermissionResponse(true, RememberScope.ONCE, null, null, null);
    }

    public static PermissionResponse allow(RememberScope remember) {
        return new PermissionResponse(true, remember, null, null, null);
    }

    public static PermissionResponse deny(String message) {
        return new PermissionResponse(false, RememberScope.ONCE, null, message, null);
    }
}
