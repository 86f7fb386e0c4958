package com.agentdeck.core.protocol;

import java.util.List;
import java.util.Map;

/**
 * A {@code control_request} sent by the agent, typically asking whether it may
 * run a tool ({@code can_use_tool}).
 */
public record ControlRequest(
    String requestId,
    String subtype,
    String toolName,
    Map<String, Object> input,
    String toolUseId,
    List<Object> permissionSuggestions
) {

    public static final String CAN_USE_TOOL = "can_use_tool";

    public ControlRequest {
        input = input == null ? Map.of() : input;
        permissionSuggestions = permissionSuggestions == null ? List.of() : permissionSuggestions;
    }

    public boolean isToolPermission() {
        return CAN_USE_TOOL.equals(subtype);
    }
}
