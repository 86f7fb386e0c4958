package com.agentdeck.session;

import java.util.Map;

/**
 * A tool call the policy could not decide on its own, handed to a human.
 *
 * @param suggestedPattern the pattern stored if the human chooses to remember the approval
 */
public record PermissionRequest(
    String networkId,
    String agentId,
    String requestId,
    String toolUseId,
    String toolName,
    Map<String, Object> input,
    String reason,
    String suggestedPattern
) {

    public PermissionRequest {
        input = input == null ? Map.of() : input;
    }
}
