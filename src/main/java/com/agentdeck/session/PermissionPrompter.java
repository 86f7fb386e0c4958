package com.agentdeck.session;

import java.util.concurrent.CompletableFuture;

/**
 * Asks a human whether a tool call may run.
 */
@FunctionalInterface
public interface PermissionPrompter {

    CompletableFuture<PermissionResponse> prompt(PermissionRequest request);
}
