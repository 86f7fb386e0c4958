package com.agentdeck.core.permission;

/**
 * Which rule produced a {@link PermissionDecision}.
 */
public enum DecisionSource {
    HARD_DENY,
    GITIGNORE,
    INTERNAL_TOOL,
    DENY_LIST,
    READ_ONLY_TOOL,
    SAFE_COMMAND,
    SESSION_CACHE,
    ALLOW_LIST,
    ASK_FALLBACK,
    USER
}
