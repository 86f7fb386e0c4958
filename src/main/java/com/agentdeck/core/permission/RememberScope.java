package com.agentdeck.core.permission;

/**
 * How long a human approval should be reused.
 */
public enum RememberScope {
    /** This invocation only. */
    ONCE,
    /** For the rest of the session. */
    SESSION,
    /** Durably: project allow-list, or the session cache for write-class tools. */
    ALWAYS
}
