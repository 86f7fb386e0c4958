package com.agentdeck.core.permission;

/**
 * What to do when no rule decides: ask a human, or answer automatically for unattended runs.
 */
public enum AskBehavior {
    ASK,
    DENY,
    ALLOW
}
