package com.agentdeck.core.protocol;

/**
 * Discriminant for {@link ResponseFragment} variants.
 */
public enum FragmentKind {
    TEXT,
    TOOL_USE,
    TOOL_RESULT,
    COMPACT_BOUNDARY,
    COMPACT_SUMMARY,
    COMPLETION,
    ERROR,
    STATUS,
    META,
    USER_MESSAGE,
    UNKNOWN
}
