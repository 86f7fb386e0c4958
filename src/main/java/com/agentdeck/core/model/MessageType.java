package com.agentdeck.core.model;

/**
 * What a {@link ConversationMessage} represents beyond its role.
 */
public enum MessageType {
    NORMAL,
    COMPACT_BOUNDARY,
    COMPACT_SUMMARY,
    STATUS,
    META,
    COMPLETION,
    ERROR,
    UNKNOWN,
    USER_MESSAGE
}
