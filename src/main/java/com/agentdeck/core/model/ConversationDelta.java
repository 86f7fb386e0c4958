package com.agentdeck.core.model;

/**
 * Outcome of applying one fragment or one protocol line to a conversation.
 *
 * @param conversation  the snapshot after the change
 * @param messageIndex  index of the affected message, or -1 if none changed
 * @param change        whether a message was appended or updated in place
 * @param turnCompleted true if this change ended the current turn
 */
public record ConversationDelta(
    Conversation conversation,
    int messageIndex,
    Change change,
    boolean turnCompleted
) {

    public enum Change { APPENDED, UPDATED, NONE }

    public static ConversationDelta unchanged(Conversation conversation) {
        return new ConversationDelta(conversation, -1, Change.NONE, false);
    }

    public boolean hasChange() {
        return change != Change.NONE;
    }

    public ConversationMessage message() {
        return messageIndex < 0 ? null : conversation.messages().get(messageIndex);
    }
}
