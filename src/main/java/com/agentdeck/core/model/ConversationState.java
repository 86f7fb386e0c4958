package com.agentdeck.core.model;

/**
 * Lifecycle state of a session's conversation.
 * Idle, then SendingMessage, then Processing and ReceivingResponse until the turn ends.
 */
public enum ConversationState {
    IDLE,
    SENDING_MESSAGE,
    PROCESSING,
    RECEIVING_RESPONSE,
    ERROR;

    public boolean isTurnInFlight() {
        return this == SENDING_MESSAGE || this == PROCESSING || this == RECEIVING_RESPONSE;
    }
}
