package com.agentdeck.session;

/**
 * A persisted transcript exists but could not be read.
 */
public class TranscriptLoadException extends AgentSessionException {

    public TranscriptLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
