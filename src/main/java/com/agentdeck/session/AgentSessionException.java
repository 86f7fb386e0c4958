package com.agentdeck.session;

/**
 * Base class for failures while running an agent session.
 */
public class AgentSessionException extends RuntimeException {

    public AgentSessionException(String message) {
        super(message);
    }

    public AgentSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
