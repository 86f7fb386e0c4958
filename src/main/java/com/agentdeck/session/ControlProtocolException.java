package com.agentdeck.session;

/**
 * A message could not be written to the agent's stdin.
 */
public class ControlProtocolException extends AgentSessionException {

    public ControlProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
