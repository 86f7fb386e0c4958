package com.agentdeck.session;

/**
 * The agent subprocess could not be started.
 */
public class ProcessStartException extends AgentSessionException {

    public ProcessStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
