package com.agentdeck.session;

/**
 * Starts agent subprocesses. The default implementation runs them locally.
 */
public interface AgentProcessLauncher {

    /**
     * @throws ProcessStartException if the process could not be started
     */
    AgentProcess launch(AgentProcessRequest request);
}
