package com.agentdeck.core.events;

/**
 * Identifies the agent an event is about.
 */
public record AgentRef(String networkId, String agentId, String agentType, String agentName) {

    public static AgentRef network(String networkId) {
        return new AgentRef(networkId, null, null, null);
    }
}
