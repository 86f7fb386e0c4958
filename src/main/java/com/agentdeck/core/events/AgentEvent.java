package com.agentdeck.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while supervising agents, consumed by UIs, loggers and remote viewers.
 *
 * @param seq       sequence number, monotonic within a network; used to resume after reconnecting
 * @param eventId   unique id of this event
 * @param type      the event type
 * @param networkId the network the agent belongs to
 * @param agentId   the agent, or null for network-level events
 * @param agentType the agent's role, e.g. "main" or "implementation"
 * @param agentName display name of the agent
 * @param payload   event-specific data
 * @param timestamp when the event occurred
 */
public record AgentEvent(
    long seq,
    String eventId,
    AgentEventType type,
    String networkId,
    String agentId,
    String agentType,
    String agentName,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public AgentEvent {
        payload = payload == null ? Map.of() : payload;
    }
}
