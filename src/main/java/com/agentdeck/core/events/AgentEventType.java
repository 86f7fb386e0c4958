package com.agentdeck.core.events;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event types published to observers of an agent network.
 */
public enum AgentEventType {
    CONNECTED("connected"),
    HISTORY("history"),
    MESSAGE("message"),
    STATUS("status"),
    TOOL_USE("tool-use"),
    TOOL_RESULT("tool-result"),
    PERMISSION_REQUEST("permission-request"),
    PERMISSION_TIMEOUT("permission-timeout"),
    AGENT_SPAWNED("agent-spawned"),
    AGENT_TERMINATED("agent-terminated"),
    DONE("done"),
    ABORTED("aborted"),
    ERROR("error"),
    UNKNOWN("unknown");

    private final String wireName;

    AgentEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
