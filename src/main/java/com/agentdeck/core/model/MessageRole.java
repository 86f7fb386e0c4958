package com.agentdeck.core.model;

public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM
}
