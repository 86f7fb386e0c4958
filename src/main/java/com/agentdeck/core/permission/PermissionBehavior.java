package com.agentdeck.core.permission;

public enum PermissionBehavior {
    ALLOW,
    DENY,
    ASK
}
