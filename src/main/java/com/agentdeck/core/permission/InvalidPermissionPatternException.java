package com.agentdeck.core.permission;

/**
 * Thrown when pattern text cannot be parsed into a {@link PermissionPattern}.
 */
public class InvalidPermissionPatternException extends RuntimeException {

    public InvalidPermissionPatternException(String message) {
        super(message);
    }

    public InvalidPermissionPatternException(String message, Throwable cause) {
        super(message, cause);
    }
}
