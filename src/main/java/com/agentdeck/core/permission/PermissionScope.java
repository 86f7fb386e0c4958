package com.agentdeck.core.permission;

import java.nio.file.Path;

/**
 * Where a permission check happens: the project whose durable lists apply, the
 * session's working directory, and the session's own cache.
 */
public record PermissionScope(Path projectRoot, Path workingDirectory, SessionPermissionCache sessionCache) {

    public static PermissionScope of(Path workingDirectory, SessionPermissionCache cache) {
        return new PermissionScope(workingDirectory, workingDirectory, cache);
    }
}
