package com.agentdeck.core.permission;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Patterns approved for the lifetime of one session. Never persisted.
 */
public class SessionPermissionCache {

    private final CopyOnWriteArrayList<PermissionPattern> patterns = new CopyOnWriteArrayList<>();

    public boolean add(PermissionPattern pattern) {
        return patterns.addIfAbsent(pattern);
    }

    public List<PermissionPattern> patterns() {
        return List.copyOf(patterns);
    }

    public void clear() {
        patterns.clear();
    }
}
