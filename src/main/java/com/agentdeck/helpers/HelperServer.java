package com.agentdeck.helpers;

import java.util.Optional;

/**
 * A helper process that lives as long as the application.
 * Start and stop are idempotent; the counters only move on real transitions.
 */
public interface HelperServer {

    String name();

    boolean isRunning();

    /**
     * @return true if the server was started, false if it was already running
     */
    boolean start();

    /**
     * @return true if the server was stopped, false if it was not running
     */
    boolean stop();

    int startCount();

    int stopCount();

    /** The URL agents connect to, if the server exposes one. */
    default Optional<String> url() {
        return Optional.empty();
    }
}
