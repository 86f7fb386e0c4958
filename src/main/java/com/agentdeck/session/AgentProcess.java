package com.agentdeck.session;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;

/**
 * A running agent subprocess, owned by exactly one session.
 */
public interface AgentProcess {

    /** Newline-delimited JSON output. */
    InputStream stdout();

    InputStream stderr();

    /**
     * Writes one line to the process's stdin and flushes it.
     */
    void writeLine(String line) throws IOException;

    boolean isAlive();

    /** Asks the process to exit (SIGTERM). */
    void terminate();

    /** Kills the process (SIGKILL). */
    void forceTerminate();

    /**
     * @return true if the process exited within the timeout
     */
    boolean waitFor(Duration timeout) throws InterruptedException;

    /** Exit code, or -1 while still running. */
    int exitCode();

    long pid();
}
