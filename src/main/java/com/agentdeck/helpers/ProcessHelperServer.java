package com.agentdeck.helpers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A helper server run as a local child process.
 */
public class ProcessHelperServer implements HelperServer {

    private static final Logger log = LoggerFactory.getLogger(ProcessHelperServer.class);

    private final String name;
    private final HelperServerProperties.ServerConfig config;
    private final AtomicInteger starts = new AtomicInteger();
    private final AtomicInteger stops = new AtomicInteger();
    private Process process;

    public ProcessHelperServer(String name, HelperServerProperties.ServerConfig config) {
        this.name = name;
        this.config = config;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized boolean isRunning() {
        return process != null && process.isAlive();
    }

    @Override
    public synchronized boolean start() {
        if (isRunning()) {
            return false;
        }
        List<String> command = new ArrayList<>();
        command.add(config.getCommand());
        command.addAll(config.getArgs());
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD);
        builder.environment().putAll(config.getEnvironment());
        try {
            process = builder.start();
            starts.incrementAndGet();
            log.info("Helper server '{}' started (pid {})", name, process.pid());
            return true;
        } catch (IOException e) {
            log.warn("Helper server '{}' failed to start: {}", name, e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized boolean stop() {
        if (!isRunning()) {
            return false;
        }
        process.destroy();
        try {
            if (!process.waitFor(2, TimeUnit.SECONDS)) {
                log.warn("Helper server '{}' did not exit, killing it", name);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        process = null;
        stops.incrementAndGet();
        log.info("Helper server '{}' stopped", name);
        return true;
    }

    @Override
    public int startCount() {
        return starts.get();
    }

    @Override
    public int stopCount() {
        return stops.get();
    }

    @Override
    public Optional<String> url() {
        return config.hasUrl() ? Optional.of(config.getUrl()) : Optional.empty();
    }
}
