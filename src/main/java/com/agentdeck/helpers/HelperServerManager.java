package com.agentdeck.helpers;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Starts the configured helper servers at startup and stops them at shutdown.
 * Servers that are already running are skipped.
 */
@Service
public class HelperServerManager {

    private static final Logger log = LoggerFactory.getLogger(HelperServerManager.class);

    private final boolean enabled;
    private final List<HelperServer> servers;

    @Autowired
    public HelperServerManager(HelperServerProperties props) {
        this(props.isEnabled(), createServers(props));
    }

    public HelperServerManager(boolean enabled, List<HelperServer> servers) {
        this.enabled = enabled;
        this.servers = List.copyOf(servers);
    }

    @PostConstruct
    public void startAll() {
        if (!enabled || servers.isEmpty()) {
            log.info("Helper servers disabled or not configured");
            return;
        }
        for (HelperServer server : servers) {
            if (server.isRunning()) {
                log.debug("Helper server '{}' already running", server.name());
                continue;
            }
            server.start();
        }
    }

    @PreDestroy
    public void stopAll() {
        for (HelperServer server : servers) {
            try {
                server.stop();
            } catch (Exception e) {
                log.warn("Error stopping helper server '{}': {}", server.name(), e.getMessage());
            }
        }
    }

    public List<HelperServer> getServers() {
        return servers;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * The {@code mcpServers} section handed to agents, listing every running server with a URL.
     */
    public Map<String, Object> mcpConfig() {
        Map<String, Object> entries = new LinkedHashMap<>();
        for (HelperServer server : servers) {
            if (server.isRunning()) {
                server.url().ifPresent(url -> entries.put(server.name(), Map.of("type", "http", "url", url)));
            }
        }
        return entries.isEmpty() ? Map.of() : Map.of("mcpServers", entries);
    }

    private static List<HelperServer> createServers(HelperServerProperties props) {
        List<HelperServer> created = new ArrayList<>();
        props.getServers().forEach((name, config) -> {
            if (config.getCommand() != null && !config.getCommand().isBlank()) {
                created.add(new ProcessHelperServer(name, config));
            }
        });
        return created;
    }
}
