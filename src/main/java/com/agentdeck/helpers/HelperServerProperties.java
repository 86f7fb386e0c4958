package com.agentdeck.helpers;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Long-lived helper processes (MCP servers) started alongside the agents.
 *
 * <pre>
 * agentdeck:
 *   helpers:
 *     enabled: true
 *     servers:
 *       agentdeck-agent:
 *         command: agentdeck-agent-server
 *         args: [--port, "8765"]
 *         url: http://localhost:8765/mcp
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "agentdeck.helpers")
public class HelperServerProperties {

    private boolean enabled = false;
    private Map<String, ServerConfig> servers = new HashMap<>();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Map<String, ServerConfig> getServers() { return servers; }
    public void setServers(Map<String, ServerConfig> servers) { this.servers = servers; }

    public static class ServerConfig {
        private String command = "";
        private List<String> args = new ArrayList<>();
        private String url = "";
        private Map<String, String> environment = new HashMap<>();

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public List<String> getArgs() { return args; }
        public void setArgs(List<String> args) { this.args = args; }
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public Map<String, String> getEnvironment() { return environment; }
        public void setEnvironment(Map<String, String> environment) { this.environment = environment; }

        /** Returns {@code true} when the agent can reach this server by URL. */
        public boolean hasUrl() {
            return url != null && !url.isBlank();
        }
    }
}
