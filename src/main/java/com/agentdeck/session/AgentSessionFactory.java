package com.agentdeck.session;

import com.agentdeck.core.events.AgentRef;
import com.agentdeck.core.events.EventBus;
import com.agentdeck.core.metrics.AgentDeckMetrics;
import com.agentdeck.core.protocol.ProtocolDecoder;
import com.agentdeck.helpers.HelperServerManager;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Creates {@link AgentSession}s wired to the shared decoder, permission gate and event bus.
 */
@Component
public class AgentSessionFactory {

    private final SessionProperties properties;
    private final AgentProcessLauncher launcher;
    private final ProtocolDecoder decoder;
    private final ToolPermissionGate permissionGate;
    private final EventBus eventBus;
    private final AgentDeckMetrics metrics;
    private final TranscriptLoader transcriptLoader;
    private final Supplier<Map<String, Object>> mcpConfig;

    @Autowired
    public AgentSessionFactory(SessionProperties properties, AgentProcessLauncher launcher, ProtocolDecoder decoder,
                               ToolPermissionGate permissionGate, EventBus eventBus, AgentDeckMetrics metrics,
                               TranscriptLoader transcriptLoader, HelperServerManager helperServers) {
        this(properties, launcher, decoder, permissionGate, eventBus, metrics, transcriptLoader,
                helperServers::mcpConfig);
    }

    public AgentSessionFactory(SessionProperties properties, AgentProcessLauncher launcher, ProtocolDecoder decoder,
                               ToolPermissionGate permissionGate, EventBus eventBus, AgentDeckMetrics metrics,
                               TranscriptLoader transcriptLoader, Supplier<Map<String, Object>> mcpConfig) {
        this.properties = properties;
        this.launcher = launcher;
        this.decoder = decoder;
        this.permissionGate = permissionGate;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.transcriptLoader = transcriptLoader;
        this.mcpConfig = mcpConfig;
    }

    public AgentSession create(AgentRef agent, Path workingDirectory) {
        return create(agent, workingDirectory, UUID.randomUUID().toString());
    }

    public AgentSession create(AgentRef agent, Path workingDirectory, String sessionId) {
        return new AgentSession(agent, sessionId, workingDirectory.toAbsolutePath().normalize(), properties,
                launcher, decoder, permissionGate, eventBus, metrics, transcriptLoader, mcpConfig);
    }
}
