package com.agentdeck.network;

import com.agentdeck.core.events.AgentEvent;
import com.agentdeck.core.events.AgentEventType;
import com.agentdeck.core.events.AgentRef;
import com.agentdeck.core.events.EventBus;
import com.agentdeck.core.logging.MdcContext;
import com.agentdeck.core.model.Attachment;
import com.agentdeck.session.AgentSession;
import com.agentdeck.session.AgentSessionFactory;
import com.agentdeck.session.SessionProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every agent network: creates them with a main agent, spawns sub-agents on
 * request or when an agent calls the spawn tool, routes messages, and tears agents down.
 */
@Service
public class AgentNetworkManager {

    private static final Logger log = LoggerFactory.getLogger(AgentNetworkManager.class);

    static final String MAIN_AGENT_TYPE = "main";

    private final AgentSessionFactory sessionFactory;
    private final EventBus eventBus;
    private final String spawnToolName;
    private final ConcurrentHashMap<String, AgentNetwork> networks = new ConcurrentHashMap<>();

    public AgentNetworkManager(AgentSessionFactory sessionFactory, EventBus eventBus, SessionProperties properties) {
        this.sessionFactory = sessionFactory;
        this.eventBus = eventBus;
        this.spawnToolName = properties.getSpawnToolName();
    }

    /**
     * Creates a network with a main agent working in {@code workingDirectory}.
     * A non-blank {@code initialPrompt} is sent to the main agent straight away.
     */
    public AgentNetwork createNetwork(Path workingDirectory, String initialPrompt) {
        String networkId = UUID.randomUUID().toString();
        MdcContext.setNetwork(networkId);
        try {
            AgentRef mainRef = new AgentRef(networkId, UUID.randomUUID().toString(), MAIN_AGENT_TYPE, "Main");
            AgentSession main = sessionFactory.create(mainRef, workingDirectory);
            AgentNetwork network = new AgentNetwork(networkId, main.workingDirectory(), main);
            networks.put(networkId, network);
            network.watchSpawns(eventBus.subscribe(networkId, event -> onEvent(network, event)));
            log.info("Created network {} in {}", networkId, network.workingDirectory());
            publishSpawned(mainRef, null);
            if (initialPrompt != null && !initialPrompt.isBlank()) {
                main.sendMessage(initialPrompt, List.of());
            }
            return network;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Adds a sub-agent to a network, sharing its working directory.
     *
     * @param parentAgentId the agent that asked for it, or null
     * @throws IllegalArgumentException if the network does not exist
     */
    public AgentSession spawnAgent(String networkId, String agentType, String name, String initialPrompt,
                                   String parentAgentId) {
        AgentNetwork network = require(networkId);
        String type = agentType == null || agentType.isBlank() ? "general" : agentType;
        String agentName = name == null || name.isBlank() ? type : name;
        AgentRef ref = new AgentRef(networkId, UUID.randomUUID().toString(), type, agentName);
        AgentSession session = sessionFactory.create(ref, network.workingDirectory());
        network.add(session);
        log.info("Spawned {} agent '{}' ({}) in network {}", type, agentName, ref.agentId(), networkId);
        publishSpawned(ref, parentAgentId);
        if (initialPrompt != null && !initialPrompt.isBlank()) {
            session.sendMessage(initialPrompt, List.of());
        }
        return session;
    }

    /**
     * @throws IllegalArgumentException if the network or agent does not exist
     */
    public boolean sendMessage(String networkId, String agentId, String text, List<Attachment> attachments) {
        return requireAgent(networkId, agentId).sendMessage(text, attachments);
    }

    public boolean abort(String networkId, String agentId) {
        return requireAgent(networkId, agentId).abort();
    }

    /** Stops the agent's current turn and keeps its process running. */
    public boolean interrupt(String networkId, String agentId) {
        return requireAgent(networkId, agentId).interrupt();
    }

    /**
     * Stops a sub-agent and removes it from its network. The main agent lives as
     * long as the network; delete the network instead.
     */
    public void terminateAgent(String networkId, String agentId) {
        AgentNetwork network = require(networkId);
        if (network.isMainAgent(agentId)) {
            throw new IllegalArgumentException("The main agent cannot be terminated; delete the network instead");
        }
        AgentSession session = network.remove(agentId);
        if (session == null) {
            throw new IllegalArgumentException("Unknown agent " + agentId + " in network " + networkId);
        }
        session.close();
        eventBus.publish(AgentEventType.AGENT_TERMINATED, session.agent(), Map.of("reason", "terminated"));
    }

    /**
     * Stops every agent of a network and forgets it.
     *
     * @return false if the network did not exist
     */
    public boolean deleteNetwork(String networkId) {
        AgentNetwork network = networks.remove(networkId);
        if (network == null) {
            return false;
        }
        network.stopWatchingSpawns();
        for (AgentSession session : network.agents()) {
            try {
                session.close();
            } catch (Exception e) {
                log.warn("Error closing agent {}: {}", session.agent().agentId(), e.getMessage());
            }
            eventBus.publish(AgentEventType.AGENT_TERMINATED, session.agent(), Map.of("reason", "network deleted"));
        }
        eventBus.closeNetwork(networkId);
        log.info("Deleted network {}", networkId);
        return true;
    }

    public Optional<AgentNetwork> network(String networkId) {
        return Optional.ofNullable(networks.get(networkId));
    }

    public Collection<AgentNetwork> networks() {
        return List.copyOf(networks.values());
    }

    @PreDestroy
    public void shutdown() {
        for (String networkId : new ArrayList<>(networks.keySet())) {
            deleteNetwork(networkId);
        }
    }

    private void onEvent(AgentNetwork network, AgentEvent event) {
        if (event.type() != AgentEventType.TOOL_USE || event.payload() == null) {
            return;
        }
        if (!spawnToolName.equals(event.payload().get("toolName"))) {
            return;
        }
        String toolUseId = String.valueOf(event.payload().get("toolUseId"));
        if (!network.markSpawnHandled(toolUseId) || !networks.containsKey(network.id())) {
            return;
        }
        Map<?, ?> input = event.payload().get("input") instanceof Map<?, ?> m ? m : Map.of();
        spawnAgent(network.id(), stringValue(input, "agentType"), stringValue(input, "name"),
                stringValue(input, "initialPrompt"), event.agentId());
    }

    private void publishSpawned(AgentRef ref, String parentAgentId) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("agentType", ref.agentType());
        payload.put("agentName", ref.agentName());
        if (parentAgentId != null) {
            payload.put("spawnedBy", parentAgentId);
        }
        eventBus.publish(AgentEventType.AGENT_SPAWNED, ref, payload);
    }

    private AgentNetwork require(String networkId) {
        AgentNetwork network = networks.get(networkId);
        if (network == null) {
            throw new IllegalArgumentException("Unknown network " + networkId);
        }
        return network;
    }

    private AgentSession requireAgent(String networkId, String agentId) {
        return require(networkId).agent(agentId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown agent " + agentId + " in network " + networkId));
    }

    private static String stringValue(Map<?, ?> input, String key) {
        Object value = input.get(key);
        return value == null ? null : value.toString();
    }
}
