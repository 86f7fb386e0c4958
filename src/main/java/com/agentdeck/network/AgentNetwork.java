package com.agentdeck.network;

import com.agentdeck.core.events.EventBus;
import com.agentdeck.session.AgentSession;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A main agent and the sub-agents it spawned, sharing one working directory
 * and one event stream.
 */
public class AgentNetwork {

    private final String id;
    private final Path workingDirectory;
    private final String mainAgentId;
    private final Instant createdAt = Instant.now();
    private final Map<String, AgentSession> agents = new ConcurrentHashMap<>();
    private final List<String> order = new CopyOnWriteArrayList<>();
    private final Set<String> handledSpawnCalls = ConcurrentHashMap.newKeySet();
    private volatile EventBus.Subscription spawnWatch;

    AgentNetwork(String id, Path workingDirectory, AgentSession mainAgent) {
        this.id = id;
        this.workingDirectory = workingDirectory;
        this.mainAgentId = mainAgent.agent().agentId();
        add(mainAgent);
    }

    public String id() {
        return id;
    }

    public Path workingDirectory() {
        return workingDirectory;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public AgentSession mainAgent() {
        return agents.get(mainAgentId);
    }

    public Optional<AgentSession> agent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    /** Agents in the order they were spawned. */
    public List<AgentSession> agents() {
        List<AgentSession> result = new ArrayList<>();
        for (String agentId : order) {
            AgentSession session = agents.get(agentId);
            if (session != null) {
                result.add(session);
            }
        }
        return result;
    }

    boolean isMainAgent(String agentId) {
        return mainAgentId.equals(agentId);
    }

    void add(AgentSession session) {
        agents.put(session.agent().agentId(), session);
        order.add(session.agent().agentId());
    }

    AgentSession remove(String agentId) {
        order.remove(agentId);
        return agents.remove(agentId);
    }

    /** Returns true the first time a spawn tool call id is seen. */
    boolean markSpawnHandled(String toolUseId) {
        return handledSpawnCalls.add(toolUseId);
    }

    void watchSpawns(EventBus.Subscription subscription) {
        this.spawnWatch = subscription;
    }

    void stopWatchingSpawns() {
        EventBus.Subscription current = spawnWatch;
        if (current != null) {
            current.unsubscribe();
        }
    }
}
