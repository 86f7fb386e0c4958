package com.agentdeck.session;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Launcher that hands out {@link FakeAgentProcess}es and records what it was asked to run.
 */
public class FakeLauncher implements AgentProcessLauncher {

    private final List<AgentProcessRequest> requests = new CopyOnWriteArrayList<>();
    private final List<FakeAgentProcess> processes = new CopyOnWriteArrayList<>();
    private final Map<String, FakeAgentProcess> byAgent = new ConcurrentHashMap<>();
    private final AtomicInteger nextPid = new AtomicInteger(1000);
    private volatile boolean failing;

    public void failNextLaunches(boolean failing) {
        this.failing = failing;
    }

    public List<AgentProcessRequest> requests() {
        return requests;
    }

    public FakeAgentProcess last() {
        return processes.get(processes.size() - 1);
    }

    /** The most recent process started for an agent. */
    public FakeAgentProcess processFor(String agentId) {
        FakeAgentProcess process = byAgent.get(agentId);
        if (process == null) {
            throw new IllegalStateException("No process for " + agentId);
        }
        return process;
    }

    public int launchCount() {
        return processes.size();
    }

    @Override
    public AgentProcess launch(AgentProcessRequest request) {
        requests.add(request);
        if (failing) {
            throw new ProcessStartException("Cannot run program \"" + request.command().get(0) + "\"", null);
        }
        FakeAgentProcess process = new FakeAgentProcess(nextPid.incrementAndGet());
        processes.add(process);
        byAgent.put(request.agentId(), process);
        return process;
    }
}
