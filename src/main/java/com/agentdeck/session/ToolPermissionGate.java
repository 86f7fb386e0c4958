package com.agentdeck.session;

import com.agentdeck.core.events.AgentEventType;
import com.agentdeck.core.events.AgentRef;
import com.agentdeck.core.events.EventBus;
import com.agentdeck.core.metrics.AgentDeckMetrics;
import com.agentdeck.core.permission.PermissionDecision;
import com.agentdeck.core.permission.PermissionPolicyEngine;
import com.agentdeck.core.permission.PermissionScope;
import com.agentdeck.core.protocol.ControlRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Answers the agent's {@code can_use_tool} requests.
 * <p>
 * The policy engine decides first. Only an {@code ask} reaches the human prompter,
 * which is given {@code agentdeck.session.permission-timeout} to answer before the
 * call is denied. The caller blocks while waiting; the conversation state is left alone.
 */
@Service
public class ToolPermissionGate {

    private static final Logger log = LoggerFactory.getLogger(ToolPermissionGate.class);

    private final PermissionPolicyEngine engine;
    private final EventBus eventBus;
    private final AgentDeckMetrics metrics;
    private final Duration timeout;
    private volatile PermissionPrompter prompter;

    @Autowired
    public ToolPermissionGate(PermissionPolicyEngine engine, EventBus eventBus, AgentDeckMetrics metrics,
                              SessionProperties properties, ObjectProvider<PermissionPrompter> prompter) {
        this(engine, eventBus, metrics, properties.getPermissionTimeout(), prompter.getIfAvailable());
    }

    public ToolPermissionGate(PermissionPolicyEngine engine, EventBus eventBus, AgentDeckMetrics metrics,
                              Duration timeout, PermissionPrompter prompter) {
        this.engine = engine;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.timeout = timeout;
        this.prompter = prompter;
    }

    public void setPrompter(PermissionPrompter prompter) {
        this.prompter = prompter;
    }

    public PermissionOutcome decide(PermissionScope scope, AgentRef agent, ControlRequest request) {
        PermissionDecision decision = engine.checkPermission(scope, request.toolName(), request.input());
        if (decision.isAllowed()) {
            return PermissionOutcome.allow(request.input());
        }
        if (decision.isDenied()) {
            log.info("Denied {}: {}", request.toolName(), decision.reason());
            return PermissionOutcome.deny(decision.reason());
        }
        return askHuman(scope, agent, request, decision);
    }

    private PermissionOutcome askHuman(PermissionScope scope, AgentRef agent, ControlRequest request,
                                       PermissionDecision decision) {
        PermissionPrompter current = prompter;
        if (current == null) {
            log.warn("No permission prompter available; denying {}", request.toolName());
            return PermissionOutcome.deny("No one is available to approve " + request.toolName());
        }

        PermissionRequest prompt = new PermissionRequest(agent.networkId(), agent.agentId(), request.requestId(),
                request.toolUseId(), request.toolName(), request.input(), decision.reason(), decision.suggestedPattern());
        Map<String, Object> payload = new HashMap<>();
        payload.put("requestId", request.requestId());
        payload.put("toolName", request.toolName());
        payload.put("input", request.input());
        if (decision.suggestedPattern() != null) {
            payload.put("suggestedPattern", decision.suggestedPattern());
        }
        eventBus.publish(AgentEventType.PERMISSION_REQUEST, agent, payload);

        Instant started = Instant.now();
        PermissionResponse response;
        try {
            response = current.prompt(prompt)
                    .copy()
                    .completeOnTimeout(null, timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PermissionOutcome.deny("Interrupted while waiting for approval");
        } catch (ExecutionException e) {
            log.warn("Permission prompt for {} failed: {}", request.toolName(), e.getCause().getMessage());
            return PermissionOutcome.deny("Permission prompt failed");
        }
        Duration waited = Duration.between(started, Instant.now());

        if (response == null) {
            metrics.recordPermissionWait(waited, true);
            log.info("Permission request {} for {} timed out after {}", request.requestId(), request.toolName(), timeout);
            Map<String, Object> timedOut = new HashMap<>();
            timedOut.put("requestId", request.requestId());
            timedOut.put("toolName", request.toolName());
            eventBus.publish(AgentEventType.PERMISSION_TIMEOUT, agent, timedOut);
            return PermissionOutcome.deny("Permission request timed out");
        }
        metrics.recordPermissionWait(waited, false);
        if (!response.allow()) {
            String message = response.message() != null ? response.message() : "Denied by user";
            return PermissionOutcome.deny(message);
        }
        String pattern = response.pattern() != null ? response.pattern() : decision.suggestedPattern();
        engine.remember(scope, response.remember(), request.toolName(), request.input(), pattern);
        Map<String, Object> input = response.updatedInput() != null ? response.updatedInput() : request.input();
        return PermissionOutcome.allow(input);
    }
}
