package com.agentdeck.session;

import com.agentdeck.core.events.AgentEvent;
import com.agentdeck.core.events.AgentEventType;
import com.agentdeck.core.events.AgentRef;
import com.agentdeck.core.events.EventBus;
import com.agentdeck.core.metrics.AgentDeckMetrics;
import com.agentdeck.core.permission.DecisionSource;
import com.agentdeck.core.permission.PermissionDecision;
import com.agentdeck.core.permission.PermissionPolicyEngine;
import com.agentdeck.core.permission.PermissionScope;
import com.agentdeck.core.permission.RememberScope;
import com.agentdeck.core.permission.SessionPermissionCache;
import com.agentdeck.core.protocol.ControlRequest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ToolPermissionGateTest {

    private static final AgentRef AGENT = new AgentRef("N-1", "A-1", "main", "Main");
    private static final Map<String, Object> INPUT = Map.of("command", "rm -rf build");
    private static final ControlRequest REQUEST =
            new ControlRequest("req-1", ControlRequest.CAN_USE_TOOL, "Bash", INPUT, "toolu_1", null);

    private PermissionPolicyEngine engine;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private PermissionScope scope;
    private List<AgentEvent> events;

    @BeforeEach
    void setUp() {
        engine = mock(PermissionPolicyEngine.class);
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribe("N-1", events::add);
        registry = new SimpleMeterRegistry();
        scope = PermissionScope.of(Path.of("/work"), new SessionPermissionCache());
    }

    private ToolPermissionGate gate(Duration timeout, PermissionPrompter prompter) {
        return new ToolPermissionGate(engine, eventBus, new AgentDeckMetrics(registry), timeout, prompter);
    }

    private void engineAsks() {
        when(engine.checkPermission(scope, "Bash", INPUT))
                .thenReturn(PermissionDecision.ask("No rule allows Bash", "Bash(rm:*)"));
    }

    @Nested
    @DisplayName("policy decisions")
    class PolicyDecisions {

        @Test
        @DisplayName("allowed calls pass without asking")
        void allowed() {
            when(engine.checkPermission(scope, "Bash", INPUT))
                    .thenReturn(PermissionDecision.allow("Matched", DecisionSource.ALLOW_LIST, null));
            PermissionPrompter prompter = mock(PermissionPrompter.class);

            PermissionOutcome outcome = gate(Duration.ofSeconds(1), prompter).decide(scope, AGENT, REQUEST);

            assertTrue(outcome.allowed());
            assertEquals(INPUT, outcome.updatedInput());
            verifyNoInteractions(prompter);
        }

        @Test
        @DisplayName("denied calls carry the policy's reason")
        void denied() {
            when(engine.checkPermission(scope, "Bash", INPUT))
                    .thenReturn(PermissionDecision.deny("Denied by Bash(rm:*)", DecisionSource.DENY_LIST, null));

            PermissionOutcome outcome = gate(Duration.ofSeconds(1), null).decide(scope, AGENT, REQUEST);

            assertFalse(outcome.allowed());
            assertEquals("Denied by Bash(rm:*)", outcome.message());
        }

        @Test
        @DisplayName("ask without a prompter is denied")
        void noPrompter() {
            engineAsks();

            PermissionOutcome outcome = gate(Duration.ofSeconds(1), null).decide(scope, AGENT, REQUEST);

            assertFalse(outcome.allowed());
            assertEquals("No one is available to approve Bash", outcome.message());
        }
    }

    @Nested
    @DisplayName("asking the human")
    class AskingTheHuman {

        @Test
        @DisplayName("request is published and the prompter sees the suggested pattern")
        void publishesRequest() throws Exception {
            engineAsks();
            AtomicReference<PermissionRequest> seen = new AtomicReference<>();
            PermissionPrompter prompter = request -> {
                seen.set(request);
                return CompletableFuture.completedFuture(PermissionResponse.allowOnce());
            };

            PermissionOutcome outcome = gate(Duration.ofSeconds(1), prompter).decide(scope, AGENT, REQUEST);

            assertTrue(outcome.allowed());
            assertEquals("Bash(rm:*)", seen.get().suggestedPattern());
            assertEquals("toolu_1", seen.get().toolUseId());
            Thread.sleep(100);
            AgentEvent event = events.stream()
                    .filter(e -> e.type() == AgentEventType.PERMISSION_REQUEST).findFirst().orElseThrow();
            assertEquals("req-1", event.payload().get("requestId"));
            assertEquals("Bash(rm:*)", event.payload().get("suggestedPattern"));
        }

        @Test
        @DisplayName("remembered approval stores the suggested pattern")
        void remembersSuggested() {
            engineAsks();
            PermissionPrompter prompter = request ->
                    CompletableFuture.completedFuture(PermissionResponse.allow(RememberScope.ALWAYS));

            gate(Duration.ofSeconds(1), prompter).decide(scope, AGENT, REQUEST);

            verify(engine).remember(scope, RememberScope.ALWAYS, "Bash", INPUT, "Bash(rm:*)");
        }

        @Test
        @DisplayName("human may choose their own pattern and edit the input")
        void customPatternAndInput() {
            engineAsks();
            Map<String, Object> edited = Map.of("command", "rm -rf build/tmp");
            PermissionPrompter prompter = request -> CompletableFuture.completedFuture(
                    new PermissionResponse(true, RememberScope.SESSION, "Bash(rm -rf build:*)", null, edited));

            PermissionOutcome outcome = gate(Duration.ofSeconds(1), prompter).decide(scope, AGENT, REQUEST);

            assertEquals(edited, outcome.updatedInput());
            verify(engine).remember(scope, RememberScope.SESSION, "Bash", INPUT, "Bash(rm -rf build:*)");
        }

        @Test
        @DisplayName("human denial is passed on")
        void humanDenies() {
            engineAsks();
            PermissionPrompter prompter = request ->
                    CompletableFuture.completedFuture(PermissionResponse.deny(null));

            PermissionOutcome outcome = gate(Duration.ofSeconds(1), prompter).decide(scope, AGENT, REQUEST);

            assertFalse(outcome.allowed());
            assertEquals("Denied by user", outcome.message());
            verify(engine, never()).remember(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("unanswered request times out as a denial")
        void timeout() throws Exception {
            engineAsks();
            CompletableFuture<PermissionResponse> unanswered = new CompletableFuture<>();

            PermissionOutcome outcome = gate(Duration.ofMillis(50), request -> unanswered).decide(scope, AGENT, REQUEST);

            assertFalse(outcome.allowed());
            assertEquals("Permission request timed out", outcome.message());
            assertFalse(unanswered.isDone());
            Thread.sleep(100);
            assertTrue(events.stream().anyMatch(e -> e.type() == AgentEventType.PERMISSION_TIMEOUT));
            assertEquals(1, registry.find("agentdeck.permission.wait").tag("timed_out", "true").timer().count());
        }

        @Test
        @DisplayName("request without an id still times out as a denial")
        void timeoutWithoutRequestId() throws Exception {
            engineAsks();
            ControlRequest anonymous = new ControlRequest(null, ControlRequest.CAN_USE_TOOL, "Bash", INPUT, "toolu_2", null);

            PermissionOutcome outcome = gate(Duration.ofMillis(50), request -> new CompletableFuture<>())
                    .decide(scope, AGENT, anonymous);

            assertFalse(outcome.allowed());
            assertEquals("Permission request timed out", outcome.message());
            Thread.sleep(100);
            AgentEvent timedOut = events.stream()
                    .filter(e -> e.type() == AgentEventType.PERMISSION_TIMEOUT)
                    .findFirst().orElseThrow();
            assertNull(timedOut.payload().get("requestId"));
            assertEquals("Bash", timedOut.payload().get("toolName"));
        }

        @Test
        @DisplayName("failing prompter is a denial")
        void failingPrompter() {
            engineAsks();
            PermissionPrompter prompter = request ->
                    CompletableFuture.failedFuture(new IllegalStateException("console closed"));

            PermissionOutcome outcome = gate(Duration.ofSeconds(1), prompter).decide(scope, AGENT, REQUEST);

            assertFalse(outcome.allowed());
            assertEquals("Permission prompt failed", outcome.message());
        }

        @Test
        @DisplayName("prompter can be replaced at runtime")
        void setPrompter() {
            engineAsks();
            ToolPermissionGate gate = gate(Duration.ofSeconds(1), null);
            gate.setPrompter(request -> CompletableFuture.completedFuture(PermissionResponse.allowOnce()));

            assertTrue(gate.decide(scope, AGENT, REQUEST).allowed());
        }
    }
}
