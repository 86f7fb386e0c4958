package com.agentdeck.session;

import com.agentdeck.core.conversation.ConversationStateMachine;
import com.agentdeck.core.events.AgentEventType;
import com.agentdeck.core.events.AgentRef;
import com.agentdeck.core.events.EventBus;
import com.agentdeck.core.events.Mailbox;
import com.agentdeck.core.logging.MdcContext;
import com.agentdeck.core.metrics.AgentDeckMetrics;
import com.agentdeck.core.model.Attachment;
import com.agentdeck.core.model.Conversation;
import com.agentdeck.core.model.ConversationDelta;
import com.agentdeck.core.model.ConversationMessage;
import com.agentdeck.core.model.ConversationState;
import com.agentdeck.core.permission.PermissionScope;
import com.agentdeck.core.permission.SessionPermissionCache;
import com.agentdeck.core.protocol.ControlProtocol;
import com.agentdeck.core.protocol.ControlRequest;
import com.agentdeck.core.protocol.DecodedLine;
import com.agentdeck.core.protocol.ProtocolDecoder;
import com.agentdeck.core.protocol.ResponseFragment;
import com.agentdeck.core.protocol.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * One agent: its subprocess, its conversation, and its permission scope.
 * <p>
 * The subprocess is started on the first message. A reader thread decodes its
 * output line by line, in order, into the conversation and answers its permission
 * requests. A message sent while a turn is in flight waits in a single slot; a
 * later one replaces it. Every change is broadcast as a snapshot to subscribers,
 * each on its own mailbox, and published to the network's {@link EventBus}.
 */
public class AgentSession {

    private static final Logger log = LoggerFactory.getLogger(AgentSession.class);

    private final AgentRef agent;
    private final String sessionId;
    private final Path workingDirectory;
    private final SessionPermissionCache permissionCache = new SessionPermissionCache();
    private final PermissionScope permissionScope;

    private final SessionProperties properties;
    private final AgentProcessLauncher launcher;
    private final ProtocolDecoder decoder;
    private final ControlProtocol controlProtocol;
    private final ToolPermissionGate permissionGate;
    private final EventBus eventBus;
    private final AgentDeckMetrics metrics;
    private final TranscriptLoader transcriptLoader;
    private final Supplier<Map<String, Object>> mcpConfig;

    private final ConversationStateMachine machine;
    private final AtomicReference<PendingMessage> pending = new AtomicReference<>();
    private final CopyOnWriteArrayList<Mailbox<Conversation>> subscribers = new CopyOnWriteArrayList<>();

    /** Guards the process handle and orders conversation changes with their broadcasts. */
    private final Object lock = new Object();
    private AgentProcess process;
    private Thread reader;
    private boolean launchedBefore;
    private boolean spawnFailed;
    private boolean aborting;
    private boolean closed;
    private Instant turnStartedAt;
    private volatile String agentSessionId;
    private volatile String lastStderrLine;

    /**
     * A user message waiting for the current turn to end.
     */
    public record PendingMessage(String text, List<Attachment> attachments) {
        public PendingMessage {
            attachments = attachments == null ? List.of() : List.copyOf(attachments);
        }
    }

    AgentSession(AgentRef agent, String sessionId, Path workingDirectory, SessionProperties properties,
                 AgentProcessLauncher launcher, ProtocolDecoder decoder, ToolPermissionGate permissionGate,
                 EventBus eventBus, AgentDeckMetrics metrics, TranscriptLoader transcriptLoader,
                 Supplier<Map<String, Object>> mcpConfig) {
        this.agent = agent;
        this.sessionId = sessionId;
        this.agentSessionId = sessionId;
        this.workingDirectory = workingDirectory;
        this.permissionScope = PermissionScope.of(workingDirectory, permissionCache);
        this.properties = properties;
        this.launcher = launcher;
        this.decoder = decoder;
        this.controlProtocol = new ControlProtocol();
        this.permissionGate = permissionGate;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.transcriptLoader = transcriptLoader;
        this.mcpConfig = mcpConfig;
        this.machine = new ConversationStateMachine(properties.getCumulativeReset(),
                orphan -> metrics.incrementOrphanedToolResults());
    }

    // -- Commands --

    /**
     * Sends a user turn, starting the agent if it is not running. While a turn is in
     * flight the message is queued instead, replacing any message queued before it.
     *
     * @return true if the message was sent or queued
     */
    public boolean sendMessage(String text, List<Attachment> attachments) {
        boolean hasText = text != null && !text.isBlank();
        boolean hasAttachments = attachments != null && !attachments.isEmpty();
        if (!hasText && !hasAttachments) {
            return false;
        }
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Session " + agent.agentId() + " is closed");
            }
            if (spawnFailed) {
                log.warn("Agent {} failed to start; restart the session before sending", agent.agentId());
                return false;
            }
            if (machine.state().isTurnInFlight()) {
                PendingMessage replaced = pending.getAndSet(new PendingMessage(text, attachments));
                if (replaced != null) {
                    log.debug("Queued message replaces an earlier queued message");
                }
                eventBus.publish(AgentEventType.STATUS, agent, Map.of("status", "queued"));
                return true;
            }
            dispatch(text, attachments);
            return true;
        }
    }

    /**
     * Stops the running turn by terminating the agent. Waits the configured grace
     * period, then kills it. The open message is marked interrupted, an aborted
     * marker is appended, and any queued message is dropped.
     *
     * @return false if no agent process was running
     */
    public boolean abort() {
        AgentProcess target;
        Thread targetReader;
        synchronized (lock) {
            if (process == null) {
                return false;
            }
            aborting = true;
            target = process;
            targetReader = reader;
        }
        log.info("Aborting agent {}", agent.agentId());
        PendingMessage dropped = pending.getAndSet(null);
        boolean forced = stopProcess(target, targetReader);

        synchronized (lock) {
            if (process == target) {
                process = null;
                reader = null;
            }
            boolean wasInFlight = machine.state().isTurnInFlight();
            ConversationDelta delta = machine.abortTurn();
            aborting = false;
            broadcast(delta.conversation());
            if (wasInFlight && turnStartedAt != null) {
                metrics.recordTurn("aborted", Duration.between(turnStartedAt, Instant.now()));
            }
        }
        metrics.recordAbort(forced);
        Map<String, Object> payload = new HashMap<>();
        payload.put("forced", forced);
        if (dropped != null) {
            payload.put("droppedMessage", dropped.text());
        }
        eventBus.publish(AgentEventType.ABORTED, agent, payload);
        return true;
    }

    /**
     * Asks the agent to stop its current turn without ending the process.
     *
     * @return false if no agent process was running
     * @throws ControlProtocolException if the request could not be written
     */
    public boolean interrupt() {
        synchronized (lock) {
            if (process == null || !process.isAlive()) {
                return false;
            }
            write(process, controlProtocol.interrupt());
            return true;
        }
    }

    /**
     * Tears down the agent and returns to idle, keeping the conversation. History is
     * reloaded from the agent's transcript when one exists; otherwise the in-memory
     * conversation is kept with every message finalized.
     */
    public Conversation restart() {
        AgentProcess target;
        Thread targetReader;
        synchronized (lock) {
            aborting = true;
            target = process;
            targetReader = reader;
        }
        if (target != null) {
            stopProcess(target, targetReader);
        }
        pending.set(null);

        Optional<Conversation> reloaded = Optional.empty();
        if (launchedBefore) {
            try {
                reloaded = transcriptLoader.load(workingDirectory, agentSessionId);
            } catch (TranscriptLoadException e) {
                log.warn("Keeping in-memory history: {}", e.getMessage());
            }
        }
        Conversation conversation;
        synchronized (lock) {
            process = null;
            reader = null;
            spawnFailed = false;
            aborting = false;
            if (reloaded.isPresent()) {
                machine.restore(reloaded.get());
                conversation = machine.snapshot();
            } else {
                conversation = machine.finalizeAll();
            }
            broadcast(conversation);
        }
        log.info("Restarted agent {} with {} messages", agent.agentId(), conversation.messages().size());
        eventBus.publish(AgentEventType.STATUS, agent, Map.of("status", "restarted"));
        return conversation;
    }

    /**
     * Stops the agent for good and closes every subscriber.
     */
    public void close() {
        AgentProcess target;
        Thread targetReader;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            aborting = true;
            target = process;
            targetReader = reader;
            process = null;
            reader = null;
        }
        if (target != null) {
            stopProcess(target, targetReader);
        }
        pending.set(null);
        subscribers.forEach(Mailbox::close);
        subscribers.clear();
        log.info("Closed session for agent {}", agent.agentId());
    }

    /**
     * Receives the current conversation, then every later snapshot, on a dedicated thread.
     */
    public EventBus.Subscription subscribe(Consumer<Conversation> consumer) {
        Mailbox<Conversation> mailbox = new Mailbox<>("session-" + agent.agentId(), consumer);
        synchronized (lock) {
            subscribers.add(mailbox);
            mailbox.post(machine.snapshot());
        }
        return () -> {
            subscribers.remove(mailbox);
            mailbox.close();
        };
    }

    // -- Queries --

    public AgentRef agent() {
        return agent;
    }

    public String sessionId() {
        return sessionId;
    }

    public Path workingDirectory() {
        return workingDirectory;
    }

    public Conversation conversation() {
        return machine.snapshot();
    }

    public ConversationState state() {
        return machine.state();
    }

    public Optional<PendingMessage> pendingMessage() {
        return Optional.ofNullable(pending.get());
    }

    public SessionPermissionCache permissionCache() {
        return permissionCache;
    }

    public boolean isRunning() {
        synchronized (lock) {
            return process != null && process.isAlive();
        }
    }

    // -- Outgoing --

    /** Caller holds {@link #lock}. */
    private void dispatch(String text, List<Attachment> attachments) {
        ConversationDelta added = machine.addUserMessage(text, attachments);
        broadcast(added.conversation());
        publishMessage(added.message());
        turnStartedAt = Instant.now();

        AgentProcess target;
        try {
            target = ensureProcess();
        } catch (ProcessStartException e) {
            log.error("Agent {} failed to start: {}", agent.agentId(), e.getMessage());
            spawnFailed = true;
            failTurn(e.getMessage(), false);
            return;
        }
        try {
            write(target, controlProtocol.userMessage(text, attachments));
        } catch (ControlProtocolException e) {
            failTurn(e.getMessage(), true);
            return;
        }
        broadcast(machine.markProcessing());
        eventBus.publish(AgentEventType.STATUS, agent, Map.of("status", "processing"));
    }

    /** Caller holds {@link #lock}. */
    private AgentProcess ensureProcess() {
        if (process != null && process.isAlive()) {
            return process;
        }
        List<String> command = AgentCommandLine.build(properties, agentSessionId, launchedBefore, mcpConfig.get());
        AgentProcess started = launcher.launch(new AgentProcessRequest(agent.agentId(), workingDirectory, command, Map.of()));
        launchedBefore = true;
        process = started;
        reader = startThread("agent-reader-" + agent.agentId(), () -> readLoop(started));
        startThread("agent-stderr-" + agent.agentId(), () -> drainStderr(started));
        eventBus.publish(AgentEventType.STATUS, agent, Map.of("status", "started", "pid", started.pid()));
        return started;
    }

    private void write(AgentProcess target, String line) {
        try {
            target.writeLine(line);
        } catch (IOException e) {
            throw new ControlProtocolException("Failed to write to agent " + agent.agentId() + ": " + e.getMessage(), e);
        }
    }

    // -- Incoming --

    private void readLoop(AgentProcess source) {
        MdcContext.setAgent(agent.networkId(), agent.agentId(), sessionId);
        try (BufferedReader in = new BufferedReader(new InputStreamReader(source.stdout(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                handleLine(source, line);
            }
        } catch (IOException e) {
            log.debug("Agent output closed: {}", e.getMessage());
        } finally {
            onProcessExit(source);
            MdcContext.clear();
        }
    }

    void handleLine(AgentProcess source, String line) {
        DecodedLine decoded = decoder.decode(line);
        if (decoded.isControlRequest()) {
            metrics.recordProtocolLine("control");
            answerControlRequest(source, decoded.controlRequest());
            return;
        }
        if (decoded.fragments().isEmpty() && !decoded.hasUsage() && decoded.messageId() == null) {
            metrics.recordProtocolLine("empty");
            return;
        }
        metrics.recordProtocolLine("decoded");
        if (decoded.sessionId() != null) {
            agentSessionId = decoded.sessionId();
        }
        recordTokens(decoded.usage());

        boolean completed;
        synchronized (lock) {
            ConversationDelta delta = machine.apply(decoded);
            broadcast(delta.conversation());
            publishFragments(decoded, delta.conversation());
            completed = delta.turnCompleted();
            if (completed) {
                finishTurn(delta.conversation());
            }
        }
        if (completed) {
            dispatchPending();
        }
    }

    private void answerControlRequest(AgentProcess source, ControlRequest request) {
        String response;
        if (!request.isToolPermission()) {
            response = controlProtocol.error(request.requestId(), "Unsupported control request: " + request.subtype());
        } else {
            PermissionOutcome outcome = permissionGate.decide(permissionScope, agent, request);
            response = outcome.allowed()
                    ? controlProtocol.allow(request.requestId(), outcome.updatedInput())
                    : controlProtocol.deny(request.requestId(), outcome.message());
        }
        try {
            write(source, response);
        } catch (ControlProtocolException e) {
            log.warn("Could not answer control request {}: {}", request.requestId(), e.getMessage());
        }
    }

    /** Caller holds {@link #lock}. */
    private void finishTurn(Conversation conversation) {
        Duration duration = turnStartedAt == null ? Duration.ZERO : Duration.between(turnStartedAt, Instant.now());
        if (conversation.state() == ConversationState.ERROR) {
            metrics.recordTurn("error", duration);
            broadcast(machine.acknowledgeError());
            return;
        }
        metrics.recordTurn("completed", duration);
        Map<String, Object> payload = new HashMap<>();
        conversation.lastMessage().ifPresent(m -> payload.put("messageId", m.id()));
        payload.put("totalInputTokens", conversation.totalInputTokens());
        payload.put("totalOutputTokens", conversation.totalOutputTokens());
        payload.put("totalCostUsd", conversation.totalCostUsd());
        eventBus.publish(AgentEventType.DONE, agent, payload);
    }

    private void dispatchPending() {
        synchronized (lock) {
            if (closed || aborting || machine.state().isTurnInFlight()) {
                return;
            }
            PendingMessage next = pending.getAndSet(null);
            if (next != null) {
                log.debug("Dispatching queued message");
                dispatch(next.text(), next.attachments());
            }
        }
    }

    private void onProcessExit(AgentProcess exited) {
        boolean unexpected;
        synchronized (lock) {
            unexpected = process == exited && !aborting;
            if (unexpected) {
                process = null;
                reader = null;
            }
        }
        if (!unexpected) {
            return;
        }
        int code = exitCodeOf(exited);
        log.warn("Agent {} exited unexpectedly with code {}", agent.agentId(), code);
        synchronized (lock) {
            if (machine.state().isTurnInFlight()) {
                String detail = lastStderrLine != null ? ": " + lastStderrLine : "";
                failTurn("Agent process exited with code " + code + detail, true);
            }
        }
        eventBus.publish(AgentEventType.STATUS, agent, Map.of("status", "exited", "exitCode", code));
        dispatchPending();
    }

    /**
     * Records a failure outside the agent's stream. Caller holds {@link #lock}.
     *
     * @param recoverable false leaves the conversation in the error state until restart
     */
    private void failTurn(String message, boolean recoverable) {
        ConversationDelta delta = machine.recordError(message);
        broadcast(delta.conversation());
        eventBus.publish(AgentEventType.ERROR, agent, Map.of("message", message));
        if (turnStartedAt != null) {
            metrics.recordTurn("error", Duration.between(turnStartedAt, Instant.now()));
        }
        if (recoverable) {
            broadcast(machine.acknowledgeError());
        }
    }

    private void drainStderr(AgentProcess source) {
        MdcContext.setAgent(agent.networkId(), agent.agentId(), sessionId);
        try (BufferedReader in = new BufferedReader(new InputStreamReader(source.stderr(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (!line.isBlank()) {
                    lastStderrLine = line;
                    log.debug("[stderr] {}", line);
                }
            }
        } catch (IOException e) {
            log.debug("Agent stderr closed: {}", e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    // -- Teardown --

    /**
     * Terminates the process, escalating to a kill after the grace period, then waits
     * for its reader to finish.
     *
     * @return true if the process had to be killed
     */
    private boolean stopProcess(AgentProcess target, Thread targetReader) {
        Duration grace = properties.getAbortGracePeriod();
        boolean forced = false;
        target.terminate();
        try {
            if (!target.waitFor(grace)) {
                log.warn("Agent {} did not exit within {}; killing it", agent.agentId(), grace);
                target.forceTerminate();
                forced = true;
                target.waitFor(grace);
            }
            if (targetReader != null && targetReader != Thread.currentThread()) {
                // Unblocks a reader waiting on a permission prompt
                targetReader.interrupt();
                targetReader.join(grace.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            target.forceTerminate();
            forced = true;
        }
        return forced;
    }

    private static int exitCodeOf(AgentProcess exited) {
        try {
            exited.waitFor(Duration.ofSeconds(1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return exited.exitCode();
    }

    private static Thread startThread(String name, Runnable body) {
        Thread thread = new Thread(body, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    // -- Observers --

    private void broadcast(Conversation conversation) {
        for (Mailbox<Conversation> subscriber : subscribers) {
            subscriber.post(conversation);
        }
    }

    private void recordTokens(TokenUsage usage) {
        if (usage.isEmpty()) {
            return;
        }
        metrics.recordTokens("input", usage.inputTokens());
        metrics.recordTokens("output", usage.outputTokens());
        metrics.recordTokens("cache_read", usage.cacheReadInputTokens());
        metrics.recordTokens("cache_creation", usage.cacheCreationInputTokens());
    }

    private void publishMessage(ConversationMessage message) {
        if (message == null) {
            return;
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("messageId", message.id());
        payload.put("role", message.role().name().toLowerCase(Locale.ROOT));
        payload.put("messageType", message.messageType().name().toLowerCase(Locale.ROOT));
        payload.put("content", message.content());
        payload.put("streaming", message.streaming());
        eventBus.publish(AgentEventType.MESSAGE, agent, payload);
    }

    private void publishFragments(DecodedLine decoded, Conversation conversation) {
        for (ResponseFragment fragment : decoded.fragments()) {
            switch (fragment.kind()) {
                case TEXT, COMPACT_BOUNDARY, COMPACT_SUMMARY, USER_MESSAGE ->
                        conversation.lastMessage().ifPresent(this::publishMessage);
                case TOOL_USE -> {
                    var use = (ResponseFragment.ToolUse) fragment;
                    eventBus.publish(AgentEventType.TOOL_USE, agent, Map.of(
                            "toolUseId", String.valueOf(use.toolUseId()),
                            "toolName", String.valueOf(use.toolName()),
                            "input", use.parameters()));
                }
                case TOOL_RESULT -> {
                    var result = (ResponseFragment.ToolResult) fragment;
                    eventBus.publish(AgentEventType.TOOL_RESULT, agent, Map.of(
                            "toolUseId", String.valueOf(result.toolUseId()),
                            "content", result.content() == null ? "" : result.content(),
                            "isError", result.error(),
                            "orphaned", !conversation.containsToolUse(result.toolUseId())));
                }
                case ERROR -> eventBus.publish(AgentEventType.ERROR, agent,
                        Map.of("message", String.valueOf(((ResponseFragment.Error) fragment).message())));
                case STATUS -> {
                    var status = (ResponseFragment.Status) fragment;
                    eventBus.publish(AgentEventType.STATUS, agent,
                            Map.of("status", String.valueOf(status.status())));
                }
                case META -> eventBus.publish(AgentEventType.STATUS, agent,
                        Map.of("status", String.valueOf(((ResponseFragment.Meta) fragment).subtype())));
                case UNKNOWN -> eventBus.publish(AgentEventType.UNKNOWN, agent,
                        Map.of("type", String.valueOf(((ResponseFragment.Unknown) fragment).type())));
                case COMPLETION -> { }
            }
        }
    }
}
