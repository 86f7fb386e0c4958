package com.agentdeck.core.conversation;

import com.agentdeck.core.model.Attachment;
import com.agentdeck.core.model.Conversation;
import com.agentdeck.core.model.ConversationDelta;
import com.agentdeck.core.model.ConversationMessage;
import com.agentdeck.core.model.ConversationState;
import com.agentdeck.core.model.MessageRole;
import com.agentdeck.core.model.MessageType;
import com.agentdeck.core.protocol.DecodedLine;
import com.agentdeck.core.protocol.ResponseFragment;
import com.agentdeck.core.protocol.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Folds decoded fragments, in arrival order, into one session's conversation.
 * <p>
 * Owns the id of the currently open streaming assistant message. A fragment that
 * declares that id, or declares none, joins the open message; any other id starts
 * a new message and leaves the previous one exactly as it was. All methods are
 * synchronized: the reader thread applies fragments while callers add user turns.
 */
public class ConversationStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ConversationStateMachine.class);

    static final String END_TURN = "end_turn";
    static final String ABORTED_TEXT = "Interrupted by user";

    private final CumulativeResetPolicy resetPolicy;
    private final Consumer<ResponseFragment.ToolResult> orphanObserver;

    private final List<ConversationMessage> messages = new ArrayList<>();
    private int openIndex = -1;
    private String openDeclaredId;
    private TextAccumulator openText;
    private int freshlyOpened = -1;

    private ConversationState state = ConversationState.IDLE;
    private TokenUsage totals = TokenUsage.NONE;
    private TokenUsage currentContext = TokenUsage.NONE;
    private double totalCostUsd;
    private String currentError;

    public ConversationStateMachine() {
        this(CumulativeResetPolicy.SEGMENT, r -> { });
    }

    public ConversationStateMachine(CumulativeResetPolicy resetPolicy) {
        this(resetPolicy, r -> { });
    }

    public ConversationStateMachine(CumulativeResetPolicy resetPolicy,
                                    Consumer<ResponseFragment.ToolResult> orphanObserver) {
        this.resetPolicy = resetPolicy;
        this.orphanObserver = orphanObserver;
    }

    /**
     * Appends a user turn and moves to {@link ConversationState#SENDING_MESSAGE}.
     * Clears any error left by the previous turn.
     */
    public synchronized ConversationDelta addUserMessage(String text, List<Attachment> attachments) {
        closeOpenMessage();
        currentError = null;
        state = ConversationState.SENDING_MESSAGE;
        return append(ConversationMessage.user(UUID.randomUUID().toString(), text, attachments));
    }

    /** The user turn was written to the agent; waiting for output. */
    public synchronized Conversation markProcessing() {
        if (state == ConversationState.SENDING_MESSAGE) {
            state = ConversationState.PROCESSING;
        }
        return snapshot();
    }

    /**
     * Applies every fragment of a decoded line, then its usage report.
     */
    public synchronized ConversationDelta apply(DecodedLine line) {
        ConversationDelta delta = ConversationDelta.unchanged(snapshot());
        if (line.fragments().isEmpty() && line.messageId() != null) {
            // A message start: later undeclared deltas belong to this id
            delta = declareMessage(line.messageId());
        }
        for (ResponseFragment fragment : line.fragments()) {
            ConversationDelta next = apply(fragment, line.messageId());
            if (next.hasChange() || next.turnCompleted()) {
                delta = next;
            }
        }
        if (line.hasUsage()) {
            recordUsage(line.usage());
            delta = new ConversationDelta(snapshot(), delta.messageIndex(), delta.change(), delta.turnCompleted());
        }
        return delta;
    }

    public synchronized ConversationDelta apply(ResponseFragment fragment) {
        return apply(fragment, null);
    }

    /**
     * Applies one fragment.
     *
     * @param fragment          the decoded fragment
     * @param declaredMessageId the assistant message id carried by its line, or null
     */
    public synchronized ConversationDelta apply(ResponseFragment fragment, String declaredMessageId) {
        return switch (fragment.kind()) {
            case TEXT -> applyText((ResponseFragment.Text) fragment, declaredMessageId);
            case TOOL_USE -> {
                state = ConversationState.PROCESSING;
                yield appendToOpen(fragment, declaredMessageId);
            }
            case TOOL_RESULT -> applyToolResult((ResponseFragment.ToolResult) fragment, declaredMessageId);
            case COMPLETION -> applyCompletion((ResponseFragment.Completion) fragment);
            case ERROR -> applyError(((ResponseFragment.Error) fragment).message(), fragment);
            case COMPACT_BOUNDARY -> {
                var boundary = (ResponseFragment.CompactBoundary) fragment;
                String text = "Conversation compacted (" + boundary.trigger() + ", " + boundary.preTokens() + " tokens)";
                yield append(ConversationMessage.standalone(UUID.randomUUID().toString(),
                        MessageRole.SYSTEM, MessageType.COMPACT_BOUNDARY, text, fragment));
            }
            case COMPACT_SUMMARY -> {
                var summary = (ResponseFragment.CompactSummary) fragment;
                yield append(ConversationMessage.standalone(UUID.randomUUID().toString(),
                                MessageRole.USER, MessageType.COMPACT_SUMMARY, summary.content(), fragment)
                        .asCompactSummary(summary.visibleInTranscriptOnly()));
            }
            case USER_MESSAGE -> {
                closeOpenMessage();
                yield append(ConversationMessage.standalone(UUID.randomUUID().toString(),
                        MessageRole.USER, MessageType.USER_MESSAGE,
                        ((ResponseFragment.UserMessage) fragment).content(), fragment));
            }
            case UNKNOWN -> openIndex >= 0
                    ? appendToOpen(fragment, null)
                    : append(ConversationMessage.standalone(UUID.randomUUID().toString(),
                            MessageRole.SYSTEM, MessageType.UNKNOWN, "", fragment));
            // Status and meta lines describe the agent, not the conversation
            case STATUS, META -> ConversationDelta.unchanged(snapshot());
        };
    }

    /**
     * Adds a usage report: totals accumulate, current-context counters are replaced.
     */
    public synchronized Conversation recordUsage(TokenUsage usage) {
        if (usage != null && !usage.isEmpty()) {
            totals = totals.plus(usage);
            currentContext = usage;
        }
        return snapshot();
    }

    /**
     * Records a failure that did not come from the agent's stream, such as a spawn error.
     */
    public synchronized ConversationDelta recordError(String message) {
        return applyError(message, new ResponseFragment.Error(message));
    }

    /**
     * Returns to idle once an error has been surfaced. The error text stays
     * available until the next user turn.
     */
    public synchronized Conversation acknowledgeError() {
        if (state == ConversationState.ERROR) {
            state = ConversationState.IDLE;
        }
        return snapshot();
    }

    /**
     * Marks the in-flight turn as interrupted and appends an aborted marker.
     */
    public synchronized ConversationDelta abortTurn() {
        if (openIndex >= 0) {
            messages.set(openIndex, messages.get(openIndex).failed(ABORTED_TEXT));
            closeOpenMessage();
        }
        state = ConversationState.IDLE;
        return append(ConversationMessage.standalone(UUID.randomUUID().toString(),
                MessageRole.SYSTEM, MessageType.STATUS, ABORTED_TEXT,
                new ResponseFragment.Status("aborted", ABORTED_TEXT)));
    }

    /**
     * Replaces the whole conversation, used when history is reloaded from a transcript.
     */
    public synchronized void restore(Conversation conversation) {
        messages.clear();
        messages.addAll(conversation.messages());
        closeOpenMessage();
        state = ConversationState.IDLE;
        totals = new TokenUsage(conversation.totalInputTokens(), conversation.totalOutputTokens(),
                conversation.totalCacheReadTokens(), conversation.totalCacheCreationTokens());
        currentContext = new TokenUsage(conversation.currentContextInputTokens(), 0,
                conversation.currentContextCacheReadTokens(), conversation.currentContextCacheCreationTokens());
        totalCostUsd = conversation.totalCostUsd();
        currentError = null;
    }

    /**
     * Finalizes every message still marked streaming. Used after replaying a
     * transcript, where no turn is in flight.
     */
    public synchronized Conversation finalizeAll() {
        for (int i = 0; i < messages.size(); i++) {
            ConversationMessage message = messages.get(i);
            if (message.streaming() || !message.complete()) {
                messages.set(i, message.finished());
            }
        }
        closeOpenMessage();
        state = ConversationState.IDLE;
        return snapshot();
    }

    public synchronized ConversationState state() {
        return state;
    }

    public synchronized Conversation snapshot() {
        return new Conversation(messages, state,
                totals.inputTokens(), totals.outputTokens(),
                totals.cacheReadInputTokens(), totals.cacheCreationInputTokens(),
                totalCostUsd,
                currentContext.inputTokens(), currentContext.cacheReadInputTokens(),
                currentContext.cacheCreationInputTokens(),
                currentError);
    }

    private ConversationDelta declareMessage(String messageId) {
        if (openIndex >= 0 && (openDeclaredId == null || openDeclaredId.equals(messageId))) {
            openMessageFor(messageId);
            return ConversationDelta.unchanged(snapshot());
        }
        int index = openMessageFor(messageId);
        return new ConversationDelta(snapshot(), index, changeFor(index), false);
    }

    private ConversationDelta applyText(ResponseFragment.Text text, String declaredMessageId) {
        state = ConversationState.RECEIVING_RESPONSE;
        int index = openMessageFor(declaredMessageId);
        openText.accept(text);
        ConversationMessage updated = messages.get(index).withFragment(text, openText.render());
        messages.set(index, updated);
        if (END_TURN.equals(text.stopReason())) {
            return completeTurn(index);
        }
        return new ConversationDelta(snapshot(), index, changeFor(index), false);
    }

    private ConversationDelta applyToolResult(ResponseFragment.ToolResult result, String declaredMessageId) {
        state = ConversationState.PROCESSING;
        String toolUseId = result.toolUseId();
        boolean matchedOpen = openIndex >= 0 && messages.get(openIndex).hasToolUse(toolUseId);
        if (!matchedOpen && messages.stream().noneMatch(m -> m.hasToolUse(toolUseId))) {
            log.warn("Tool result {} has no matching tool call; recording as orphaned", toolUseId);
            result = result.asOrphaned();
            orphanObserver.accept(result);
        }
        return appendToOpen(result, declaredMessageId);
    }

    private ConversationDelta applyCompletion(ResponseFragment.Completion completion) {
        totalCostUsd += completion.costUsd();
        if (openIndex >= 0) {
            int index = openIndex;
            closeTextSegment();
            messages.set(index, messages.get(index).withFragment(completion, openText.render()));
            if (END_TURN.equals(completion.stopReason())) {
                return completeTurn(index);
            }
            return new ConversationDelta(snapshot(), index, ConversationDelta.Change.UPDATED, false);
        }
        if (END_TURN.equals(completion.stopReason()) && state != ConversationState.ERROR) {
            boolean wasInFlight = state.isTurnInFlight();
            state = ConversationState.IDLE;
            return new ConversationDelta(snapshot(), -1, ConversationDelta.Change.NONE, wasInFlight);
        }
        return ConversationDelta.unchanged(snapshot());
    }

    private ConversationDelta applyError(String message, ResponseFragment fragment) {
        currentError = message;
        state = ConversationState.ERROR;
        if (openIndex >= 0) {
            int index = openIndex;
            closeTextSegment();
            messages.set(index, messages.get(index).withFragment(fragment, openText.render()).failed(message));
            closeOpenMessage();
            return new ConversationDelta(snapshot(), index, ConversationDelta.Change.UPDATED, true);
        }
        ConversationMessage errorMessage = ConversationMessage.standalone(UUID.randomUUID().toString(),
                MessageRole.ASSISTANT, MessageType.ERROR, message, fragment).failed(message);
        ConversationDelta delta = append(errorMessage);
        return new ConversationDelta(delta.conversation(), delta.messageIndex(), delta.change(), true);
    }

    private ConversationDelta appendToOpen(ResponseFragment fragment, String declaredMessageId) {
        int index = openMessageFor(declaredMessageId);
        closeTextSegment();
        messages.set(index, messages.get(index).withFragment(fragment, openText.render()));
        return new ConversationDelta(snapshot(), index, changeFor(index), false);
    }

    private ConversationDelta completeTurn(int index) {
        messages.set(index, messages.get(index).finished());
        closeOpenMessage();
        state = ConversationState.IDLE;
        return new ConversationDelta(snapshot(), index, ConversationDelta.Change.UPDATED, true);
    }

    /**
     * Index of the message a fragment with this declared id belongs to, opening a
     * new assistant message when the id does not match the open one. A message
     * opened by undeclared fragments adopts the first id declared to it.
     */
    private int openMessageFor(String declaredMessageId) {
        if (openIndex >= 0) {
            if (declaredMessageId == null || declaredMessageId.equals(openDeclaredId)) {
                return openIndex;
            }
            if (openDeclaredId == null) {
                openDeclaredId = declaredMessageId;
                messages.set(openIndex, messages.get(openIndex).withId(declaredMessageId));
                return openIndex;
            }
        }
        String id = declaredMessageId != null ? declaredMessageId : UUID.randomUUID().toString();
        messages.add(ConversationMessage.assistant(id));
        openIndex = messages.size() - 1;
        openDeclaredId = declaredMessageId;
        openText = new TextAccumulator(resetPolicy);
        freshlyOpened = openIndex;
        return openIndex;
    }

    private ConversationDelta.Change changeFor(int index) {
        if (freshlyOpened == index) {
            freshlyOpened = -1;
            return ConversationDelta.Change.APPENDED;
        }
        return ConversationDelta.Change.UPDATED;
    }

    private ConversationDelta append(ConversationMessage message) {
        messages.add(message);
        return new ConversationDelta(snapshot(), messages.size() - 1, ConversationDelta.Change.APPENDED, false);
    }

    private void closeTextSegment() {
        if (openText != null) {
            openText.closeSegment();
        }
    }

    private void closeOpenMessage() {
        openIndex = -1;
        openDeclaredId = null;
        openText = null;
        freshlyOpened = -1;
    }
}
