package com.agentdeck.core.model;

import com.agentdeck.core.protocol.FragmentKind;
import com.agentdeck.core.protocol.ResponseFragment;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One message of a conversation. Immutable; the state machine replaces the
 * open message with an updated copy as fragments arrive.
 *
 * @param id                      the declared assistant message id, or a generated one
 * @param role                    who authored the message
 * @param messageType             what kind of message this is
 * @param content                 rendered text after applying the merge rules
 * @param fragments               every fragment applied to this message, in arrival order
 * @param streaming               true while fragments may still arrive
 * @param complete                true once the turn finished; never reverts
 * @param attachments             user-supplied attachments
 * @param error                   error text for failed turns, or null
 * @param compactSummary          true for a summary produced by compaction
 * @param visibleInTranscriptOnly true when the summary is not meant for normal display
 * @param timestamp               when the message was created
 */
public record ConversationMessage(
    String id,
    MessageRole role,
    MessageType messageType,
    String content,
    List<ResponseFragment> fragments,
    boolean streaming,
    boolean complete,
    List<Attachment> attachments,
    String error,
    boolean compactSummary,
    boolean visibleInTranscriptOnly,
    Instant timestamp
) {

    public ConversationMessage {
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
        content = content == null ? "" : content;
    }

    public static ConversationMessage user(String id, String text, List<Attachment> attachments) {
        return new ConversationMessage(id, MessageRole.USER, MessageType.NORMAL, text, List.of(),
                false, true, attachments, null, false, false, Instant.now());
    }

    public static ConversationMessage assistant(String id) {
        return new ConversationMessage(id, MessageRole.ASSISTANT, MessageType.NORMAL, "", List.of(),
                true, false, List.of(), null, false, false, Instant.now());
    }

    public static ConversationMessage standalone(String id, MessageRole role, MessageType type,
                                                 String content, ResponseFragment fragment) {
        return new ConversationMessage(id, role, type, content, List.of(fragment),
                false, true, List.of(), null, false, false, Instant.now());
    }

    public ConversationMessage withFragment(ResponseFragment fragment, String renderedContent) {
        List<ResponseFragment> next = new ArrayList<>(fragments);
        next.add(fragment);
        return new ConversationMessage(id, role, messageType, renderedContent, next, streaming, complete,
                attachments, error, compactSummary, visibleInTranscriptOnly, timestamp);
    }

    public ConversationMessage withId(String newId) {
        return new ConversationMessage(newId, role, messageType, content, fragments, streaming, complete,
                attachments, error, compactSummary, visibleInTranscriptOnly, timestamp);
    }

    public ConversationMessage finished() {
        return new ConversationMessage(id, role, messageType, content, fragments, false, true,
                attachments, error, compactSummary, visibleInTranscriptOnly, timestamp);
    }

    public ConversationMessage failed(String errorText) {
        return new ConversationMessage(id, role, messageType, content, fragments, false, true,
                attachments, errorText, compactSummary, visibleInTranscriptOnly, timestamp);
    }

    public ConversationMessage asCompactSummary(boolean transcriptOnly) {
        return new ConversationMessage(id, role, MessageType.COMPACT_SUMMARY, content, fragments, false, true,
                attachments, error, true, transcriptOnly, timestamp);
    }

    public boolean hasToolUse(String toolUseId) {
        return toolUseId != null && fragments.stream()
                .filter(f -> f.kind() == FragmentKind.TOOL_USE)
                .anyMatch(f -> toolUseId.equals(((ResponseFragment.ToolUse) f).toolUseId()));
    }

    /**
     * Pairs this message's tool calls with their results by tool-use id.
     * Orphaned results are listed as invocations without a call. Results whose
     * call lives in another message are left to {@link Conversation#toolInvocations()}.
     */
    public List<ToolInvocation> toolInvocations() {
        Map<String, ResponseFragment.ToolUse> calls = new LinkedHashMap<>();
        Map<String, ResponseFragment.ToolResult> results = new LinkedHashMap<>();
        List<ToolInvocation> orphans = new ArrayList<>();
        for (ResponseFragment fragment : fragments) {
            if (fragment instanceof ResponseFragment.ToolUse use) {
                calls.put(use.toolUseId(), use);
            } else if (fragment instanceof ResponseFragment.ToolResult result) {
                if (result.orphaned()) {
                    orphans.add(new ToolInvocation(null, result));
                } else {
                    results.putIfAbsent(result.toolUseId(), result);
                }
            }
        }
        List<ToolInvocation> invocations = new ArrayList<>();
        calls.forEach((id, call) -> invocations.add(new ToolInvocation(call, results.get(id))));
        invocations.addAll(orphans);
        return invocations;
    }
}
