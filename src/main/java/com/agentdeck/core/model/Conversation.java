package com.agentdeck.core.model;

import com.agentdeck.core.protocol.ResponseFragment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of a session's conversation.
 * <p>
 * The {@code total*} counters only grow. The {@code currentContext*} counters hold
 * the most recent usage report, which is what occupies the context window.
 */
public record Conversation(
    List<ConversationMessage> messages,
    ConversationState state,
    long totalInputTokens,
    long totalOutputTokens,
    long totalCacheReadTokens,
    long totalCacheCreationTokens,
    double totalCostUsd,
    long currentContextInputTokens,
    long currentContextCacheReadTokens,
    long currentContextCacheCreationTokens,
    String currentError
) {

    public Conversation {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static Conversation empty() {
        return new Conversation(List.of(), ConversationState.IDLE, 0, 0, 0, 0, 0.0, 0, 0, 0, null);
    }

    public Optional<ConversationMessage> lastMessage() {
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(messages.size() - 1));
    }

    public Optional<String> error() {
        return Optional.ofNullable(currentError);
    }

    public long currentContextTokens() {
        return currentContextInputTokens + currentContextCacheReadTokens + currentContextCacheCreationTokens;
    }

    public boolean containsToolUse(String toolUseId) {
        return messages.stream().anyMatch(m -> m.hasToolUse(toolUseId));
    }

    /**
     * Pairs calls and results across every message of the conversation.
     */
    public List<ToolInvocation> toolInvocations() {
        Map<String, ResponseFragment.ToolUse> calls = new LinkedHashMap<>();
        Map<String, ResponseFragment.ToolResult> results = new LinkedHashMap<>();
        List<ToolInvocation> orphans = new ArrayList<>();
        for (ConversationMessage message : messages) {
            for (ResponseFragment fragment : message.fragments()) {
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
        }
        List<ToolInvocation> invocations = new ArrayList<>();
        calls.forEach((id, call) -> invocations.add(new ToolInvocation(call, results.get(id))));
        invocations.addAll(orphans);
        return invocations;
    }
}
