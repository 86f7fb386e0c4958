package com.agentdeck.core.protocol;

import java.util.List;

/**
 * Everything the decoder extracted from one protocol line.
 *
 * @param fragments      conversation fragments, in block order
 * @param usage          side-channel token counters, {@link TokenUsage#NONE} when absent
 * @param messageId      the assistant message id the line declares, or null
 * @param sessionId      the agent-side session id, or null
 * @param controlRequest a control request addressed to the supervisor, or null
 */
public record DecodedLine(
    List<ResponseFragment> fragments,
    TokenUsage usage,
    String messageId,
    String sessionId,
    ControlRequest controlRequest
) {

    public static final DecodedLine EMPTY = new DecodedLine(List.of(), TokenUsage.NONE, null, null, null);

    public DecodedLine {
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
        usage = usage == null ? TokenUsage.NONE : usage;
    }

    public static DecodedLine of(List<ResponseFragment> fragments, TokenUsage usage, String messageId, String sessionId) {
        return new DecodedLine(fragments, usage, messageId, sessionId, null);
    }

    public boolean hasUsage() {
        return !usage.isEmpty();
    }

    public boolean isControlRequest() {
        return controlRequest != null;
    }
}
