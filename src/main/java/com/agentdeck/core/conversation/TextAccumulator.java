package com.agentdeck.core.conversation;

import com.agentdeck.core.protocol.ResponseFragment;

/**
 * Renders the text of one message from a mix of streaming deltas and snapshots.
 * <p>
 * Text is gathered in segments separated by non-text fragments. Inside a segment a
 * partial fragment appends, a plain fragment appends, and a cumulative fragment
 * replaces the segment unless a partial has already been seen, in which case it
 * would only repeat what the partials delivered and is ignored.
 */
final class TextAccumulator {

    private final CumulativeResetPolicy policy;
    private final StringBuilder closedSegments = new StringBuilder();
    private final StringBuilder segment = new StringBuilder();
    private boolean partialInSegment;
    private boolean partialInMessage;

    TextAccumulator(CumulativeResetPolicy policy) {
        this.policy = policy;
    }

    void accept(ResponseFragment.Text text) {
        String content = text.content() == null ? "" : text.content();
        if (text.partial()) {
            segment.append(content);
            partialInSegment = true;
            partialInMessage = true;
        } else if (text.cumulative()) {
            boolean suppressed = policy == CumulativeResetPolicy.MESSAGE ? partialInMessage : partialInSegment;
            if (!suppressed) {
                segment.setLength(0);
                segment.append(content);
            }
        } else {
            segment.append(content);
        }
    }

    void closeSegment() {
        closedSegments.append(segment);
        segment.setLength(0);
        partialInSegment = false;
    }

    String render() {
        return closedSegments.toString() + segment;
    }
}
