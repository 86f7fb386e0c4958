package com.agentdeck.core.conversation;

/**
 * How long "a partial was seen" suppresses cumulative text snapshots.
 */
public enum CumulativeResetPolicy {
    /** Until the next non-text fragment closes the text segment. */
    SEGMENT,
    /** For the rest of the message. */
    MESSAGE
}
