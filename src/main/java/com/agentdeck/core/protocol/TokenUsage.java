package com.agentdeck.core.protocol;

/**
 * Token counters reported by the agent for one protocol line.
 * A report with every counter at zero means the line carried no usage.
 */
public record TokenUsage(
    long inputTokens,
    long outputTokens,
    long cacheReadInputTokens,
    long cacheCreationInputTokens
) {

    public static final TokenUsage NONE = new TokenUsage(0, 0, 0, 0);

    public boolean isEmpty() {
        return inputTokens == 0 && outputTokens == 0
                && cacheReadInputTokens == 0 && cacheCreationInputTokens == 0;
    }

    public TokenUsage plus(TokenUsage other) {
        return new TokenUsage(
                inputTokens + other.inputTokens,
                outputTokens + other.outputTokens,
                cacheReadInputTokens + other.cacheReadInputTokens,
                cacheCreationInputTokens + other.cacheCreationInputTokens);
    }
}
