package com.agentdeck.core.model;

import com.agentdeck.core.protocol.ResponseFragment;

/**
 * A tool call paired with its result. Either side may be absent: a call still
 * running has no result, and an orphaned result has no call.
 */
public record ToolInvocation(ResponseFragment.ToolUse call, ResponseFragment.ToolResult result) {

    public String toolUseId() {
        return call != null ? call.toolUseId() : result.toolUseId();
    }

    public String toolName() {
        return call != null ? call.toolName() : null;
    }

    public boolean hasResult() {
        return result != null;
    }

    public boolean isComplete() {
        return call != null && result != null;
    }

    public boolean isError() {
        return result != null && result.error();
    }

    public boolean isOrphaned() {
        return call == null;
    }
}
