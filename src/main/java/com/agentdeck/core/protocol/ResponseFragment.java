package com.agentdeck.core.protocol;

import java.util.Map;

/**
 * One decoded unit of the agent's output stream.
 * <p>
 * Every variant reports its {@link FragmentKind} so consumers can switch over
 * the full set; {@link Unknown} keeps lines this version does not understand.
 */
public interface ResponseFragment {

    FragmentKind kind();

    /**
     * Assistant text. {@code partial} marks a streaming delta to append,
     * {@code cumulative} a snapshot of the whole segment so far.
     */
    record Text(String content, boolean partial, boolean cumulative, String stopReason) implements ResponseFragment {

        public static Text partial(String content) {
            return new Text(content, true, false, null);
        }

        public static Text cumulative(String content, String stopReason) {
            return new Text(content, false, true, stopReason);
        }

        public static Text plain(String content) {
            return new Text(content, false, false, null);
        }

        @Override
        public FragmentKind kind() {
            return FragmentKind.TEXT;
        }
    }

    record ToolUse(String toolName, Map<String, Object> parameters, String toolUseId) implements ResponseFragment {

        public ToolUse {
            parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        }

        @Override
        public FragmentKind kind() {
            return FragmentKind.TOOL_USE;
        }
    }

    /**
     * Result of a tool call. {@code orphaned} is set by the conversation when no
     * call with the same id was ever seen; the decoder always emits {@code false}.
     */
    record ToolResult(String toolUseId, String content, boolean error, boolean orphaned) implements ResponseFragment {

        public ToolResult(String toolUseId, String content, boolean error) {
            this(toolUseId, content, error, false);
        }

        public ToolResult asOrphaned() {
            return new ToolResult(toolUseId, content, error, true);
        }

        @Override
        public FragmentKind kind() {
            return FragmentKind.TOOL_RESULT;
        }
    }

    record CompactBoundary(String trigger, long preTokens) implements ResponseFragment {
        @Override
        public FragmentKind kind() {
            return FragmentKind.COMPACT_BOUNDARY;
        }
    }

    record CompactSummary(String content, boolean visibleInTranscriptOnly) implements ResponseFragment {
        @Override
        public FragmentKind kind() {
            return FragmentKind.COMPACT_SUMMARY;
        }
    }

    record Completion(String stopReason, TokenUsage usage, double costUsd) implements ResponseFragment {
        @Override
        public FragmentKind kind() {
            return FragmentKind.COMPLETION;
        }
    }

    record Error(String message) implements ResponseFragment {
        @Override
        public FragmentKind kind() {
            return FragmentKind.ERROR;
        }
    }

    record Status(String status, String message) implements ResponseFragment {
        @Override
        public FragmentKind kind() {
            return FragmentKind.STATUS;
        }
    }

    record Meta(String subtype, Map<String, Object> data) implements ResponseFragment {

        public Meta {
            data = data == null ? Map.of() : Map.copyOf(data);
        }

        @Override
        public FragmentKind kind() {
            return FragmentKind.META;
        }
    }

    /** A user turn that the agent echoed back or that came from a transcript. */
    record UserMessage(String content) implements ResponseFragment {
        @Override
        public FragmentKind kind() {
            return FragmentKind.USER_MESSAGE;
        }
    }

    record Unknown(String type, String raw) implements ResponseFragment {
        @Override
        public FragmentKind kind() {
            return FragmentKind.UNKNOWN;
        }
    }
}
