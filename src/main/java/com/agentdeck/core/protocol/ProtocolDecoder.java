package com.agentdeck.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns one line of the agent's newline-delimited JSON output into typed fragments.
 * <p>
 * Stateless and thread-safe. Never throws on malformed input: a line that is not
 * JSON, or has no {@code type}, decodes to nothing; a line with an unrecognised
 * {@code type} decodes to a single {@link ResponseFragment.Unknown}.
 */
@Component
public class ProtocolDecoder {

    private static final Logger log = LoggerFactory.getLogger(ProtocolDecoder.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ProtocolDecoder() {
        this(new ObjectMapper());
    }

    public ProtocolDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Decodes a line and returns only its conversation fragments.
     */
    public List<ResponseFragment> decodeLine(String raw) {
        return decode(raw).fragments();
    }

    /**
     * Decodes a line including its side-channel data (usage, ids, control requests).
     */
    public DecodedLine decode(String raw) {
        if (raw == null || raw.isBlank()) {
            return DecodedLine.EMPTY;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.debug("Skipping unparseable protocol line: {}", e.getOriginalMessage());
            return DecodedLine.EMPTY;
        }
        if (root == null || !root.isObject()) {
            return DecodedLine.EMPTY;
        }
        String type = text(root, "type");
        if (type == null) {
            return DecodedLine.EMPTY;
        }

        try {
            return switch (type) {
                case "assistant" -> decodeAssistant(root);
                case "user" -> decodeUser(root);
                case "system" -> decodeSystem(root);
                case "result" -> decodeResult(root);
                case "stream_event" -> decodeStreamEvent(root);
                case "control_request" -> decodeControlRequest(root);
                case "control_response", "control_cancel_request", "keep_alive" -> DecodedLine.EMPTY;
                case "error" -> single(root, new ResponseFragment.Error(errorMessage(root)));
                case "status" -> single(root, new ResponseFragment.Status(
                        textOr(root, "status", "unknown"), text(root, "message")));
                case "meta" -> single(root, new ResponseFragment.Meta("meta", toMap(root)));
                case "completion" -> single(root, new ResponseFragment.Completion(
                        text(root, "stop_reason"), usage(root), root.path("total_cost_usd").asDouble(0)));
                default -> single(root, new ResponseFragment.Unknown(type, raw));
            };
        } catch (RuntimeException e) {
            // Structurally valid JSON with a shape we did not expect
            log.debug("Recording malformed '{}' line as unknown: {}", type, e.getMessage());
            return DecodedLine.of(List.of(new ResponseFragment.Unknown(type, raw)), TokenUsage.NONE, null, null);
        }
    }

    private DecodedLine decodeAssistant(JsonNode root) {
        JsonNode message = root.path("message");
        String messageId = text(message, "id");
        String stopReason = text(message, "stop_reason");
        JsonNode content = message.path("content");

        List<ResponseFragment> fragments = new ArrayList<>();
        if (content.isTextual()) {
            fragments.add(ResponseFragment.Text.cumulative(content.asText(), stopReason));
        } else if (content.isArray()) {
            int last = content.size() - 1;
            for (int i = 0; i <= last; i++) {
                JsonNode block = content.get(i);
                String blockStop = i == last ? stopReason : null;
                switch (textOr(block, "type", "")) {
                    case "text" -> fragments.add(ResponseFragment.Text.cumulative(textOr(block, "text", ""), blockStop));
                    case "tool_use" -> fragments.add(new ResponseFragment.ToolUse(
                            textOr(block, "name", ""), toMap(block.path("input")), text(block, "id")));
                    // thinking and redacted blocks are not part of the rendered conversation
                    default -> { }
                }
            }
        }
        return DecodedLine.of(fragments, usage(root), messageId, text(root, "session_id"));
    }

    private DecodedLine decodeUser(JsonNode root) {
        if (root.path("isMeta").asBoolean(false) || root.path("isReplay").asBoolean(false)) {
            return DecodedLine.EMPTY;
        }
        JsonNode message = root.path("message");
        JsonNode content = message.path("content");
        String sessionId = text(root, "session_id");

        if (root.path("isCompactSummary").asBoolean(false) || root.path("is_compact_summary").asBoolean(false)) {
            boolean transcriptOnly = root.path("isVisibleInTranscriptOnly").asBoolean(true);
            return DecodedLine.of(List.of(new ResponseFragment.CompactSummary(flattenText(content), transcriptOnly)),
                    TokenUsage.NONE, null, sessionId);
        }

        List<ResponseFragment> results = new ArrayList<>();
        if (content.isArray()) {
            for (JsonNode block : content) {
                if ("tool_result".equals(text(block, "type"))) {
                    results.add(new ResponseFragment.ToolResult(
                            text(block, "tool_use_id"),
                            flattenText(block.path("content")),
                            block.path("is_error").asBoolean(false)));
                }
            }
        }
        if (!results.isEmpty()) {
            return DecodedLine.of(results, usage(root), null, sessionId);
        }
        return DecodedLine.of(List.of(new ResponseFragment.UserMessage(flattenText(content))),
                TokenUsage.NONE, null, sessionId);
    }

    private DecodedLine decodeSystem(JsonNode root) {
        String subtype = textOr(root, "subtype", "");
        String sessionId = text(root, "session_id");
        ResponseFragment fragment;
        if ("compact_boundary".equals(subtype)) {
            JsonNode metadata = root.has("compactMetadata") ? root.path("compactMetadata") : root.path("compact_metadata");
            JsonNode preTokens = metadata.has("preTokens") ? metadata.path("preTokens") : metadata.path("pre_tokens");
            fragment = new ResponseFragment.CompactBoundary(textOr(metadata, "trigger", "auto"), preTokens.asLong(0));
        } else if ("init".equals(subtype)) {
            Map<String, Object> data = new LinkedHashMap<>();
            putIfPresent(data, "session_id", root.get("session_id"));
            putIfPresent(data, "model", root.get("model"));
            putIfPresent(data, "cwd", root.get("cwd"));
            putIfPresent(data, "permissionMode", root.get("permissionMode"));
            if (root.path("tools").isArray()) {
                data.put("tools", objectMapper.convertValue(root.path("tools"), LIST_TYPE));
            }
            fragment = new ResponseFragment.Meta("init", data);
        } else {
            fragment = new ResponseFragment.Status(subtype.isEmpty() ? "system" : subtype, text(root, "message"));
        }
        return DecodedLine.of(List.of(fragment), TokenUsage.NONE, null, sessionId);
    }

    private DecodedLine decodeResult(JsonNode root) {
        String subtype = textOr(root, "subtype", "success");
        TokenUsage usage = usage(root);
        ResponseFragment fragment;
        if (root.path("is_error").asBoolean(false) || !"success".equals(subtype)) {
            String result = text(root, "result");
            fragment = new ResponseFragment.Error(result != null && !result.isBlank() ? result : subtype);
        } else {
            fragment = new ResponseFragment.Completion("end_turn", usage, root.path("total_cost_usd").asDouble(0));
        }
        return DecodedLine.of(List.of(fragment), usage, null, text(root, "session_id"));
    }

    private DecodedLine decodeStreamEvent(JsonNode root) {
        JsonNode event = root.path("event");
        String eventType = textOr(event, "type", "");
        String sessionId = text(root, "session_id");
        if ("message_start".equals(eventType)) {
            return DecodedLine.of(List.of(), TokenUsage.NONE, text(event.path("message"), "id"), sessionId);
        }
        if ("content_block_delta".equals(eventType)) {
            String delta = text(event.path("delta"), "text");
            if (delta != null) {
                return DecodedLine.of(List.of(ResponseFragment.Text.partial(delta)), TokenUsage.NONE, null, sessionId);
            }
        }
        return DecodedLine.EMPTY;
    }

    private DecodedLine decodeControlRequest(JsonNode root) {
        JsonNode request = root.path("request");
        ControlRequest controlRequest = new ControlRequest(
                text(root, "request_id"),
                text(request, "subtype"),
                text(request, "tool_name"),
                toMap(request.path("input")),
                text(request, "tool_use_id"),
                request.path("permission_suggestions").isArray()
                        ? objectMapper.convertValue(request.path("permission_suggestions"), LIST_TYPE)
                        : List.of());
        return new DecodedLine(List.of(), TokenUsage.NONE, null, null, controlRequest);
    }

    /**
     * Usage from {@code message.usage}, falling back to a top-level {@code usage}.
     */
    private TokenUsage usage(JsonNode root) {
        JsonNode usage = root.path("message").path("usage");
        if (!usage.isObject()) {
            usage = root.path("usage");
        }
        if (!usage.isObject()) {
            return TokenUsage.NONE;
        }
        TokenUsage parsed = new TokenUsage(
                usage.path("input_tokens").asLong(0),
                usage.path("output_tokens").asLong(0),
                usage.path("cache_read_input_tokens").asLong(0),
                usage.path("cache_creation_input_tokens").asLong(0));
        return parsed.isEmpty() ? TokenUsage.NONE : parsed;
    }

    private DecodedLine single(JsonNode root, ResponseFragment fragment) {
        return DecodedLine.of(List.of(fragment), usage(root), null, text(root, "session_id"));
    }

    private String errorMessage(JsonNode root) {
        JsonNode error = root.path("error");
        if (error.isObject()) {
            return textOr(error, "message", "Unknown error");
        }
        if (error.isTextual()) {
            return error.asText();
        }
        return textOr(root, "message", "Unknown error");
    }

    /**
     * Text from a string node or a list of {@code text} blocks, joined by newlines.
     */
    private String flattenText(JsonNode content) {
        if (content.isTextual()) {
            return content.asText();
        }
        if (!content.isArray()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (JsonNode block : content) {
            if (block.isTextual()) {
                parts.add(block.asText());
            } else if ("text".equals(text(block, "type"))) {
                parts.add(textOr(block, "text", ""));
            }
        }
        return String.join("\n", parts);
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private void putIfPresent(Map<String, Object> target, String key, JsonNode value) {
        if (value != null && !value.isNull()) {
            target.put(key, value.isTextual() ? value.asText() : value.toString());
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String textOr(JsonNode node, String field, String fallback) {
        String value = text(node, field);
        return value == null ? fallback : value;
    }
}
