package com.agentdeck.core.protocol;

import com.agentdeck.core.model.Attachment;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the JSON lines the supervisor writes to the agent's stdin.
 */
public class ControlProtocol {

    private final ObjectMapper objectMapper;

    public ControlProtocol() {
        this(new ObjectMapper());
    }

    public ControlProtocol(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * A user turn. Plain text goes out as a string; attachments turn the
     * content into a block list.
     */
    public String userMessage(String text, List<Attachment> attachments) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("type", "user");
        ObjectNode message = root.putObject("message");
        message.put("role", "user");
        if (attachments == null || attachments.isEmpty()) {
            message.put("content", text == null ? "" : text);
        } else {
            ArrayNode content = message.putArray("content");
            if (text != null && !text.isBlank()) {
                content.addObject().put("type", "text").put("text", text);
            }
            for (Attachment attachment : attachments) {
                if (attachment.kind() == Attachment.Kind.IMAGE) {
                    ObjectNode image = content.addObject().put("type", "image");
                    image.putObject("source")
                            .put("type", "base64")
                            .put("media_type", attachment.mimeType())
                            .put("data", attachment.content());
                } else {
                    content.addObject().put("type", "text").put("text", attachment.content());
                }
            }
        }
        return write(root);
    }

    public String allow(String requestId, Map<String, Object> updatedInput) {
        ObjectNode decision = objectMapper.createObjectNode();
        decision.put("behavior", "allow");
        decision.set("updatedInput", objectMapper.valueToTree(updatedInput == null ? Map.of() : updatedInput));
        return success(requestId, decision);
    }

    public String deny(String requestId, String message) {
        ObjectNode decision = objectMapper.createObjectNode();
        decision.put("behavior", "deny");
        decision.put("message", message);
        return success(requestId, decision);
    }

    public String error(String requestId, String message) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("type", "control_response");
        root.putObject("response")
                .put("subtype", "error")
                .put("request_id", requestId)
                .put("error", message);
        return write(root);
    }

    public String interrupt() {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("type", "control_request");
        root.put("request_id", "req_" + UUID.randomUUID());
        root.putObject("request").put("subtype", "interrupt");
        return write(root);
    }

    private String success(String requestId, ObjectNode decision) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("type", "control_response");
        ObjectNode response = root.putObject("response");
        response.put("subtype", "success");
        response.put("request_id", requestId);
        response.set("response", decision);
        return write(root);
    }

    private String write(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise control message", e);
        }
    }
}
