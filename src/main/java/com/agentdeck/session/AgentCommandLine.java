package com.agentdeck.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the agent's command line. The first spawn of a session names the
 * session id; later spawns resume it so the agent keeps its history.
 */
public final class AgentCommandLine {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AgentCommandLine() {}

    public static List<String> build(SessionProperties props, String sessionId, boolean resume,
                                     Map<String, Object> mcpConfig) {
        List<String> args = new ArrayList<>();
        args.add(props.getCommand());
        args.add("--output-format=stream-json");
        args.add("--input-format=stream-json");
        args.add("--verbose");
        args.add("--permission-prompt-tool=stdio");
        if (resume) {
            args.add("--resume");
            args.add(sessionId);
        } else {
            args.add("--session-id=" + sessionId);
        }
        if (props.getModel() != null && !props.getModel().isBlank()) {
            args.add("--model");
            args.add(props.getModel());
        }
        if (mcpConfig != null && !mcpConfig.isEmpty()) {
            args.add("--mcp-config");
            args.add(toJson(mcpConfig));
        }
        args.addAll(props.getExtraArgs());
        return args;
    }

    private static String toJson(Map<String, Object> config) {
        try {
            return MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("MCP config is not serialisable", e);
        }
    }
}
