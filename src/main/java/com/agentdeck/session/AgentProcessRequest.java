package com.agentdeck.session;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to start an agent subprocess.
 */
public record AgentProcessRequest(
    String agentId,
    Path workingDirectory,
    List<String> command,
    Map<String, String> environment
) {

    public AgentProcessRequest {
        command = List.copyOf(command);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }
}
