package com.agentdeck.dispatch.cli;

import com.agentdeck.core.permission.PermissionDecision;
import com.agentdeck.core.permission.PermissionPolicyEngine;
import com.agentdeck.core.permission.PermissionScope;
import com.agentdeck.core.permission.SessionPermissionCache;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: agentdeck check &lt;tool&gt; '&lt;json-input&gt;'
 * <p>
 * Shows what the policy would decide for a tool call in a project.
 * Exit code 0 means allow, 1 deny, 3 ask.
 */
@Command(name = "check", mixinStandardHelpOptions = true, description = "Evaluate the permission policy for a tool call")
@Component
public class CheckCommand implements Callable<Integer> {

    static final int EXIT_ASK = 3;

    @Parameters(index = "0", description = "Tool name, e.g. Bash")
    private String toolName;

    @Parameters(index = "1", defaultValue = "{}", description = "Tool input as a JSON object")
    private String input;

    @Option(names = {"--dir", "-d"}, description = "Project directory (default: current directory)")
    private Path directory;

    private final PermissionPolicyEngine engine;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public CheckCommand(PermissionPolicyEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        Map<String, Object> toolInput;
        try {
            toolInput = objectMapper.readValue(input, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Tool input is not a JSON object: " + e.getOriginalMessage());
            return 2;
        }
        Path project = (directory != null ? directory : Path.of("")).toAbsolutePath().normalize();
        PermissionDecision decision = engine.checkPermission(
                PermissionScope.of(project, new SessionPermissionCache()), toolName, toolInput);
        ConsoleOutput.decision(decision);
        return switch (decision.behavior()) {
            case ALLOW -> 0;
            case DENY -> 1;
            case ASK -> EXIT_ASK;
        };
    }
}
