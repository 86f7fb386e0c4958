package com.agentdeck.dispatch.cli;

import com.agentdeck.core.events.AgentEvent;
import com.agentdeck.core.events.AgentEventType;
import com.agentdeck.core.events.EventBus;
import com.agentdeck.network.AgentNetwork;
import com.agentdeck.network.AgentNetworkManager;
import com.agentdeck.session.AgentSession;
import com.agentdeck.session.ToolPermissionGate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: agentdeck run "&lt;prompt&gt;"
 * <p>
 * Starts a network in a working directory, sends the prompt to its main agent,
 * streams the network's events and asks for tool approvals on the console until
 * the main agent's turn ends.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run an agent on a prompt")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Set<AgentEventType> TURN_END =
            Set.of(AgentEventType.DONE, AgentEventType.ERROR, AgentEventType.ABORTED);

    @Parameters(index = "0", description = "Prompt for the main agent")
    private String prompt;

    @Option(names = {"--dir", "-d"}, description = "Working directory (default: current directory)")
    private Path directory;

    @Option(names = {"--timeout"}, description = "Minutes to wait for the agent", defaultValue = "30")
    private long timeoutMinutes;

    @Option(names = {"--json"}, description = "Print events as JSON lines")
    private boolean json;

    private final AgentNetworkManager networkManager;
    private final EventBus eventBus;
    private final ToolPermissionGate permissionGate;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public RunCommand(AgentNetworkManager networkManager, EventBus eventBus, ToolPermissionGate permissionGate) {
        this.networkManager = networkManager;
        this.eventBus = eventBus;
        this.permissionGate = permissionGate;
    }

    @Override
    public Integer call() throws Exception {
        ConsoleOutput.printBanner();
        Path workingDirectory = (directory != null ? directory : Path.of("")).toAbsolutePath().normalize();

        try (ConsolePermissionPrompter prompter = new ConsolePermissionPrompter(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out)) {
            permissionGate.setPrompter(prompter);

            AgentNetwork network = networkManager.createNetwork(workingDirectory, null);
            AgentSession main = network.mainAgent();
            ConsoleOutput.info("Network " + network.id() + " in " + workingDirectory);

            CountDownLatch finished = new CountDownLatch(1);
            EventBus.Subscription subscription = eventBus.subscribe(network.id(), event -> {
                printEvent(event);
                if (TURN_END.contains(event.type()) && main.agent().agentId().equals(event.agentId())) {
                    finished.countDown();
                }
            });
            try {
                if (!main.sendMessage(prompt, List.of())) {
                    ConsoleOutput.error("Nothing to send");
                    return 2;
                }
                if (!finished.await(timeoutMinutes, TimeUnit.MINUTES)) {
                    ConsoleOutput.error("Timed out after " + timeoutMinutes + " minutes; aborting");
                    main.abort();
                    return 1;
                }
                var conversation = main.conversation();
                conversation.lastMessage().ifPresent(m -> {
                    System.out.println();
                    System.out.println(m.content());
                });
                ConsoleOutput.usage(conversation);
                return conversation.error().isPresent() ? 1 : 0;
            } finally {
                subscription.unsubscribe();
                networkManager.deleteNetwork(network.id());
            }
        } finally {
            permissionGate.setPrompter(null);
        }
    }

    private void printEvent(AgentEvent event) {
        if (json) {
            try {
                System.out.println(objectMapper.writeValueAsString(event));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Could not serialise event " + event.seq() + ": " + e.getOriginalMessage());
            }
            return;
        }
        // Streaming text is printed once the turn ends
        if (event.type() == AgentEventType.MESSAGE) {
            return;
        }
        ConsoleOutput.event(event);
    }
}
