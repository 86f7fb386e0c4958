package com.agentdeck.dispatch.cli;

import com.agentdeck.core.events.EventBus;
import com.agentdeck.core.metrics.AgentDeckMetrics;
import com.agentdeck.core.permission.AllowListStore;
import com.agentdeck.core.permission.PermissionPolicyEngine;
import com.agentdeck.core.permission.PermissionProperties;
import com.agentdeck.core.protocol.ProtocolDecoder;
import com.agentdeck.network.AgentNetworkManager;
import com.agentdeck.session.AgentSessionFactory;
import com.agentdeck.session.FakeAgentProcess;
import com.agentdeck.session.FakeLauncher;
import com.agentdeck.session.SessionProperties;
import com.agentdeck.session.ToolPermissionGate;
import com.agentdeck.session.TranscriptLoader;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Tests for the AgentDeck CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, help output, and execution behavior.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path project;

    private AllowListStore store;
    private PermissionPolicyEngine engine;
    private FakeLauncher launcher;
    private AgentNetworkManager networkManager;
    private EventBus eventBus;
    private TranscriptLoader transcriptLoader;

    @BeforeEach
    void setUp() {
        PermissionProperties permissionProperties = new PermissionProperties();
        store = new AllowListStore(permissionProperties);
        engine = new PermissionPolicyEngine(permissionProperties, store, new AgentDeckMetrics(new SimpleMeterRegistry()));

        SessionProperties sessionProperties = new SessionProperties();
        sessionProperties.setClaudeHome(project.resolve(".claude-home").toString());
        ProtocolDecoder decoder = new ProtocolDecoder();
        transcriptLoader = new TranscriptLoader(decoder, sessionProperties);
        launcher = new FakeLauncher();
        eventBus = new EventBus();
        var factory = new AgentSessionFactory(sessionProperties, launcher, decoder, mock(ToolPermissionGate.class),
                eventBus, new AgentDeckMetrics(new SimpleMeterRegistry()), transcriptLoader, Map::of);
        networkManager = new AgentNetworkManager(factory, eventBus, sessionProperties);
    }

    /**
     * Custom picocli IFactory that provides test dependencies for commands.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == CheckCommand.class) {
                    return (K) new CheckCommand(engine);
                }
                if (cls == AllowCommand.class) {
                    return (K) new AllowCommand(store);
                }
                if (cls == ReplayCommand.class) {
                    return (K) new ReplayCommand(transcriptLoader);
                }
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(networkManager, eventBus, mock(ToolPermissionGate.class));
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new AgentDeckCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(CliTest.class.getResource("/streams/" + name).toURI());
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("run"), "Help should list 'run' subcommand");
            assertTrue(output.contains("check"), "Help should list 'check' subcommand");
            assertTrue(output.contains("allow"), "Help should list 'allow' subcommand");
            assertTrue(output.contains("replay"), "Help should list 'replay' subcommand");
            assertTrue(output.contains("help"), "Help should list 'help' subcommand");
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("AgentDeck 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints the banner and usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("AGENTDECK"));
            assertTrue(result.output().contains("Usage"));
        }

        @Test
        @DisplayName("run --help shows run options")
        void runHelpOutput() {
            CliResult result = execute("run", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Run an agent on a prompt"));
            assertTrue(result.output().contains("--timeout"));
        }

        @Test
        @DisplayName("run without a prompt is a usage error")
        void runWithoutPrompt() {
            CliResult result = execute("run");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
        }
    }

    @Nested
    @DisplayName("check")
    class CheckTests {

        @Test
        @DisplayName("reads inside the project are allowed with exit code 0")
        void allowsReads() {
            CliResult result = execute("check", "Read",
                    "{\"file_path\":\"" + project.resolve("src/Main.java") + "\"}", "--dir", project.toString());
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("ALLOW"));
        }

        @Test
        @DisplayName("denied commands exit with 1 and name the matching rule")
        void deniesListedCommands() throws Exception {
            Path settings = store.settingsFile(project);
            Files.createDirectories(settings.getParent());
            Files.writeString(settings, "{\"permissions\":{\"allow\":[],\"deny\":[\"Bash(rm:*)\"]}}");

            CliResult result = execute("check", "Bash", "{\"command\":\"rm -rf build\"}", "--dir", project.toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("DENY"));
            assertTrue(result.output().contains("Bash(rm:*)"));
        }

        @Test
        @DisplayName("undecided calls exit with 3 and suggest a pattern")
        void asksForUnknownCommands() {
            CliResult result = execute("check", "Bash", "{\"command\":\"make build\"}", "--dir", project.toString());
            assertEquals(CheckCommand.EXIT_ASK, result.exitCode());
            assertTrue(result.output().contains("ASK"));
            assertTrue(result.output().contains("suggested: Bash(make"));
        }

        @Test
        @DisplayName("malformed input exits with 2")
        void rejectsBadJson() {
            CliResult result = execute("check", "Bash", "{not json", "--dir", project.toString());
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("not a JSON object"));
        }
    }

    @Nested
    @DisplayName("allow")
    class AllowTests {

        @Test
        @DisplayName("adds a pattern that check then honours")
        void addsPattern() {
            CliResult added = execute("allow", "Bash(make:*)", "--dir", project.toString());
            assertEquals(0, added.exitCode());
            assertTrue(added.output().contains("Added Bash(make:*)"));

            CliResult again = execute("allow", "Bash(make:*)", "--dir", project.toString());
            assertTrue(again.output().contains("already allowed"));

            CliResult check = execute("check", "Bash", "{\"command\":\"make build\"}", "--dir", project.toString());
            assertEquals(0, check.exitCode());
        }

        @Test
        @DisplayName("--list prints the stored patterns")
        void listsPatterns() {
            execute("allow", "Bash(npm test:*)", "--dir", project.toString());

            CliResult result = execute("allow", "--list", "--dir", project.toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Bash(npm test:*)"));
        }

        @Test
        @DisplayName("an empty list says so")
        void emptyList() {
            CliResult result = execute("allow", "--dir", project.toString());
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("(empty)"));
        }

        @Test
        @DisplayName("invalid patterns exit with 2 and are not stored")
        void rejectsInvalidPattern() {
            CliResult result = execute("allow", "Bash(npm", "--dir", project.toString());
            assertEquals(2, result.exitCode());
            assertFalse(Files.exists(store.settingsFile(project)));
        }
    }

    @Nested
    @DisplayName("replay")
    class ReplayTests {

        @Test
        @DisplayName("summarises a saved transcript")
        void replaysTranscript() throws Exception {
            CliResult result = execute("replay", fixture("session.jsonl").toString());
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("There are 3 files in src."));
            assertTrue(output.contains("1 tool calls (0 without result)"));
            assertTrue(output.contains("Tokens: 150 in"));
        }

        @Test
        @DisplayName("missing files exit with 2")
        void missingFile() {
            CliResult result = execute("replay", project.resolve("nope.jsonl").toString());
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("No such file"));
        }
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("streams the main agent's turn and prints its answer")
        void runsPrompt() throws Exception {
            Thread agent = new Thread(() -> {
                try {
                    long deadline = System.currentTimeMillis() + 5000;
                    while (launcher.launchCount() == 0 && System.currentTimeMillis() < deadline) {
                        Thread.sleep(10);
                    }
                    FakeAgentProcess process = launcher.last();
                    process.emit("{\"type\":\"assistant\",\"message\":{\"id\":\"msg_1\",\"content\":"
                            + "[{\"type\":\"text\",\"text\":\"All tests pass\"}]},"
                            + "\"usage\":{\"input_tokens\":12,\"output_tokens\":4}}");
                    process.emit("{\"type\":\"result\",\"subtype\":\"success\",\"total_cost_usd\":0.02}");
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            agent.start();

            CliResult result = execute("run", "Run the tests", "--dir", project.toString(), "--timeout", "1");
            agent.join(5000);

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("All tests pass"));
            assertTrue(result.output().contains("done"));
            assertTrue(result.output().contains("Tokens: 12 in, 4 out"));
            assertTrue(networkManager.networks().isEmpty());
        }
    }
}
