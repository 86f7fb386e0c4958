package com.agentdeck.dispatch.cli;

import com.agentdeck.core.model.Conversation;
import com.agentdeck.core.model.ConversationMessage;
import com.agentdeck.session.TranscriptLoadException;
import com.agentdeck.session.TranscriptLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI command: agentdeck replay &lt;transcript.jsonl&gt;
 * <p>
 * Decodes a saved transcript and prints the rebuilt conversation.
 */
@Command(name = "replay", mixinStandardHelpOptions = true, description = "Replay a transcript and summarise it")
@Component
public class ReplayCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Transcript file (JSONL)")
    private Path transcript;

    private final TranscriptLoader loader;

    public ReplayCommand(TranscriptLoader loader) {
        this.loader = loader;
    }

    @Override
    public Integer call() {
        if (!Files.isRegularFile(transcript)) {
            ConsoleOutput.error("No such file: " + transcript);
            return 2;
        }
        Conversation conversation;
        try {
            conversation = loader.load(transcript);
        } catch (TranscriptLoadException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        for (ConversationMessage message : conversation.messages()) {
            String label = message.role().name().toLowerCase(Locale.ROOT);
            if (message.compactSummary()) {
                label += " (summary)";
            }
            String body = message.content().isBlank()
                    ? message.fragments().size() + " fragment(s)"
                    : ConsoleOutput.abbreviate(message.content());
            ConsoleOutput.agent(label, body);
        }
        var invocations = conversation.toolInvocations();
        long unanswered = invocations.stream().filter(i -> i.result() == null).count();
        ConsoleOutput.info(conversation.messages().size() + " messages, " + invocations.size()
                + " tool calls (" + unanswered + " without result)");
        ConsoleOutput.usage(conversation);
        return 0;
    }
}
