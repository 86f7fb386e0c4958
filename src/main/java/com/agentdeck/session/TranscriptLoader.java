package com.agentdeck.session;

import com.agentdeck.core.conversation.ConversationStateMachine;
import com.agentdeck.core.model.Conversation;
import com.agentdeck.core.protocol.DecodedLine;
import com.agentdeck.core.protocol.ProtocolDecoder;
import com.agentdeck.core.protocol.ResponseFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds a conversation from the agent's persisted JSONL transcript.
 */
@Component
public class TranscriptLoader {

    private static final Logger log = LoggerFactory.getLogger(TranscriptLoader.class);

    private final ProtocolDecoder decoder;
    private final SessionProperties properties;

    public TranscriptLoader(ProtocolDecoder decoder, SessionProperties properties) {
        this.decoder = decoder;
        this.properties = properties;
    }

    /**
     * {@code <claude-home>/projects/<working dir with / and _ as ->/<sessionId>.jsonl}
     */
    public Path transcriptPath(Path workingDirectory, String sessionId) {
        String encoded = workingDirectory.toAbsolutePath().normalize().toString()
                .replace('/', '-')
                .replace('_', '-');
        return Path.of(properties.getClaudeHome(), "projects", encoded, sessionId + ".jsonl");
    }

    /**
     * Loads the transcript of a session, if one was written.
     *
     * @throws TranscriptLoadException if the file exists but cannot be read
     */
    public Optional<Conversation> load(Path workingDirectory, String sessionId) {
        Path file = transcriptPath(workingDirectory, sessionId);
        if (!Files.isRegularFile(file)) {
            log.debug("No transcript at {}", file);
            return Optional.empty();
        }
        return Optional.of(load(file));
    }

    /**
     * Replays a transcript file. Every message comes back complete and the
     * conversation ends idle.
     *
     * @throws TranscriptLoadException if the file cannot be read
     */
    public Conversation load(Path file) {
        ConversationStateMachine machine = new ConversationStateMachine(properties.getCumulativeReset());
        int lines = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                lines++;
                DecodedLine decoded = decoder.decode(line);
                List<ResponseFragment> kept = decoded.fragments().stream()
                        .filter(TranscriptLoader::belongsInHistory)
                        .toList();
                machine.apply(new DecodedLine(kept, decoded.usage(), decoded.messageId(), decoded.sessionId(), null));
            }
        } catch (IOException e) {
            throw new TranscriptLoadException("Failed to read transcript " + file + ": " + e.getMessage(), e);
        }
        Conversation conversation = machine.finalizeAll();
        log.info("Loaded {} messages from {} lines of {}", conversation.messages().size(), lines, file);
        return conversation;
    }

    // Transcripts also hold bookkeeping entries that never were conversation
    private static boolean belongsInHistory(ResponseFragment fragment) {
        return switch (fragment.kind()) {
            case UNKNOWN, STATUS, META -> false;
            default -> true;
        };
    }
}
