package com.agentdeck.core.permission;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Durable per-project allow and deny lists, stored in the project's local
 * settings file as {@code {"permissions":{"allow":[],"deny":[],"ask":[]}}}.
 * <p>
 * Sessions read concurrently under a shared lock. Appends are serialized per
 * project, skip duplicates, keep unrelated settings, and replace the file atomically.
 * The parsed lists are cached and reloaded when the file changes on disk.
 */
@Service
public class AllowListStore {

    private static final Logger log = LoggerFactory.getLogger(AllowListStore.class);

    private final PermissionProperties properties;
    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<Path, ProjectRules> projects = new ConcurrentHashMap<>();

    public AllowListStore(PermissionProperties properties) {
        this.properties = properties;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Parsed rules of one project. Invalid stored patterns are logged and left out.
     */
    public record Rules(List<String> allowText, List<PermissionPattern> allow, List<PermissionPattern> deny) {
        static final Rules EMPTY = new Rules(List.of(), List.of(), List.of());
    }

    public Path settingsFile(Path projectRoot) {
        return projectRoot.resolve(properties.getSettingsFile()).normalize();
    }

    public Rules rules(Path projectRoot) {
        ProjectRules project = projectFor(projectRoot);
        project.lock.readLock().lock();
        try {
            if (!project.isStale()) {
                return project.rules;
            }
        } finally {
            project.lock.readLock().unlock();
        }
        project.lock.writeLock().lock();
        try {
            if (project.isStale()) {
                project.reload();
            }
            return project.rules;
        } finally {
            project.lock.writeLock().unlock();
        }
    }

    public List<PermissionPattern> allowPatterns(Path projectRoot) {
        return rules(projectRoot).allow();
    }

    public List<PermissionPattern> denyPatterns(Path projectRoot) {
        return rules(projectRoot).deny();
    }

    /**
     * Appends a pattern to the project's allow list.
     *
     * @return true if the pattern was added, false if it was already present or could not be written
     * @throws InvalidPermissionPatternException if the pattern text is invalid
     */
    public boolean addAllow(Path projectRoot, String patternText) {
        PermissionPattern pattern = PermissionPattern.parse(patternText);
        ProjectRules project = projectFor(projectRoot);
        project.lock.writeLock().lock();
        try {
            ObjectNode root = readRoot(project.file).orElseGet(objectMapper::createObjectNode);
            ObjectNode permissions = root.has("permissions") && root.get("permissions").isObject()
                    ? (ObjectNode) root.get("permissions")
                    : root.putObject("permissions");
            ArrayNode allow = arrayField(permissions, "allow");
            arrayField(permissions, "deny");
            arrayField(permissions, "ask");
            for (JsonNode existing : allow) {
                if (pattern.source().equals(existing.asText())) {
                    return false;
                }
            }
            allow.add(pattern.source());
            writeAtomically(project.file, root);
            project.reload();
            log.info("Added '{}' to allow list {}", pattern.source(), project.file);
            return true;
        } catch (IOException e) {
            log.error("Failed to persist permission pattern '{}' to {}: {}", patternText, project.file, e.getMessage());
            return false;
        } finally {
            project.lock.writeLock().unlock();
        }
    }

    private ProjectRules projectFor(Path projectRoot) {
        return projects.computeIfAbsent(projectRoot.toAbsolutePath().normalize(),
                root -> new ProjectRules(settingsFile(root)));
    }

    private Optional<ObjectNode> readRoot(Path file) throws IOException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        JsonNode node = objectMapper.readTree(file.toFile());
        return node != null && node.isObject() ? Optional.of((ObjectNode) node) : Optional.empty();
    }

    private void writeAtomically(Path file, ObjectNode root) throws IOException {
        Files.createDirectories(file.getParent());
        Path temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), root);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static ArrayNode arrayField(ObjectNode parent, String name) {
        JsonNode existing = parent.get(name);
        if (existing != null && existing.isArray()) {
            return (ArrayNode) existing;
        }
        return parent.putArray(name);
    }

    private static List<String> texts(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array != null && array.isArray()) {
            array.forEach(n -> values.add(n.asText()));
        }
        return values;
    }

    private static List<PermissionPattern> parseAll(List<String> texts) {
        List<PermissionPattern> patterns = new ArrayList<>();
        for (String text : texts) {
            PermissionPattern.tryParse(text).ifPresent(patterns::add);
        }
        return List.copyOf(patterns);
    }

    private final class ProjectRules {

        final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        final Path file;
        Rules rules = Rules.EMPTY;
        FileStamp loaded;

        ProjectRules(Path file) {
            this.file = file;
        }

        boolean isStale() {
            return !FileStamp.of(file).equals(loaded);
        }

        void reload() {
            FileStamp stamp = FileStamp.of(file);
            try {
                Optional<ObjectNode> root = readRoot(file);
                JsonNode permissions = root.map(r -> r.path("permissions")).orElse(null);
                if (permissions == null) {
                    rules = Rules.EMPTY;
                } else {
                    List<String> allowText = texts(permissions.get("allow"));
                    rules = new Rules(List.copyOf(allowText), parseAll(allowText), parseAll(texts(permissions.get("deny"))));
                }
            } catch (IOException e) {
                // Unreadable settings grant nothing
                log.warn("Could not read permission settings {}: {}", file, e.getMessage());
                rules = Rules.EMPTY;
            }
            loaded = stamp;
        }
    }
}
