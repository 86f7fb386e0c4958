package com.agentdeck.core.permission;

import com.agentdeck.core.metrics.AgentDeckMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides whether a tool invocation may run without asking a human.
 * <p>
 * Rules are checked in order: hard-denied tools, reads of git-ignored files, internal
 * tools, the project's deny list, read-only tools, safe shell commands, the session
 * cache, the project's allow list, and finally the configured fallback (normally {@code ask}).
 * A compound shell command is allowed only when each of its commands is.
 */
@Service
public class PermissionPolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PermissionPolicyEngine.class);

    private final PermissionProperties properties;
    private final AllowListStore allowListStore;
    private final AgentDeckMetrics metrics;
    private final ConcurrentHashMap<Path, GitIgnoreMatcher> gitIgnores = new ConcurrentHashMap<>();

    public PermissionPolicyEngine(PermissionProperties properties, AllowListStore allowListStore,
                                  AgentDeckMetrics metrics) {
        this.properties = properties;
        this.allowListStore = allowListStore;
        this.metrics = metrics;
    }

    public PermissionDecision checkPermission(PermissionScope scope, String toolName, Map<String, Object> toolInput) {
        PermissionDecision decision = evaluate(scope, new ToolInput(toolName, toolInput));
        metrics.recordPermissionDecision(decision.behavior().name(), decision.source().name());
        log.debug("Permission for {}: {} ({})", toolName, decision.behavior(), decision.reason());
        return decision;
    }

    private PermissionDecision evaluate(PermissionScope scope, ToolInput input) {
        String toolName = input.toolName();
        if (properties.getHardDeny().contains(toolName)) {
            return PermissionDecision.deny(toolName + " is not permitted", DecisionSource.HARD_DENY, null);
        }
        if (properties.isRespectGitignore() && "Read".equals(toolName)
                && gitIgnore(scope.projectRoot()).isIgnored(input.filePath())) {
            return PermissionDecision.deny("Blocked by .gitignore", DecisionSource.GITIGNORE, null);
        }
        if (properties.getAutoApprovedTools().contains(toolName)) {
            return PermissionDecision.allow("Internal tool", DecisionSource.INTERNAL_TOOL, null);
        }

        AllowListStore.Rules rules = allowListStore.rules(scope.projectRoot());
        PermissionPattern denied = PermissionPolicy.firstMatch(input, rules.deny());
        if (denied != null) {
            return PermissionDecision.deny("Denied by " + denied.source(), DecisionSource.DENY_LIST, denied);
        }

        if (properties.getReadOnlyTools().contains(toolName) && !hasTraversal(input)) {
            return PermissionDecision.allow("Read-only tool", DecisionSource.READ_ONLY_TOOL, null);
        }

        String command = input.grammar() == ToolGrammar.BASH ? input.string("command") : null;
        if (command != null && isSafeCommand(command, scope)) {
            return PermissionDecision.allow("Read-only command", DecisionSource.SAFE_COMMAND, null);
        }

        PermissionPattern cached = PermissionPolicy.firstMatch(input, scope.sessionCache().patterns());
        if (cached != null) {
            return PermissionDecision.allow("Approved earlier in this session", DecisionSource.SESSION_CACHE, cached);
        }
        PermissionDecision listed = PermissionPolicy.checkPermission(toolName, input.values(), rules.allow());
        if (listed.isAllowed()) {
            return listed;
        }

        if (command != null) {
            List<PermissionPattern> all = new ArrayList<>(scope.sessionCache().patterns());
            all.addAll(rules.allow());
            if (isCompoundAllowed(command, scope, all)) {
                return PermissionDecision.allow("Every command is allowed", DecisionSource.ALLOW_LIST, null);
            }
        }

        String suggestion = listed.suggestedPattern();
        return switch (properties.getAskBehavior()) {
            case ASK -> PermissionDecision.ask("No rule allows " + toolName, suggestion);
            case DENY -> PermissionDecision.deny("No rule allows " + toolName, DecisionSource.ASK_FALLBACK, null);
            case ALLOW -> PermissionDecision.allow("Unattended run", DecisionSource.ASK_FALLBACK, null);
        };
    }

    /**
     * Stores the pattern for an approved invocation.
     * Session scope, and write-class tools under any scope, go to the session cache;
     * everything else approved with {@link RememberScope#ALWAYS} goes to the project allow list.
     *
     * @param patternText the pattern to store, or null to infer one from the invocation
     * @return the stored pattern, if any
     */
    public Optional<PermissionPattern> remember(PermissionScope scope, RememberScope rememberScope,
                                                String toolName, Map<String, Object> toolInput, String patternText) {
        if (rememberScope == null || rememberScope == RememberScope.ONCE) {
            return Optional.empty();
        }
        String text = patternText != null && !patternText.isBlank()
                ? patternText
                : PatternInference.inferPattern(new ToolInput(toolName, toolInput));
        Optional<PermissionPattern> pattern = PermissionPattern.tryParse(text);
        if (pattern.isEmpty()) {
            return Optional.empty();
        }
        if (rememberScope == RememberScope.SESSION || properties.isSessionCacheTool(toolName)) {
            scope.sessionCache().add(pattern.get());
            log.info("Remembered '{}' for this session", text);
        } else {
            allowListStore.addAllow(scope.projectRoot(), text);
        }
        return pattern;
    }

    private GitIgnoreMatcher gitIgnore(Path projectRoot) {
        return gitIgnores.compute(projectRoot.toAbsolutePath().normalize(),
                (root, current) -> current == null || current.isStale() ? GitIgnoreMatcher.load(root) : current);
    }

    private boolean hasTraversal(ToolInput input) {
        String path = input.filePath() != null ? input.filePath() : input.string("path");
        return path != null && PathGlob.containsTraversal(path);
    }

    private boolean isSafeCommand(String command, PermissionScope scope) {
        var parts = BashCommandParser.parse(command);
        if (parts.isEmpty()) {
            return false;
        }
        for (var part : parts) {
            if (!isHarmless(part, scope) && !SafeCommands.isCommandSafe(part.command())) {
                return false;
            }
        }
        return true;
    }

    private boolean isCompoundAllowed(String command, PermissionScope scope, List<PermissionPattern> patterns) {
        var parts = BashCommandParser.parse(command);
        if (parts.size() < 2) {
            return false;
        }
        for (var part : parts) {
            if (isHarmless(part, scope) || SafeCommands.isCommandSafe(part.command())) {
                continue;
            }
            ToolInput single = new ToolInput("Bash", Map.of("command", part.command()));
            if (PermissionPolicy.firstMatch(single, patterns) == null) {
                return false;
            }
        }
        return true;
    }

    private boolean isHarmless(BashCommandParser.ParsedCommand part, PermissionScope scope) {
        return switch (part.type()) {
            case CD -> scope.workingDirectory() != null
                    && BashCommandParser.isCdWithinWorkingDir(part.command(), scope.workingDirectory().toString());
            case PIPELINE_PART -> SafeCommands.isSafeOutputFilter(part.command());
            case SIMPLE -> false;
        };
    }
}
