package com.agentdeck.core.permission;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Configuration for the permission policy engine.
 *
 * <pre>
 * agentdeck:
 *   permissions:
 *     settings-file: .claude/settings.local.json
 *     ask-behavior: ask
 *     respect-gitignore: true
 *     hard-deny: [mcp__dart__analyze_files]
 *     auto-approved-tools: [TodoWrite, BashOutput]
 *     read-only-tools: [Read, Grep, Glob]
 *     session-cache-tools: [Write, Edit, MultiEdit]
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "agentdeck.permissions")
public class PermissionProperties {

    private String settingsFile = ".claude/settings.local.json";
    private AskBehavior askBehavior = AskBehavior.ASK;
    /** Deny Read of files the project's .gitignore excludes. */
    private boolean respectGitignore = true;
    private List<String> hardDeny = List.of();
    private List<String> autoApprovedTools = List.of("TodoWrite", "BashOutput", "KillShell", "KillBash");
    private List<String> readOnlyTools = List.of("Read", "Grep", "Glob");
    private List<String> sessionCacheTools = List.of("Write", "Edit", "MultiEdit");

    public String getSettingsFile() {
        return settingsFile;
    }

    public void setSettingsFile(String settingsFile) {
        this.settingsFile = settingsFile;
    }

    public AskBehavior getAskBehavior() {
        return askBehavior;
    }

    public void setAskBehavior(AskBehavior askBehavior) {
        this.askBehavior = askBehavior;
    }

    public List<String> getHardDeny() {
        return hardDeny;
    }

    public void setHardDeny(List<String> hardDeny) {
        this.hardDeny = hardDeny;
    }

    public List<String> getAutoApprovedTools() {
        return autoApprovedTools;
    }

    public void setAutoApprovedTools(List<String> autoApprovedTools) {
        this.autoApprovedTools = autoApprovedTools;
    }

    public List<String> getReadOnlyTools() {
        return readOnlyTools;
    }

    public void setReadOnlyTools(List<String> readOnlyTools) {
        this.readOnlyTools = readOnlyTools;
    }

    public List<String> getSessionCacheTools() {
        return sessionCacheTools;
    }

    public void setSessionCacheTools(List<String> sessionCacheTools) {
        this.sessionCacheTools = sessionCacheTools;
    }

    public boolean isRespectGitignore() {
        return respectGitignore;
    }

    public void setRespectGitignore(boolean respectGitignore) {
        this.respectGitignore = respectGitignore;
    }

    public boolean isSessionCacheTool(String toolName) {
        return sessionCacheTools.contains(toolName);
    }
}
