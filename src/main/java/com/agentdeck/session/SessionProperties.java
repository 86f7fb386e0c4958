package com.agentdeck.session;

import com.agentdeck.core.conversation.CumulativeResetPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for agent sessions and the subprocess each one runs.
 */
@Component
@ConfigurationProperties(prefix = "agentdeck.session")
public class SessionProperties {

    private String command = "claude";
    private List<String> extraArgs = new ArrayList<>();
    private String model = "";
    private Duration abortGracePeriod = Duration.ofSeconds(2);
    private Duration permissionTimeout = Duration.ofMinutes(5);
    private String claudeHome = Path.of(System.getProperty("user.home"), ".claude").toString();
    private CumulativeResetPolicy cumulativeReset = CumulativeResetPolicy.SEGMENT;
    private String spawnToolName = "mcp__agentdeck-agent__spawnAgent";

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }

    public List<String> getExtraArgs() {
        return extraArgs;
    }

    public void setExtraArgs(List<String> extraArgs) {
        this.extraArgs = extraArgs;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public Duration getAbortGracePeriod() {
        return abortGracePeriod;
    }

    public void setAbortGracePeriod(Duration abortGracePeriod) {
        this.abortGracePeriod = abortGracePeriod;
    }

    public Duration getPermissionTimeout() {
        return permissionTimeout;
    }

    public void setPermissionTimeout(Duration permissionTimeout) {
        this.permissionTimeout = permissionTimeout;
    }

    public String getClaudeHome() {
        return claudeHome;
    }

    public void setClaudeHome(String claudeHome) {
        this.claudeHome = claudeHome;
    }

    public CumulativeResetPolicy getCumulativeReset() {
        return cumulativeReset;
    }

    public void setCumulativeReset(CumulativeResetPolicy cumulativeReset) {
        this.cumulativeReset = cumulativeReset;
    }

    public String getSpawnToolName() {
        return spawnToolName;
    }

    public void setSpawnToolName(String spawnToolName) {
        this.spawnToolName = spawnToolName;
    }
}
