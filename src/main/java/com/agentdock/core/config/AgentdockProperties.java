package com.agentdock.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Environment-provided settings for the orchestrator.
 * Bound from {@code agentdock.*}; see {@code application.yml} for the environment variable mapping.
 */
@Component
@ConfigurationProperties(prefix = "agentdock")
public class AgentdockProperties {

    private String workspaceDir = "/workspace";
    private String agentDir;
    private String defaultCommand = "codex";
    private String shell = "bash";
    private long maxJsonBytes = 1024 * 1024;
    private Git git = new Git();
    private Github github = new Github();
    private Sse sse = new Sse();

    /** Directory holding the askpass helper and the task store; defaults under the workspace. */
    public Path getAgentPath() {
        if (agentDir != null && !agentDir.isBlank()) {
            return Path.of(agentDir);
        }
        return Path.of(workspaceDir, ".agentdock", "agent");
    }

    /** Root of the persistent store: one subdirectory per task. */
    public Path getStorageRoot() {
        return getAgentPath().resolve("tasks");
    }

    public boolean hasGithubToken() {
        return github.token != null && !github.token.isBlank();
    }

    public String getWorkspaceDir() { return workspaceDir; }
    public void setWorkspaceDir(String workspaceDir) { this.workspaceDir = workspaceDir; }
    public String getAgentDir() { return agentDir; }
    public void setAgentDir(String agentDir) { this.agentDir = agentDir; }
    public String getDefaultCommand() { return defaultCommand; }
    public void setDefaultCommand(String defaultCommand) { this.defaultCommand = defaultCommand; }
    public String getShell() { return shell; }
    public void setShell(String shell) { this.shell = shell; }
    public long getMaxJsonBytes() { return maxJsonBytes; }
    public void setMaxJsonBytes(long maxJsonBytes) { this.maxJsonBytes = maxJsonBytes; }
    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }
    public Github getGithub() { return github; }
    public void setGithub(Github github) { this.github = github; }
    public Sse getSse() { return sse; }
    public void setSse(Sse sse) { this.sse = sse; }

    public static class Git {
        private String authorName = "agentdock";
        private String authorEmail = "agentdock@local";

        public String getAuthorName() { return authorName; }
        public void setAuthorName(String authorName) { this.authorName = authorName; }
        public String getAuthorEmail() { return authorEmail; }
        public void setAuthorEmail(String authorEmail) { this.authorEmail = authorEmail; }
    }

    public static class Github {
        private String token = "";
        private String apiUrl = "https://api.github.com";

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token != null ? token.trim() : ""; }
        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }

        @Override
        public String toString() {
            // Never render the token.
            return "Github{apiUrl=" + apiUrl + ", token=" + (token.isBlank() ? "<none>" : "***") + "}";
        }
    }

    public static class Sse {
        private long pingSeconds = 15;
        private long timeoutMinutes = 30;

        public long getPingSeconds() { return pingSeconds; }
        public void setPingSeconds(long pingSeconds) { this.pingSeconds = pingSeconds; }
        public long getTimeoutMinutes() { return timeoutMinutes; }
        public void setTimeoutMinutes(long timeoutMinutes) { this.timeoutMinutes = timeoutMinutes; }
    }
}
