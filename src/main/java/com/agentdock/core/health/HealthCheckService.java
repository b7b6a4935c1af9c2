package com.agentdock.core.health;

import com.agentdock.core.config.AgentdockProperties;
import com.agentdock.core.git.GitCli;
import com.agentdock.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final TaskStore store;
    private final GitCli git;
    private final AgentdockProperties properties;

    public HealthCheckService(TaskStore store, GitCli git, AgentdockProperties properties) {
        this.store = store;
        this.git = git;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStorage());
        results.add(checkGit());
        results.add(checkGithubToken());
        return results;
    }

    private HealthStatus checkStorage() {
        var root = store.root();
        try {
            Files.createDirectories(root);
            if (Files.isWritable(root)) {
                return new HealthStatus("storage", HealthStatus.Status.UP,
                        "Task store writable", Map.of("path", root.toString()));
            }
            return new HealthStatus("storage", HealthStatus.Status.DOWN,
                    "Task store not writable", Map.of("path", root.toString()));
        } catch (Exception e) {
            log.warn("Storage health check failed: {}", e.getMessage());
            return new HealthStatus("storage", HealthStatus.Status.DOWN,
                    "Storage error: " + e.getMessage(), Map.of("path", root.toString()));
        }
    }

    private HealthStatus checkGit() {
        if (git.isAvailable()) {
            return new HealthStatus("git", HealthStatus.Status.UP, "git binary available", Map.of());
        }
        return new HealthStatus("git", HealthStatus.Status.DOWN, "git binary not found", Map.of());
    }

    private HealthStatus checkGithubToken() {
        if (properties.hasGithubToken()) {
            return new HealthStatus("github", HealthStatus.Status.UP,
                    "GitHub token configured", Map.of("apiUrl", properties.getGithub().getApiUrl()));
        }
        return new HealthStatus("github", HealthStatus.Status.DEGRADED,
                "No GitHub token; promotion pushes without opening pull requests", Map.of());
    }
}
