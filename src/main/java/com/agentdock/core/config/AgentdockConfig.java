package com.agentdock.core.config;

import com.agentdock.core.events.EventLog;
import com.agentdock.core.git.DiffExtractor;
import com.agentdock.core.git.GitCli;
import com.agentdock.core.git.PromotionService;
import com.agentdock.core.git.WorkspacePreparer;
import com.agentdock.core.github.GitHubClient;
import com.agentdock.core.process.ProcessRunner;
import com.agentdock.core.store.TaskStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the task store, git tooling and process runner.
 */
@Configuration
public class AgentdockConfig {

    private static final Logger log = LoggerFactory.getLogger(AgentdockConfig.class);

    @Bean
    public TaskStore taskStore(AgentdockProperties properties, ObjectMapper objectMapper) {
        log.info("Task store at {}", properties.getStorageRoot());
        return new TaskStore(properties.getStorageRoot(), objectMapper);
    }

    @Bean
    public EventLog eventLog(TaskStore taskStore) {
        return new EventLog(taskStore);
    }

    @Bean
    public GitCli gitCli(AgentdockProperties properties) {
        return new GitCli(properties);
    }

    @Bean
    public GitHubClient gitHubClient(AgentdockProperties properties, ObjectMapper objectMapper) {
        return new GitHubClient(properties, objectMapper);
    }

    @Bean
    public WorkspacePreparer workspacePreparer(GitCli gitCli, TaskStore taskStore, EventLog eventLog,
                                               AgentdockProperties properties) {
        return new WorkspacePreparer(gitCli, taskStore, eventLog, properties);
    }

    @Bean
    public DiffExtractor diffExtractor(GitCli gitCli, EventLog eventLog) {
        return new DiffExtractor(gitCli, eventLog);
    }

    @Bean
    public PromotionService promotionService(GitCli gitCli, GitHubClient gitHubClient, EventLog eventLog,
                                             AgentdockProperties properties) {
        return new PromotionService(gitCli, gitHubClient, eventLog, properties);
    }

    @Bean
    public ProcessRunner processRunner(AgentdockProperties properties) {
        return new ProcessRunner(properties);
    }

    /**
     * Runs repository preparation off the request thread. Unbounded: tasks start immediately.
     */
    @Bean(name = "orchestratorExecutor", destroyMethod = "shutdownNow")
    public ExecutorService orchestratorExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "agentdock-task-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }
}
