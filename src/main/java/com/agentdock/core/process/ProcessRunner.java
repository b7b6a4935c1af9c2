package com.agentdock.core.process;

import com.agentdock.core.config.AgentdockProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Launches agent commands through a login shell in a repository's working copy.
 */
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    private final AgentdockProperties properties;

    public ProcessRunner(AgentdockProperties properties) {
        this.properties = properties;
    }

    /**
     * Starts {@code <shell> -lc <command>} in {@code workdir} with the inherited environment.
     * Output and exit are reported to {@code listener}; stdin stays open for later input.
     */
    public RunningProcess start(Path workdir, String command, String taskId, String repoId,
                                ProcessOutputListener listener) throws IOException {
        List<String> argv = List.of(properties.getShell(), "-lc", command);
        Process process = new ProcessBuilder(argv)
                .directory(workdir.toFile())
                .redirectErrorStream(false)
                .start();
        log.info("Started '{}' for repo {} (pid {})", command, repoId, process.pid());

        RunningProcess running = new RunningProcess(process, taskId, repoId, listener);
        running.startPumps();
        return running;
    }
}
