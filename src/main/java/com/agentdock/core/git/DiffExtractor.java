package com.agentdock.core.git;

import com.agentdock.core.events.EventLog;
import com.agentdock.core.events.TaskEvent;
import com.agentdock.core.model.RepoEntry;
import com.agentdock.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Captures a repository's working-copy changes (tracked and untracked) as a unified diff
 * and stores it as the repository's diff artifact.
 *
 * <p>Changes are staged only long enough to diff them; the index is reset afterwards,
 * so running the extractor twice without edits yields the same patch.
 */
public class DiffExtractor {

    private static final Logger log = LoggerFactory.getLogger(DiffExtractor.class);

    private final GitCli git;
    private final EventLog eventLog;

    public DiffExtractor(GitCli git, EventLog eventLog) {
        this.git = git;
        this.eventLog = eventLog;
    }

    /**
     * Extracts the diff and emits {@code diff_ready} or {@code diff_error}.
     * Never changes the repository's run status.
     *
     * @return true when the artifact was written
     */
    public boolean extract(Task task, RepoEntry repo) {
        String repoId;
        String workdir;
        String diffFile;
        synchronized (task) {
            repoId = repo.getId();
            workdir = repo.getWorkdir();
            diffFile = repo.getDiffFile();
        }
        if (workdir == null || diffFile == null) {
            return false;
        }

        Path dir = Path.of(workdir);
        try {
            String patch = capture(dir);
            Files.writeString(Path.of(diffFile), patch, StandardCharsets.UTF_8);
            long bytes = patch.getBytes(StandardCharsets.UTF_8).length;
            log.debug("Captured {} byte diff for repo {}", bytes, repoId);
            eventLog.append(task, TaskEvent.DIFF_READY, repoId, Map.of("bytes", bytes));
            return true;
        } catch (GitCommandException | IOException e) {
            log.warn("Diff extraction failed for repo {}: {}", repoId, e.getMessage());
            String message = e.getMessage() != null ? e.getMessage() : "diff_failed";
            eventLog.append(task, TaskEvent.DIFF_ERROR, repoId, Map.of("message", message));
            return false;
        }
    }

    String capture(Path dir) {
        git.runChecked(dir, "add", "-A");
        try {
            return git.runChecked(dir, "diff", "--cached", "--no-color").stdout();
        } finally {
            GitResult reset = git.run(dir, "reset", "-q");
            if (!reset.isSuccess()) {
                log.debug("git reset after diff failed in {} (exit code {})", dir, reset.exitCode());
            }
        }
    }
}
