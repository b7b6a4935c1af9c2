package com.agentdock.core.git;

import com.agentdock.core.config.AgentdockProperties;
import com.agentdock.core.events.EventLog;
import com.agentdock.core.events.TaskEvent;
import com.agentdock.core.logging.SensitiveData;
import com.agentdock.core.model.RepoEntry;
import com.agentdock.core.model.RepoKind;
import com.agentdock.core.model.Task;
import com.agentdock.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Materializes an isolated working copy for one repository of a task.
 *
 * <p>Local sources get a linked worktree on a task branch; git URLs are cloned and the
 * task branch is checked out. Either way the working copy lives at
 * {@code <storageRoot>/<taskId>/repos/<repoId>/workdir} and is never shared.
 */
public class WorkspacePreparer {

    private static final Logger log = LoggerFactory.getLogger(WorkspacePreparer.class);

    static final String BRANCH_PREFIX = "agentdock/";
    static final int MAX_BRANCH_LENGTH = 120;

    private final GitCli git;
    private final TaskStore store;
    private final EventLog eventLog;
    private final AgentdockProperties properties;

    public WorkspacePreparer(GitCli git, TaskStore store, EventLog eventLog, AgentdockProperties properties) {
        this.git = git;
        this.store = store;
        this.eventLog = eventLog;
        this.properties = properties;
    }

    /**
     * Prepares the repository's working copy and records branch, workdir and diff paths
     * on the entry. Emits {@code repo_status} progress events but not {@code ready};
     * the caller decides what happens next.
     *
     * @throws GitCommandException      if a git step fails
     * @throws IllegalArgumentException for a missing URL or unknown repository type
     */
    public void prepare(Task task, RepoEntry repo) {
        String taskId = task.getId();
        String repoId;
        RepoKind type;
        String path;
        String url;
        Path workdir;
        String branch;

        synchronized (task) {
            repoId = repo.getId();
            type = repo.getType();
            path = repo.getPath();
            url = repo.getUrl();
            workdir = store.workdir(taskId, repoId);
            branch = branchName(taskId, repoId);
            repo.setWorkdir(workdir.toString());
            repo.setDiffFile(store.diffFile(taskId, repoId).toString());
            repo.setBranch(branch);
        }

        Path repoRoot = store.repoRoot(taskId, repoId);
        try {
            Files.createDirectories(repoRoot);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create " + repoRoot, e);
        }

        if (type == RepoKind.LOCAL) {
            prepareLocal(task, repoId, path, branch, workdir);
        } else if (type == RepoKind.GIT) {
            prepareClone(task, repo, repoId, url, branch, workdir, repoRoot);
        } else {
            throw new IllegalArgumentException("invalid_repo_type");
        }
        git.configureIdentity(workdir);
    }

    private void prepareLocal(Task task, String repoId, String path, String branch, Path workdir) {
        String src = path != null && !path.isBlank() ? path.trim() : properties.getWorkspaceDir();
        eventLog.append(task, TaskEvent.REPO_STATUS, repoId, Map.of("status", "worktree_create", "src", src));
        log.info("Creating worktree {} on branch '{}' from {}", workdir, branch, src);
        git.runChecked(Path.of(src), "worktree", "add", "-B", branch, workdir.toString());
    }

    private void prepareClone(Task task, RepoEntry repo, String repoId, String url, String branch,
                              Path workdir, Path repoRoot) {
        String cloneUrl = url != null ? url.trim() : "";
        if (cloneUrl.isEmpty()) {
            throw new IllegalArgumentException("missing_repo_url");
        }
        // With only a token available, SSH remotes are switched to https so askpass can authenticate.
        if (properties.hasGithubToken()) {
            Optional<GitHubRemote> remote = GitHubRemote.parse(cloneUrl);
            if (remote.isPresent()) {
                cloneUrl = remote.get().httpsUrl();
            }
        }
        synchronized (task) {
            repo.setUrl(cloneUrl);
        }

        String maskedUrl = SensitiveData.mask(cloneUrl);
        eventLog.append(task, TaskEvent.REPO_STATUS, repoId, Map.of("status", "clone", "url", maskedUrl));
        log.info("Cloning {} into {}", maskedUrl, workdir);
        git.runChecked(repoRoot, "clone", cloneUrl, workdir.toString());
        git.runChecked(workdir, "checkout", "-B", branch);
    }

    /**
     * Task branch for a repository: {@code agentdock/<taskId>/<repoId>}, capped then sanitized.
     */
    static String branchName(String taskId, String repoId) {
        String raw = BRANCH_PREFIX + taskId + "/" + repoId;
        if (raw.length() > MAX_BRANCH_LENGTH) {
            raw = raw.substring(0, MAX_BRANCH_LENGTH);
        }
        return sanitizeBranchName(raw);
    }

    static String sanitizeBranchName(String input) {
        String branch = (input == null ? "" : input).trim()
                .replaceAll("\\s+", "-")
                .replaceAll("[^a-zA-Z0-9._/-]", "-")
                .replaceAll("-+", "-")
                .replaceAll("/+", "/")
                .replaceAll("^-+", "")
                .replaceAll("-+$", "");
        return branch.isEmpty() ? "agentdock" : branch;
    }
}
