package com.agentdock.core.git;

import com.agentdock.core.config.AgentdockProperties;
import com.agentdock.core.events.EventLog;
import com.agentdock.core.events.TaskEvent;
import com.agentdock.core.github.GitHubClient;
import com.agentdock.core.github.PullRequest;
import com.agentdock.core.logging.SensitiveData;
import com.agentdock.core.model.RepoEntry;
import com.agentdock.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Commits a repository's working copy, pushes the task branch and, for GitHub remotes,
 * opens a pull request. Every step is recorded in the task's event log.
 */
public class PromotionService {

    private static final Logger log = LoggerFactory.getLogger(PromotionService.class);

    static final String DEFAULT_BASE_BRANCH = "main";

    private final GitCli git;
    private final GitHubClient gitHub;
    private final EventLog eventLog;
    private final AgentdockProperties properties;

    public PromotionService(GitCli git, GitHubClient gitHub, EventLog eventLog, AgentdockProperties properties) {
        this.git = git;
        this.gitHub = gitHub;
        this.eventLog = eventLog;
        this.properties = properties;
    }

    /**
     * Promotes one repository. Failures are recorded as {@code promote_error} and returned
     * as a failed result rather than thrown, so sibling repositories can still be promoted.
     */
    public PromoteResult promote(Task task, RepoEntry repo, PromoteOptions options) {
        String repoId;
        String workdir;
        String branch;
        String prompt;
        synchronized (task) {
            repoId = repo.getId();
            workdir = repo.getWorkdir();
            branch = repo.getBranch();
            prompt = task.getPrompt();
        }
        PromoteOptions opts = options != null ? options : PromoteOptions.defaults();

        try {
            if (workdir == null || !Files.isDirectory(Path.of(workdir))) {
                throw new IllegalStateException("repo_not_ready");
            }
            Path dir = Path.of(workdir);
            String message = firstNonBlank(opts.message(), "agentdock: " + task.getId());

            if (!commit(dir, message)) {
                log.info("Nothing to commit for repo {} of task {}", repoId, task.getId());
                eventLog.append(task, TaskEvent.PROMOTE_SKIP, repoId, Map.of("reason", "nothing_to_commit"));
                return PromoteResult.skipped(repoId);
            }

            String remoteUrl = originUrl(dir);
            Optional<GitHubRemote> gh = GitHubRemote.parse(remoteUrl);
            boolean hasToken = properties.hasGithubToken();

            eventLog.append(task, TaskEvent.PROMOTE_STATUS, repoId, Map.of("status", "push"));
            if (hasToken && gh.isPresent() && branch != null && !branch.isBlank()) {
                git.runChecked(dir, "push", gh.get().httpsUrl(), "HEAD:refs/heads/" + branch);
            } else {
                String target = branch != null && !branch.isBlank() ? branch : "HEAD";
                git.runChecked(dir, "push", "-u", "origin", target);
            }
            log.info("Pushed branch '{}' for repo {} to {}", branch, repoId, SensitiveData.mask(remoteUrl));

            if (gh.isEmpty()) {
                eventLog.append(task, TaskEvent.PROMOTE_STATUS, repoId, Map.of("status", "pushed_no_pr"));
                return PromoteResult.pushed(repoId);
            }
            if (!hasToken) {
                eventLog.append(task, TaskEvent.PROMOTE_STATUS, repoId,
                        Map.of("status", "pushed_no_pr", "reason", "missing_github_token"));
                return PromoteResult.pushedWithoutPr(repoId);
            }

            String base = defaultBranch(dir);
            String title = firstNonBlank(opts.prTitle(), message);
            String body = firstNonBlank(opts.prBody(),
                    prompt != null && !prompt.isEmpty() ? "Prompt:\n\n" + prompt + "\n" : "");

            eventLog.append(task, TaskEvent.PROMOTE_STATUS, repoId, Map.of("status", "create_pr", "base", base));
            String prUrl = gitHub.createPullRequest(gh.get().owner(), gh.get().repo(),
                    new PullRequest(title, branch, base, body));
            synchronized (task) {
                repo.setPrUrl(prUrl);
                task.touch();
            }
            eventLog.append(task, TaskEvent.PR_CREATED, repoId, Map.of("url", prUrl));
            return PromoteResult.pullRequest(repoId, prUrl);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? SensitiveData.mask(e.getMessage()) : "promote_failed";
            log.warn("Promotion failed for repo {} of task {}: {}", repoId, task.getId(), message);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("message", message);
            eventLog.append(task, TaskEvent.PROMOTE_ERROR, repoId, payload);
            return PromoteResult.failed(repoId, message);
        }
    }

    /**
     * Stages everything and commits.
     *
     * @return false when there was nothing to commit
     */
    boolean commit(Path dir, String message) {
        git.configureIdentity(dir);
        git.runChecked(dir, "add", "-A");

        // diff --cached --quiet exits 0 when the index matches HEAD
        if (git.run(dir, "diff", "--cached", "--quiet").exitCode() == 0) {
            return false;
        }
        GitResult commit = git.run(dir, "commit", "-m", message);
        if (!commit.isSuccess()) {
            String output = commit.stdout() + commit.stderr();
            if (output.toLowerCase().contains("nothing to commit")) {
                return false;
            }
            String stderr = SensitiveData.mask(commit.stderr().trim());
            throw new GitCommandException("git commit", commit.exitCode(),
                    stderr.isEmpty() ? "git commit failed (exit code " + commit.exitCode() + ")" : stderr);
        }
        return true;
    }

    String originUrl(Path dir) {
        GitResult result = git.run(dir, "remote", "get-url", "origin");
        return result.isSuccess() ? result.stdout().trim() : "";
    }

    /** Default branch of {@code origin} from {@code refs/remotes/origin/HEAD}, or {@code main}. */
    String defaultBranch(Path dir) {
        GitResult result = git.run(dir, "symbolic-ref", "--quiet", "--short", "refs/remotes/origin/HEAD");
        if (!result.isSuccess()) {
            return DEFAULT_BASE_BRANCH;
        }
        String ref = result.stdout().trim();
        int slash = ref.indexOf('/');
        return slash >= 0 && slash < ref.length() - 1 ? ref.substring(slash + 1) : DEFAULT_BASE_BRANCH;
    }

    private static String firstNonBlank(String value, String fallback) {
        return value != null && !value.trim().isEmpty() ? value.trim() : fallback;
    }
}
