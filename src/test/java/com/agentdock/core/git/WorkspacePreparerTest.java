package com.agentdock.core.git;

import com.agentdock.core.config.AgentdockProperties;
import com.agentdock.core.events.EventLog;
import com.agentdock.core.events.TaskEvent;
import com.agentdock.core.model.RepoEntry;
import com.agentdock.core.model.RepoKind;
import com.agentdock.core.model.Task;
import com.agentdock.core.store.TaskStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link WorkspacePreparer}.
 *
 * <p>Uses {@link ScriptedGitCli} to capture git commands without touching a real repository.
 */
class WorkspacePreparerTest {

    @TempDir
    Path root;

    private AgentdockProperties properties;
    private ScriptedGitCli git;
    private TaskStore store;
    private EventLog eventLog;
    private WorkspacePreparer preparer;

    @BeforeEach
    void setUp() {
        properties = new AgentdockProperties();
        properties.setWorkspaceDir(root.resolve("workspace").toString());
        git = new ScriptedGitCli(properties);
        store = new TaskStore(root.resolve("tasks"), new ObjectMapper());
        eventLog = new EventLog(store);
        preparer = new WorkspacePreparer(git, store, eventLog, properties);
    }

    private Task task(RepoEntry repo) {
        return new Task("task-1", "t", "p", "true", List.of(repo));
    }

    @Nested
    @DisplayName("branch names")
    class BranchNames {

        @Test
        void formatsTaskBranch() {
            assertEquals("agentdock/task-1/api", WorkspacePreparer.branchName("task-1", "api"));
        }

        @Test
        void capsLength() {
            String branch = WorkspacePreparer.branchName("t".repeat(200), "api");
            assertTrue(branch.length() <= WorkspacePreparer.MAX_BRANCH_LENGTH);
            assertTrue(branch.startsWith("agentdock/"));
        }

        @Test
        void sanitizesUnsafeCharacters() {
            assertEquals("agentdock/my-task/repo", WorkspacePreparer.sanitizeBranchName("agentdock/my task//repo"));
            assertEquals("a-b", WorkspacePreparer.sanitizeBranchName("--a~^:b--"));
            assertEquals("agentdock", WorkspacePreparer.sanitizeBranchName("  "));
        }
    }

    @Nested
    @DisplayName("local repositories")
    class Local {

        @Test
        @DisplayName("adds a worktree from the source checkout on the task branch")
        void addsWorktree() {
            var repo = new RepoEntry("api", "API", RepoKind.LOCAL, "/src/api", null);
            var task = task(repo);

            preparer.prepare(task, repo);

            Path workdir = store.workdir("task-1", "api");
            var first = git.calls().get(0);
            assertEquals(Path.of("/src/api"), first.dir());
            assertEquals("worktree add -B agentdock/task-1/api " + workdir, first.args());
            assertEquals(workdir.toString(), repo.getWorkdir());
            assertEquals(store.diffFile("task-1", "api").toString(), repo.getDiffFile());
            assertEquals("agentdock/task-1/api", repo.getBranch());
            assertTrue(git.commands().contains("config user.name agentdock"));
        }

        @Test
        @DisplayName("defaults the source to the workspace directory")
        void defaultsToWorkspace() {
            var repo = new RepoEntry("ws", "Workspace", RepoKind.LOCAL, null, null);

            preparer.prepare(task(repo), repo);

            assertEquals(Path.of(properties.getWorkspaceDir()), git.calls().get(0).dir());
        }

        @Test
        @DisplayName("emits worktree_create progress")
        void emitsProgress() {
            var repo = new RepoEntry("api", "API", RepoKind.LOCAL, "/src/api", null);
            var task = task(repo);

            preparer.prepare(task, repo);

            var events = eventLog.history(task, 0);
            assertEquals(1, events.size());
            assertEquals(TaskEvent.REPO_STATUS, events.get(0).type());
            assertEquals("worktree_create", events.get(0).payload().get("status"));
            assertEquals("/src/api", events.get(0).payload().get("src"));
        }

        @Test
        @DisplayName("a failing worktree add surfaces as GitCommandException")
        void failurePropagates() {
            git.respond("worktree add", 128, "", "fatal: not a git repository");
            var repo = new RepoEntry("api", "API", RepoKind.LOCAL, "/src/api", null);

            var e = assertThrows(GitCommandException.class, () -> preparer.prepare(task(repo), repo));
            assertEquals("fatal: not a git repository", e.getMessage());
            assertEquals(128, e.getExitCode());
        }
    }

    @Nested
    @DisplayName("git repositories")
    class Clone {

        @Test
        @DisplayName("clones into the workdir and checks out the task branch")
        void clonesAndChecksOut() {
            var repo = new RepoEntry("web", "Web", RepoKind.GIT, null, "https://example.com/acme/web.git");

            preparer.prepare(task(repo), repo);

            Path workdir = store.workdir("task-1", "web");
            assertEquals("clone https://example.com/acme/web.git " + workdir, git.commands().get(0));
            assertEquals(store.repoRoot("task-1", "web"), git.calls().get(0).dir());
            assertEquals("checkout -B agentdock/task-1/web", git.commands().get(1));
            assertEquals(workdir, git.calls().get(1).dir());
        }

        @Test
        @DisplayName("switches GitHub SSH remotes to https when a token is configured")
        void normalizesToHttpsWithToken() {
            properties.getGithub().setToken("ghp_secret");
            var repo = new RepoEntry("web", "Web", RepoKind.GIT, null, "git@github.com:acme/web.git");

            preparer.prepare(task(repo), repo);

            assertTrue(git.commands().get(0).startsWith("clone https://github.com/acme/web.git "));
            assertEquals("https://github.com/acme/web.git", repo.getUrl());
        }

        @Test
        @DisplayName("masks credentials in the clone progress event")
        void masksCredentials() {
            var repo = new RepoEntry("web", "Web", RepoKind.GIT, null, "https://user:pw@example.com/acme/web.git");
            var task = task(repo);

            preparer.prepare(task, repo);

            var event = eventLog.history(task, 0).get(0);
            assertEquals("clone", event.payload().get("status"));
            assertEquals("https://***@example.com/acme/web.git", event.payload().get("url"));
        }

        @Test
        @DisplayName("rejects a missing url")
        void missingUrl() {
            var repo = new RepoEntry("web", "Web", RepoKind.GIT, null, "  ");

            var e = assertThrows(IllegalArgumentException.class, () -> preparer.prepare(task(repo), repo));
            assertEquals("missing_repo_url", e.getMessage());
            assertTrue(git.commands().isEmpty());
        }
    }
}
