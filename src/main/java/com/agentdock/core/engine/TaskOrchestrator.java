package com.agentdock.core.engine;

import com.agentdock.core.config.AgentdockProperties;
import com.agentdock.core.events.EventLog;
import com.agentdock.core.events.TaskEvent;
import com.agentdock.core.git.DiffExtractor;
import com.agentdock.core.git.PromoteOptions;
import com.agentdock.core.git.PromoteResult;
import com.agentdock.core.git.PromotionService;
import com.agentdock.core.git.WorkspacePreparer;
import com.agentdock.core.logging.MdcContext;
import com.agentdock.core.logging.SensitiveData;
import com.agentdock.core.metrics.AgentdockMetrics;
import com.agentdock.core.model.RepoEntry;
import com.agentdock.core.model.RepoKind;
import com.agentdock.core.model.RepoStatus;
import com.agentdock.core.model.Task;
import com.agentdock.core.model.TaskStatus;
import com.agentdock.core.model.TaskSummary;
import com.agentdock.core.process.ExitStatus;
import com.agentdock.core.process.ProcessOutputListener;
import com.agentdock.core.process.ProcessRunner;
import com.agentdock.core.process.RunningProcess;
import com.agentdock.core.store.TaskStore;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.regex.Pattern;

/**
 * Owns the task registry and drives every task through preparation, execution,
 * diff capture and promotion.
 * <p>
 * State lives in memory and is mirrored to the {@link TaskStore}; on startup the registry
 * is hydrated from disk. All mutation of a task happens under that task's monitor, while
 * git and process I/O run outside it.
 */
@Service
public class TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    static final int MAX_TITLE_LENGTH = 80;
    static final String DEFAULT_REPO_ID = "workspace";
    private static final Pattern REPO_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private final AgentdockProperties properties;
    private final TaskStore store;
    private final EventLog eventLog;
    private final WorkspacePreparer preparer;
    private final ProcessRunner processRunner;
    private final DiffExtractor diffExtractor;
    private final PromotionService promotionService;
    private final AgentdockMetrics metrics;
    private final ExecutorService executor;

    private final ConcurrentHashMap<String, Task> tasks = new ConcurrentHashMap<>();

    /** Live processes: taskId -> repoId -> process. Mutated under the task monitor. */
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, RunningProcess>> processes =
            new ConcurrentHashMap<>();

    public TaskOrchestrator(AgentdockProperties properties,
                            TaskStore store,
                            EventLog eventLog,
                            WorkspacePreparer preparer,
                            ProcessRunner processRunner,
                            DiffExtractor diffExtractor,
                            PromotionService promotionService,
                            AgentdockMetrics metrics,
                            @Qualifier("orchestratorExecutor") ExecutorService executor) {
        this.properties = properties;
        this.store = store;
        this.eventLog = eventLog;
        this.preparer = preparer;
        this.processRunner = processRunner;
        this.diffExtractor = diffExtractor;
        this.promotionService = promotionService;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Loads persisted tasks. Repositories recorded as in flight have no process in this JVM;
     * they stay as recorded until {@link #resume} is called.
     */
    @PostConstruct
    public void hydrate() {
        List<Task> loaded = store.loadAll();
        for (Task task : loaded) {
            // pids from a previous JVM are meaningless here
            task.getRepos().forEach(repo -> repo.setPid(null));
            tasks.put(task.getId(), task);
        }
        log.info("Loaded {} task(s) from {}", loaded.size(), store.root());
    }

    // ------------------------------------------------------------------
    // Create / query
    // ------------------------------------------------------------------

    /**
     * Registers a task, persists it and starts preparing its repositories in the background.
     *
     * @return a snapshot taken before any repository left {@code pending}
     * @throws TaskRequestException if the repository list is invalid
     */
    public TaskSummary create(CreateTaskCommand request) {
        String prompt = request.prompt() != null ? request.prompt() : "";
        String command = request.command() != null && !request.command().isBlank()
                ? request.command().trim()
                : properties.getDefaultCommand();
        String title = resolveTitle(request.title(), prompt);
        List<RepoEntry> repos = buildRepos(request.repos());

        Task task = new Task(Task.newId(), title, prompt, command, repos);
        tasks.put(task.getId(), task);
        MdcContext.setTask(task.getId());
        try {
            try {
                store.save(task);
            } catch (IOException e) {
                tasks.remove(task.getId());
                throw new UncheckedIOException("Could not persist task " + task.getId(), e);
            }
            eventLog.append(task, TaskEvent.TASK_CREATED, Map.of("title", title, "command", command));
            metrics.recordTaskCreated(repos.size());
            log.info("Created task {} with {} repo(s): {}", task.getId(), repos.size(), title);

            TaskSummary summary = TaskSummary.of(task);
            executor.execute(() -> runTask(task));
            return summary;
        } finally {
            MdcContext.clear();
        }
    }

    public Optional<Task> get(String taskId) {
        return taskId != null ? Optional.ofNullable(tasks.get(taskId)) : Optional.empty();
    }

    /** All tasks, newest first. */
    public List<Task> list() {
        return tasks.values().stream()
                .sorted(Comparator.comparingLong(Task::getCreatedAt).reversed()
                        .thenComparing(Task::getId, Comparator.reverseOrder()))
                .toList();
    }

    public int liveProcessCount(String taskId) {
        Map<String, RunningProcess> live = processes.get(taskId);
        return live != null ? live.size() : 0;
    }

    // ------------------------------------------------------------------
    // Control
    // ------------------------------------------------------------------

    /**
     * Marks every unfinished repository canceled and sends SIGTERM to the live processes.
     * Processes that ignore the signal keep running and stay tracked until they exit.
     * A task with nothing left to cancel keeps its derived status.
     */
    public void cancel(String taskId) {
        Task task = require(taskId);
        List<RunningProcess> toSignal;
        int canceled = 0;
        synchronized (task) {
            for (RepoEntry repo : task.getRepos()) {
                if (!repo.getStatus().isTerminal()) {
                    repo.setStatus(RepoStatus.CANCELED);
                    canceled++;
                }
            }
            toSignal = new ArrayList<>(liveProcesses(taskId).values());
            if (canceled > 0) {
                task.setStatus(TaskStatus.CANCELED);
                task.touch();
                eventLog.append(task, TaskEvent.TASK_STATUS, Map.of("status", TaskStatus.CANCELED.wireName()));
            }
        }
        log.info("Canceling task {}: {} repo(s) canceled, {} live process(es)", taskId, canceled, toSignal.size());
        toSignal.forEach(RunningProcess::terminate);
        if (canceled == 0) {
            refreshStatus(task);
        }
        persist(task);
    }

    /**
     * Restarts the agent command for every repository that has a working copy, no live
     * process and did not finish as done or canceled. Working copies are not re-prepared;
     * unfinished repositories that never got one are marked failed.
     */
    public void resume(String taskId) {
        Task task = require(taskId);
        List<RepoEntry> restart = new ArrayList<>();
        List<RepoEntry> orphaned = new ArrayList<>();
        synchronized (task) {
            task.setStatus(TaskStatus.RUNNING);
            task.touch();
            eventLog.append(task, TaskEvent.TASK_STATUS, Map.of("status", TaskStatus.RUNNING.wireName()));
            Map<String, RunningProcess> live = liveProcesses(taskId);
            for (RepoEntry repo : task.getRepos()) {
                if (live.containsKey(repo.getId()) || !repo.getStatus().isResumable()) {
                    continue;
                }
                if (repo.getWorkdir() != null && Files.isDirectory(Path.of(repo.getWorkdir()))) {
                    restart.add(repo);
                } else if (repo.getStatus().isInFlight()) {
                    orphaned.add(repo);
                }
            }
        }
        log.info("Resuming task {}: restarting {} repo(s)", taskId, restart.size());

        for (RepoEntry repo : orphaned) {
            failRepo(task, repo, "working_copy_missing");
        }
        for (RepoEntry repo : restart) {
            startProcess(task, repo);
        }
        refreshStatus(task);
        persist(task);
    }

    /**
     * Forwards a line of input to the addressed live process, or to all of them.
     * Repositories without a live process are skipped.
     */
    public void sendInput(String taskId, String text, String repoId) {
        if (text == null || text.isEmpty()) {
            throw new TaskRequestException("Missing text");
        }
        Task task = require(taskId);
        String target = repoId != null && !repoId.isBlank() ? repoId : null;
        if (target != null && task.findRepo(target).isEmpty()) {
            throw new NotFoundException("Repo not found");
        }

        List<RunningProcess> recipients = new ArrayList<>();
        synchronized (task) {
            Map<String, RunningProcess> live = liveProcesses(taskId);
            if (target != null) {
                RunningProcess process = live.get(target);
                if (process != null) {
                    recipients.add(process);
                }
            } else {
                recipients.addAll(live.values());
            }
        }
        String line = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        for (RunningProcess process : recipients) {
            process.writeLine(line);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", text);
        eventLog.append(task, TaskEvent.STDIN, target, payload);
    }

    /**
     * Returns the stored diff. When the artifact is missing but the working copy exists and
     * no process is running, the diff is extracted first.
     *
     * @throws NotFoundException for an unknown repository or when no diff is available
     */
    public String diff(String taskId, String repoId) {
        Task task = require(taskId);
        RepoEntry repo = task.findRepo(repoId).orElseThrow(() -> new NotFoundException("Repo not found"));

        String diffFile;
        String workdir;
        boolean live;
        synchronized (task) {
            diffFile = repo.getDiffFile() != null ? repo.getDiffFile() : store.diffFile(taskId, repoId).toString();
            workdir = repo.getWorkdir();
            live = liveProcesses(taskId).containsKey(repoId);
        }

        Optional<String> patch = store.readDiff(Path.of(diffFile));
        if (patch.isEmpty() && !live && workdir != null && Files.isDirectory(Path.of(workdir))) {
            if (diffExtractor.extract(task, repo)) {
                patch = store.readDiff(Path.of(diffFile));
            }
        }
        return patch.orElseThrow(() -> new NotFoundException("Diff not ready"));
    }

    /**
     * Promotes one repository, or every repository when {@code repoId} is null, one after
     * another. A failure in one repository does not stop the rest.
     */
    public List<PromoteResult> promote(String taskId, String repoId, PromoteOptions options) {
        Task task = require(taskId);
        List<RepoEntry> targets;
        synchronized (task) {
            targets = repoId == null
                    ? new ArrayList<>(task.getRepos())
                    : task.findRepo(repoId).map(List::of).orElse(List.of());
        }
        if (targets.isEmpty()) {
            throw new NotFoundException("Repo not found");
        }

        MdcContext.setTask(taskId);
        try {
            List<PromoteResult> results = new ArrayList<>();
            for (RepoEntry repo : targets) {
                PromoteResult result = promotionService.promote(task, repo, options);
                metrics.recordPromotion(outcome(result));
                results.add(result);
            }
            synchronized (task) {
                task.touch();
            }
            persist(task);
            return results;
        } finally {
            MdcContext.clear();
        }
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    void runTask(Task task) {
        MdcContext.setTask(task.getId());
        try {
            List<RepoEntry> repos;
            synchronized (task) {
                if (task.getStatus() == TaskStatus.CANCELED) {
                    return;
                }
                task.setStatus(TaskStatus.RUNNING);
                task.touch();
                eventLog.append(task, TaskEvent.TASK_STATUS, Map.of("status", TaskStatus.RUNNING.wireName()));
                repos = new ArrayList<>(task.getRepos());
            }
            persist(task);

            for (RepoEntry repo : repos) {
                prepareAndStart(task, repo);
            }
            refreshStatus(task);
        } catch (RuntimeException e) {
            log.error("Task {} failed during preparation", task.getId(), e);
            String message = e.getMessage() != null ? SensitiveData.mask(e.getMessage()) : "run_failed";
            synchronized (task) {
                task.setStatus(TaskStatus.ERROR);
                task.touch();
                eventLog.append(task, TaskEvent.TASK_ERROR, Map.of("message", message));
            }
            persist(task);
        } finally {
            MdcContext.clear();
        }
    }

    private void prepareAndStart(Task task, RepoEntry repo) {
        String repoId;
        RepoKind type;
        synchronized (task) {
            if (repo.getStatus() != RepoStatus.PENDING) {
                return;
            }
            repo.setStatus(RepoStatus.PREPARING);
            repo.setError(null);
            task.touch();
            repoId = repo.getId();
            type = repo.getType();
        }
        persist(task);
        MdcContext.setRepo(task.getId(), repoId);
        try {
            preparer.prepare(task, repo);
            metrics.recordPreparation(type != null ? type.wireName() : "unknown", true);
        } catch (RuntimeException e) {
            metrics.recordPreparation(type != null ? type.wireName() : "unknown", false);
            String message = e.getMessage() != null ? SensitiveData.mask(e.getMessage()) : "prepare_failed";
            log.warn("Preparation of repo {} failed: {}", repoId, message);
            failRepo(task, repo, message);
            return;
        } finally {
            MdcContext.setTask(task.getId());
        }

        synchronized (task) {
            if (repo.getStatus() != RepoStatus.PREPARING) {
                return;
            }
            repo.setStatus(RepoStatus.READY);
            eventLog.append(task, TaskEvent.REPO_STATUS, repoId, Map.of("status", "ready"));
        }
        startProcess(task, repo);
    }

    /**
     * Spawns the agent command for a prepared repository and feeds it the prompt.
     * The spawn happens under the task monitor so a concurrent cancel either sees the
     * process or prevents it from starting.
     */
    private void startProcess(Task task, RepoEntry repo) {
        String taskId = task.getId();
        String repoId;
        RunningProcess running;
        synchronized (task) {
            repoId = repo.getId();
            if (repo.getStatus() == RepoStatus.CANCELED || liveProcesses(taskId).containsKey(repoId)) {
                return;
            }
            try {
                running = processRunner.start(Path.of(repo.getWorkdir()), task.getCommand(), taskId, repoId,
                        new RepoProcessListener(task, repo));
            } catch (IOException | RuntimeException e) {
                String message = e.getMessage() != null ? e.getMessage() : "spawn_failed";
                log.warn("Could not start command for repo {}: {}", repoId, message);
                repo.setStatus(RepoStatus.ERROR);
                repo.setError(message);
                eventLog.append(task, TaskEvent.REPO_ERROR, repoId, Map.of("message", message));
                refreshStatus(task);
                return;
            }
            processes.computeIfAbsent(taskId, k -> new ConcurrentHashMap<>()).put(repoId, running);
            metrics.processStarted();
            repo.setStatus(RepoStatus.RUNNING);
            repo.setPid(running.pid());
            repo.setStartedAt(System.currentTimeMillis());
            repo.setFinishedAt(null);
            repo.setExitCode(null);
            repo.setSignal(null);
            repo.setError(null);
            task.touch();
        }
        if (task.getPrompt() != null && !task.getPrompt().isEmpty()) {
            running.writeLine(task.getPrompt());
        }
        refreshStatus(task);
        persist(task);
    }

    /**
     * Records the exit, captures the diff and only then drops the process from the live set,
     * so the task cannot be derived as finished before its diff artifacts exist.
     */
    private void handleExit(Task task, RepoEntry repo, ExitStatus exit) {
        String taskId = task.getId();
        String repoId;
        RepoStatus finalStatus;
        long runMs;
        synchronized (task) {
            repoId = repo.getId();
            long now = System.currentTimeMillis();
            repo.setExitCode(exit.code());
            repo.setSignal(exit.signal());
            repo.setFinishedAt(now);
            if (repo.getStatus() != RepoStatus.CANCELED) {
                repo.setStatus(exit.isSuccess() ? RepoStatus.DONE : RepoStatus.ERROR);
            }
            finalStatus = repo.getStatus();
            runMs = repo.getStartedAt() != null ? now - repo.getStartedAt() : 0;
            task.touch();

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("code", exit.code());
            payload.put("signal", exit.signal());
            eventLog.append(task, TaskEvent.REPO_EXIT, repoId, payload);
        }
        metrics.processExited();
        metrics.recordRepoExit(finalStatus.wireName(), runMs);
        log.info("Repo {} exited (code={}, signal={}) -> {}", repoId, exit.code(), exit.signal(), finalStatus.wireName());

        diffExtractor.extract(task, repo);
        synchronized (task) {
            Map<String, RunningProcess> live = processes.get(taskId);
            if (live != null) {
                live.remove(repoId);
            }
        }
        refreshStatus(task);
        persist(task);
    }

    private void failRepo(Task task, RepoEntry repo, String message) {
        synchronized (task) {
            if (repo.getStatus() != RepoStatus.CANCELED) {
                repo.setStatus(RepoStatus.ERROR);
                repo.setError(message);
            }
            task.touch();
            eventLog.append(task, TaskEvent.REPO_ERROR, repo.getId(), Map.of("message", message));
        }
        refreshStatus(task);
        persist(task);
    }

    /**
     * Re-derives the task status and emits {@code task_status} when it changes.
     * A canceled task whose repositories are all finished stays canceled while signaled
     * processes wind down.
     */
    void refreshStatus(Task task) {
        synchronized (task) {
            TaskStatus derived = TaskStatus.derive(task.getRepos(), liveProcessCount(task.getId()));
            if (task.getStatus() == TaskStatus.CANCELED && derived == TaskStatus.RUNNING
                    && task.getRepos().stream().allMatch(r -> r.getStatus().isTerminal())) {
                return;
            }
            if (derived != task.getStatus()) {
                task.setStatus(derived);
                task.touch();
                eventLog.append(task, TaskEvent.TASK_STATUS, Map.of("status", derived.wireName()));
            }
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Task require(String taskId) {
        return get(taskId).orElseThrow(() -> new NotFoundException("Task not found"));
    }

    private Map<String, RunningProcess> liveProcesses(String taskId) {
        Map<String, RunningProcess> live = processes.get(taskId);
        return live != null ? live : Map.of();
    }

    private void persist(Task task) {
        try {
            store.save(task);
        } catch (IOException e) {
            log.warn("Could not persist task {}: {}", task.getId(), e.getMessage());
        }
    }

    private String resolveTitle(String title, String prompt) {
        if (title != null && !title.isBlank()) {
            return title.trim();
        }
        String trimmed = prompt.trim();
        if (!trimmed.isEmpty()) {
            String firstLine = trimmed.split("\n", 2)[0].trim();
            return firstLine.length() > MAX_TITLE_LENGTH ? firstLine.substring(0, MAX_TITLE_LENGTH) : firstLine;
        }
        return "Task " + Instant.now();
    }

    private List<RepoEntry> buildRepos(List<RepoSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            return List.of(new RepoEntry(DEFAULT_REPO_ID, "Workspace", RepoKind.LOCAL,
                    properties.getWorkspaceDir(), null));
        }
        List<RepoEntry> repos = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < specs.size(); i++) {
            RepoSpec spec = specs.get(i);
            String id = spec.id() != null && !spec.id().isBlank() ? spec.id().trim() : "repo" + (i + 1);
            if (!REPO_ID.matcher(id).matches() || id.equals(".") || id.equals("..")) {
                throw new TaskRequestException("Invalid repo id: " + id);
            }
            if (!seen.add(id)) {
                throw new TaskRequestException("Duplicate repo id: " + id);
            }
            boolean hasUrl = spec.url() != null && !spec.url().isBlank();
            RepoKind type;
            if (spec.type() != null && !spec.type().isBlank()) {
                type = RepoKind.fromWireName(spec.type())
                        .orElseThrow(() -> new TaskRequestException("invalid_repo_type: " + spec.type()));
            } else {
                type = hasUrl ? RepoKind.GIT : RepoKind.LOCAL;
            }
            String name = spec.name() != null && !spec.name().isBlank() ? spec.name().trim() : id;
            repos.add(new RepoEntry(id, name, type, spec.path(), spec.url()));
        }
        return repos;
    }

    private static String outcome(PromoteResult result) {
        if (!result.ok()) return "failed";
        if (Boolean.TRUE.equals(result.skipped())) return "skipped";
        if (result.prUrl() != null) return "pr_created";
        return "pushed";
    }

    /** Bridges process callbacks into the event log and exit handling. */
    private final class RepoProcessListener implements ProcessOutputListener {

        private final Task task;
        private final RepoEntry repo;
        private final String repoId;

        RepoProcessListener(Task task, RepoEntry repo) {
            this.task = task;
            this.repo = repo;
            this.repoId = repo.getId();
        }

        @Override
        public void onOutput(String stream, String text) {
            eventLog.append(task, TaskEvent.LOG, repoId, Map.of("stream", stream, "text", text));
        }

        @Override
        public void onExit(ExitStatus status) {
            handleExit(task, repo, status);
        }
    }
}
