package com.agentdock.core.store;

import com.agentdock.core.events.TaskEvent;
import com.agentdock.core.model.Task;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Directory-tree store for tasks.
 *
 * <p>Layout under the storage root:
 * <pre>
 *   &lt;taskId&gt;/task.json                     metadata (atomically replaced)
 *   &lt;taskId&gt;/events.ndjson                 append-only event log, one JSON object per line
 *   &lt;taskId&gt;/repos/&lt;repoId&gt;/workdir/       working copy
 *   &lt;taskId&gt;/repos/&lt;repoId&gt;/diff.patch     last captured diff
 * </pre>
 */
public class TaskStore {

    private static final Logger log = LoggerFactory.getLogger(TaskStore.class);

    static final String META_FILE = "task.json";
    static final String EVENTS_FILE = "events.ndjson";

    private final Path root;
    private final ObjectMapper objectMapper;

    public TaskStore(Path root, ObjectMapper objectMapper) {
        this.root = root;
        this.objectMapper = objectMapper;
    }

    public Path root() {
        return root;
    }

    public Path taskDir(String taskId) {
        return root.resolve(taskId);
    }

    public Path repoRoot(String taskId, String repoId) {
        return taskDir(taskId).resolve("repos").resolve(repoId);
    }

    public Path workdir(String taskId, String repoId) {
        return repoRoot(taskId, repoId).resolve("workdir");
    }

    public Path diffFile(String taskId, String repoId) {
        return repoRoot(taskId, repoId).resolve("diff.patch");
    }

    // ------------------------------------------------------------------
    // Metadata
    // ------------------------------------------------------------------

    /**
     * Writes {@code task.json} via a temp file and an atomic rename, so readers never
     * observe a partial file. Holds the task monitor so concurrent saves cannot reorder.
     */
    public void save(Task task) throws IOException {
        synchronized (task) {
            Path dir = taskDir(task.getId());
            Files.createDirectories(dir);
            byte[] json = objectMapper.writeValueAsBytes(task);
            Path target = dir.resolve(META_FILE);
            Path tmp = dir.resolve(META_FILE + ".tmp-" + UUID.randomUUID());
            try {
                Files.write(tmp, json, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                try {
                    Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        }
    }

    /**
     * Loads every readable task under the root. Entries whose directory name does not
     * match the stored id, or whose metadata cannot be parsed, are skipped.
     *
     * <p>The sequence counter is reconciled with the event log so numbering continues
     * after the last durable event even if metadata was persisted before later appends.
     */
    public List<Task> loadAll() {
        List<Task> tasks = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return tasks;
        }
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path dir : dirs) {
                String id = dir.getFileName().toString();
                Path metaFile = dir.resolve(META_FILE);
                if (!Files.isRegularFile(metaFile)) {
                    continue;
                }
                try {
                    Task task = objectMapper.readValue(metaFile.toFile(), Task.class);
                    if (!id.equals(task.getId())) {
                        log.warn("Skipping task directory {}: metadata id is {}", id, task.getId());
                        continue;
                    }
                    long lastLogged = lastSeq(id);
                    if (task.getNextSeq() <= lastLogged) {
                        task.setNextSeq(lastLogged + 1);
                    }
                    tasks.add(task);
                } catch (IOException e) {
                    log.warn("Skipping unreadable task metadata {}: {}", metaFile, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Could not list task store {}: {}", root, e.getMessage());
        }
        return tasks;
    }

    // ------------------------------------------------------------------
    // Event log
    // ------------------------------------------------------------------

    public void appendEvent(String taskId, TaskEvent event) throws IOException {
        Path dir = taskDir(taskId);
        Files.createDirectories(dir);
        String line = objectMapper.writeValueAsString(event) + "\n";
        Files.writeString(dir.resolve(EVENTS_FILE), line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    }

    /**
     * Reads durable events with {@code seq > sinceSeq}, in file order.
     * Blank and unparseable lines are skipped.
     */
    public List<TaskEvent> readEvents(String taskId, long sinceSeq) {
        List<TaskEvent> events = new ArrayList<>();
        Path file = taskDir(taskId).resolve(EVENTS_FILE);
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                TaskEvent event;
                try {
                    event = objectMapper.readValue(line, TaskEvent.class);
                } catch (IOException | IllegalArgumentException e) {
                    log.debug("Skipping corrupt event line in {}: {}", file, e.getMessage());
                    continue;
                }
                if (event.seq() > sinceSeq) {
                    events.add(event);
                }
            }
        } catch (NoSuchFileException e) {
            return events;
        } catch (IOException e) {
            log.warn("Could not read event log {}: {}", file, e.getMessage());
        }
        return events;
    }

    /** Highest sequence number in the durable log, or 0 when the log is empty or missing. */
    public long lastSeq(String taskId) {
        return readEvents(taskId, 0).stream().mapToLong(TaskEvent::seq).max().orElse(0L);
    }

    // ------------------------------------------------------------------
    // Diff artifact
    // ------------------------------------------------------------------

    public Optional<String> readDiff(Path diffFile) {
        if (diffFile == null || !Files.isRegularFile(diffFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(diffFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Could not read diff artifact {}: {}", diffFile, e.getMessage());
            return Optional.empty();
        }
    }
}
