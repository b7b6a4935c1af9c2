package com.agentdock.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * One user-submitted unit of work spanning one or more repositories.
 *
 * <p>The task object doubles as the lock for its own state: every mutation of the task,
 * its {@link RepoEntry repositories} or its event sequence happens inside
 * {@code synchronized (task)}.
 *
 * <p>Persisted as {@code task.json} in the task directory.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Task {

    private static final SecureRandom RANDOM = new SecureRandom();

    private String id;
    private String title;
    private String prompt;
    private String command;
    private TaskStatus status = TaskStatus.QUEUED;
    private long createdAt;
    private long updatedAt;

    // Sequence number the next appended event will receive.
    private long nextSeq = 1;

    private List<RepoEntry> repos = new ArrayList<>();

    public Task() {}   // required by Jackson

    public Task(String id, String title, String prompt, String command, List<RepoEntry> repos) {
        this.id        = id;
        this.title     = title;
        this.prompt    = prompt;
        this.command   = command;
        this.repos     = new ArrayList<>(repos);
        this.createdAt = System.currentTimeMillis();
        this.updatedAt = this.createdAt;
    }

    /**
     * Generates a time-ordered, collision-resistant task id:
     * {@code task-<base36 epoch millis>-<16 hex chars>}.
     */
    public static String newId() {
        byte[] random = new byte[8];
        RANDOM.nextBytes(random);
        return "task-" + Long.toString(System.currentTimeMillis(), 36) + "-" + HexFormat.of().formatHex(random);
    }

    public Optional<RepoEntry> findRepo(String repoId) {
        if (repoId == null) {
            return Optional.empty();
        }
        return repos.stream().filter(r -> repoId.equals(r.getId())).findFirst();
    }

    /** Returns the next sequence number and advances the counter. Caller holds the task monitor. */
    public long allocateSeq() {
        if (nextSeq < 1) {
            nextSeq = 1;
        }
        return nextSeq++;
    }

    public void touch() {
        this.updatedAt = System.currentTimeMillis();
    }

    @JsonIgnore
    public long getLastSeq() {
        return nextSeq - 1;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String          getId()        { return id; }
    public String          getTitle()     { return title; }
    public String          getPrompt()    { return prompt; }
    public String          getCommand()   { return command; }
    public TaskStatus      getStatus()    { return status; }
    public long            getCreatedAt() { return createdAt; }
    public long            getUpdatedAt() { return updatedAt; }
    public long            getNextSeq()   { return nextSeq; }
    public List<RepoEntry> getRepos()     { return repos; }

    public void setId(String id)                  { this.id = id; }
    public void setTitle(String title)            { this.title = title; }
    public void setPrompt(String prompt)          { this.prompt = prompt; }
    public void setCommand(String command)        { this.command = command; }
    public void setStatus(TaskStatus status)      { this.status = status; }
    public void setCreatedAt(long createdAt)      { this.createdAt = createdAt; }
    public void setUpdatedAt(long updatedAt)      { this.updatedAt = updatedAt; }
    public void setNextSeq(long nextSeq)          { this.nextSeq = nextSeq; }
    public void setRepos(List<RepoEntry> repos)   { this.repos = repos != null ? new ArrayList<>(repos) : new ArrayList<>(); }
}
