package com.agentdock.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One target codebase within a {@link Task}: its source, working copy, process and outcome.
 *
 * <p>Mutated only while holding the owning task's monitor.
 * The live process handle is not part of this record; it is tracked by the orchestrator.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RepoEntry {

    private String id;
    private String name;
    private RepoKind type = RepoKind.LOCAL;

    // Source locator: path for LOCAL, url for GIT.
    private String path;
    private String url;

    // Set during preparation.
    private String branch;
    private String workdir;
    private String diffFile;

    private RepoStatus status = RepoStatus.PENDING;
    private String error;

    private Long pid;
    private Integer exitCode;
    private String signal;
    private Long startedAt;
    private Long finishedAt;

    private String prUrl;

    public RepoEntry() {}   // required by Jackson

    public RepoEntry(String id, String name, RepoKind type, String path, String url) {
        this.id   = id;
        this.name = name;
        this.type = type;
        this.path = path;
        this.url  = url;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String     getId()         { return id; }
    public String     getName()       { return name; }
    public RepoKind   getType()       { return type; }
    public String     getPath()       { return path; }
    public String     getUrl()        { return url; }
    public String     getBranch()     { return branch; }
    public String     getWorkdir()    { return workdir; }
    public String     getDiffFile()   { return diffFile; }
    public RepoStatus getStatus()     { return status; }
    public String     getError()      { return error; }
    public Long       getPid()        { return pid; }
    public Integer    getExitCode()   { return exitCode; }
    public String     getSignal()     { return signal; }
    public Long       getStartedAt()  { return startedAt; }
    public Long       getFinishedAt() { return finishedAt; }
    public String     getPrUrl()      { return prUrl; }

    public void setId(String id)                 { this.id = id; }
    public void setName(String name)             { this.name = name; }
    public void setType(RepoKind type)           { this.type = type; }
    public void setPath(String path)             { this.path = path; }
    public void setUrl(String url)               { this.url = url; }
    public void setBranch(String branch)         { this.branch = branch; }
    public void setWorkdir(String workdir)       { this.workdir = workdir; }
    public void setDiffFile(String diffFile)     { this.diffFile = diffFile; }
    public void setStatus(RepoStatus status)     { this.status = status; }
    public void setError(String error)           { this.error = error; }
    public void setPid(Long pid)                 { this.pid = pid; }
    public void setExitCode(Integer exitCode)    { this.exitCode = exitCode; }
    public void setSignal(String signal)         { this.signal = signal; }
    public void setStartedAt(Long startedAt)     { this.startedAt = startedAt; }
    public void setFinishedAt(Long finishedAt)   { this.finishedAt = finishedAt; }
    public void setPrUrl(String prUrl)           { this.prUrl = prUrl; }
}
