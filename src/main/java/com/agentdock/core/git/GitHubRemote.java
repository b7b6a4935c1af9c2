package com.agentdock.core.git;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Owner and repository name of a GitHub remote.
 */
public record GitHubRemote(String owner, String repo) {

    // https://github.com/owner/repo(.git), optionally with embedded credentials
    private static final Pattern HTTPS = Pattern.compile(
            "^https?://([^@/]+@)?github\\.com/([^/]+)/([^/]+?)(?:\\.git)?/?$", Pattern.CASE_INSENSITIVE);

    // git@github.com:owner/repo(.git)
    private static final Pattern SSH = Pattern.compile(
            "^git@github\\.com:([^/]+)/([^/]+?)(?:\\.git)?$", Pattern.CASE_INSENSITIVE);

    /**
     * Parses a remote URL. Returns empty for non-GitHub hosts and anything unparseable.
     */
    public static Optional<GitHubRemote> parse(String remoteUrl) {
        if (remoteUrl == null) return Optional.empty();
        String raw = remoteUrl.trim();
        if (raw.isEmpty()) return Optional.empty();

        Matcher https = HTTPS.matcher(raw);
        if (https.matches()) {
            return Optional.of(new GitHubRemote(https.group(2), https.group(3)));
        }
        Matcher ssh = SSH.matcher(raw);
        if (ssh.matches()) {
            return Optional.of(new GitHubRemote(ssh.group(1), ssh.group(2)));
        }
        return Optional.empty();
    }

    /** Credential-free https clone/push URL. */
    public String httpsUrl() {
        return "https://github.com/" + owner + "/" + repo + ".git";
    }
}
