package com.agentdock.core.git;

import com.agentdock.core.config.AgentdockProperties;
import com.agentdock.core.logging.SensitiveData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Thin wrapper around the {@code git} binary.
 *
 * <p>Shells out via {@link ProcessBuilder} rather than depending on JGit. Every command
 * runs with {@code GIT_TERMINAL_PROMPT=0}; when a GitHub token is configured,
 * {@code GIT_ASKPASS} points at a small owner-only script that answers
 * {@code x-access-token} and the token from the environment, so the token never
 * appears on a command line or in a remote URL.
 */
public class GitCli {

    private static final Logger log = LoggerFactory.getLogger(GitCli.class);

    static final String ASKPASS_FILE = "git-askpass.sh";
    static final String TOKEN_ENV = "AGENTDOCK_GITHUB_TOKEN";

    private static final String ASKPASS_SCRIPT = String.join("\n",
            "#!/usr/bin/env bash",
            "set -euo pipefail",
            "token=\"${" + TOKEN_ENV + ":-${GITHUB_TOKEN:-${GITHUB_PAT:-}}}\"",
            "case \"${1:-}\" in",
            "  *Username*) echo \"x-access-token\" ;;",
            "  *Password*) echo \"${token}\" ;;",
            "  *) echo \"\" ;;",
            "esac",
            "");

    private final AgentdockProperties properties;

    public GitCli(AgentdockProperties properties) {
        this.properties = properties;
    }

    /**
     * Runs a git command and returns its outcome regardless of exit code.
     *
     * @param workDir working directory for the git command
     * @param args    git arguments (e.g. "checkout", "-B", "branch-name")
     * @throws GitCommandException if git cannot be started or the wait is interrupted
     */
    public GitResult run(Path workDir, String... args) {
        List<String> command = buildCommand(args);
        String masked = SensitiveData.maskCommand(command);
        log.debug("Running: {} (in {})", masked, workDir);

        try {
            ProcessBuilder pb = new ProcessBuilder(command).directory(workDir.toFile());
            Map<String, String> env = pb.environment();
            env.put("GIT_TERMINAL_PROMPT", "0");
            if (properties.hasGithubToken()) {
                env.put(TOKEN_ENV, properties.getGithub().getToken());
                env.put("GIT_ASKPASS", ensureAskpassScript().toString());
            }

            Process process = pb.start();
            process.getOutputStream().close();

            // Drain stderr concurrently so a chatty command cannot fill the pipe and stall.
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));
            String stdout = readFully(process.getInputStream());
            int exitCode = process.waitFor();
            GitResult result = new GitResult(exitCode, stdout, stderr.get());

            if (!result.isSuccess()) {
                log.debug("git exited with code {}: {}: {}", exitCode, masked,
                        SensitiveData.mask(result.stderr().trim()));
            }
            return result;
        } catch (IOException | UncheckedIOException | ExecutionException e) {
            throw new GitCommandException(masked, "Git command failed: " + masked, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitCommandException(masked, "Git command interrupted: " + masked, e);
        }
    }

    /**
     * Runs a git command and fails on a non-zero exit.
     *
     * @throws GitCommandException carrying the masked stderr of the failed command
     */
    public GitResult runChecked(Path workDir, String... args) {
        GitResult result = run(workDir, args);
        if (!result.isSuccess()) {
            String masked = SensitiveData.maskCommand(buildCommand(args));
            String stderr = SensitiveData.mask(result.stderr().trim());
            String message = stderr.isEmpty()
                    ? "%s failed (exit code %d)".formatted(masked, result.exitCode())
                    : stderr;
            throw new GitCommandException(masked, result.exitCode(), message);
        }
        return result;
    }

    /**
     * Sets the commit identity in a working copy. Best-effort: failures are logged.
     */
    public void configureIdentity(Path workDir) {
        try {
            run(workDir, "config", "user.name", properties.getGit().getAuthorName());
            run(workDir, "config", "user.email", properties.getGit().getAuthorEmail());
        } catch (GitCommandException e) {
            log.debug("Could not set commit identity in {}: {}", workDir, e.getMessage());
        }
    }

    /** Whether a usable {@code git} binary is on the PATH. */
    public boolean isAvailable() {
        try {
            return run(Path.of(System.getProperty("java.io.tmpdir")), "--version").isSuccess();
        } catch (GitCommandException e) {
            return false;
        }
    }

    Path ensureAskpassScript() throws IOException {
        Path dir = properties.getAgentPath();
        Path script = dir.resolve(ASKPASS_FILE);
        if (Files.isRegularFile(script)) {
            return script;
        }
        Files.createDirectories(dir);
        Files.writeString(script, ASKPASS_SCRIPT, StandardCharsets.UTF_8);
        try {
            Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwx------"));
        } catch (UnsupportedOperationException e) {
            log.warn("Filesystem does not support POSIX permissions; askpass helper at {} is not owner-only", script);
        }
        return script;
    }

    private static String readFully(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static List<String> buildCommand(String... args) {
        var command = new ArrayList<String>();
        command.add("git");
        command.addAll(List.of(args));
        return command;
    }
}
