package com.agentdock.core.process;

import com.agentdock.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * A supervised child process: output pumps, stdin writer and exit notification.
 *
 * <p>Each output stream is read on its own daemon thread in chunks of up to
 * {@value #CHUNK_CHARS} characters. Input lines are queued (at most
 * {@value #STDIN_QUEUE_LINES}) and written by a dedicated thread, so callers never wait
 * on a process that stops reading. Another thread waits for the process and both
 * pumps, then reports the exit status exactly once.
 */
public class RunningProcess {

    private static final Logger log = LoggerFactory.getLogger(RunningProcess.class);

    static final int CHUNK_CHARS = 8192;
    static final int STDIN_QUEUE_LINES = 1024;

    private final Process process;
    private final String taskId;
    private final String repoId;
    private final ProcessOutputListener listener;
    private final Writer stdin;
    private final LinkedBlockingQueue<String> pendingInput = new LinkedBlockingQueue<>(STDIN_QUEUE_LINES);
    private volatile boolean stdinClosed;
    private Thread stdinWriter;
    private final CountDownLatch pumpsDone = new CountDownLatch(2);
    private final CompletableFuture<ExitStatus> exit = new CompletableFuture<>();

    RunningProcess(Process process, String taskId, String repoId, ProcessOutputListener listener) {
        this.process = process;
        this.taskId = taskId;
        this.repoId = repoId;
        this.listener = listener;
        this.stdin = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8);
    }

    void startPumps() {
        String name = "agentdock-" + taskId + "-" + repoId;
        daemon(name + "-stdout", () -> pump("stdout", process.getInputStream())).start();
        daemon(name + "-stderr", () -> pump("stderr", process.getErrorStream())).start();
        stdinWriter = daemon(name + "-stdin", this::writeInput);
        stdinWriter.start();
        daemon(name + "-exit", this::awaitExit).start();
    }

    public long pid() {
        return process.pid();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public CompletableFuture<ExitStatus> onExit() {
        return exit;
    }

    /**
     * Queues {@code text} plus a newline for the process's stdin.
     *
     * @return false if the process is gone, its stdin is closed or the input queue is full
     */
    public boolean writeLine(String text) {
        if (stdinClosed || !process.isAlive()) {
            return false;
        }
        if (!pendingInput.offer(text)) {
            log.warn("stdin queue full for repo {}; dropping input", repoId);
            return false;
        }
        return true;
    }

    /**
     * Asks the process and its descendants to stop (SIGTERM). Never force-kills; a process
     * that ignores the signal stays tracked until it exits on its own.
     */
    public void terminate() {
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
    }

    private void pump(String stream, InputStream in) {
        MdcContext.setRepo(taskId, repoId);
        char[] buffer = new char[CHUNK_CHARS];
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            int n;
            while ((n = reader.read(buffer)) != -1) {
                if (n > 0) {
                    deliverOutput(stream, new String(buffer, 0, n));
                }
            }
        } catch (IOException e) {
            log.debug("{} pump closed: {}", stream, e.getMessage());
        } finally {
            pumpsDone.countDown();
            MdcContext.clear();
        }
    }

    private void writeInput() {
        MdcContext.setRepo(taskId, repoId);
        try {
            while (!stdinClosed) {
                String line = pendingInput.take();
                stdin.write(line);
                stdin.write('\n');
                stdin.flush();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            log.debug("stdin write failed for repo {}: {}", repoId, e.getMessage());
        } finally {
            stdinClosed = true;
            pendingInput.clear();
            MdcContext.clear();
        }
    }

    private void awaitExit() {
        MdcContext.setRepo(taskId, repoId);
        try {
            int exitValue = process.waitFor();
            stdinClosed = true;
            stdinWriter.interrupt();
            pumpsDone.await();
            ExitStatus status = ExitStatus.from(exitValue);
            try {
                listener.onExit(status);
            } catch (RuntimeException e) {
                log.error("Exit handler failed for repo {}", repoId, e);
            }
            exit.complete(status);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exit.completeExceptionally(e);
        } finally {
            MdcContext.clear();
        }
    }

    private void deliverOutput(String stream, String text) {
        try {
            listener.onOutput(stream, text);
        } catch (RuntimeException e) {
            log.warn("Output handler failed for repo {}: {}", repoId, e.getMessage(), e);
        }
    }

    private static Thread daemon(String name, Runnable body) {
        Thread thread = new Thread(body, name);
        thread.setDaemon(true);
        return thread;
    }
}
