package com.agentdock.dispatch.api;

import com.agentdock.core.config.AgentdockProperties;
import com.agentdock.core.events.EventLog;
import com.agentdock.core.events.TaskEvent;
import com.agentdock.core.model.Task;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventLog} subscriptions to {@link SseEmitter} instances.
 * <p>
 * A new stream first receives a {@code :ok} comment, then every durable event after the
 * requested sequence number, then live events as they are appended. Each event is one
 * {@code data:} frame carrying the flattened event JSON, with the sequence number as the
 * SSE id. Idle connections are kept open with periodic {@code :ping} comments.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private final EventLog eventLog;
    private final long timeoutMs;
    private final long pingSeconds;

    /** Tracks active emitter registrations for heartbeats and cleanup. */
    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventLog eventLog, AgentdockProperties properties) {
        this(eventLog, TimeUnit.MINUTES.toMillis(properties.getSse().getTimeoutMinutes()),
                properties.getSse().getPingSeconds());
    }

    SseStreamingService(EventLog eventLog, long timeoutMs, long pingSeconds) {
        this.eventLog = eventLog;
        this.timeoutMs = timeoutMs;
        this.pingSeconds = pingSeconds;
    }

    @PostConstruct
    void startHeartbeat() {
        if (pingSeconds <= 0) {
            return;
        }
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats, pingSeconds, pingSeconds, TimeUnit.SECONDS);
        log.info("SSE heartbeat scheduler started (interval={}s)", pingSeconds);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (EmitterRegistration registration : activeRegistrations) {
            registration.emitter.complete();
        }
    }

    void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("ping"));
            } catch (IOException | IllegalStateException e) {
                // onError/onCompletion callbacks handle cleanup
                log.debug("Heartbeat failed for task {}: {}", registration.taskId, e.getMessage());
            }
        }
    }

    /**
     * Creates an emitter that replays events with {@code seq > sinceSeq} and then follows
     * the task live.
     */
    public SseEmitter createEmitter(Task task, long sinceSeq) {
        String taskId = task.getId();
        SseEmitter emitter = new SseEmitter(timeoutMs);

        try {
            emitter.send(SseEmitter.event().comment("ok"));
        } catch (IOException e) {
            log.debug("Failed to open SSE stream for task {}: {}", taskId, e.getMessage());
            emitter.completeWithError(e);
            return emitter;
        }

        EventLog.Subscription subscription = eventLog.subscribe(task, sinceSeq, event -> send(emitter, event));
        var registration = new EmitterRegistration(taskId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for task {}", taskId);
            emitter.complete();
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for task {}: {}", taskId, ex.getMessage());
            cleanup(registration);
        });

        log.debug("SSE emitter created for task {} from seq {}", taskId, sinceSeq);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private static void send(SseEmitter emitter, TaskEvent event) throws IOException {
        emitter.send(SseEmitter.event()
                .id(String.valueOf(event.seq()))
                .data(event, MediaType.APPLICATION_JSON));
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(
            String taskId,
            SseEmitter emitter,
            EventLog.Subscription subscription
    ) {}
}
