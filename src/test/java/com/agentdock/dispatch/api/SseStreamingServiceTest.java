package com.agentdock.dispatch.api;

import com.agentdock.core.events.EventLog;
import com.agentdock.core.model.Task;
import com.agentdock.core.store.TaskStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SseStreamingService}.
 */
class SseStreamingServiceTest {

    @TempDir
    Path root;

    private EventLog eventLog;
    private SseStreamingService service;
    private Task task;

    @BeforeEach
    void setUp() {
        eventLog = new EventLog(new TaskStore(root, new ObjectMapper()));
        service = new SseStreamingService(eventLog, 60_000L, 0);
        task = new Task(Task.newId(), "demo", "do it", "true", List.of());
    }

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitterTests {

        @Test
        @DisplayName("creates a distinct emitter per stream")
        void createsEmitters() {
            SseEmitter first = service.createEmitter(task, 0);
            SseEmitter second = service.createEmitter(task, 0);

            assertNotNull(first);
            assertNotSame(first, second);
            assertEquals(2, service.activeEmitterCount());
        }

        @Test
        @DisplayName("subscribes to the event log from the requested sequence")
        void subscribesFromSequence() {
            EventLog mockLog = mock(EventLog.class);
            when(mockLog.subscribe(eq(task), eq(5L), any())).thenReturn(() -> {});
            var scoped = new SseStreamingService(mockLog, 60_000L, 0);

            scoped.createEmitter(task, 5);

            verify(mockLog).subscribe(eq(task), eq(5L), any());
        }

        @Test
        @DisplayName("registers a live listener on the task")
        void registersListener() {
            service.createEmitter(task, 0);
            assertEquals(1, eventLog.listenerCount(task.getId()));
        }
    }

    @Nested
    @DisplayName("event forwarding")
    class EventForwardingTests {

        @Test
        @DisplayName("appending events with an open stream keeps it subscribed")
        void forwardsEvents() {
            eventLog.append(task, "task_created", Map.of("title", "demo"));
            service.createEmitter(task, 0);

            eventLog.append(task, "log", "api", Map.of("stream", "stdout", "text", "hello\n"));

            assertEquals(1, eventLog.listenerCount(task.getId()));
            assertEquals(1, service.activeEmitterCount());
        }

        @Test
        @DisplayName("concurrent appends do not throw")
        void concurrentAppends() throws InterruptedException {
            service.createEmitter(task, 0);

            int threadCount = 4;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                final int threadId = t;
                new Thread(() -> {
                    for (int i = 0; i < 25; i++) {
                        eventLog.append(task, "log", "r" + threadId, Map.of("text", "line " + i));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(5, TimeUnit.SECONDS));
            assertEquals(100, eventLog.history(task, 0).size());
        }
    }

    @Nested
    @DisplayName("heartbeats and shutdown")
    class LifecycleTests {

        @Test
        @DisplayName("heartbeats can be sent to open streams")
        void heartbeat() {
            service.createEmitter(task, 0);
            assertDoesNotThrow(service::sendHeartbeats);
        }

        @Test
        @DisplayName("starts with no active emitters")
        void startsAtZero() {
            assertEquals(0, service.activeEmitterCount());
            assertEquals(0, eventLog.listenerCount(task.getId()));
        }

        @Test
        @DisplayName("stopping completes open streams")
        void stopCompletes() {
            service.createEmitter(task, 0);
            assertDoesNotThrow(service::stopHeartbeat);
        }
    }
}
