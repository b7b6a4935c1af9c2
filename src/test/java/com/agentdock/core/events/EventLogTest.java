package com.agentdock.core.events;

import com.agentdock.core.model.Task;
import com.agentdock.core.store.TaskStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventLog}.
 */
class EventLogTest {

    @TempDir
    Path root;

    private TaskStore store;
    private EventLog eventLog;
    private Task task;

    @BeforeEach
    void setUp() {
        store = new TaskStore(root, new ObjectMapper());
        eventLog = new EventLog(store);
        task = new Task("task-1", "t", "p", "true", List.of());
    }

    private void appendLogs(int count) {
        for (int i = 0; i < count; i++) {
            eventLog.append(task, TaskEvent.LOG, "api", Map.of("stream", "stdout", "text", "line " + i));
        }
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 10s");
            }
            Thread.sleep(10);
        }
    }

    private static List<Long> seqs(List<TaskEvent> events) {
        return events.stream().map(TaskEvent::seq).toList();
    }

    @Nested
    @DisplayName("append")
    class Append {

        @Test
        @DisplayName("numbers events from 1 without gaps and persists them")
        void numbersSequentially() {
            appendLogs(3);

            assertEquals(List.of(1L, 2L, 3L), seqs(store.readEvents("task-1", 0)));
            assertEquals(3, task.getLastSeq());
        }

        @Test
        @DisplayName("concurrent appends still produce a gap-free sequence")
        void concurrentAppends() throws Exception {
            int threads = 8;
            int perThread = 50;
            var start = new CountDownLatch(1);
            var workers = new ArrayList<Thread>();
            for (int t = 0; t < threads; t++) {
                Thread worker = new Thread(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    appendLogs(perThread);
                });
                worker.start();
                workers.add(worker);
            }
            start.countDown();
            for (Thread worker : workers) {
                worker.join(TimeUnit.SECONDS.toMillis(10));
            }

            List<Long> expected = new ArrayList<>();
            for (long s = 1; s <= threads * perThread; s++) {
                expected.add(s);
            }
            assertEquals(expected, seqs(store.readEvents("task-1", 0)));
        }

        @Test
        @DisplayName("a failing listener is detached and does not affect others")
        void failingListenerDetached() throws Exception {
            var received = new CopyOnWriteArrayList<TaskEvent>();
            eventLog.subscribe(task, 0, event -> {
                throw new IOException("client gone");
            });
            eventLog.subscribe(task, 0, received::add);
            assertEquals(2, eventLog.listenerCount("task-1"));

            appendLogs(2);

            await(() -> received.size() == 2 && eventLog.listenerCount("task-1") == 1);
        }

        @Test
        @DisplayName("a stalled listener holds up neither appenders nor other listeners")
        void stalledListenerDoesNotBlockAppends() throws Exception {
            var release = new CountDownLatch(1);
            var slow = new CopyOnWriteArrayList<TaskEvent>();
            var fast = new CopyOnWriteArrayList<TaskEvent>();
            eventLog.subscribe(task, 0, event -> {
                release.await();
                slow.add(event);
            });
            eventLog.subscribe(task, 0, fast::add);

            assertTimeoutPreemptively(Duration.ofMillis(500), () -> {
                eventLog.append(task, TaskEvent.LOG, "r1", Map.of("stream", "stdout", "text", "one"));
                eventLog.append(task, TaskEvent.LOG, "r2", Map.of("stream", "stdout", "text", "two"));
            });
            await(() -> fast.size() == 2);
            assertTrue(slow.isEmpty());

            release.countDown();
            await(() -> slow.size() == 2);
            assertEquals(List.of(1L, 2L), seqs(slow));
        }

        @Test
        @DisplayName("a listener that falls too far behind is dropped")
        void overflowingListenerDropped() throws Exception {
            var bounded = new EventLog(store, 2);
            var release = new CountDownLatch(1);
            try {
                bounded.subscribe(task, 0, event -> release.await());

                for (int i = 0; i < 10; i++) {
                    bounded.append(task, TaskEvent.LOG, "api", Map.of("text", "line " + i));
                }

                assertEquals(0, bounded.listenerCount("task-1"));
                assertEquals(10, store.readEvents("task-1", 0).size());
            } finally {
                release.countDown();
            }
        }
    }

    @Nested
    @DisplayName("subscribe")
    class Subscribe {

        @Test
        @DisplayName("replays events after since, then continues live without duplicates")
        void replayThenLive() throws Exception {
            appendLogs(5);
            var received = new CopyOnWriteArrayList<TaskEvent>();

            eventLog.subscribe(task, 2, received::add);
            appendLogs(2);

            await(() -> received.size() >= 5);
            assertEquals(List.of(3L, 4L, 5L, 6L, 7L), seqs(received));
        }

        @Test
        @DisplayName("since beyond the last event replays nothing")
        void sinceBeyondEnd() throws Exception {
            appendLogs(3);
            var received = new CopyOnWriteArrayList<TaskEvent>();

            eventLog.subscribe(task, 10, received::add);
            appendLogs(1);

            await(() -> !received.isEmpty());
            assertEquals(List.of(4L), seqs(received));
        }

        @Test
        @DisplayName("subscribing while another thread appends neither drops nor repeats events")
        void subscribeDuringAppends() throws Exception {
            appendLogs(10);
            Thread writer = new Thread(() -> appendLogs(200));
            writer.start();
            var received = new CopyOnWriteArrayList<TaskEvent>();
            eventLog.subscribe(task, 0, received::add);
            writer.join(TimeUnit.SECONDS.toMillis(10));
            await(() -> received.size() >= 210);

            List<Long> expected = new ArrayList<>();
            for (long s = 1; s <= 210; s++) {
                expected.add(s);
            }
            assertEquals(expected, seqs(received));
        }

        @Test
        @DisplayName("unsubscribe stops delivery and is idempotent")
        void unsubscribeIdempotent() throws Exception {
            var received = new CopyOnWriteArrayList<TaskEvent>();
            EventLog.Subscription first = eventLog.subscribe(task, 0, received::add);
            EventLog.Subscription second = eventLog.subscribe(task, 0, event -> { });

            first.unsubscribe();
            first.unsubscribe();
            appendLogs(1);

            Thread.sleep(100);
            assertTrue(received.isEmpty());
            assertEquals(1, eventLog.listenerCount("task-1"));
            second.unsubscribe();
            assertEquals(0, eventLog.listenerCount("task-1"));
        }

        @Test
        @DisplayName("a listener failing during replay is detached")
        void failingReplayDetached() throws Exception {
            appendLogs(2);

            eventLog.subscribe(task, 0, event -> {
                throw new IOException("closed");
            });

            await(() -> eventLog.listenerCount("task-1") == 0);
        }
    }

    @Test
    void historyReadsFromDisk() {
        appendLogs(4);
        assertEquals(List.of(3L, 4L), seqs(eventLog.history(task, 2)));
    }
}
