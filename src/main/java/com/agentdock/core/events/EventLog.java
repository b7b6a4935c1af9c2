package com.agentdock.core.events;

import com.agentdock.core.model.Task;
import com.agentdock.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Durable, per-task event log with live fan-out.
 * <p>
 * Every append allocates the next sequence number and writes one line to the task's
 * {@code events.ndjson} under the task monitor, then offers the event to each live
 * subscriber's queue. Delivery happens on one sender thread per subscriber, outside the
 * monitor, so a slow listener never holds up appenders. A subscriber whose queue is full
 * or whose listener throws is detached.
 * <p>
 * Subscribing queues the replayed events and registers the subscriber under the same
 * monitor, so a subscriber that replays from {@code since} and then goes live sees every
 * event exactly once, in order.
 */
public class EventLog {

    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    /** Live events a subscriber may fall behind by before it is dropped. */
    static final int DEFAULT_QUEUE_CAPACITY = 10_000;

    private static final AtomicInteger SENDER_COUNTER = new AtomicInteger();

    private final TaskStore store;
    private final int queueCapacity;

    /** Live subscribers keyed by taskId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Subscriber>> subscribers =
            new ConcurrentHashMap<>();

    public EventLog(TaskStore store) {
        this(store, DEFAULT_QUEUE_CAPACITY);
    }

    EventLog(TaskStore store, int queueCapacity) {
        this.store = store;
        this.queueCapacity = queueCapacity;
    }

    /**
     * Appends an event for the task and queues it for live subscribers.
     * A failed disk write is logged; the event is still delivered and its number stays consumed.
     *
     * @return the appended event
     */
    public TaskEvent append(Task task, String type, String repoId, Map<String, Object> payload) {
        synchronized (task) {
            TaskEvent event = new TaskEvent(task.allocateSeq(), System.currentTimeMillis(), type, repoId, payload);
            try {
                store.appendEvent(task.getId(), event);
            } catch (IOException e) {
                log.warn("Failed to persist event {} #{} for task {}: {}",
                        type, event.seq(), task.getId(), e.getMessage());
            }
            List<Subscriber> subs = subscribers.get(task.getId());
            if (subs != null) {
                for (Subscriber subscriber : subs) {
                    if (!subscriber.offer(event)) {
                        log.warn("Subscriber for task {} fell {} events behind; dropping it",
                                task.getId(), queueCapacity);
                        subscriber.unsubscribe();
                    }
                }
            }
            return event;
        }
    }

    public TaskEvent append(Task task, String type, Map<String, Object> payload) {
        return append(task, type, null, payload);
    }

    /**
     * Queues durable events with {@code seq > sinceSeq} for the listener, then registers it
     * for live delivery. Events reach the listener on a dedicated thread.
     *
     * @return a handle that detaches the listener; calling it more than once is harmless
     */
    public Subscription subscribe(Task task, long sinceSeq, TaskEventListener listener) {
        String taskId = task.getId();
        Subscriber subscriber;
        synchronized (task) {
            List<TaskEvent> replay = store.readEvents(taskId, Math.max(0, sinceSeq));
            subscriber = new Subscriber(taskId, listener, replay);
            subscribers.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(subscriber);
        }
        subscriber.start();
        log.debug("Subscribed to task {} from seq {}", taskId, sinceSeq);
        return subscriber;
    }

    public List<TaskEvent> history(Task task, long sinceSeq) {
        return store.readEvents(task.getId(), Math.max(0, sinceSeq));
    }

    public int listenerCount(String taskId) {
        List<Subscriber> subs = subscribers.get(taskId);
        return subs != null ? subs.size() : 0;
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void detach(String taskId, Subscriber subscriber) {
        subscribers.computeIfPresent(taskId, (k, subs) -> {
            subs.remove(subscriber);
            return subs.isEmpty() ? null : subs;
        });
    }

    private final class Subscriber implements Subscription {

        private final String taskId;
        private final TaskEventListener listener;
        private final BlockingQueue<TaskEvent> queue;
        private final Thread sender;
        private final AtomicBoolean active = new AtomicBoolean(true);

        Subscriber(String taskId, TaskEventListener listener, List<TaskEvent> replay) {
            this.taskId = taskId;
            this.listener = listener;
            this.queue = new LinkedBlockingQueue<>(replay.size() + queueCapacity);
            this.queue.addAll(replay);
            this.sender = new Thread(this::drain, "agentdock-events-" + SENDER_COUNTER.incrementAndGet());
            this.sender.setDaemon(true);
        }

        void start() {
            sender.start();
        }

        boolean offer(TaskEvent event) {
            return queue.offer(event);
        }

        private void drain() {
            TaskEvent event = null;
            try {
                while (active.get()) {
                    event = queue.take();
                    listener.deliver(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                log.debug("Detaching listener for task {} after delivery failure on {}: {}",
                        taskId, event != null ? event.type() : "-", e.getMessage());
                unsubscribe();
            }
        }

        @Override
        public void unsubscribe() {
            if (active.compareAndSet(true, false)) {
                detach(taskId, this);
                queue.clear();
                if (Thread.currentThread() != sender) {
                    sender.interrupt();
                }
            }
        }
    }
}
