package com.agentdock.core.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * An immutable, ordered fact about a task, used for the durable log and the live feed.
 *
 * <p>On the wire and on disk the payload is flattened next to the envelope fields:
 * {@code {"seq":4,"ts":1700000000000,"type":"log","repoId":"r1","stream":"stdout","text":"hi\n"}}.
 *
 * @param seq     sequence number, strictly increasing from 1 within a task
 * @param ts      epoch millis when the event was appended
 * @param type    event kind (see the constants on this type)
 * @param repoId  repository the event relates to; null for task-level events
 * @param payload kind-specific fields
 */
public record TaskEvent(
    long seq,
    long ts,
    String type,
    String repoId,
    Map<String, Object> payload
) {

    public static final String TASK_CREATED   = "task_created";
    public static final String TASK_STATUS    = "task_status";
    public static final String TASK_ERROR     = "task_error";
    public static final String REPO_STATUS    = "repo_status";
    public static final String REPO_ERROR     = "repo_error";
    public static final String REPO_EXIT      = "repo_exit";
    public static final String LOG            = "log";
    public static final String STDIN          = "stdin";
    public static final String DIFF_READY     = "diff_ready";
    public static final String DIFF_ERROR     = "diff_error";
    public static final String PROMOTE_STATUS = "promote_status";
    public static final String PROMOTE_SKIP   = "promote_skip";
    public static final String PROMOTE_ERROR  = "promote_error";
    public static final String PR_CREATED     = "pr_created";

    private static final Set<String> ENVELOPE_KEYS = Set.of("seq", "ts", "type", "repoId");

    public TaskEvent {
        if (seq < 1) {
            throw new IllegalArgumentException("seq must be >= 1, got: " + seq);
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        payload = payload != null ? Collections.unmodifiableMap(withoutNulls(payload)) : Map.of();
    }

    @JsonValue
    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("seq", seq);
        json.put("ts", ts);
        json.put("type", type);
        if (repoId != null) {
            json.put("repoId", repoId);
        }
        payload.forEach((key, value) -> {
            if (!ENVELOPE_KEYS.contains(key)) {
                json.put(key, value);
            }
        });
        return json;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TaskEvent fromJson(Map<String, Object> json) {
        Object seq = json.get("seq");
        Object ts = json.get("ts");
        Object type = json.get("type");
        Object repoId = json.get("repoId");
        if (!(seq instanceof Number) || !(type instanceof String)) {
            throw new IllegalArgumentException("event is missing seq or type");
        }
        Map<String, Object> payload = new LinkedHashMap<>(json);
        ENVELOPE_KEYS.forEach(payload::remove);
        return new TaskEvent(
                ((Number) seq).longValue(),
                ts instanceof Number n ? n.longValue() : 0L,
                (String) type,
                repoId instanceof String s ? s : null,
                payload);
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> in) {
        Map<String, Object> out = new LinkedHashMap<>();
        in.forEach((k, v) -> {
            if (k != null && v != null) {
                out.put(k, v);
            }
        });
        return out;
    }
}
