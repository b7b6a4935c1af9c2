package com.agentdock.dispatch.api;

import com.agentdock.core.engine.CreateTaskCommand;
import com.agentdock.core.engine.NotFoundException;
import com.agentdock.core.engine.TaskOrchestrator;
import com.agentdock.core.git.PromoteOptions;
import com.agentdock.core.git.PromoteResult;
import com.agentdock.core.model.Task;
import com.agentdock.core.model.TaskSummary;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the task lifecycle: submit, observe, steer and promote.
 */
@RestController
@RequestMapping("/tasks")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final MediaType TEXT_PLAIN_UTF8 = new MediaType("text", "plain", StandardCharsets.UTF_8);

    private final TaskOrchestrator orchestrator;
    private final SseStreamingService sseStreamingService;

    public TaskController(TaskOrchestrator orchestrator, SseStreamingService sseStreamingService) {
        this.orchestrator = orchestrator;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /tasks: Submit a task. Preparation and execution continue in the background.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestBody(required = false) CreateTaskRequest request) {
        CreateTaskCommand command = request != null
                ? request.toCommand()
                : new CreateTaskCommand(null, null, null, List.of());
        TaskSummary summary = orchestrator.create(command);
        return ResponseEntity.ok(Map.of("ok", true, "task", summary));
    }

    /**
     * GET /tasks: All tasks, newest first.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> list() {
        List<TaskSummary> tasks = orchestrator.list().stream().map(TaskSummary::of).toList();
        return ResponseEntity.ok(Map.of("ok", true, "tasks", tasks));
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String taskId) {
        return ResponseEntity.ok(Map.of("ok", true, "task", TaskSummary.of(require(taskId))));
    }

    /**
     * GET /tasks/{id}/events?since=N: Replay events after N, then stream live.
     * A {@code Last-Event-ID} header is honoured when {@code since} is absent.
     */
    @GetMapping(value = "/{taskId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable String taskId,
                             @RequestParam(required = false) String since,
                             @RequestHeader(value = "Last-Event-ID", required = false) String lastEventId,
                             HttpServletResponse response) {
        Task task = require(taskId);
        long sinceSeq = parseSeq(since != null ? since : lastEventId);
        response.setHeader("Cache-Control", "no-cache, no-store, must-revalidate");
        response.setHeader("X-Accel-Buffering", "no");
        log.debug("Streaming task {} from seq {}", taskId, sinceSeq);
        return sseStreamingService.createEmitter(task, sinceSeq);
    }

    @PostMapping("/{taskId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String taskId) {
        orchestrator.cancel(taskId);
        return ResponseEntity.ok(Map.of("ok", true));
    }

    @PostMapping("/{taskId}/resume")
    public ResponseEntity<Map<String, Object>> resume(@PathVariable String taskId) {
        orchestrator.resume(taskId);
        return ResponseEntity.ok(Map.of("ok", true));
    }

    @PostMapping("/{taskId}/input")
    public ResponseEntity<Map<String, Object>> input(@PathVariable String taskId,
                                                     @RequestBody(required = false) InputRequest request) {
        String text = request != null ? request.text() : null;
        String repoId = request != null ? request.repoId() : null;
        orchestrator.sendInput(taskId, text, repoId);
        return ResponseEntity.ok(Map.of("ok", true));
    }

    /**
     * GET /tasks/{id}/repos/{repoId}/diff: The captured patch as plain text.
     */
    @GetMapping("/{taskId}/repos/{repoId}/diff")
    public ResponseEntity<String> diff(@PathVariable String taskId, @PathVariable String repoId) {
        String patch = orchestrator.diff(taskId, repoId);
        return ResponseEntity.ok()
                .contentType(TEXT_PLAIN_UTF8)
                .cacheControl(CacheControl.noStore())
                .body(patch);
    }

    /**
     * POST /tasks/{id}/promote: Promote every repository; one result per repository.
     */
    @PostMapping("/{taskId}/promote")
    public ResponseEntity<Map<String, Object>> promoteAll(@PathVariable String taskId,
                                                          @RequestBody(required = false) PromoteRequest request) {
        List<PromoteResult> results = orchestrator.promote(taskId, null, options(request));
        return ResponseEntity.ok(Map.of("ok", true, "results", results));
    }

    /**
     * POST /tasks/{id}/repos/{repoId}/promote: Promote one repository; the result is returned inline.
     */
    @PostMapping("/{taskId}/repos/{repoId}/promote")
    public ResponseEntity<Map<String, Object>> promoteRepo(@PathVariable String taskId,
                                                           @PathVariable String repoId,
                                                           @RequestBody(required = false) PromoteRequest request) {
        PromoteResult result = orchestrator.promote(taskId, repoId, options(request)).get(0);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", result.ok());
        body.put("repoId", result.repoId());
        if (result.skipped() != null) body.put("skipped", result.skipped());
        if (result.pushed() != null) body.put("pushed", result.pushed());
        if (result.prSkipped() != null) body.put("prSkipped", result.prSkipped());
        if (result.prUrl() != null) body.put("prUrl", result.prUrl());
        if (result.message() != null) body.put("message", result.message());
        if (!result.ok()) body.put("code", "promote_failed");
        return ResponseEntity.ok(body);
    }

    private Task require(String taskId) {
        return orchestrator.get(taskId).orElseThrow(() -> new NotFoundException("Task not found"));
    }

    private static PromoteOptions options(PromoteRequest request) {
        return request != null ? request.toOptions() : PromoteOptions.defaults();
    }

    static long parseSeq(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Math.max(0, (long) Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
