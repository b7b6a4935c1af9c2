package com.agentdock.dispatch.api;

import com.agentdock.core.engine.CreateTaskCommand;
import com.agentdock.core.engine.NotFoundException;
import com.agentdock.core.engine.TaskOrchestrator;
import com.agentdock.core.engine.TaskRequestException;
import com.agentdock.core.git.PromoteOptions;
import com.agentdock.core.git.PromoteResult;
import com.agentdock.core.model.RepoEntry;
import com.agentdock.core.model.RepoKind;
import com.agentdock.core.model.Task;
import com.agentdock.core.model.TaskStatus;
import com.agentdock.core.model.TaskSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TaskController.class)
@TestPropertySource(properties = {
        "spring.main.web-application-type=servlet",
        "agentdock.max-json-bytes=2048"
})
class TaskControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TaskOrchestrator orchestrator;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private static Task sampleTask() {
        var repo = new RepoEntry("api", "api", RepoKind.LOCAL, "/src/api", null);
        return new Task("task-abc", "Fix the build", "Fix the build", "codex", List.of(repo));
    }

    // ── POST /tasks ─────────────────────────────────────────────────

    @Nested
    @DisplayName("POST /tasks")
    class CreateTests {

        @Test
        @DisplayName("returns the new task summary")
        void createsTask() throws Exception {
            when(orchestrator.create(any())).thenReturn(TaskSummary.of(sampleTask()));

            mockMvc.perform(post("/tasks")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"prompt":"Fix the build","repos":[{"id":"api","path":"/src/api"}]}
                                    """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ok").value(true))
                    .andExpect(jsonPath("$.task.id").value("task-abc"))
                    .andExpect(jsonPath("$.task.status").value("queued"))
                    .andExpect(jsonPath("$.task.repos[0].type").value("local"))
                    .andExpect(jsonPath("$.task.repos[0].exitCode").doesNotExist());

            var captor = ArgumentCaptor.forClass(CreateTaskCommand.class);
            verify(orchestrator).create(captor.capture());
            assertEquals("Fix the build", captor.getValue().prompt());
            assertEquals(1, captor.getValue().repos().size());
        }

        @Test
        @DisplayName("validation failures become 400 bad_request")
        void validationFailure() throws Exception {
            when(orchestrator.create(any())).thenThrow(new TaskRequestException("prompt is required"));

            mockMvc.perform(post("/tasks").contentType(MediaType.APPLICATION_JSON).content("{}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.ok").value(false))
                    .andExpect(jsonPath("$.code").value("bad_request"))
                    .andExpect(jsonPath("$.message").value("prompt is required"));
        }

        @Test
        @DisplayName("malformed JSON becomes 400 invalid_json")
        void invalidJson() throws Exception {
            mockMvc.perform(post("/tasks").contentType(MediaType.APPLICATION_JSON).content("{\"prompt\": "))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("invalid_json"));
            verifyNoInteractions(orchestrator);
        }

        @Test
        @DisplayName("oversized bodies are rejected with 413")
        void payloadTooLarge() throws Exception {
            String prompt = "x".repeat(4096);
            mockMvc.perform(post("/tasks")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"prompt\":\"" + prompt + "\"}"))
                    .andExpect(status().isPayloadTooLarge())
                    .andExpect(jsonPath("$.code").value("payload_too_large"));
            verifyNoInteractions(orchestrator);
        }
    }

    // ── GET /tasks ──────────────────────────────────────────────────

    @Nested
    @DisplayName("reading tasks")
    class ReadTests {

        @Test
        @DisplayName("GET /tasks lists summaries")
        void listTasks() throws Exception {
            when(orchestrator.list()).thenReturn(List.of(sampleTask()));

            mockMvc.perform(get("/tasks"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ok").value(true))
                    .andExpect(jsonPath("$.tasks", hasSize(1)))
                    .andExpect(jsonPath("$.tasks[0].title").value("Fix the build"));
        }

        @Test
        @DisplayName("GET /tasks/{id} returns one task")
        void getTask() throws Exception {
            when(orchestrator.get("task-abc")).thenReturn(Optional.of(sampleTask()));

            mockMvc.perform(get("/tasks/task-abc"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.task.repos[0].id").value("api"));
        }

        @Test
        @DisplayName("unknown task is 404 not_found")
        void unknownTask() throws Exception {
            when(orchestrator.get("missing")).thenReturn(Optional.empty());

            mockMvc.perform(get("/tasks/missing"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.ok").value(false))
                    .andExpect(jsonPath("$.code").value("not_found"));
        }

        @Test
        @DisplayName("unknown endpoint is 404 not_found")
        void unknownEndpoint() throws Exception {
            mockMvc.perform(get("/nowhere"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("not_found"));

            mockMvc.perform(delete("/tasks/task-abc"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("not_found"));
        }

        @Test
        @DisplayName("GET /tasks/{id}/repos/{repoId}/diff returns plain text")
        void diff() throws Exception {
            when(orchestrator.diff("task-abc", "api")).thenReturn("diff --git a/x b/x\n");

            mockMvc.perform(get("/tasks/task-abc/repos/api/diff"))
                    .andExpect(status().isOk())
                    .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                    .andExpect(content().string("diff --git a/x b/x\n"));
        }

        @Test
        @DisplayName("diff of an unknown repository is 404")
        void diffUnknownRepo() throws Exception {
            when(orchestrator.diff("task-abc", "nope")).thenThrow(new NotFoundException("Repo not found"));

            mockMvc.perform(get("/tasks/task-abc/repos/nope/diff"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.message").value("Repo not found"));
        }
    }

    // ── GET /tasks/{id}/events ──────────────────────────────────────

    @Nested
    @DisplayName("GET /tasks/{id}/events")
    class EventsTests {

        @Test
        @DisplayName("opens a stream from the since parameter")
        void streamsFromSince() throws Exception {
            Task task = sampleTask();
            when(orchestrator.get("task-abc")).thenReturn(Optional.of(task));
            when(sseStreamingService.createEmitter(any(), anyLong())).thenReturn(new SseEmitter());

            mockMvc.perform(get("/tasks/task-abc/events").param("since", "7"))
                    .andExpect(request().asyncStarted())
                    .andExpect(header().string("X-Accel-Buffering", "no"));

            verify(sseStreamingService).createEmitter(task, 7L);
        }

        @Test
        @DisplayName("falls back to Last-Event-ID")
        void lastEventId() throws Exception {
            Task task = sampleTask();
            when(orchestrator.get("task-abc")).thenReturn(Optional.of(task));
            when(sseStreamingService.createEmitter(any(), anyLong())).thenReturn(new SseEmitter());

            mockMvc.perform(get("/tasks/task-abc/events").header("Last-Event-ID", "12"))
                    .andExpect(request().asyncStarted());

            verify(sseStreamingService).createEmitter(task, 12L);
        }

        @Test
        @DisplayName("unknown task is 404 before streaming")
        void unknownTask() throws Exception {
            when(orchestrator.get("missing")).thenReturn(Optional.empty());

            mockMvc.perform(get("/tasks/missing/events"))
                    .andExpect(status().isNotFound());
            verifyNoInteractions(sseStreamingService);
        }

        @Test
        @DisplayName("parseSeq tolerates junk and negatives")
        void parseSeq() {
            assertEquals(0, TaskController.parseSeq(null));
            assertEquals(0, TaskController.parseSeq(""));
            assertEquals(0, TaskController.parseSeq("abc"));
            assertEquals(0, TaskController.parseSeq("-4"));
            assertEquals(3, TaskController.parseSeq(" 3 "));
            assertEquals(5, TaskController.parseSeq("5.9"));
        }
    }

    // ── control endpoints ───────────────────────────────────────────

    @Nested
    @DisplayName("control")
    class ControlTests {

        @Test
        @DisplayName("POST cancel and resume acknowledge")
        void cancelAndResume() throws Exception {
            mockMvc.perform(post("/tasks/task-abc/cancel"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ok").value(true));
            mockMvc.perform(post("/tasks/task-abc/resume"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ok").value(true));

            verify(orchestrator).cancel("task-abc");
            verify(orchestrator).resume("task-abc");
        }

        @Test
        @DisplayName("POST input forwards text and target repository")
        void input() throws Exception {
            mockMvc.perform(post("/tasks/task-abc/input")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"text\":\"yes\",\"repoId\":\"api\"}"))
                    .andExpect(status().isOk());

            verify(orchestrator).sendInput("task-abc", "yes", "api");
        }

        @Test
        @DisplayName("input without text is 400")
        void inputWithoutText() throws Exception {
            doThrow(new TaskRequestException("text is required"))
                    .when(orchestrator).sendInput("task-abc", null, null);

            mockMvc.perform(post("/tasks/task-abc/input").contentType(MediaType.APPLICATION_JSON).content("{}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("bad_request"));
        }
    }

    // ── promotion ───────────────────────────────────────────────────

    @Nested
    @DisplayName("promotion")
    class PromoteTests {

        @Test
        @DisplayName("POST /tasks/{id}/promote returns one result per repository")
        void promoteAll() throws Exception {
            when(orchestrator.promote(eq("task-abc"), isNull(), any())).thenReturn(List.of(
                    PromoteResult.pullRequest("api", "https://github.com/acme/api/pull/3"),
                    PromoteResult.skipped("web")));

            mockMvc.perform(post("/tasks/task-abc/promote")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"message\":\"Ship it\",\"prTitle\":\"Ship\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ok").value(true))
                    .andExpect(jsonPath("$.results", hasSize(2)))
                    .andExpect(jsonPath("$.results[0].prUrl").value("https://github.com/acme/api/pull/3"))
                    .andExpect(jsonPath("$.results[1].skipped").value(true))
                    .andExpect(jsonPath("$.results[1].prUrl").doesNotExist());

            var captor = ArgumentCaptor.forClass(PromoteOptions.class);
            verify(orchestrator).promote(eq("task-abc"), isNull(), captor.capture());
            assertEquals("Ship it", captor.getValue().message());
            assertEquals("Ship", captor.getValue().prTitle());
        }

        @Test
        @DisplayName("per-repository promote flattens the result")
        void promoteRepo() throws Exception {
            when(orchestrator.promote(eq("task-abc"), eq("api"), any()))
                    .thenReturn(List.of(PromoteResult.pushedWithoutPr("api")));

            mockMvc.perform(post("/tasks/task-abc/repos/api/promote"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ok").value(true))
                    .andExpect(jsonPath("$.repoId").value("api"))
                    .andExpect(jsonPath("$.pushed").value(true))
                    .andExpect(jsonPath("$.prSkipped").value(true));
        }

        @Test
        @DisplayName("a failed promotion carries promote_failed")
        void promoteFailed() throws Exception {
            when(orchestrator.promote(eq("task-abc"), eq("api"), any()))
                    .thenReturn(List.of(PromoteResult.failed("api", "push rejected")));

            mockMvc.perform(post("/tasks/task-abc/repos/api/promote"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ok").value(false))
                    .andExpect(jsonPath("$.code").value("promote_failed"))
                    .andExpect(jsonPath("$.message").value("push rejected"));
        }
    }
}
