package com.agentdock.dispatch.api;

import com.agentdock.core.health.HealthCheckService;
import com.agentdock.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("GET /healthz is 200 when nothing is DOWN")
    void healthy() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("storage", HealthStatus.Status.UP, "Task store writable", Map.of()),
                new HealthStatus("github", HealthStatus.Status.DEGRADED, "No GitHub token", Map.of())));

        mockMvc.perform(get("/healthz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.github.status").value("DEGRADED"));
    }

    @Test
    @DisplayName("GET /healthz is 503 when a component is DOWN")
    void unhealthy() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("git", HealthStatus.Status.DOWN, "git binary not found", Map.of())));

        mockMvc.perform(get("/healthz"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.components.git.detail").value("git binary not found"));
    }
}
