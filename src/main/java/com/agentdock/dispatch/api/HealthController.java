package com.agentdock.dispatch.api;

import com.agentdock.core.health.HealthCheckService;
import com.agentdock.core.health.HealthStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness and component health.
 */
@RestController
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /healthz: 200 unless a component is DOWN, then 503.
     */
    @GetMapping("/healthz")
    public ResponseEntity<Map<String, Object>> health() {
        var checks = healthCheckService.checkAll();
        boolean anyDown = false;

        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : checks) {
            Map<String, String> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            components.put(check.component(), componentInfo);

            if (check.status() == HealthStatus.Status.DOWN) {
                anyDown = true;
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("ok", !anyDown);
        result.put("status", anyDown ? "DOWN" : "UP");
        result.put("components", components);

        return anyDown ? ResponseEntity.status(503).body(result)
                       : ResponseEntity.ok(result);
    }
}
