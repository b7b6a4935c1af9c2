package com.agentdock.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralised Micrometer metrics for task execution.
 */
@Service
public class AgentdockMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger liveProcesses = new AtomicInteger();

    public AgentdockMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("agentdock.processes.live", liveProcesses, AtomicInteger::get)
                .description("Agent processes currently running")
                .register(registry);
    }

    public void recordTaskCreated(int repoCount) {
        Counter.builder("agentdock.tasks.created")
                .register(registry)
                .increment();
        Counter.builder("agentdock.repos.submitted")
                .register(registry)
                .increment(repoCount);
    }

    public void recordPreparation(String repoType, boolean success) {
        Counter.builder("agentdock.repos.prepared")
                .tag("type", repoType)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    /**
     * Records a finished agent run.
     *
     * @param status repository status after exit ("done", "error" or "canceled")
     * @param ms     wall-clock run time
     */
    public void recordRepoExit(String status, long ms) {
        Counter.builder("agentdock.repos.exits")
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("agentdock.run.duration")
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(Math.max(ms, 0)));
    }

    /**
     * @param outcome "pr_created", "pushed", "skipped" or "failed"
     */
    public void recordPromotion(String outcome) {
        Counter.builder("agentdock.promotions.total")
                .description("Promotion attempts by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void processStarted() {
        liveProcesses.incrementAndGet();
    }

    public void processExited() {
        liveProcesses.decrementAndGet();
    }
}
