package com.tenantgate.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for tenant sandbox lifecycles.
 */
@Service
public class TenantgateMetrics {

    private final MeterRegistry registry;

    public TenantgateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordColdStart(boolean success, long ms) {
        Timer.builder("tenantgate.agent.cold_start")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSandboxProvisioned() {
        Counter.builder("tenantgate.sandbox.provisioned")
                .register(registry)
                .increment();
    }

    public void recordConfigFetch(boolean success) {
        Counter.builder("tenantgate.config.fetches")
                .tag("result", success ? "success" : "degraded")
                .register(registry)
                .increment();
    }

    public void recordConfigInjection(int skillCount) {
        DistributionSummary.builder("tenantgate.config.injected_skills")
                .register(registry)
                .record(skillCount);
    }

    /**
     * Records a proxy retry.
     *
     * @param kind "chat" for the unary restart-and-retry, "websocket" for upgrade backoff
     */
    public void recordProxyRetry(String kind) {
        Counter.builder("tenantgate.proxy.retries")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordProxyFailure(String kind) {
        Counter.builder("tenantgate.proxy.failures")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordChatLatency(long ms) {
        Timer.builder("tenantgate.chat.latency")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStreamEvent(String type) {
        Counter.builder("tenantgate.stream.events")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void recordTokenUsage(long inputTokens, long outputTokens) {
        Counter.builder("tenantgate.tokens")
                .tag("direction", "input")
                .register(registry)
                .increment(inputTokens);
        Counter.builder("tenantgate.tokens")
                .tag("direction", "output")
                .register(registry)
                .increment(outputTokens);
    }

    public void recordLogFlush(int entries, boolean success) {
        Counter.builder("tenantgate.logs.flushes")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
        if (success) {
            DistributionSummary.builder("tenantgate.logs.batch_size")
                    .register(registry)
                    .record(entries);
        }
    }

    public void recordLogRetentionDeletes(int deleted) {
        Counter.builder("tenantgate.logs.retention_deletes")
                .register(registry)
                .increment(deleted);
    }

    public void recordIdleDestroy() {
        Counter.builder("tenantgate.sandbox.idle_destroys")
                .description("Sandboxes destroyed after the inactivity threshold")
                .register(registry)
                .increment();
    }
}
