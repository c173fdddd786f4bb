package com.tenantgate.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantgate.config.ConfigSnapshot;
import com.tenantgate.core.metrics.TenantgateMetrics;
import com.tenantgate.core.time.Sleeper;
import com.tenantgate.sandbox.Sandbox;
import com.tenantgate.sandbox.SandboxException;
import com.tenantgate.sandbox.SandboxHttpRequest;
import com.tenantgate.sandbox.SandboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the agent HTTP server running inside one tenant's sandbox.
 *
 * <p>The supervisor trusts a local "believed running" flag so that the warm path costs
 * no sandbox calls at all. The flag is volatile state: it starts false after every
 * rehydration, in which case the health endpoint is probed before anything is restarted.
 * Callers clear it through {@link #markNotRunning()} when a proxied call fails.
 */
public class ProcessSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);

    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(2);

    private final SandboxProperties properties;
    private final SandboxDiagnostics diagnostics;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;
    private final Clock clock;
    private final TenantgateMetrics metrics;

    private boolean believedRunning;

    public ProcessSupervisor(SandboxProperties properties, SandboxDiagnostics diagnostics,
                             ObjectMapper objectMapper, Sleeper sleeper, Clock clock,
                             TenantgateMetrics metrics) {
        this.properties = properties;
        this.diagnostics = diagnostics;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;
        this.clock = clock;
        this.metrics = metrics;
    }

    public boolean isBelievedRunning() {
        return believedRunning;
    }

    public void markNotRunning() {
        believedRunning = false;
    }

    /**
     * Returns once the agent answers its health check, starting it if necessary.
     *
     * @throws ColdStartException if a started agent never became healthy
     */
    public void ensureAgentRunning(Sandbox sandbox, ConfigSnapshot config) {
        if (believedRunning) {
            return;
        }
        if (probeHealth(sandbox)) {
            log.info("Agent already healthy in {}, reusing it", sandbox.name());
            believedRunning = true;
            return;
        }
        coldStart(sandbox, config);
    }

    public boolean probeHealth(Sandbox sandbox) {
        return healthFailure(sandbox) == null;
    }

    void coldStart(Sandbox sandbox, ConfigSnapshot config) {
        long start = clock.millis();
        String command = properties.getAgentCommand() + " > " + properties.getAgentLogFile() + " 2>&1";
        log.info("Cold-starting agent in {}", sandbox.name());
        long pid = sandbox.startProcess(command, properties.getAgentWorkDir(), buildEnvironment(config));
        log.debug("Agent process started in {} (pid {})", sandbox.name(), pid);

        try {
            waitForServer(sandbox);
        } catch (ColdStartException e) {
            if (metrics != null) metrics.recordColdStart(false, clock.millis() - start);
            throw e;
        }
        believedRunning = true;
        long elapsed = clock.millis() - start;
        if (metrics != null) metrics.recordColdStart(true, elapsed);
        log.info("Agent ready in {} after {} ms", sandbox.name(), elapsed);
    }

    /**
     * Polls the health endpoint until it answers or the attempt budget is spent.
     *
     * @throws ColdStartException carrying diagnostics when the budget is spent
     */
    public void waitForServer(Sandbox sandbox) {
        int attempts = properties.getHealthPollAttempts();
        List<String> notes = new ArrayList<>();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            String failure = healthFailure(sandbox);
            if (failure == null) {
                log.debug("Agent healthy in {} after {} attempt(s)", sandbox.name(), attempt);
                return;
            }
            notes.add("attempt " + attempt + ": " + failure);
            if (attempt < attempts) {
                try {
                    sleeper.sleep(properties.getHealthPollInterval());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SandboxException("Interrupted waiting for agent in " + sandbox.name(), e);
                }
            }
        }
        log.error("Agent in {} not healthy after {} attempts", sandbox.name(), attempts);
        // Keep the bundle readable: first and last notes are the informative ones
        List<String> summary = notes.size() <= 4
                ? notes
                : List.of(notes.get(0), notes.get(1), "...", notes.get(notes.size() - 1));
        throw new ColdStartException("Agent server failed to start after " + attempts + " health checks",
                diagnostics.collect(sandbox, summary));
    }

    Map<String, String> buildEnvironment(ConfigSnapshot config) {
        var env = new LinkedHashMap<String, String>();
        env.put("NODE_ENV", "production");
        env.put("TENANT_ID", nullToEmpty(config.tenantId()));
        env.put("USER_ID", nullToEmpty(config.userId()));
        env.put("SKILLS_PATH", properties.getSkillsPath());
        env.put("CONNECTORS_CONFIG", connectorsJson(config));
        env.put("PORT", String.valueOf(properties.getAgentPort()));

        var agent = properties.getAgent();
        if (properties.isBedrockConfigured()) {
            env.put("CLAUDE_CODE_USE_BEDROCK", "1");
            env.put("AWS_ACCESS_KEY_ID", agent.getAwsAccessKeyId());
            env.put("AWS_SECRET_ACCESS_KEY", agent.getAwsSecretAccessKey());
            env.put("AWS_REGION", agent.getAwsRegion() != null ? agent.getAwsRegion() : "us-east-1");
        } else if (agent.getAnthropicApiKey() != null && !agent.getAnthropicApiKey().isBlank()) {
            env.put("ANTHROPIC_API_KEY", agent.getAnthropicApiKey());
        } else {
            log.warn("No model credentials configured; agent in tenant {} will not be able to answer",
                    config.tenantId());
        }
        env.putAll(agent.getExtraEnv());
        return env;
    }

    /**
     * @return null when healthy, otherwise a short description of why not
     */
    private String healthFailure(Sandbox sandbox) {
        try (var response = sandbox.httpCall(
                SandboxHttpRequest.get(properties.getAgentHealthPath(), HEALTH_TIMEOUT), properties.getAgentPort())) {
            if (!response.isSuccessful()) {
                return "status " + response.statusCode();
            }
            String body = response.readBody();
            return body.contains("ok") ? null : "unexpected body: " + abbreviate(body);
        } catch (SandboxException e) {
            return e.getMessage();
        }
    }

    private String connectorsJson(ConfigSnapshot config) {
        try {
            return objectMapper.writeValueAsString(config.connectors().stream().map(ConfigInjector::toMap).toList());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Connector list is not serializable", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String abbreviate(String value) {
        return value.length() > 120 ? value.substring(0, 120) + "..." : value;
    }
}
