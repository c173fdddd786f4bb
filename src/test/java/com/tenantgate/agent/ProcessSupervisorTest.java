package com.tenantgate.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.tenantgate.config.ConfigSnapshot;
import com.tenantgate.core.metrics.TenantgateMetrics;
import com.tenantgate.sandbox.FakeSandbox;
import com.tenantgate.sandbox.Sandbox;
import com.tenantgate.sandbox.SandboxProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ProcessSupervisorTest {

    private SandboxProperties properties;
    private List<Duration> sleeps;
    private SimpleMeterRegistry registry;
    private ProcessSupervisor supervisor;
    private final ConfigSnapshot config = ConfigSnapshot.empty("acme", "alice");

    @BeforeEach
    void setUp() {
        properties = new SandboxProperties();
        properties.getAgent().setAnthropicApiKey("sk-test");
        sleeps = new ArrayList<>();
        registry = new SimpleMeterRegistry();
        supervisor = new ProcessSupervisor(properties, new ShellSandboxDiagnostics("/tmp/agent.log"),
                new ObjectMapper(), sleeps::add, Clock.systemUTC(), new TenantgateMetrics(registry));
    }

    // ── ensureAgentRunning ──

    @Test
    void believedRunningAgentCostsNoSandboxCalls() {
        var sandbox = new FakeSandbox("tenant-acme");
        supervisor.ensureAgentRunning(sandbox, config);
        assertTrue(supervisor.isBelievedRunning());

        Sandbox untouched = mock(Sandbox.class);
        supervisor.ensureAgentRunning(untouched, config);

        verifyNoInteractions(untouched);
    }

    @Test
    void healthyAgentIsAdoptedWithoutRestart() {
        var sandbox = new FakeSandbox("tenant-acme").healthy(true);

        supervisor.ensureAgentRunning(sandbox, config);

        assertTrue(supervisor.isBelievedRunning());
        assertTrue(sandbox.startedCommands.isEmpty());
        assertEquals(1, sandbox.healthCalls());
    }

    @Test
    void unhealthyAgentIsColdStarted() {
        var sandbox = new FakeSandbox("tenant-acme");

        supervisor.ensureAgentRunning(sandbox, config);

        assertEquals(1, sandbox.startedCommands.size());
        assertEquals("node /app/packages/agent/dist/index.js > /tmp/agent.log 2>&1", sandbox.startedCommands.get(0));
        assertTrue(supervisor.isBelievedRunning());
        assertEquals(1, registry.find("tenantgate.agent.cold_start").tag("result", "success").timer().count());
    }

    @Test
    void markNotRunningForcesProbeOnNextCall() {
        var sandbox = new FakeSandbox("tenant-acme");
        supervisor.ensureAgentRunning(sandbox, config);
        long probes = sandbox.healthCalls();

        supervisor.markNotRunning();
        supervisor.ensureAgentRunning(sandbox, config);

        assertEquals(probes + 1, sandbox.healthCalls());
        assertEquals(1, sandbox.startedCommands.size());
    }

    // ── waitForServer ──

    @Test
    void waitForServerGivesUpAfterExactlyThirtyChecks() {
        var sandbox = new FakeSandbox("tenant-acme").startMakesHealthy(false);

        var e = assertThrows(ColdStartException.class, () -> supervisor.ensureAgentRunning(sandbox, config));

        // one probe before starting, then the polling budget
        assertEquals(31, sandbox.healthCalls());
        assertEquals(29, sleeps.size());
        assertTrue(sleeps.stream().allMatch(d -> d.equals(Duration.ofMillis(200))));
        assertFalse(supervisor.isBelievedRunning());
        assertTrue(e.getMessage().contains("30"));
    }

    @Test
    void coldStartFailureCarriesDiagnostics() {
        var sandbox = new FakeSandbox("tenant-acme").startMakesHealthy(false);
        sandbox.appendLog("Error: Cannot find module 'express'\n");

        var e = assertThrows(ColdStartException.class, () -> supervisor.ensureAgentRunning(sandbox, config));

        Diagnostics diagnostics = e.getDiagnostics();
        assertTrue(diagnostics.agentLog().contains("Cannot find module"));
        assertEquals("output of ps aux", diagnostics.processes());
        assertFalse(diagnostics.listeningPorts().isBlank());
        assertFalse(diagnostics.notes().isEmpty());
        assertEquals(1, registry.find("tenantgate.agent.cold_start").tag("result", "failure").timer().count());
    }

    // ── buildEnvironment ──

    @Test
    void environmentCarriesIdentityAndApiKey() {
        Map<String, String> env = supervisor.buildEnvironment(new ConfigSnapshot("acme", "alice", List.of(),
                List.of(new ConfigSnapshot.Connector("github", "mcp", JsonNodeFactory.instance.objectNode().put("url", "x")))));

        assertEquals("production", env.get("NODE_ENV"));
        assertEquals("acme", env.get("TENANT_ID"));
        assertEquals("alice", env.get("USER_ID"));
        assertEquals("/app/skills", env.get("SKILLS_PATH"));
        assertEquals("8080", env.get("PORT"));
        assertEquals("sk-test", env.get("ANTHROPIC_API_KEY"));
        assertTrue(env.get("CONNECTORS_CONFIG").contains("\"github\""));
        assertFalse(env.containsKey("CLAUDE_CODE_USE_BEDROCK"));
    }

    @Test
    void bedrockCredentialsTakePrecedence() {
        properties.getAgent().setAwsAccessKeyId("AKIA");
        properties.getAgent().setAwsSecretAccessKey("secret");
        properties.getAgent().setAwsRegion("eu-west-1");

        Map<String, String> env = supervisor.buildEnvironment(config);

        assertEquals("1", env.get("CLAUDE_CODE_USE_BEDROCK"));
        assertEquals("AKIA", env.get("AWS_ACCESS_KEY_ID"));
        assertEquals("eu-west-1", env.get("AWS_REGION"));
        assertFalse(env.containsKey("ANTHROPIC_API_KEY"));
    }

    @Test
    void extraEnvIsPassedThrough() {
        properties.getAgent().getExtraEnv().put("LOG_LEVEL", "debug");

        assertEquals("debug", supervisor.buildEnvironment(config).get("LOG_LEVEL"));
    }
}
