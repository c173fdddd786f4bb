package com.tenantgate.tenant;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenantgate.agent.ColdStartException;
import com.tenantgate.agent.ProxyException;
import com.tenantgate.sandbox.FakeSandbox;
import com.tenantgate.sandbox.SandboxProvisionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TenantControllerTest {

    @TempDir
    Path dir;

    private TenantFixture fixture;
    private TenantController controller;

    @BeforeEach
    void setUp() {
        fixture = new TenantFixture(dir);
        controller = new TenantController("tenant-acme", fixture.runtime);
    }

    // ── Bring-up ──────────────────────────────────────────────────────

    @Test
    void firstChatProvisionsConfiguresAndStartsAgent() {
        ChatResult result = controller.chat("acme", "alice", "hello", "s1");

        assertEquals(200, result.status());
        assertEquals("hello", ((JsonNode) result.body().get("response")).asText());
        assertEquals("s1", result.body().get("sessionId"));
        assertEquals(1, fixture.provider.creations());

        FakeSandbox sandbox = fixture.provider.get("tenant-acme");
        assertEquals("# Review v1", sandbox.files.get("/app/skills/review/SKILL.md"));
        assertEquals(1, sandbox.startedCommands.size());
        assertEquals(TenantState.READY, controller.state());
    }

    @Test
    void warmChatWithinTtlSkipsFetchInjectionAndHealthChecks() {
        controller.chat("acme", "alice", "first", "s1");
        FakeSandbox sandbox = fixture.provider.get("tenant-acme");
        long healthCalls = sandbox.healthCalls();
        int execs = sandbox.execCommands.size();

        fixture.clock.advance(Duration.ofSeconds(30));
        controller.chat("acme", "alice", "second", "s1");

        assertEquals(1, fixture.fetches.get());
        assertEquals(healthCalls, sandbox.healthCalls());
        assertEquals(execs, sandbox.execCommands.size());
        assertEquals(2, sandbox.agentCalls());
        assertEquals(1, fixture.registry.find("tenantgate.config.injected_skills").summary().count());
    }

    @Test
    void changedConfigIsReinjectedWithoutRestartingAgent() {
        controller.chat("acme", "alice", "first", "s1");
        FakeSandbox sandbox = fixture.provider.get("tenant-acme");

        fixture.skillContent = "# Review v2";
        fixture.clock.advance(Duration.ofSeconds(61));
        controller.chat("acme", "alice", "second", "s1");

        assertEquals(2, fixture.fetches.get());
        assertEquals("# Review v2", sandbox.files.get("/app/skills/review/SKILL.md"));
        assertEquals(1, sandbox.startedCommands.size());
    }

    @Test
    void unchangedConfigAfterTtlIsNotReinjected() {
        controller.chat("acme", "alice", "first", "s1");

        fixture.clock.advance(Duration.ofMinutes(2));
        controller.chat("acme", "alice", "second", "s1");

        assertEquals(2, fixture.fetches.get());
        assertEquals(1, fixture.registry.find("tenantgate.config.injected_skills").summary().count());
    }

    @Test
    void provisioningFailureLeavesControllerCold() {
        fixture.provider.failOpen(true);

        assertThrows(SandboxProvisionException.class, () -> controller.chat("acme", "alice", "hi", null));
        assertEquals(TenantState.COLD, controller.state());

        fixture.provider.failOpen(false);
        assertEquals(200, controller.chat("acme", "alice", "hi", null).status());
    }

    @Test
    void agentThatNeverStartsSurfacesColdStartFailure() {
        fixture.provider.seed("tenant-acme").startMakesHealthy(false);

        var e = assertThrows(ColdStartException.class, () -> controller.chat("acme", "alice", "hi", null));

        assertNotNull(e.getDiagnostics());
        assertEquals(TenantState.STARTING_AGENT, controller.state());
    }

    // ── Rehydration ───────────────────────────────────────────────────

    @Test
    void rehydratedControllerAdoptsRunningAgent() {
        FakeSandbox survivor = fixture.provider.seed("tenant-acme").healthy(true);

        ChatResult result = controller.chat("acme", "alice", "hi", null);

        assertEquals(200, result.status());
        assertTrue(survivor.startedCommands.isEmpty(), "healthy agent must not be restarted");
        assertEquals(0, fixture.provider.creations());
    }

    @Test
    void wakeUpOnFreshInstanceReconnectsAndFlushesLogs() {
        fixture.durableStore.put("tenant-acme", TenantController.MARKER_KEY,
                new DurableMarker(fixture.clock.millis(), "acme"));
        FakeSandbox survivor = fixture.provider.seed("tenant-acme").healthy(true);
        survivor.appendLog("still running\n");

        WakeUpOutcome outcome = controller.onWakeUp();

        assertEquals(WakeUpOutcome.RESCHEDULED, outcome);
        assertEquals(1, fixture.blobStore.list("logs/acme/").size());
        verify(fixture.timer).arm("tenant-acme", fixture.lifecycleProperties.getFlushInterval());
    }

    @Test
    void tenantIdIsRecoveredFromNameWithoutMarker() {
        fixture.provider.seed("tenant-acme").appendLog("orphan line\n");

        controller.onWakeUp();

        assertEquals(1, fixture.blobStore.list("logs/acme/").size());
    }

    // ── Lost sandbox ──────────────────────────────────────────────────

    @Test
    void chatRecoversWhenSandboxIsRemovedBehindController() {
        controller.chat("acme", "alice", "hi", "s1");
        FakeSandbox original = fixture.provider.get("tenant-acme");
        original.destroy();

        ChatResult result = controller.chat("acme", "alice", "again", "s1");

        assertEquals(200, result.status());
        assertEquals(2, fixture.provider.creations());
        FakeSandbox replacement = fixture.provider.get("tenant-acme");
        assertNotSame(original, replacement);
        assertEquals("# Review v1", replacement.files.get("/app/skills/review/SKILL.md"));
        assertEquals(1, replacement.startedCommands.size());
        assertEquals(TenantState.READY, controller.state());
    }

    @Test
    void failedStreamOnRemovedSandboxIsRecoveredByNextRequest() {
        controller.chat("acme", "alice", "hi", "s1");
        fixture.provider.get("tenant-acme").destroy();

        assertThrows(ProxyException.class, () -> controller.openStream("acme", "alice", "hi", "s1"));
        ChatResult result = controller.chat("acme", "alice", "again", "s1");

        assertEquals(200, result.status());
        assertEquals(2, fixture.provider.creations());
    }

    @Test
    void stoppedSandboxReconnectedOnWakeUpIsRestartedByNextChat() {
        fixture.durableStore.put("tenant-acme", TenantController.MARKER_KEY,
                new DurableMarker(fixture.clock.millis(), "acme"));
        FakeSandbox stopped = fixture.provider.seed("tenant-acme").stop();

        assertEquals(WakeUpOutcome.RESCHEDULED, controller.onWakeUp());
        assertTrue(controller.status().sandboxHeld());

        ChatResult result = controller.chat("acme", "alice", "hi", "s1");

        assertEquals(200, result.status());
        assertFalse(stopped.isStopped());
        assertEquals(0, fixture.provider.creations());
        assertEquals(1, stopped.startedCommands.size());
    }

    @Test
    void idleWakeUpDestroysStoppedSandbox() {
        fixture.durableStore.put("tenant-acme", TenantController.MARKER_KEY,
                new DurableMarker(fixture.clock.millis(), "acme"));
        FakeSandbox stopped = fixture.provider.seed("tenant-acme").stop();
        fixture.clock.advance(Duration.ofMinutes(31));

        assertEquals(WakeUpOutcome.DESTROYED, controller.onWakeUp());

        assertTrue(stopped.isDestroyed());
        assertEquals(TenantState.IDLE, controller.state());
    }

    // ── Chat results ──────────────────────────────────────────────────

    @Test
    void agentFailureStatusBecomesExecutionError() {
        fixture.provider.seed("tenant-acme").healthy(true)
                .agentHandler(r -> FakeSandbox.response(500, "{\"error\":\"model overloaded\"}"));

        ChatResult result = controller.chat("acme", "alice", "hi", "s9");

        assertEquals(500, result.status());
        assertEquals("Agent execution failed", result.body().get("error"));
        assertEquals("s9", result.body().get("sessionId"));
        assertTrue(controller.listSessions("acme", "alice").isEmpty());
    }

    @Test
    void agentErrorFieldIsReturnedWithLogTail() {
        FakeSandbox sandbox = fixture.provider.seed("tenant-acme").healthy(true)
                .agentHandler(r -> FakeSandbox.response(200, "{\"error\":\"tool crashed\"}"));
        sandbox.appendLog("TypeError: undefined\n");

        ChatResult result = controller.chat("acme", "alice", "hi", "s1");

        assertEquals(200, result.status());
        @SuppressWarnings("unchecked")
        var diagnostics = (Map<String, Object>) result.body().get("diagnostics");
        assertTrue(diagnostics.get("agentLog").toString().contains("TypeError"));
    }

    @Test
    void missingSessionIdIsGenerated() {
        ChatResult result = controller.chat("acme", "alice", "hi", null);

        String sessionId = (String) result.body().get("sessionId");
        assertNotNull(sessionId);
        assertFalse(sessionId.isBlank());
    }

    @Test
    void missingUsageDefaultsToZero() {
        fixture.provider.seed("tenant-acme").healthy(true)
                .agentHandler(r -> FakeSandbox.response(200, "{\"response\":\"plain\"}"));

        ChatResult result = controller.chat("acme", "alice", "hi", "s1");

        assertEquals("plain", ((JsonNode) result.body().get("response")).asText());
        assertEquals(0, ((JsonNode) result.body().get("usage")).get("inputTokens").asInt());
    }

    // ── Sessions ──────────────────────────────────────────────────────

    @Test
    void sessionsAreListedNewestFirstPerUser() {
        controller.chat("acme", "alice", "one", "s1");
        fixture.clock.advance(Duration.ofSeconds(5));
        controller.chat("acme", "alice", "two", "s2");
        controller.chat("acme", "bob", "three", "s3");

        var sessions = controller.listSessions("acme", "alice");

        assertEquals(2, sessions.size());
        assertEquals("s2", sessions.get(0).id());
        assertEquals("two", sessions.get(0).lastMessage());
        assertEquals("s1", sessions.get(1).id());
    }

    @Test
    void getSessionIsScopedToUser() {
        controller.chat("acme", "alice", "one", "s1");

        assertTrue(controller.getSession("acme", "alice", "s1").isPresent());
        assertTrue(controller.getSession("acme", "bob", "s1").isEmpty());
    }

    // ── Lifecycle ─────────────────────────────────────────────────────

    @Test
    void everyRequestRecordsActivityAndArmsTimer() {
        controller.chat("acme", "alice", "hi", "s1");

        var marker = fixture.durableStore.get("tenant-acme", TenantController.MARKER_KEY, DurableMarker.class);
        assertEquals(new DurableMarker(fixture.clock.millis(), "acme"), marker.orElseThrow());
        verify(fixture.timer).arm("tenant-acme", fixture.lifecycleProperties.getFlushInterval());
    }

    @Test
    void requestWithoutSandboxArmsIdleThreshold() {
        controller.listSessions("acme", "alice");

        verify(fixture.timer).arm("tenant-acme", fixture.lifecycleProperties.getIdleThreshold());
    }

    @Test
    void wakeUpWithinThresholdFlushesAndReschedules() {
        controller.chat("acme", "alice", "hi", "s1");
        fixture.provider.get("tenant-acme").appendLog("handled chat\n");
        fixture.clock.advance(Duration.ofMinutes(5));

        assertEquals(WakeUpOutcome.RESCHEDULED, controller.onWakeUp());

        assertEquals(1, fixture.blobStore.list("logs/acme/").size());
        assertEquals(TenantState.READY, controller.state());
    }

    @Test
    void wakeUpAfterIdleThresholdDestroysSandbox() {
        controller.chat("acme", "alice", "hi", "s1");
        FakeSandbox sandbox = fixture.provider.get("tenant-acme");
        sandbox.appendLog("last words\n");
        fixture.clock.advance(Duration.ofMinutes(31));

        assertEquals(WakeUpOutcome.DESTROYED, controller.onWakeUp());

        assertTrue(sandbox.isDestroyed());
        assertEquals(TenantState.IDLE, controller.state());
        assertFalse(controller.status().sandboxHeld());
        assertFalse(controller.status().agentBelievedRunning());
        assertEquals(1, fixture.blobStore.list("logs/acme/").size(), "final logs flushed before teardown");
        assertEquals(1.0, fixture.registry.find("tenantgate.sandbox.idle_destroys").counter().count());
    }

    @Test
    void requestAfterIdleDestroyStartsFromScratch() {
        controller.chat("acme", "alice", "hi", "s1");
        fixture.clock.advance(Duration.ofMinutes(31));
        controller.onWakeUp();

        ChatResult result = controller.chat("acme", "alice", "again", "s1");

        assertEquals(200, result.status());
        assertEquals(2, fixture.provider.creations());
        FakeSandbox fresh = fixture.provider.get("tenant-acme");
        assertEquals("# Review v1", fresh.files.get("/app/skills/review/SKILL.md"));
        assertEquals(1, fresh.startedCommands.size());
    }

    @Test
    void idleWakeUpWithoutSandboxIsDormant() {
        fixture.durableStore.put("tenant-acme", TenantController.MARKER_KEY,
                new DurableMarker(fixture.clock.millis(), "acme"));
        fixture.clock.advance(Duration.ofHours(1));

        assertEquals(WakeUpOutcome.DORMANT, controller.onWakeUp());
        assertEquals(TenantState.IDLE, controller.state());
    }

    @Test
    void reapDestroysImmediately() {
        controller.chat("acme", "alice", "hi", "s1");
        FakeSandbox sandbox = fixture.provider.get("tenant-acme");

        assertTrue(controller.reap());

        assertTrue(sandbox.isDestroyed());
        verify(fixture.timer).cancel("tenant-acme");
        assertFalse(controller.reap());
    }

    @Test
    void retireIsRefusedWhileSandboxIsHeld() {
        controller.chat("acme", "alice", "hi", "s1");
        assertFalse(controller.tryRetire());

        controller.reap();
        assertTrue(controller.tryRetire());
        assertThrows(ControllerRetiredException.class, () -> controller.chat("acme", "alice", "hi", "s1"));
    }

    @Test
    void statusReflectsLiveState() {
        controller.chat("acme", "alice", "hi", "s1");

        TenantStatus status = controller.status();

        assertEquals("tenant-acme", status.name());
        assertEquals("acme", status.tenantId());
        assertEquals(TenantState.READY, status.state());
        assertTrue(status.resident());
        assertTrue(status.sandboxHeld());
        assertTrue(status.agentBelievedRunning());
        assertNotNull(status.injectedConfigHash());
        assertEquals(fixture.clock.millis(), status.lastActivity());
    }
}
