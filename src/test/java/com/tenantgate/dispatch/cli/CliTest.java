package com.tenantgate.dispatch.cli;

import com.tenantgate.core.health.HealthCheckService;
import com.tenantgate.core.health.HealthStatus;
import com.tenantgate.sandbox.SandboxException;
import com.tenantgate.tenant.TenantControllerRegistry;
import com.tenantgate.tenant.TenantState;
import com.tenantgate.tenant.TenantStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * Exercises picocli directly without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private HealthCheckService healthCheckService;
    private TenantControllerRegistry registry;

    @BeforeEach
    void setUp() {
        healthCheckService = mock(HealthCheckService.class);
        registry = mock(TenantControllerRegistry.class);
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(registry);
                }
                if (cls == ReapCommand.class) {
                    return (K) new ReapCommand(registry);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = new CommandLine(new TenantgateCommand(), createFactory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // ── Help output ──────────────────────────────────────────────────

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("serve", "health", "status", "reap", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
            assertTrue(result.output().contains("Per-tenant sandbox and agent lifecycle controller"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Tenantgate 0.1.0"));
        }

        @Test
        @DisplayName("status without a tenant id is a usage error")
        void statusRequiresTenant() {
            CliResult result = execute("status");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
        }
    }

    // ── health ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("health command")
    class HealthTests {

        @Test
        void printsEveryComponent() {
            var checks = List.of(
                    new HealthStatus("sandbox", HealthStatus.Status.UP, "Docker reachable", Map.of()),
                    new HealthStatus("controlPlane", HealthStatus.Status.DEGRADED, "Not configured", Map.of()));
            when(healthCheckService.checkAll()).thenReturn(checks);
            when(healthCheckService.overall(anyList())).thenReturn(HealthStatus.Status.DEGRADED);

            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("sandbox: Docker reachable"));
            assertTrue(result.output().contains("controlPlane: Not configured"));
            assertTrue(result.output().contains("Overall: degraded"));
        }
    }

    // ── status ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("status command")
    class StatusTests {

        @Test
        void unknownTenant() {
            when(registry.status("ghost")).thenReturn(Optional.empty());

            CliResult result = execute("status", "ghost");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No state recorded for tenant ghost"));
        }

        @Test
        void residentTenantShowsLiveState() {
            when(registry.status("acme")).thenReturn(Optional.of(new TenantStatus(
                    "tenant-acme", "acme", TenantState.READY, true, true, true,
                    "abc123", 42L, 3, 1741608000000L)));

            CliResult result = execute("status", "acme");

            assertTrue(result.output().contains("tenant-acme"));
            assertTrue(result.output().contains("READY"));
            assertTrue(result.output().contains("abc123"));
            assertTrue(result.output().contains("2025-03-10T12:00:00Z"));
        }

        @Test
        void nonResidentTenantShowsMarkerOnly() {
            when(registry.status("acme")).thenReturn(Optional.of(new TenantStatus(
                    "tenant-acme", "acme", TenantState.COLD, false, false, false,
                    null, 0L, 0, 1741608000000L)));

            CliResult result = execute("status", "acme");

            assertTrue(result.output().contains("not resident in this process"));
            assertFalse(result.output().contains("Log offset"));
        }
    }

    // ── reap ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("reap command")
    class ReapTests {

        @Test
        void destroysSandbox() {
            when(registry.reap("acme")).thenReturn(true);

            CliResult result = execute("reap", "acme");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Sandbox for tenant acme destroyed"));
        }

        @Test
        void nothingToReap() {
            when(registry.reap("acme")).thenReturn(false);

            CliResult result = execute("reap", "acme");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("has no sandbox"));
        }

        @Test
        void failureExitsNonZero() {
            when(registry.reap("acme")).thenThrow(new SandboxException("docker daemon gone"));

            CliResult result = execute("reap", "acme");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Reap failed: docker daemon gone"));
        }
    }

    // ── Serve mode detection ─────────────────────────────────────────

    @Nested
    @DisplayName("Serve mode")
    class ServeModeTests {

        @Test
        void serveArgumentSelectsServer() {
            assertTrue(CliRunner.isServeMode(new String[]{"serve"}, false));
            assertFalse(CliRunner.isServeMode(new String[]{"status", "acme"}, true));
        }

        @Test
        void bareInvocationFollowsDefault() {
            assertTrue(CliRunner.isServeMode(new String[0], true));
            assertFalse(CliRunner.isServeMode(new String[0], false));
        }
    }
}
