package com.tenantgate.dispatch.cli;

import com.tenantgate.tenant.TenantControllerRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.time.Instant;

/**
 * CLI command: tenantgate status &lt;tenantId&gt;
 * <p>
 * Shows the tenant's durable marker and, when its controller is resident in this
 * process, the live lifecycle state.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show a tenant's lifecycle status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Tenant id")
    private String tenantId;

    private final TenantControllerRegistry registry;

    public StatusCommand(TenantControllerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var status = registry.status(tenantId);
        if (status.isEmpty()) {
            ConsoleOutput.error("No state recorded for tenant " + tenantId);
            return;
        }
        var s = status.get();
        ConsoleOutput.sandbox(s.name());
        ConsoleOutput.field("Tenant", s.tenantId());
        ConsoleOutput.field("State", s.resident() ? s.state() : "not resident in this process");
        ConsoleOutput.field("Last activity", s.lastActivity() == null ? null : Instant.ofEpochMilli(s.lastActivity()));
        if (s.resident()) {
            ConsoleOutput.field("Sandbox held", s.sandboxHeld());
            ConsoleOutput.field("Agent running", s.agentBelievedRunning());
            ConsoleOutput.field("Config hash", s.injectedConfigHash());
            ConsoleOutput.field("Log offset", s.logOffset());
            ConsoleOutput.field("Buffered log lines", s.bufferedLogEntries());
        }
    }
}
