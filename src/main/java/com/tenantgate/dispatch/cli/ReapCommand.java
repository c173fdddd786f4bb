package com.tenantgate.dispatch.cli;

import com.tenantgate.core.error.TenantgateException;
import com.tenantgate.tenant.TenantControllerRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: tenantgate reap &lt;tenantId&gt;
 * <p>
 * Flushes the tenant's remaining agent logs and destroys its sandbox immediately,
 * exactly as an idle timeout would.
 */
@Command(name = "reap", mixinStandardHelpOptions = true, description = "Destroy a tenant's sandbox now")
@Component
public class ReapCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Tenant id")
    private String tenantId;

    private final TenantControllerRegistry registry;

    public ReapCommand(TenantControllerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            if (registry.reap(tenantId)) {
                ConsoleOutput.success("Sandbox for tenant " + tenantId + " destroyed");
            } else {
                ConsoleOutput.info("Tenant " + tenantId + " has no sandbox");
            }
            return 0;
        } catch (TenantgateException e) {
            ConsoleOutput.error("Reap failed: " + e.getMessage());
            return 1;
        }
    }
}
