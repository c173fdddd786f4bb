package com.tenantgate.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Tenantgate.
 * Routes to subcommands: serve, health, status, reap.
 */
@Command(
        name = "tenantgate",
        mixinStandardHelpOptions = true,
        version = "Tenantgate 0.1.0",
        description = "Per-tenant sandbox and agent lifecycle controller",
        subcommands = {
                ServeCommand.class,
                HealthCommand.class,
                StatusCommand.class,
                ReapCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TenantgateCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
