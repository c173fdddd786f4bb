package com.tenantgate.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Runs the operator commands (health, status, reap) through picocli and hands
 * their exit code to Spring Boot. Serve mode is left to the web server.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final String SERVE = "serve";

    private final TenantgateCommand tenantgateCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TenantgateCommand tenantgateCommand, IFactory factory) {
        this.tenantgateCommand = tenantgateCommand;
        this.factory = factory;
    }

    /**
     * True when the process should stay up as an HTTP server. A bare invocation counts
     * as serve mode when {@code TENANTGATE_SERVE} is set, which is how container images run.
     */
    public static boolean isServeMode(String[] args, boolean serveByDefault) {
        if (args.length == 0) {
            return serveByDefault;
        }
        return Arrays.asList(args).contains(SERVE);
    }

    @Override
    public void run(String... args) {
        // picocli's execute() would return at once and let main() exit under the server
        if (isServeMode(args, false)) {
            return;
        }
        exitCode = new CommandLine(tenantgateCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
