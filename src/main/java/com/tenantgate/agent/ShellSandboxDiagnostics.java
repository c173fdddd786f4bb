package com.tenantgate.agent;

import com.tenantgate.sandbox.ExecResult;
import com.tenantgate.sandbox.Sandbox;
import com.tenantgate.sandbox.SandboxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Gathers diagnostics with ordinary shell tools run through {@link Sandbox#exec}.
 */
public class ShellSandboxDiagnostics implements SandboxDiagnostics {

    private static final Logger log = LoggerFactory.getLogger(ShellSandboxDiagnostics.class);

    private static final int LOG_TAIL_LINES = 30;

    private final String logFile;

    public ShellSandboxDiagnostics(String logFile) {
        this.logFile = logFile;
    }

    @Override
    public Diagnostics collect(Sandbox sandbox, List<String> notes) {
        return new Diagnostics(
                agentLogTail(sandbox),
                run(sandbox, "ps aux"),
                run(sandbox, "ss -tulpn 2>&1 || netstat -tulpn 2>&1"),
                notes);
    }

    @Override
    public String agentLogTail(Sandbox sandbox) {
        return run(sandbox, "tail -n " + LOG_TAIL_LINES + " " + logFile + " 2>&1");
    }

    private String run(Sandbox sandbox, String command) {
        try {
            ExecResult result = sandbox.exec(command);
            String output = result.stdout().isBlank() ? result.stderr() : result.stdout();
            return output.isBlank() ? "(no output, exit " + result.exitCode() + ")" : output;
        } catch (SandboxException e) {
            log.debug("Diagnostics command '{}' failed in {}: {}", command, sandbox.name(), e.getMessage());
            return "(unavailable: " + e.getMessage() + ")";
        }
    }
}
