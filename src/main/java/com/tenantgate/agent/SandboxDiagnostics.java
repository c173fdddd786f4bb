package com.tenantgate.agent;

import com.tenantgate.sandbox.Sandbox;

import java.util.List;

/**
 * Collects troubleshooting evidence from a sandbox. Never throws.
 */
public interface SandboxDiagnostics {

    Diagnostics collect(Sandbox sandbox, List<String> notes);

    /** Last lines of the agent's log file. */
    String agentLogTail(Sandbox sandbox);
}
