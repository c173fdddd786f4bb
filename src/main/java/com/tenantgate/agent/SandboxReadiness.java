package com.tenantgate.agent;

import com.tenantgate.sandbox.Sandbox;

/**
 * Runs the full bring-up (provision, configure, start agent) and returns the ready sandbox.
 */
@FunctionalInterface
public interface SandboxReadiness {

    Sandbox ensureReady();
}
