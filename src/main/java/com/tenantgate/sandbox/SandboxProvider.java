package com.tenantgate.sandbox;

import java.util.Optional;

/**
 * Abstraction over sandbox infrastructure.
 * Implementations manage isolated environments addressed by name.
 */
public interface SandboxProvider {

    /**
     * Returns the environment with the given name, creating and starting it if needed.
     * Repeated calls with the same name reconnect to the same environment.
     *
     * @throws SandboxProvisionException if the environment cannot be created or started
     */
    Sandbox open(String name);

    /**
     * Reconnects to an existing environment, running or stopped, without creating or
     * starting one.
     */
    Optional<Sandbox> find(String name);

    /**
     * Lightweight reachability check of the underlying infrastructure.
     */
    boolean isAvailable();
}
