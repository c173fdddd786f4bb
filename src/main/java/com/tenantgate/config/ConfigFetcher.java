package com.tenantgate.config;

/**
 * Resolves the configuration a tenant's agent should run with.
 * Implementations never throw: an unreachable source yields an empty snapshot.
 */
@FunctionalInterface
public interface ConfigFetcher {

    ConfigSnapshot fetch(String tenantId, String userId);
}
