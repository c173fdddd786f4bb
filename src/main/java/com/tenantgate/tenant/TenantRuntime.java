package com.tenantgate.tenant;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantgate.agent.ConfigInjector;
import com.tenantgate.agent.SandboxDiagnostics;
import com.tenantgate.config.ConfigFetcher;
import com.tenantgate.core.metrics.TenantgateMetrics;
import com.tenantgate.core.time.Sleeper;
import com.tenantgate.logs.LogProperties;
import com.tenantgate.sandbox.SandboxProperties;
import com.tenantgate.sandbox.SandboxProvider;
import com.tenantgate.storage.BlobStore;
import com.tenantgate.storage.DurableStore;

import java.time.Clock;
import java.time.Duration;

/**
 * Collaborators shared by every tenant controller. Per-tenant state (config cache,
 * process flag, log offset) is created by each controller from these.
 */
public record TenantRuntime(
    SandboxProvider sandboxProvider,
    ConfigFetcher configFetcher,
    Duration configCacheTtl,
    ConfigInjector configInjector,
    SandboxDiagnostics diagnostics,
    BlobStore blobStore,
    DurableStore durableStore,
    LifecycleTimer timer,
    SandboxProperties sandboxProperties,
    LifecycleProperties lifecycleProperties,
    LogProperties logProperties,
    ObjectMapper objectMapper,
    Clock clock,
    Sleeper sleeper,
    TenantgateMetrics metrics
) {}
