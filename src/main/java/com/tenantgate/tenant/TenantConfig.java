package com.tenantgate.tenant;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantgate.agent.ConfigInjector;
import com.tenantgate.agent.SandboxDiagnostics;
import com.tenantgate.agent.ShellSandboxDiagnostics;
import com.tenantgate.config.ConfigFetcher;
import com.tenantgate.config.ControlPlaneProperties;
import com.tenantgate.core.metrics.TenantgateMetrics;
import com.tenantgate.core.time.Sleeper;
import com.tenantgate.logs.LogProperties;
import com.tenantgate.sandbox.SandboxProperties;
import com.tenantgate.sandbox.SandboxProvider;
import com.tenantgate.storage.BlobStore;
import com.tenantgate.storage.DurableStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TenantConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SandboxDiagnostics sandboxDiagnostics(SandboxProperties properties) {
        return new ShellSandboxDiagnostics(properties.getAgentLogFile());
    }

    @Bean
    public TenantRuntime tenantRuntime(SandboxProvider sandboxProvider,
                                       ConfigFetcher configFetcher,
                                       ControlPlaneProperties controlPlaneProperties,
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
                                       @Autowired(required = false) TenantgateMetrics metrics) {
        return new TenantRuntime(sandboxProvider, configFetcher, controlPlaneProperties.getCacheTtl(),
                configInjector, diagnostics, blobStore, durableStore, timer, sandboxProperties,
                lifecycleProperties, logProperties, objectMapper, clock, Sleeper.system(), metrics);
    }
}
