package com.tenantgate.core.health;

import com.tenantgate.config.ControlPlaneProperties;
import com.tenantgate.sandbox.SandboxProvider;
import com.tenantgate.storage.BlobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SandboxProvider sandboxProvider;
    private final BlobStore blobStore;
    private final ControlPlaneProperties controlPlaneProperties;

    public HealthCheckService(
            @Autowired(required = false) SandboxProvider sandboxProvider,
            @Autowired(required = false) BlobStore blobStore,
            ControlPlaneProperties controlPlaneProperties) {
        this.sandboxProvider = sandboxProvider;
        this.blobStore = blobStore;
        this.controlPlaneProperties = controlPlaneProperties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkSandboxProvider());
        results.add(checkBlobStore());
        results.add(checkControlPlane());
        return results;
    }

    /**
     * UP only when every component is UP; DOWN if any is DOWN; otherwise DEGRADED.
     */
    public HealthStatus.Status overall(List<HealthStatus> checks) {
        if (checks.stream().anyMatch(c -> c.status() == HealthStatus.Status.DOWN)) {
            return HealthStatus.Status.DOWN;
        }
        if (checks.stream().anyMatch(c -> c.status() == HealthStatus.Status.DEGRADED)) {
            return HealthStatus.Status.DEGRADED;
        }
        return HealthStatus.Status.UP;
    }

    private HealthStatus checkSandboxProvider() {
        if (sandboxProvider == null) {
            return HealthStatus.down("sandbox", "No SandboxProvider configured");
        }
        try {
            if (sandboxProvider.isAvailable()) {
                return HealthStatus.up("sandbox", "Sandbox provider reachable (" + sandboxProvider.getClass().getSimpleName() + ")");
            }
            return HealthStatus.down("sandbox", "Sandbox provider unreachable");
        } catch (RuntimeException e) {
            log.warn("Sandbox health check failed: {}", e.getMessage());
            return HealthStatus.down("sandbox", "Sandbox error: " + e.getMessage());
        }
    }

    private HealthStatus checkBlobStore() {
        if (blobStore == null) {
            return HealthStatus.down("blobStore", "No BlobStore configured");
        }
        if (blobStore.isAvailable()) {
            return HealthStatus.up("blobStore", "Blob store writable");
        }
        return HealthStatus.down("blobStore", "Blob store not writable");
    }

    // An unconfigured control plane is survivable: agents run with an empty config
    private HealthStatus checkControlPlane() {
        if (!controlPlaneProperties.isConfigured()) {
            return HealthStatus.degraded("controlPlane", "No control plane URL configured, agents start with empty config");
        }
        return new HealthStatus("controlPlane", HealthStatus.Status.UP,
                "Control plane configured", Map.of("url", controlPlaneProperties.getUrl()));
    }
}
