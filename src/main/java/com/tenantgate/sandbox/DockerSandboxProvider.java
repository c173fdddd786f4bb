package com.tenantgate.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.HostConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Docker-based SandboxProvider.
 * Runs one long-lived container per tenant, named after the tenant.
 *
 * <p>Each container is configured with:
 * <ul>
 *   <li>A keep-alive command so the container outlives the agent process</li>
 *   <li>Memory and CPU limits from {@link SandboxProperties}</li>
 *   <li>A label marking it as a tenant sandbox, used by operators to list them</li>
 * </ul>
 *
 * <p>The agent process is launched later through {@code docker exec}, and the
 * controller talks to it over the container's network address.
 */
public class DockerSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxProvider.class);

    static final String SANDBOX_LABEL = "tenantgate.sandbox";
    private static final String[] KEEP_ALIVE_CMD = {"sleep", "infinity"};

    private final DockerClient dockerClient;
    private final SandboxProperties properties;
    private final HttpClient httpClient;

    public DockerSandboxProvider(DockerClient dockerClient, SandboxProperties properties) {
        this(dockerClient, properties, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build());
    }

    DockerSandboxProvider(DockerClient dockerClient, SandboxProperties properties, HttpClient httpClient) {
        this.dockerClient = dockerClient;
        this.properties = properties;
        this.httpClient = httpClient;
    }

    @Override
    public Sandbox open(String name) {
        try {
            var existing = inspect(name);
            String containerId;
            if (existing.isEmpty()) {
                containerId = createContainer(name);
                dockerClient.startContainerCmd(containerId).exec();
                log.info("Sandbox {} created and started (container {})", name, containerId);
            } else {
                containerId = existing.get().getId();
                var state = existing.get().getState();
                if (state == null || !Boolean.TRUE.equals(state.getRunning())) {
                    dockerClient.startContainerCmd(containerId).exec();
                    log.info("Sandbox {} was stopped, restarted container {}", name, containerId);
                } else {
                    log.debug("Reconnected to running sandbox {} (container {})", name, containerId);
                }
            }
            return new DockerSandbox(dockerClient, httpClient, containerId, name, properties.getExecTimeoutSeconds());
        } catch (SandboxException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SandboxProvisionException("Failed to provision sandbox " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Sandbox> find(String name) {
        try {
            return inspect(name)
                    .map(c -> new DockerSandbox(dockerClient, httpClient, c.getId(), name,
                            properties.getExecTimeoutSeconds()));
        } catch (RuntimeException e) {
            log.warn("Could not look up sandbox {}: {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            dockerClient.pingCmd().exec();
            return true;
        } catch (RuntimeException e) {
            log.warn("Docker ping failed: {}", e.getMessage());
            return false;
        }
    }

    private Optional<InspectContainerResponse> inspect(String name) {
        try {
            return Optional.of(dockerClient.inspectContainerCmd(name).exec());
        } catch (NotFoundException e) {
            return Optional.empty();
        }
    }

    private String createContainer(String name) {
        log.info("Creating sandbox {} (image: {})", name, properties.getImage());

        var hostConfig = HostConfig.newHostConfig()
                .withMemory((long) properties.getMemoryLimitMb() * 1024 * 1024)
                .withCpuCount((long) properties.getCpuCount());
        if (properties.getNetwork() != null && !properties.getNetwork().isBlank()) {
            hostConfig.withNetworkMode(properties.getNetwork());
        }

        var response = dockerClient.createContainerCmd(properties.getImage())
                .withName(name)
                .withHostConfig(hostConfig)
                .withLabels(Map.of(SANDBOX_LABEL, name))
                .withCmd(KEEP_ALIVE_CMD)
                .exec();
        return response.getId();
    }
}
