package com.tenantgate.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantgate.config.ConfigSnapshot;
import com.tenantgate.core.error.TenantgateException;
import com.tenantgate.core.metrics.TenantgateMetrics;
import com.tenantgate.core.time.Sleeper;
import com.tenantgate.sandbox.Sandbox;
import com.tenantgate.sandbox.SandboxException;
import com.tenantgate.sandbox.SandboxHttpRequest;
import com.tenantgate.sandbox.SandboxHttpResponse;
import com.tenantgate.sandbox.SandboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.WebSocket;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Forwards requests to the agent inside a tenant's sandbox.
 *
 * <ul>
 *   <li>Unary chat: on an unavailable agent, restart it once and retry once.</li>
 *   <li>Streaming chat: no retry, the caller relays the body as it arrives.</li>
 *   <li>WebSocket: bounded backoff, re-running the full bring-up before each retry.</li>
 * </ul>
 *
 * An application-level error from the agent (e.g. HTTP 500 with a JSON error body) is
 * returned to the caller and does not count as an unavailable agent.
 */
public class RequestProxy {

    private static final Logger log = LoggerFactory.getLogger(RequestProxy.class);

    private static final Set<Integer> UNAVAILABLE_STATUSES = Set.of(502, 503, 504);

    private final ProcessSupervisor supervisor;
    private final SandboxDiagnostics diagnostics;
    private final SandboxProperties properties;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;
    private final TenantgateMetrics metrics;

    public RequestProxy(ProcessSupervisor supervisor, SandboxDiagnostics diagnostics,
                        SandboxProperties properties, ObjectMapper objectMapper,
                        Sleeper sleeper, TenantgateMetrics metrics) {
        this.supervisor = supervisor;
        this.diagnostics = diagnostics;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * Sends a unary request. If the agent is unavailable, it is restarted once and the
     * request retried once.
     *
     * @throws ProxyException when the retry fails as well
     * @throws ColdStartException when the restart itself fails
     */
    public AgentReply proxyChat(Sandbox sandbox, ConfigSnapshot config, String path,
                                String tenantId, String userId, Object payload) {
        byte[] body = toJson(payload);
        try {
            return call(sandbox, path, tenantId, userId, body);
        } catch (AgentUnavailableException first) {
            log.warn("Agent call {} in {} failed ({}), restarting agent and retrying once",
                    path, sandbox.name(), first.getMessage());
            if (metrics != null) metrics.recordProxyRetry("chat");
            supervisor.markNotRunning();
            supervisor.ensureAgentRunning(sandbox, config);
            try {
                return call(sandbox, path, tenantId, userId, body);
            } catch (AgentUnavailableException second) {
                supervisor.markNotRunning();
                if (metrics != null) metrics.recordProxyFailure("chat");
                throw new ProxyException("Agent request failed after restart: " + second.getMessage(),
                        diagnostics.collect(sandbox, List.of(
                                "first attempt: " + first.getMessage(),
                                "retry: " + second.getMessage())));
            }
        }
    }

    /**
     * Opens a streaming request and hands back the unbuffered response. Never retried.
     *
     * @throws ProxyException when the stream cannot be established
     */
    public SandboxHttpResponse proxyStream(Sandbox sandbox, String path, String tenantId,
                                           String userId, Object payload) {
        var request = SandboxHttpRequest.postJson(path, headers(tenantId, userId), toJson(payload),
                properties.getRequestTimeout());
        SandboxHttpResponse response;
        try {
            response = sandbox.httpCall(request, properties.getAgentPort());
        } catch (SandboxException e) {
            return failStream(sandbox, path, e.getMessage());
        }
        if (UNAVAILABLE_STATUSES.contains(response.statusCode())) {
            response.close();
            return failStream(sandbox, path, "status " + response.statusCode());
        }
        return response;
    }

    /**
     * Opens a WebSocket to the agent. The first attempt is immediate; each configured
     * delay precedes one retry, which clears the running flag and re-runs the bring-up.
     *
     * @return the upstream socket, or empty once every retry has failed
     */
    public Optional<WebSocket> proxyWebSocket(SandboxReadiness readiness, String path, String tenantId,
                                              String userId, WebSocket.Listener listener) {
        List<Duration> delays = properties.getWebsocketRetryDelays();
        for (int attempt = 0; attempt <= delays.size(); attempt++) {
            if (attempt > 0) {
                supervisor.markNotRunning();
                if (metrics != null) metrics.recordProxyRetry("websocket");
                try {
                    sleeper.sleep(delays.get(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Optional.empty();
                }
            }
            try {
                Sandbox sandbox = readiness.ensureReady();
                return Optional.of(sandbox.wsConnect(path, identityHeaders(tenantId, userId),
                        properties.getAgentPort(), listener));
            } catch (TenantgateException e) {
                log.warn("WebSocket attempt {}/{} for tenant {} failed: {}",
                        attempt + 1, delays.size() + 1, tenantId, e.getMessage());
            }
        }
        if (metrics != null) metrics.recordProxyFailure("websocket");
        return Optional.empty();
    }

    private AgentReply call(Sandbox sandbox, String path, String tenantId, String userId, byte[] body)
            throws AgentUnavailableException {
        var request = SandboxHttpRequest.postJson(path, headers(tenantId, userId), body,
                properties.getRequestTimeout());
        SandboxHttpResponse response;
        try {
            response = sandbox.httpCall(request, properties.getAgentPort());
        } catch (SandboxException e) {
            throw new AgentUnavailableException(e.getMessage());
        }
        if (UNAVAILABLE_STATUSES.contains(response.statusCode())) {
            response.close();
            throw new AgentUnavailableException("status " + response.statusCode());
        }
        try {
            return new AgentReply(response.statusCode(), response.readBody());
        } catch (SandboxException e) {
            throw new AgentUnavailableException(e.getMessage());
        }
    }

    private SandboxHttpResponse failStream(Sandbox sandbox, String path, String reason) {
        supervisor.markNotRunning();
        if (metrics != null) metrics.recordProxyFailure("stream");
        log.warn("Could not open agent stream {} in {}: {}", path, sandbox.name(), reason);
        throw new ProxyException("Failed to open agent stream: " + reason,
                diagnostics.collect(sandbox, List.of("stream: " + reason)));
    }

    private static Map<String, String> headers(String tenantId, String userId) {
        var headers = new LinkedHashMap<String, String>();
        headers.put("Content-Type", "application/json");
        headers.putAll(identityHeaders(tenantId, userId));
        return headers;
    }

    private static Map<String, String> identityHeaders(String tenantId, String userId) {
        var headers = new LinkedHashMap<String, String>();
        if (tenantId != null) headers.put("X-Tenant-Id", tenantId);
        if (userId != null) headers.put("X-User-Id", userId);
        return headers;
    }

    private byte[] toJson(Object payload) {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable", e);
        }
    }

    private static class AgentUnavailableException extends Exception {
        AgentUnavailableException(String message) {
            super(message);
        }
    }
}
