package com.tenantgate.dispatch.ws;

import com.tenantgate.dispatch.api.MissingTenantContextException;
import com.tenantgate.dispatch.api.TenantContext;
import com.tenantgate.core.error.TenantgateException;
import com.tenantgate.tenant.TenantControllerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;

/**
 * Opens the upstream agent socket before accepting the client's upgrade, so that an
 * unreachable agent is reported as HTTP 503 instead of an immediately closed socket.
 */
public class TunnelHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(TunnelHandshakeInterceptor.class);

    static final String TUNNEL_ATTRIBUTE = "tenantgate.tunnel";

    private final TenantControllerRegistry registry;
    private final String upstreamPath;

    public TunnelHandshakeInterceptor(TenantControllerRegistry registry, String upstreamPath) {
        this.registry = registry;
        this.upstreamPath = upstreamPath;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        if (!(request instanceof ServletServerHttpRequest servletRequest)) {
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }

        TenantContext context;
        try {
            context = TenantContext.from(servletRequest.getServletRequest());
        } catch (MissingTenantContextException e) {
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }

        String query = request.getURI().getRawQuery();
        String path = query == null ? upstreamPath : upstreamPath + "?" + query;
        var tunnel = new WebSocketTunnel(context.tenantId());
        try {
            var upstream = registry.openWebSocket(context.tenantId(), context.userId(), path, tunnel);
            if (upstream.isEmpty()) {
                log.warn("Agent WebSocket for tenant {} unavailable after retries", context.tenantId());
                response.setStatusCode(HttpStatus.SERVICE_UNAVAILABLE);
                return false;
            }
            tunnel.setUpstream(upstream.get());
        } catch (TenantgateException e) {
            log.error("WebSocket bring-up for tenant {} failed: {}", context.tenantId(), e.getMessage());
            response.setStatusCode(HttpStatus.SERVICE_UNAVAILABLE);
            return false;
        }
        attributes.put(TUNNEL_ATTRIBUTE, tunnel);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("WebSocket handshake failed: {}", exception.getMessage());
        }
    }
}
