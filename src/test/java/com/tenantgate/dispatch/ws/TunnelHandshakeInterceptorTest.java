package com.tenantgate.dispatch.ws;

import com.tenantgate.sandbox.SandboxProvisionException;
import com.tenantgate.tenant.TenantControllerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

import java.net.http.WebSocket;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TunnelHandshakeInterceptorTest {

    private TenantControllerRegistry registry;
    private TunnelHandshakeInterceptor interceptor;
    private MockHttpServletRequest servletRequest;
    private MockHttpServletResponse servletResponse;
    private Map<String, Object> attributes;

    @BeforeEach
    void setUp() {
        registry = mock(TenantControllerRegistry.class);
        interceptor = new TunnelHandshakeInterceptor(registry, "/ws/chat");
        servletRequest = new MockHttpServletRequest("GET", "/ws/chat");
        servletResponse = new MockHttpServletResponse();
        attributes = new HashMap<>();
    }

    private boolean handshake() {
        return interceptor.beforeHandshake(new ServletServerHttpRequest(servletRequest),
                new ServletServerHttpResponse(servletResponse), mock(WebSocketHandler.class), attributes);
    }

    @Test
    void opensUpstreamWithQueryAndBindsTunnel() {
        servletRequest.addHeader("X-Tenant-Id", "acme");
        servletRequest.addHeader("X-User-Id", "alice");
        servletRequest.setQueryString("session=s1");
        when(registry.openWebSocket(eq("acme"), eq("alice"), eq("/ws/chat?session=s1"), any()))
                .thenReturn(Optional.of(mock(WebSocket.class)));

        assertTrue(handshake());
        assertInstanceOf(WebSocketTunnel.class, attributes.get(TunnelHandshakeInterceptor.TUNNEL_ATTRIBUTE));
    }

    @Test
    void missingContextIsBadRequest() {
        assertFalse(handshake());
        assertEquals(400, servletResponse.getStatus());
        verifyNoInteractions(registry);
    }

    @Test
    void unreachableAgentIsServiceUnavailable() {
        servletRequest.addHeader("X-Tenant-Id", "acme");
        servletRequest.addHeader("X-User-Id", "alice");
        when(registry.openWebSocket(any(), any(), any(), any())).thenReturn(Optional.empty());

        assertFalse(handshake());
        assertEquals(503, servletResponse.getStatus());
        assertTrue(attributes.isEmpty());
    }

    @Test
    void bringUpFailureIsServiceUnavailable() {
        servletRequest.addHeader("X-Tenant-Id", "acme");
        servletRequest.addHeader("X-User-Id", "alice");
        when(registry.openWebSocket(any(), any(), any(), any()))
                .thenThrow(new SandboxProvisionException("Failed to provision sandbox tenant-acme", null));

        assertFalse(handshake());
        assertEquals(503, servletResponse.getStatus());
    }
}
