package com.tenantgate.dispatch.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Client side of the chat tunnel; the upstream side is set up by
 * {@link TunnelHandshakeInterceptor}.
 */
public class ChatWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ChatWebSocketHandler.class);

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        tunnel(session).attach(session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        tunnel(session).sendUpstream(message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Client transport error on {}: {}", session.getId(), exception.getMessage());
        tunnel(session).closeUpstream(CloseStatus.GOING_AWAY);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        tunnel(session).closeUpstream(status);
    }

    private static WebSocketTunnel tunnel(WebSocketSession session) {
        var tunnel = (WebSocketTunnel) session.getAttributes().get(TunnelHandshakeInterceptor.TUNNEL_ATTRIBUTE);
        if (tunnel == null) {
            throw new IllegalStateException("No tunnel bound to session " + session.getId());
        }
        return tunnel;
    }
}
