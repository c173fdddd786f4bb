package com.tenantgate.dispatch.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Pairs a client WebSocket session with the upstream socket to the agent.
 *
 * <p>The upstream is opened during the handshake, before the client session exists,
 * so messages arriving from the agent in that window are queued and delivered once
 * the client side is attached. Closing either side closes the other.
 */
public class WebSocketTunnel implements WebSocket.Listener {

    private static final Logger log = LoggerFactory.getLogger(WebSocketTunnel.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final String tenantId;
    private final List<String> pending = new ArrayList<>();
    private final StringBuilder partial = new StringBuilder();

    private WebSocket upstream;
    private WebSocketSession downstream;
    private boolean closed;

    public WebSocketTunnel(String tenantId) {
        this.tenantId = tenantId;
    }

    public synchronized void setUpstream(WebSocket upstream) {
        this.upstream = upstream;
    }

    /**
     * Attaches the client session and flushes anything the agent sent meanwhile.
     */
    public void attach(WebSocketSession session) throws IOException {
        List<String> queued;
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        synchronized (this) {
            if (closed) {
                session.close(CloseStatus.GOING_AWAY);
                return;
            }
            downstream = decorated;
            queued = new ArrayList<>(pending);
            pending.clear();
        }
        for (String message : queued) {
            decorated.sendMessage(new TextMessage(message));
        }
    }

    /** Forwards a client message to the agent. */
    public void sendUpstream(String text) {
        WebSocket target;
        synchronized (this) {
            target = upstream;
        }
        if (target == null) {
            log.warn("Dropping client message for tenant {}: no upstream", tenantId);
            return;
        }
        // java.net.http.WebSocket allows one outstanding send at a time
        synchronized (target) {
            target.sendText(text, true).join();
        }
    }

    /** Client went away: close the agent side. */
    public void closeUpstream(CloseStatus status) {
        WebSocket target;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            target = upstream;
        }
        if (target != null && !target.isOutputClosed()) {
            target.sendClose(status.getCode() == CloseStatus.NO_STATUS_CODE.getCode()
                    ? WebSocket.NORMAL_CLOSURE : status.getCode(), "client closed");
        }
    }

    // ── Upstream listener ─────────────────────────────────────────────

    @Override
    public void onOpen(WebSocket webSocket) {
        webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
        partial.append(data);
        if (last) {
            String message = partial.toString();
            partial.setLength(0);
            deliver(message);
        }
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
        log.debug("Ignoring binary frame from agent for tenant {}", tenantId);
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
        closeDownstream(new CloseStatus(statusCode, reason));
        return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
        log.warn("Agent WebSocket for tenant {} failed: {}", tenantId, error.getMessage());
        closeDownstream(CloseStatus.SERVER_ERROR);
    }

    private void deliver(String message) {
        WebSocketSession target;
        synchronized (this) {
            if (downstream == null) {
                pending.add(message);
                return;
            }
            target = downstream;
        }
        try {
            target.sendMessage(new TextMessage(message));
        } catch (IOException e) {
            log.info("Client of tenant {} unreachable, closing agent socket: {}", tenantId, e.getMessage());
            closeUpstream(CloseStatus.GOING_AWAY);
        }
    }

    private void closeDownstream(CloseStatus status) {
        WebSocketSession target;
        synchronized (this) {
            closed = true;
            target = downstream;
        }
        if (target != null && target.isOpen()) {
            try {
                target.close(status);
            } catch (IOException e) {
                log.debug("Closing client socket for tenant {} failed: {}", tenantId, e.getMessage());
            }
        }
    }

    synchronized int pendingCount() {
        return pending.size();
    }
}
