package com.tenantgate.dispatch.api;

import com.tenantgate.agent.NdjsonStreamRelay;
import com.tenantgate.core.metrics.TenantgateMetrics;
import com.tenantgate.sandbox.SandboxHttpResponse;
import com.tenantgate.tenant.ChatResult;
import com.tenantgate.tenant.SessionRecord;
import com.tenantgate.tenant.TenantControllerRegistry;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.util.List;
import java.util.Map;

/**
 * Tenant-facing chat API. Each call is routed to the tenant's controller, which brings
 * the sandbox and agent up as needed and forwards the request.
 */
@RestController
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final TenantControllerRegistry registry;
    private final NdjsonStreamRelay streamRelay;
    private final TenantgateMetrics metrics;

    public ChatController(TenantControllerRegistry registry,
                          NdjsonStreamRelay streamRelay,
                          @Autowired(required = false) TenantgateMetrics metrics) {
        this.registry = registry;
        this.streamRelay = streamRelay;
        this.metrics = metrics;
    }

    /**
     * POST /chat: unary chat. POST /chat/invocations is an alias for hosted-model callers.
     */
    @PostMapping({"/chat", "/chat/invocations"})
    public ResponseEntity<Map<String, Object>> chat(@RequestBody ChatRequest request, HttpServletRequest http) {
        var context = TenantContext.from(http);
        requireMessage(request);

        ChatResult result = registry.chat(context.tenantId(), context.userId(), request.message(), request.sessionId());
        if (context.requestStart() != null && metrics != null) {
            metrics.recordChatLatency(Math.max(0, System.currentTimeMillis() - context.requestStart()));
        }
        return ResponseEntity.status(result.status()).body(result.body());
    }

    /**
     * POST /chat/stream: NDJSON event stream relayed line by line from the agent.
     */
    @PostMapping("/chat/stream")
    public ResponseEntity<StreamingResponseBody> stream(@RequestBody ChatRequest request, HttpServletRequest http) {
        var context = TenantContext.from(http);
        requireMessage(request);

        SandboxHttpResponse upstream = registry.openStream(context.tenantId(), context.userId(),
                request.message(), request.sessionId());
        if (!upstream.isSuccessful()) {
            // application-level refusal: pass the agent's answer through unchanged
            log.warn("Agent refused stream for tenant {} with status {}", context.tenantId(), upstream.statusCode());
            MediaType type = upstream.contentType() != null
                    ? MediaType.parseMediaType(upstream.contentType())
                    : MediaType.APPLICATION_JSON;
            return ResponseEntity.status(upstream.statusCode())
                    .contentType(type)
                    .body(out -> {
                        try (var in = upstream.body()) {
                            in.transferTo(out);
                        }
                    });
        }

        StreamingResponseBody body = out -> streamRelay.relay(upstream, out, context.tenantId());
        return ResponseEntity.ok()
                .contentType(NDJSON)
                .header("Cache-Control", "no-cache")
                .body(body);
    }

    /**
     * GET /sessions: the caller's sessions, most recently updated first.
     */
    @GetMapping("/sessions")
    public ResponseEntity<Map<String, Object>> listSessions(HttpServletRequest http) {
        var context = TenantContext.from(http);
        List<SessionRecord> sessions = registry.listSessions(context.tenantId(), context.userId());
        return ResponseEntity.ok(Map.of("sessions", sessions));
    }

    /**
     * GET /sessions/{id}: one of the caller's sessions.
     */
    @GetMapping("/sessions/{id}")
    public ResponseEntity<?> getSession(@PathVariable String id, HttpServletRequest http) {
        var context = TenantContext.from(http);
        return registry.getSession(context.tenantId(), context.userId(), id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(404).body(Map.of("error", "Not found")));
    }

    private static void requireMessage(ChatRequest request) {
        if (request.message() == null || request.message().isBlank()) {
            throw new InvalidChatRequestException("Message is required");
        }
    }
}
