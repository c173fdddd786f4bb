package com.tenantgate.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantgate.core.metrics.TenantgateMetrics;
import com.tenantgate.sandbox.SandboxHttpResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;

/**
 * Copies an agent's NDJSON event stream to the client line by line, without buffering
 * whole responses.
 *
 * <p>Event types {@code start}, {@code stream}, {@code tool_use}, {@code done} and
 * {@code error} are recognized for metrics only; every line is forwarded unchanged.
 * If the upstream breaks mid-stream the client receives a terminal
 * {@code {"type":"error",...}} line. If the client goes away the upstream is closed
 * and forwarding stops.
 */
@Component
public class NdjsonStreamRelay {

    private static final Logger log = LoggerFactory.getLogger(NdjsonStreamRelay.class);

    private final ObjectMapper objectMapper;
    private final TenantgateMetrics metrics;

    public NdjsonStreamRelay(ObjectMapper objectMapper,
                             @Autowired(required = false) TenantgateMetrics metrics) {
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * @return number of lines forwarded
     */
    public int relay(SandboxHttpResponse upstream, OutputStream out, String tenantId) {
        int forwarded = 0;
        try (var reader = new BufferedReader(new InputStreamReader(upstream.body(), StandardCharsets.UTF_8))) {
            while (true) {
                String line;
                try {
                    line = reader.readLine();
                } catch (IOException e) {
                    log.warn("Agent stream for tenant {} broke after {} lines: {}", tenantId, forwarded, e.getMessage());
                    writeTerminalError(out, "Stream interrupted: " + e.getMessage());
                    return forwarded;
                }
                if (line == null) {
                    return forwarded;
                }
                if (line.isBlank()) {
                    continue;
                }
                inspect(line);
                try {
                    out.write((line + "\n").getBytes(StandardCharsets.UTF_8));
                    out.flush();
                } catch (IOException e) {
                    log.info("Client disconnected from stream for tenant {} after {} lines", tenantId, forwarded);
                    return forwarded;
                }
                forwarded++;
            }
        } catch (IOException e) {
            log.debug("Closing agent stream for tenant {} failed: {}", tenantId, e.getMessage());
            return forwarded;
        }
    }

    private void inspect(String line) {
        if (metrics == null) {
            return;
        }
        JsonNode event;
        try {
            event = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            metrics.recordStreamEvent("unparseable");
            return;
        }
        String type = event.path("type").asText("unknown");
        switch (type) {
            case "start", "stream", "tool_use", "error" -> metrics.recordStreamEvent(type);
            case "done" -> {
                metrics.recordStreamEvent(type);
                JsonNode usage = event.path("usage");
                metrics.recordTokenUsage(usage.path("inputTokens").asLong(0), usage.path("outputTokens").asLong(0));
            }
            default -> metrics.recordStreamEvent("other");
        }
    }

    private void writeTerminalError(OutputStream out, String message) {
        var error = new LinkedHashMap<String, Object>();
        error.put("type", "error");
        error.put("error", message);
        try {
            out.write((objectMapper.writeValueAsString(error) + "\n").getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            log.debug("Could not deliver terminal error line: {}", e.getMessage());
        }
    }
}
