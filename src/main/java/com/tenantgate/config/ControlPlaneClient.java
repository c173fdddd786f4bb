package com.tenantgate.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantgate.core.metrics.TenantgateMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP client for the control plane's internal configuration API.
 *
 * <p>Reads the tenant's skill list and connector list from
 * {@code GET /internal/sandbox-config}, then fetches each skill's body from
 * {@code GET /internal/skills/{name}/content}. Requests carry the shared
 * {@code X-Internal-Key} header.
 *
 * <p>Any failure degrades to an empty configuration so that a control-plane outage
 * never blocks chat traffic.
 */
@Component
public class ControlPlaneClient implements ConfigFetcher {

    private static final Logger log = LoggerFactory.getLogger(ControlPlaneClient.class);

    static final String INTERNAL_KEY_HEADER = "X-Internal-Key";

    private final ControlPlaneProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TenantgateMetrics metrics;

    public ControlPlaneClient(ControlPlaneProperties properties,
                              ObjectMapper objectMapper,
                              @Autowired(required = false) TenantgateMetrics metrics) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public ConfigSnapshot fetch(String tenantId, String userId) {
        if (!properties.isConfigured()) {
            log.debug("No control plane URL configured, using empty config for tenant {}", tenantId);
            return ConfigSnapshot.empty(tenantId, userId);
        }
        try {
            JsonNode config = objectMapper.readTree(get("/internal/sandbox-config?tenantId=" + encode(tenantId)
                    + "&userId=" + encode(userId)));

            List<ConfigSnapshot.Skill> skills = new ArrayList<>();
            for (JsonNode skill : config.path("skills")) {
                String name = skill.path("name").asText(null);
                if (name == null || name.isBlank()) {
                    continue;
                }
                skills.add(new ConfigSnapshot.Skill(name, fetchSkillContent(tenantId, name)));
            }

            List<ConfigSnapshot.Connector> connectors = new ArrayList<>();
            for (JsonNode connector : config.path("connectors")) {
                connectors.add(new ConfigSnapshot.Connector(
                        connector.path("name").asText(null),
                        connector.path("type").asText(null),
                        connector.get("config")));
            }

            if (metrics != null) metrics.recordConfigFetch(true);
            return new ConfigSnapshot(tenantId, userId, skills, connectors);
        } catch (IOException | ControlPlaneException e) {
            log.error("Failed to fetch sandbox config for tenant {}: {}", tenantId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted fetching sandbox config for tenant {}", tenantId);
        }
        if (metrics != null) metrics.recordConfigFetch(false);
        return ConfigSnapshot.empty(tenantId, userId);
    }

    /**
     * A skill whose body cannot be fetched is kept in the list with null content
     * and is skipped at injection time.
     */
    private String fetchSkillContent(String tenantId, String skillName) throws InterruptedException {
        try {
            return get("/internal/skills/" + encode(skillName) + "/content?tenantId=" + encode(tenantId));
        } catch (IOException | ControlPlaneException e) {
            log.warn("Failed to fetch content of skill {} for tenant {}: {}", skillName, tenantId, e.getMessage());
            return null;
        }
    }

    private String get(String pathAndQuery) throws IOException, InterruptedException {
        var builder = HttpRequest.newBuilder(URI.create(stripTrailingSlash(properties.getUrl()) + pathAndQuery))
                .timeout(properties.getTimeout())
                .GET();
        if (properties.getInternalApiKey() != null) {
            builder.header(INTERNAL_KEY_HEADER, properties.getInternalApiKey());
        }
        var response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new ControlPlaneException("GET " + pathAndQuery.replaceAll("\\?.*", "")
                    + " returned " + response.statusCode());
        }
        return response.body();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    static class ControlPlaneException extends RuntimeException {
        ControlPlaneException(String message) {
            super(message);
        }
    }
}
