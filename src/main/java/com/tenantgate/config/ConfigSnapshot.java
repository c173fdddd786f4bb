package com.tenantgate.config;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * The skills and connectors active for one tenant and user at one point in time.
 * Snapshots are superseded, never mutated.
 */
public record ConfigSnapshot(
    String tenantId,
    String userId,
    List<Skill> skills,
    List<Connector> connectors
) {
    public ConfigSnapshot {
        skills = skills == null ? List.of() : List.copyOf(skills);
        connectors = connectors == null ? List.of() : List.copyOf(connectors);
    }

    public static ConfigSnapshot empty(String tenantId, String userId) {
        return new ConfigSnapshot(tenantId, userId, List.of(), List.of());
    }

    public boolean isFor(String tenantId, String userId) {
        return Objects.equals(this.tenantId, tenantId)
                && Objects.equals(this.userId, userId);
    }

    /** A named skill; {@code content} is null when it could not be fetched. */
    public record Skill(String name, String content) {}

    public record Connector(String name, String type, JsonNode config) {}
}
