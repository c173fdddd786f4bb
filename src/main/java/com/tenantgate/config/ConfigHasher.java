package com.tenantgate.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Content hash of a {@link ConfigSnapshot}, used to skip re-injecting an unchanged
 * configuration. The snapshot is rendered as JSON with object keys sorted at every
 * depth, then folded with a 32-bit rolling hash ({@code h = 31 * h + c}).
 */
public final class ConfigHasher {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .build();

    private ConfigHasher() {}

    public static String hash(ConfigSnapshot snapshot) {
        String canonical = canonicalJson(snapshot);
        int h = 0;
        for (int i = 0; i < canonical.length(); i++) {
            h = 31 * h + canonical.charAt(i);
        }
        return Integer.toHexString(h);
    }

    static String canonicalJson(ConfigSnapshot snapshot) {
        List<Map<String, Object>> skills = new ArrayList<>();
        for (var skill : snapshot.skills()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("name", skill.name());
            entry.put("content", skill.content());
            skills.add(entry);
        }
        List<Map<String, Object>> connectors = new ArrayList<>();
        for (var connector : snapshot.connectors()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("name", connector.name());
            entry.put("type", connector.type());
            // JsonNode -> plain maps so that key ordering applies inside the config too
            entry.put("config", connector.config() == null ? null : CANONICAL.convertValue(connector.config(), Object.class));
            connectors.add(entry);
        }
        var root = new LinkedHashMap<String, Object>();
        root.put("skills", skills);
        root.put("connectors", connectors);
        try {
            return CANONICAL.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Config snapshot is not serializable", e);
        }
    }
}
