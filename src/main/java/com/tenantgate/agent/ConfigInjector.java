package com.tenantgate.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantgate.config.ConfigSnapshot;
import com.tenantgate.sandbox.Sandbox;
import com.tenantgate.sandbox.SandboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a configuration snapshot into a sandbox: one {@code SKILL.md} per skill under
 * the skills directory, and the connector list as {@code connectors.json}.
 * Injecting the same snapshot twice leaves the sandbox in the same state.
 */
@Component
public class ConfigInjector {

    private static final Logger log = LoggerFactory.getLogger(ConfigInjector.class);

    static final String SKILL_FILE = "SKILL.md";
    static final String CONNECTORS_FILE = "connectors.json";

    private final SandboxProperties properties;
    private final ObjectMapper objectMapper;

    public ConfigInjector(SandboxProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * @return the number of skill files written
     */
    public int inject(Sandbox sandbox, ConfigSnapshot config) {
        String skillsPath = properties.getSkillsPath();
        sandbox.mkdir(skillsPath);

        int written = 0;
        for (var skill : config.skills()) {
            if (skill.content() == null) {
                log.debug("Skill {} has no content, skipping", skill.name());
                continue;
            }
            if (!isSafeName(skill.name())) {
                log.warn("Refusing to inject skill with unsafe name '{}'", skill.name());
                continue;
            }
            String dir = skillsPath + "/" + skill.name();
            sandbox.mkdir(dir);
            sandbox.writeFile(dir + "/" + SKILL_FILE, skill.content());
            written++;
        }

        sandbox.mkdir(properties.getConfigPath());
        sandbox.writeFile(properties.getConfigPath() + "/" + CONNECTORS_FILE, connectorsJson(config.connectors()));

        log.info("Injected {} skills and {} connectors into {}", written, config.connectors().size(), sandbox.name());
        return written;
    }

    String connectorsJson(List<ConfigSnapshot.Connector> connectors) {
        var list = connectors.stream().map(ConfigInjector::toMap).toList();
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(list);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Connector list is not serializable", e);
        }
    }

    static Map<String, Object> toMap(ConfigSnapshot.Connector connector) {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", connector.name());
        map.put("type", connector.type());
        map.put("config", connector.config());
        return map;
    }

    private static boolean isSafeName(String name) {
        return name != null && !name.isBlank() && !name.contains("/") && !name.contains("..");
    }
}
