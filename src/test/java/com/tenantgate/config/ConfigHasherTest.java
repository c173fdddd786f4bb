package com.tenantgate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigHasherTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void equalSnapshotsHashEqually() {
        var a = new ConfigSnapshot("acme", "alice", List.of(new ConfigSnapshot.Skill("review", "# R")), List.of());
        var b = new ConfigSnapshot("acme", "alice", List.of(new ConfigSnapshot.Skill("review", "# R")), List.of());

        assertEquals(ConfigHasher.hash(a), ConfigHasher.hash(b));
    }

    @Test
    void connectorKeyOrderDoesNotMatter() throws Exception {
        var a = snapshotWithConnector("{\"url\":\"https://x\",\"auth\":{\"token\":\"t\",\"scheme\":\"bearer\"}}");
        var b = snapshotWithConnector("{\"auth\":{\"scheme\":\"bearer\",\"token\":\"t\"},\"url\":\"https://x\"}");

        assertEquals(ConfigHasher.hash(a), ConfigHasher.hash(b));
    }

    @Test
    void changedSkillContentChangesHash() {
        var a = new ConfigSnapshot("acme", "alice", List.of(new ConfigSnapshot.Skill("review", "v1")), List.of());
        var b = new ConfigSnapshot("acme", "alice", List.of(new ConfigSnapshot.Skill("review", "v2")), List.of());

        assertNotEquals(ConfigHasher.hash(a), ConfigHasher.hash(b));
    }

    @Test
    void identityIsNotPartOfTheHash() {
        assertEquals(ConfigHasher.hash(ConfigSnapshot.empty("acme", "alice")),
                ConfigHasher.hash(ConfigSnapshot.empty("globex", "bob")));
    }

    @Test
    void canonicalJsonSortsKeys() throws Exception {
        var snapshot = snapshotWithConnector("{\"b\":1,\"a\":2}");

        assertEquals("{\"connectors\":[{\"config\":{\"a\":2,\"b\":1},\"name\":\"github\",\"type\":\"mcp\"}],\"skills\":[]}",
                ConfigHasher.canonicalJson(snapshot));
    }

    @Test
    void hashIsRollingThirtyOneHashOfCanonicalJson() {
        var snapshot = ConfigSnapshot.empty("acme", "alice");

        assertEquals(Integer.toHexString(ConfigHasher.canonicalJson(snapshot).hashCode()), ConfigHasher.hash(snapshot));
    }

    private ConfigSnapshot snapshotWithConnector(String config) throws Exception {
        return new ConfigSnapshot("acme", "alice", List.of(),
                List.of(new ConfigSnapshot.Connector("github", "mcp", mapper.readTree(config))));
    }
}
