package com.tenantgate.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemBlobStoreTest {

    @TempDir
    Path root;

    private FileSystemBlobStore store;

    @BeforeEach
    void setUp() {
        store = new FileSystemBlobStore(root, new ObjectMapper());
    }

    @Test
    void putStoresContentAndMetadata() throws Exception {
        store.put("logs/acme/2025-03-01/1.ndjson", "line\n", Map.of("tenantId", "acme"));

        assertEquals("line\n", Files.readString(root.resolve("logs/acme/2025-03-01/1.ndjson")));
        var listed = store.list("logs/acme/");
        assertEquals(1, listed.size());
        assertEquals(Map.of("tenantId", "acme"), listed.get(0).metadata());
        assertEquals(5, listed.get(0).size());
    }

    @Test
    void listFiltersByPrefixAndSortsByKey() {
        store.put("logs/acme/2025-03-02/2.ndjson", "b", Map.of());
        store.put("logs/acme/2025-03-01/1.ndjson", "a", Map.of());
        store.put("logs/globex/2025-03-01/1.ndjson", "c", Map.of());

        List<String> keys = store.list("logs/acme/").stream().map(BlobObject::key).toList();

        assertEquals(List.of("logs/acme/2025-03-01/1.ndjson", "logs/acme/2025-03-02/2.ndjson"), keys);
    }

    @Test
    void deleteRemovesObjectAndMetadata() {
        store.put("a/b.txt", "x", Map.of("k", "v"));

        store.delete("a/b.txt");

        assertTrue(store.list("").isEmpty());
        assertFalse(Files.exists(root.resolve("a/b.txt" + FileSystemBlobStore.META_SUFFIX)));
    }

    @Test
    void deleteOfMissingKeyIsNoOp() {
        assertDoesNotThrow(() -> store.delete("nope/none.txt"));
    }

    @Test
    void keysEscapingRootAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.put("../outside.txt", "x", Map.of()));
    }

    @Test
    void listOnMissingRootIsEmpty() {
        var fresh = new FileSystemBlobStore(root.resolve("not-yet"), new ObjectMapper());
        assertTrue(fresh.list("logs/").isEmpty());
    }

    @Test
    void isAvailableCreatesRoot() {
        var fresh = new FileSystemBlobStore(root.resolve("created"), new ObjectMapper());
        assertTrue(fresh.isAvailable());
        assertTrue(Files.isDirectory(root.resolve("created")));
    }
}
