package com.tenantgate.storage;

import java.util.List;
import java.util.Map;

/**
 * Minimal object store: immutable objects addressed by slash-separated keys,
 * each with string metadata.
 */
public interface BlobStore {

    void put(String key, String content, Map<String, String> metadata);

    /** Lists every object whose key starts with the given prefix. */
    List<BlobObject> list(String prefix);

    void delete(String key);

    /** Lightweight writability check used by health reporting. */
    boolean isAvailable();
}
