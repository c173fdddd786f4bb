package com.tenantgate.storage;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value storage that survives controller eviction and process restarts.
 * Each tenant controller owns one namespace (its sandbox name).
 */
public interface DurableStore {

    <T> Optional<T> get(String namespace, String key, Class<T> type);

    void put(String namespace, String key, Object value);

    /** Returns every entry whose key starts with the prefix, keyed by full key. */
    <T> Map<String, T> list(String namespace, String prefix, Class<T> type);

    void delete(String namespace, String key);

    List<String> namespaces();
}
