package com.tenantgate.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * {@link DurableStore} keeping one JSON document per key:
 * {@code <root>/<namespace>/<url-encoded key>.json}.
 */
public class FileDurableStore implements DurableStore {

    private static final Logger log = LoggerFactory.getLogger(FileDurableStore.class);

    private static final String SUFFIX = ".json";

    private final Path root;
    private final ObjectMapper objectMapper;

    public FileDurableStore(Path root, ObjectMapper objectMapper) {
        this.root = root.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> Optional<T> get(String namespace, String key, Class<T> type) {
        Path file = file(namespace, key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            throw new StorageException("Failed to read " + namespace + "/" + key, e);
        }
    }

    @Override
    public void put(String namespace, String key, Object value) {
        Path file = file(namespace, key);
        try {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), ".write-", ".tmp");
            objectMapper.writeValue(tmp.toFile(), value);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Failed to write " + namespace + "/" + key, e);
        }
    }

    @Override
    public <T> Map<String, T> list(String namespace, String prefix, Class<T> type) {
        Path dir = namespaceDir(namespace);
        var result = new TreeMap<String, T>();
        if (!Files.isDirectory(dir)) {
            return result;
        }
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                String name = file.getFileName().toString();
                if (!name.endsWith(SUFFIX) || name.startsWith(".write-")) {
                    continue;
                }
                String key = URLDecoder.decode(name.substring(0, name.length() - SUFFIX.length()), StandardCharsets.UTF_8);
                if (key.startsWith(prefix)) {
                    result.put(key, objectMapper.readValue(file.toFile(), type));
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list " + namespace + "/" + prefix, e);
        }
        return result;
    }

    @Override
    public void delete(String namespace, String key) {
        try {
            Files.deleteIfExists(file(namespace, key));
        } catch (IOException e) {
            throw new StorageException("Failed to delete " + namespace + "/" + key, e);
        }
    }

    @Override
    public List<String> namespaces() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        var result = new ArrayList<String>();
        try (Stream<Path> dirs = Files.list(root)) {
            dirs.filter(Files::isDirectory)
                    .map(d -> URLDecoder.decode(d.getFileName().toString(), StandardCharsets.UTF_8))
                    .sorted()
                    .forEach(result::add);
        } catch (IOException e) {
            log.warn("Could not list durable namespaces under {}: {}", root, e.getMessage());
        }
        return result;
    }

    private Path namespaceDir(String namespace) {
        return root.resolve(encode(namespace));
    }

    private Path file(String namespace, String key) {
        return namespaceDir(namespace).resolve(encode(key) + SUFFIX);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
