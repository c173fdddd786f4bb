package com.tenantgate.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * {@link BlobStore} on the local filesystem. Each object is a file under the root
 * directory; its metadata sits next to it in a {@code <name>.meta.json} file.
 * Objects are written to a temporary file and moved into place.
 */
public class FileSystemBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemBlobStore.class);

    static final String META_SUFFIX = ".meta.json";
    private static final TypeReference<Map<String, String>> META_TYPE = new TypeReference<>() {};

    private final Path root;
    private final ObjectMapper objectMapper;

    public FileSystemBlobStore(Path root, ObjectMapper objectMapper) {
        this.root = root.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    @Override
    public void put(String key, String content, Map<String, String> metadata) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            objectMapper.writeValue(metaPath(target).toFile(), metadata);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Failed to store " + key, e);
        }
    }

    @Override
    public List<BlobObject> list(String prefix) {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        var result = new ArrayList<BlobObject>();
        try (Stream<Path> files = Files.walk(root)) {
            for (Path file : (Iterable<Path>) files.filter(Files::isRegularFile)::iterator) {
                String key = root.relativize(file).toString().replace('\\', '/');
                String name = file.getFileName().toString();
                if (name.endsWith(META_SUFFIX) || name.startsWith(".upload-") || !key.startsWith(prefix)) {
                    continue;
                }
                result.add(new BlobObject(key, Files.size(file),
                        Files.getLastModifiedTime(file).toInstant(), readMetadata(file)));
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list " + prefix, e);
        }
        result.sort(Comparator.comparing(BlobObject::key));
        return result;
    }

    @Override
    public void delete(String key) {
        Path target = resolve(key);
        try {
            Files.deleteIfExists(target);
            Files.deleteIfExists(metaPath(target));
        } catch (IOException e) {
            throw new StorageException("Failed to delete " + key, e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            Files.createDirectories(root);
            return Files.isWritable(root);
        } catch (IOException e) {
            log.warn("Blob store root {} not usable: {}", root, e.getMessage());
            return false;
        }
    }

    public Path root() {
        return root;
    }

    private Map<String, String> readMetadata(Path file) {
        Path meta = metaPath(file);
        if (!Files.exists(meta)) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(meta.toFile(), META_TYPE);
        } catch (IOException e) {
            log.warn("Unreadable metadata for {}: {}", file, e.getMessage());
            return Map.of();
        }
    }

    private Path resolve(String key) {
        Path target = root.resolve(key).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new IllegalArgumentException("Invalid blob key: " + key);
        }
        return target;
    }

    private static Path metaPath(Path file) {
        return file.resolveSibling(file.getFileName() + META_SUFFIX);
    }
}
