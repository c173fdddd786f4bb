package com.tenantgate.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class StorageConfig {

    @Bean
    public BlobStore blobStore(StorageProperties properties, ObjectMapper objectMapper) {
        return new FileSystemBlobStore(Path.of(properties.getBlobRoot()), objectMapper);
    }

    @Bean
    public DurableStore durableStore(StorageProperties properties, ObjectMapper objectMapper) {
        return new FileDurableStore(Path.of(properties.getDurableRoot()), objectMapper);
    }
}
