package com.tenantgate.storage;

import java.time.Instant;
import java.util.Map;

public record BlobObject(String key, long size, Instant uploaded, Map<String, String> metadata) {}
