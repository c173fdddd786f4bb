package com.tenantgate.sandbox;

import java.time.Duration;
import java.util.Map;

public record SandboxHttpRequest(
    String method,
    String path,
    Map<String, String> headers,
    byte[] body,
    Duration timeout
) {
    public static SandboxHttpRequest get(String path, Duration timeout) {
        return new SandboxHttpRequest("GET", path, Map.of(), null, timeout);
    }

    public static SandboxHttpRequest postJson(String path, Map<String, String> headers, byte[] body, Duration timeout) {
        return new SandboxHttpRequest("POST", path, headers, body, timeout);
    }
}
