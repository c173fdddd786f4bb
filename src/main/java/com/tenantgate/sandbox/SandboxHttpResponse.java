package com.tenantgate.sandbox;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Response of an HTTP call into a sandbox. The body is an unbuffered stream and
 * must be closed by whoever consumes it.
 */
public record SandboxHttpResponse(int statusCode, String contentType, InputStream body) implements Closeable {

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Reads the remaining body as UTF-8 and closes it.
     */
    public String readBody() {
        try (InputStream in = body) {
            return in == null ? "" : new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SandboxException("Failed to read sandbox response body: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (body == null) {
            return;
        }
        try {
            body.close();
        } catch (IOException e) {
            throw new SandboxException("Failed to close sandbox response body", e);
        }
    }
}
