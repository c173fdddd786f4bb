package com.tenantgate.dispatch.api;

import com.tenantgate.agent.ColdStartException;
import com.tenantgate.agent.ProxyException;
import com.tenantgate.core.error.TenantgateException;
import com.tenantgate.sandbox.SandboxException;
import com.tenantgate.sandbox.SandboxProvisionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps request failures to JSON error bodies: {@code {error, message, diagnostics?}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MissingTenantContextException.class)
    public ResponseEntity<Map<String, Object>> missingContext(MissingTenantContextException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "Missing user context"));
    }

    @ExceptionHandler(InvalidChatRequestException.class)
    public ResponseEntity<Map<String, Object>> invalid(InvalidChatRequestException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "Invalid request body"));
    }

    @ExceptionHandler(ColdStartException.class)
    public ResponseEntity<Map<String, Object>> coldStart(ColdStartException e) {
        log.error("Agent cold start failed: {}\n{}", e.getMessage(), e.getDiagnostics());
        var body = body("Agent failed to start", e.getMessage());
        body.put("diagnostics", e.getDiagnostics().toMap());
        return ResponseEntity.status(503).body(body);
    }

    @ExceptionHandler(ProxyException.class)
    public ResponseEntity<Map<String, Object>> proxy(ProxyException e) {
        log.error("Agent request failed: {}\n{}", e.getMessage(), e.getDiagnostics());
        var body = body("Agent request failed", e.getMessage());
        body.put("diagnostics", e.getDiagnostics().toMap());
        return ResponseEntity.status(502).body(body);
    }

    @ExceptionHandler(SandboxProvisionException.class)
    public ResponseEntity<Map<String, Object>> provision(SandboxProvisionException e) {
        log.error("Sandbox provisioning failed: {}", e.getMessage(), e);
        return ResponseEntity.status(502).body(body("Sandbox unavailable", e.getMessage()));
    }

    @ExceptionHandler(SandboxException.class)
    public ResponseEntity<Map<String, Object>> sandbox(SandboxException e) {
        log.error("Sandbox operation failed: {}", e.getMessage(), e);
        return ResponseEntity.status(502).body(body("Sandbox operation failed", e.getMessage()));
    }

    @ExceptionHandler(TenantgateException.class)
    public ResponseEntity<Map<String, Object>> other(TenantgateException e) {
        log.error("Chat processing failed: {}", e.getMessage(), e);
        return ResponseEntity.status(500).body(body("Chat processing failed", e.getMessage()));
    }

    private static Map<String, Object> body(String error, String message) {
        var body = new LinkedHashMap<String, Object>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
