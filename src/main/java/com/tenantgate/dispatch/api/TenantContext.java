package com.tenantgate.dispatch.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantgate.core.security.JwtAuthFilter;
import jakarta.servlet.http.HttpServletRequest;

import java.io.IOException;
import java.util.List;

/**
 * Who is calling: resolved from token attributes set by {@link JwtAuthFilter}, or from
 * the edge router's {@code X-Tenant-Id} / {@code X-User-Id} / {@code X-User-Roles} headers.
 *
 * @param requestStart epoch millis from {@code X-Request-Start}; null when absent
 */
public record TenantContext(String tenantId, String userId, List<String> roles, Long requestStart) {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> ROLES_TYPE = new TypeReference<>() {};

    /**
     * @throws MissingTenantContextException when tenant or user cannot be determined
     */
    public static TenantContext from(HttpServletRequest request) {
        Object tenantAttr = request.getAttribute(JwtAuthFilter.TENANT_ATTRIBUTE);
        if (tenantAttr != null) {
            Object userAttr = request.getAttribute(JwtAuthFilter.USER_ATTRIBUTE);
            @SuppressWarnings("unchecked")
            List<String> roles = (List<String>) request.getAttribute(JwtAuthFilter.ROLES_ATTRIBUTE);
            return build(tenantAttr.toString(), userAttr == null ? null : userAttr.toString(),
                    roles, request.getHeader("X-Request-Start"));
        }
        return build(request.getHeader("X-Tenant-Id"), request.getHeader("X-User-Id"),
                parseRoles(request.getHeader("X-User-Roles")), request.getHeader("X-Request-Start"));
    }

    private static TenantContext build(String tenantId, String userId, List<String> roles, String requestStart) {
        if (tenantId == null || tenantId.isBlank() || userId == null || userId.isBlank()) {
            throw new MissingTenantContextException();
        }
        return new TenantContext(tenantId, userId, roles == null ? List.of() : roles, parseStart(requestStart));
    }

    static List<String> parseRoles(String header) {
        if (header == null || header.isBlank()) {
            return List.of();
        }
        try {
            return MAPPER.readValue(header, ROLES_TYPE);
        } catch (IOException e) {
            return List.of();
        }
    }

    private static Long parseStart(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
