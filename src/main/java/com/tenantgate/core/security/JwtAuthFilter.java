package com.tenantgate.core.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * Resolves tenant and user from a Bearer token on protected paths and exposes them
 * as request attributes. Tokens without a {@code tenant_id} claim are rejected with 403,
 * missing or invalid tokens with 401.
 */
public class JwtAuthFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);

    public static final String TENANT_ATTRIBUTE = "tenantgate.tenantId";
    public static final String USER_ATTRIBUTE = "tenantgate.userId";
    public static final String ROLES_ATTRIBUTE = "tenantgate.roles";

    private final JwtTokenVerifier verifier;
    private final List<String> protectedPrefixes;

    public JwtAuthFilter(JwtTokenVerifier verifier, List<String> protectedPrefixes) {
        this.verifier = verifier;
        this.protectedPrefixes = protectedPrefixes;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        if (!isProtected(httpRequest.getRequestURI())) {
            chain.doFilter(request, response);
            return;
        }

        String header = httpRequest.getHeader("Authorization");
        if (header == null || !header.startsWith("Bearer ")) {
            reject(httpResponse, HttpServletResponse.SC_UNAUTHORIZED, "Missing bearer token");
            return;
        }

        Claims claims;
        try {
            claims = verifier.verify(header.substring("Bearer ".length()).trim());
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            reject(httpResponse, HttpServletResponse.SC_UNAUTHORIZED, "Invalid token");
            return;
        }

        String tenantId = claims.get("tenant_id", String.class);
        if (tenantId == null || tenantId.isBlank()) {
            reject(httpResponse, HttpServletResponse.SC_FORBIDDEN, "Token carries no tenant");
            return;
        }

        httpRequest.setAttribute(TENANT_ATTRIBUTE, tenantId);
        httpRequest.setAttribute(USER_ATTRIBUTE, claims.getSubject());
        Object roles = claims.get("roles");
        httpRequest.setAttribute(ROLES_ATTRIBUTE, roles instanceof Collection<?> c
                ? c.stream().map(String::valueOf).toList()
                : List.of());
        chain.doFilter(request, response);
    }

    private boolean isProtected(String path) {
        for (String prefix : protectedPrefixes) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static void reject(HttpServletResponse response, int status, String message) throws IOException {
        response.setStatus(status);
        response.setContentType("application/json");
        response.getWriter().write("{\"error\":\"" + message + "\"}");
    }
}
