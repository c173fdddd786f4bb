package com.tenantgate.tenant;

import java.util.Map;

/**
 * Outcome of a unary chat: the HTTP status to answer with and the JSON body.
 */
public record ChatResult(int status, Map<String, Object> body) {}
