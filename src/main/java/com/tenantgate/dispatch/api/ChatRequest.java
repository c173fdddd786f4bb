package com.tenantgate.dispatch.api;

/**
 * Inbound JSON body for POST /chat and POST /chat/stream.
 *
 * @param message   the user's message; required
 * @param sessionId conversation id; nullable, a random one is assigned when absent
 */
public record ChatRequest(
    String message,
    String sessionId
) {}
