package com.tenantgate.tenant;

/**
 * The only controller state guaranteed to survive eviction. Overwritten on every
 * inbound request and read by the wake-up handler to decide idleness.
 */
public record DurableMarker(long lastActivity, String tenantId) {}
