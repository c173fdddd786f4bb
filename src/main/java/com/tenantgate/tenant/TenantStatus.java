package com.tenantgate.tenant;

public record TenantStatus(
    String name,
    String tenantId,
    TenantState state,
    boolean resident,
    boolean sandboxHeld,
    boolean agentBelievedRunning,
    String injectedConfigHash,
    long logOffset,
    int bufferedLogEntries,
    Long lastActivity
) {}
