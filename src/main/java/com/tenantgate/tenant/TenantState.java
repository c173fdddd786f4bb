package com.tenantgate.tenant;

public enum TenantState {
    COLD,
    PROVISIONING,
    CONFIGURING,
    STARTING_AGENT,
    READY,
    IDLE
}
