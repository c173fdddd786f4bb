package com.tenantgate.agent;

import com.tenantgate.core.error.TenantgateException;

/**
 * The agent server did not become healthy after a cold start.
 */
public class ColdStartException extends TenantgateException {

    private final Diagnostics diagnostics;

    public ColdStartException(String message, Diagnostics diagnostics) {
        super(message);
        this.diagnostics = diagnostics;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }
}
