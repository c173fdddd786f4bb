package com.tenantgate.agent;

import com.tenantgate.core.error.TenantgateException;

/**
 * A request could not be delivered to the agent within its retry budget.
 */
public class ProxyException extends TenantgateException {

    private final Diagnostics diagnostics;

    public ProxyException(String message, Diagnostics diagnostics) {
        super(message);
        this.diagnostics = diagnostics;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }
}
