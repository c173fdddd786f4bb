package com.tenantgate.sandbox;

import com.tenantgate.core.error.TenantgateException;

/**
 * A sandbox primitive could not be carried out.
 */
public class SandboxException extends TenantgateException {

    public SandboxException(String message) {
        super(message);
    }

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
