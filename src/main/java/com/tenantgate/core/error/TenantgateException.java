package com.tenantgate.core.error;

/**
 * Root of the unchecked exceptions raised while serving a tenant request.
 */
public class TenantgateException extends RuntimeException {

    public TenantgateException(String message) {
        super(message);
    }

    public TenantgateException(String message, Throwable cause) {
        super(message, cause);
    }
}
