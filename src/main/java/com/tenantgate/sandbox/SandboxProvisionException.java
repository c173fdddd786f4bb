package com.tenantgate.sandbox;

/**
 * The sandbox environment could not be created or started. Not retried.
 */
public class SandboxProvisionException extends SandboxException {

    public SandboxProvisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
