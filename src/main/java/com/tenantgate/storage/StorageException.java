package com.tenantgate.storage;

import com.tenantgate.core.error.TenantgateException;

public class StorageException extends TenantgateException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
