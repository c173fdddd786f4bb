package com.tenantgate.dispatch.api;

import com.tenantgate.core.error.TenantgateException;

public class MissingTenantContextException extends TenantgateException {

    public MissingTenantContextException() {
        super("Missing user context");
    }
}
