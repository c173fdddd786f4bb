package com.tenantgate.dispatch.api;

import com.tenantgate.core.error.TenantgateException;

public class InvalidChatRequestException extends TenantgateException {

    public InvalidChatRequestException(String message) {
        super(message);
    }
}
