package com.tenantgate.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Tenantgate-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTenant(String tenantId) {
        if (tenantId != null) {
            MDC.put("tenantId", tenantId);
        }
    }

    public static void setRequest(String tenantId, String userId) {
        setTenant(tenantId);
        if (userId != null) {
            MDC.put("userId", userId);
        }
    }

    public static void clear() {
        MDC.remove("tenantId");
        MDC.remove("userId");
    }
}
