package com.infomedia.abacox.callshipping.component.engine;

import org.slf4j.MDC;

/**
 * Puts the call being processed into the logging context.
 */
public class CallContext {

    // Matches the keys used in logback-spring.xml
    private static final String LINKED_ID_KEY = "linkedId";
    private static final String TENANT_KEY = "tenant";

    private CallContext() {
    }

    public static void setLinkedId(String linkedId) {
        if (linkedId != null) {
            MDC.put(LINKED_ID_KEY, linkedId);
        } else {
            MDC.remove(LINKED_ID_KEY);
        }
    }

    public static void setTenant(String tenant) {
        if (tenant != null && !tenant.isEmpty()) {
            MDC.put(TENANT_KEY, tenant);
        } else {
            MDC.remove(TENANT_KEY);
        }
    }

    public static void clear() {
        MDC.remove(LINKED_ID_KEY);
        MDC.remove(TENANT_KEY);
    }
}
