package com.comparo.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Comparo-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String REQUEST_ID = "requestId";
    public static final String TARGET_ID = "targetId";

    private MdcContext() {}

    public static void setRequest(String requestId) {
        MDC.put(REQUEST_ID, requestId);
    }

    public static void setTarget(String requestId, String targetId) {
        MDC.put(REQUEST_ID, requestId);
        MDC.put(TARGET_ID, targetId);
    }

    public static void clear() {
        MDC.remove(REQUEST_ID);
        MDC.remove(TARGET_ID);
    }
}
