package com.atlas.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Atlas-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTurn(String turnId) {
        MDC.put("turnId", turnId);
    }

    public static void setIntent(String turnId, String intent) {
        MDC.put("turnId", turnId);
        MDC.put("intent", intent);
    }

    public static void clear() {
        MDC.remove("turnId");
        MDC.remove("intent");
    }
}
