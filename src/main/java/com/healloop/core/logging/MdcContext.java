package com.healloop.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Healloop-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setExecution(String executionId, String tool) {
        MDC.put("executionId", executionId);
        MDC.put("tool", tool);
    }

    public static void setAttempt(int attempt) {
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void clearAttempt() {
        MDC.remove("attempt");
    }

    public static void clear() {
        MDC.remove("executionId");
        MDC.remove("tool");
        MDC.remove("attempt");
    }
}
