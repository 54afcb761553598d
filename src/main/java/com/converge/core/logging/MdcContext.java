package com.converge.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Converge-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setStage(String stage) {
        MDC.put("stage", stage);
    }

    public static void setResource(String stage, String resourceType, String resourceName) {
        MDC.put("stage", stage);
        MDC.put("resourceType", resourceType);
        MDC.put("resourceName", resourceName);
    }

    public static void clearResource() {
        MDC.remove("resourceType");
        MDC.remove("resourceName");
    }

    public static void setApiMethod(String methodName) {
        MDC.put("apiMethod", methodName);
    }

    public static void clearApiMethod() {
        MDC.remove("apiMethod");
    }

    public static void clear() {
        MDC.remove("stage");
        MDC.remove("resourceType");
        MDC.remove("resourceName");
        MDC.remove("apiMethod");
    }
}
