package com.cellblock.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Cellblock-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUNTIME_ID = "runtimeId";
    public static final String CONTAINER_REF = "containerRef";
    public static final String EVALUATION_REF = "evaluationRef";

    private MdcContext() {}

    public static void setRuntime(String runtimeId) {
        MDC.put(RUNTIME_ID, runtimeId);
    }

    public static void setContainer(String runtimeId, String containerRef) {
        if (runtimeId != null) {
            MDC.put(RUNTIME_ID, runtimeId);
        }
        MDC.put(CONTAINER_REF, containerRef);
    }

    public static void setEvaluation(String containerRef, String evaluationRef) {
        MDC.put(CONTAINER_REF, containerRef);
        MDC.put(EVALUATION_REF, evaluationRef);
    }

    public static void clearEvaluation() {
        MDC.remove(EVALUATION_REF);
    }

    public static void clear() {
        MDC.remove(RUNTIME_ID);
        MDC.remove(CONTAINER_REF);
        MDC.remove(EVALUATION_REF);
    }
}
