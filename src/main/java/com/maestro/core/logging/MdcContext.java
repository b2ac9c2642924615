package com.maestro.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Maestro-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setStage(String stageId) {
        MDC.put("stageId", stageId);
    }

    public static void setRound(String stageId, int round) {
        MDC.put("stageId", stageId);
        MDC.put("round", String.valueOf(round));
    }

    public static void setAgent(String stageId, int round, String role) {
        MDC.put("stageId", stageId);
        MDC.put("round", String.valueOf(round));
        MDC.put("role", role);
    }

    public static void clearAgent() {
        MDC.remove("role");
    }

    public static void clear() {
        MDC.remove("stageId");
        MDC.remove("round");
        MDC.remove("role");
    }
}
