package com.foresight.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Foresight-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setAnalysis(String analysisId, String agentId) {
        MDC.put("analysisId", analysisId);
        MDC.put("agentId", agentId);
    }

    public static void setCapability(String capabilityName) {
        MDC.put("capability", capabilityName);
    }

    public static void setRecommendation(String recommendationId) {
        MDC.put("recommendationId", recommendationId);
    }

    public static void clear() {
        MDC.remove("analysisId");
        MDC.remove("agentId");
        MDC.remove("capability");
        MDC.remove("recommendationId");
    }
}
