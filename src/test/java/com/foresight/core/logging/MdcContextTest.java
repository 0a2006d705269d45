package com.foresight.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setAnalysis puts analysisId and agentId in MDC")
    void setAnalysis() {
        MdcContext.setAnalysis("a-1", "agent-1");
        assertEquals("a-1", MDC.get("analysisId"));
        assertEquals("agent-1", MDC.get("agentId"));
    }

    @Test
    @DisplayName("setCapability and setRecommendation add their keys")
    void setCapabilityAndRecommendation() {
        MdcContext.setCapability("wallet:balance");
        MdcContext.setRecommendation("r-1");
        assertEquals("wallet:balance", MDC.get("capability"));
        assertEquals("r-1", MDC.get("recommendationId"));
    }

    @Test
    @DisplayName("clear removes all foresight MDC keys and leaves others")
    void clear() {
        MDC.put("traceId", "t-1");
        MdcContext.setAnalysis("a-1", "agent-1");
        MdcContext.setCapability("wallet:balance");
        MdcContext.setRecommendation("r-1");

        MdcContext.clear();

        assertNull(MDC.get("analysisId"));
        assertNull(MDC.get("agentId"));
        assertNull(MDC.get("capability"));
        assertNull(MDC.get("recommendationId"));
        assertEquals("t-1", MDC.get("traceId"));
        MDC.remove("traceId");
    }
}
