package com.maestro.core.logging;

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
    @DisplayName("setStage puts stageId in MDC")
    void setStage() {
        MdcContext.setStage("03-planning");
        assertEquals("03-planning", MDC.get("stageId"));
    }

    @Test
    @DisplayName("setAgent puts stageId, round and role in MDC")
    void setAgent() {
        MdcContext.setAgent("03-planning", 2, "Architect");
        assertEquals("03-planning", MDC.get("stageId"));
        assertEquals("2", MDC.get("round"));
        assertEquals("Architect", MDC.get("role"));
    }

    @Test
    @DisplayName("clearAgent keeps the stage")
    void clearAgent() {
        MdcContext.setAgent("03-planning", 2, "Architect");
        MdcContext.clearAgent();
        assertNull(MDC.get("role"));
        assertEquals("03-planning", MDC.get("stageId"));
    }

    @Test
    @DisplayName("clear removes all maestro MDC keys")
    void clear() {
        MdcContext.setAgent("03-planning", 2, "Architect");
        MdcContext.clear();
        assertNull(MDC.get("stageId"));
        assertNull(MDC.get("round"));
        assertNull(MDC.get("role"));
    }
}
