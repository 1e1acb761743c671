package com.keystone.core.logging;

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
    @DisplayName("setRun puts runId in MDC")
    void setRun() {
        MdcContext.setRun("RUN-2026-0001");
        assertEquals("RUN-2026-0001", MDC.get("runId"));
    }

    @Test
    @DisplayName("setAgent puts runId, nodeId and agentRole in MDC")
    void setAgent() {
        MdcContext.setAgent("RUN-2026-0001", "1.2", "planner");
        assertEquals("RUN-2026-0001", MDC.get("runId"));
        assertEquals("1.2", MDC.get("nodeId"));
        assertEquals("planner", MDC.get("agentRole"));
    }

    @Test
    @DisplayName("clearAgent keeps run and node")
    void clearAgent() {
        MdcContext.setAgent("RUN-2026-0001", "1", "verifier");
        MdcContext.clearAgent();
        assertEquals("RUN-2026-0001", MDC.get("runId"));
        assertEquals("1", MDC.get("nodeId"));
        assertNull(MDC.get("agentRole"));
    }

    @Test
    @DisplayName("clearNode keeps only the run")
    void clearNode() {
        MdcContext.setAgent("RUN-2026-0001", "1", "executor");
        MdcContext.clearNode();
        assertEquals("RUN-2026-0001", MDC.get("runId"));
        assertNull(MDC.get("nodeId"));
        assertNull(MDC.get("agentRole"));
    }

    @Test
    @DisplayName("clear removes all keystone MDC keys")
    void clear() {
        MdcContext.setAgent("RUN-2026-0001", "1.1", "planner");
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("nodeId"));
        assertNull(MDC.get("agentRole"));
    }
}
