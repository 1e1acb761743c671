package com.keystone.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Keystone-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String NODE_ID = "nodeId";
    public static final String AGENT_ROLE = "agentRole";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setNode(String runId, String nodeId) {
        MDC.put(RUN_ID, runId);
        MDC.put(NODE_ID, nodeId);
    }

    public static void setAgent(String runId, String nodeId, String agentRole) {
        setNode(runId, nodeId);
        MDC.put(AGENT_ROLE, agentRole);
    }

    public static void clearAgent() {
        MDC.remove(AGENT_ROLE);
    }

    public static void clearNode() {
        MDC.remove(NODE_ID);
        MDC.remove(AGENT_ROLE);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(NODE_ID);
        MDC.remove(AGENT_ROLE);
    }
}
