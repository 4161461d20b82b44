package com.armada.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Armada-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setMission(String missionId) {
        MDC.put("missionId", missionId);
    }

    public static void setExecution(String missionId, String executionId) {
        MDC.put("missionId", missionId);
        MDC.put("executionId", executionId);
    }

    public static void setTask(String missionId, String taskId) {
        MDC.put("missionId", missionId);
        MDC.put("taskId", taskId);
    }

    public static void clearTask() {
        MDC.remove("taskId");
    }

    public static void setAgent(String agentId) {
        MDC.put("agentId", agentId);
    }

    public static void clearAgent() {
        MDC.remove("agentId");
    }

    public static void clear() {
        MDC.remove("missionId");
        MDC.remove("executionId");
        MDC.remove("taskId");
        MDC.remove("agentId");
    }
}
