package com.keystone.core.logging;

import org.slf4j.MDC;

/**
 * Keystone-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setStage(String taskId, String stage) {
        MDC.put("taskId", taskId);
        MDC.put("stage", stage);
    }

    public static void setProposal(String proposalId) {
        MDC.put("proposalId", proposalId);
    }

    public static void clearStage() {
        MDC.remove("stage");
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("stage");
        MDC.remove("proposalId");
    }
}
