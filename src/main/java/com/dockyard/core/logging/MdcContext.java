package com.dockyard.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Dockyard-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setProject(String projectId) {
        if (projectId != null) {
            MDC.put("projectId", projectId);
        }
    }

    public static void setJob(String jobId, String jobType, String projectId) {
        MDC.put("jobId", jobId);
        MDC.put("jobType", jobType);
        setProject(projectId);
    }

    public static void clear() {
        MDC.remove("projectId");
        MDC.remove("jobId");
        MDC.remove("jobType");
    }
}
