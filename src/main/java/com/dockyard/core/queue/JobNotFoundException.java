package com.dockyard.core.queue;

/**
 * Thrown when an administrative action targets a job id that does not exist.
 */
public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
    }
}
