package com.dockyard.core.queue;

/**
 * Thrown from {@link JobContext#throwIfCancelRequested()} when a cancel was
 * requested for the running job. The dispatcher moves the job to cancelled.
 */
public class JobCancelledException extends RuntimeException {
    public JobCancelledException(String jobId) {
        super("Job " + jobId + " was cancelled");
    }
}
