package com.dockyard.core.queue;

/**
 * Executes one job type. Implementations are registered as Spring beans and
 * looked up by {@link #type()} when the dispatcher claims a job.
 *
 * <p>Contract for implementers:
 * <ul>
 *   <li>Return normally on success; throw on failure. The dispatcher owns retry,
 *       backoff and every state transition.</li>
 *   <li>Delivery is at-least-once. A handler may run again after a crash or a
 *       force-unlock, so each step must be idempotent.</li>
 *   <li>Cancellation is cooperative. Call {@link JobContext#throwIfCancelRequested()}
 *       between steps; nothing interrupts a running handler.</li>
 *   <li>Throw {@link RescheduleException} to poll an external condition without
 *       consuming an attempt, and {@link NonRetryableJobException} for failures a
 *       retry cannot fix.</li>
 *   <li>Every external call must carry its own timeout.</li>
 * </ul>
 */
public interface JobHandler {

    /** Wire name of the job type this handler executes. */
    String type();

    void handle(JobContext context) throws Exception;
}
