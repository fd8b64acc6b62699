package com.dockyard.core.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Per-execution view handed to a {@link JobHandler}.
 */
public class JobContext {

    private final Job job;
    private final JobStore store;
    private final ObjectMapper objectMapper;

    public JobContext(Job job, JobStore store, ObjectMapper objectMapper) {
        this.job = job;
        this.store = store;
        this.objectMapper = objectMapper;
    }

    public Job job() {
        return job;
    }

    public String projectId() {
        return job.projectId();
    }

    public <T> T payload(Class<T> type) {
        try {
            return objectMapper.readValue(job.payload(), type);
        } catch (JsonProcessingException e) {
            throw new NonRetryableJobException("Malformed payload for job " + job.id() + ": " + e.getOriginalMessage(), e);
        }
    }

    public boolean isCancelRequested() {
        return store.isCancelRequested(job.id());
    }

    /**
     * Safe checkpoint for cooperative cancellation.
     *
     * @throws JobCancelledException if a cancel was requested for this job
     */
    public void throwIfCancelRequested() {
        if (isCancelRequested()) {
            throw new JobCancelledException(job.id());
        }
    }
}
