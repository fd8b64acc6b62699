package com.dockyard.core.queue;

/**
 * Filters for listing and counting jobs. Any {@code null} field matches everything.
 *
 * @param text case-insensitive substring matched against payload and last error
 */
public record JobFilter(JobState state, String type, String projectId, String text) {

    public static JobFilter none() {
        return new JobFilter(null, null, null, null);
    }

    public static JobFilter forProject(String projectId) {
        return new JobFilter(null, null, projectId, null);
    }

    public boolean matches(Job job) {
        if (state != null && job.state() != state) return false;
        if (type != null && !type.equals(job.type())) return false;
        if (projectId != null && !projectId.equals(job.projectId())) return false;
        if (text != null && !text.isBlank()) {
            String needle = text.toLowerCase();
            boolean inPayload = job.payload() != null && job.payload().toLowerCase().contains(needle);
            boolean inError = job.lastError() != null && job.lastError().toLowerCase().contains(needle);
            return inPayload || inError;
        }
        return true;
    }
}
