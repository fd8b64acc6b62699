package com.dockyard.core.queue;

import java.util.List;

/**
 * One page of jobs plus pagination metadata. {@code page} is 1-based.
 */
public record JobPage(List<Job> jobs, long total, int page, int pageSize, int totalPages) {

    public static JobPage of(List<Job> jobs, long total, int page, int pageSize) {
        int totalPages = pageSize > 0 ? (int) ((total + pageSize - 1) / pageSize) : 0;
        return new JobPage(jobs, total, page, pageSize, totalPages);
    }
}
