package com.dockyard.dispatch.api;

import com.dockyard.core.queue.Job;
import com.dockyard.core.queue.JobFilter;
import com.dockyard.core.queue.JobPage;
import com.dockyard.core.queue.JobState;
import com.dockyard.core.queue.QueueService;
import com.dockyard.core.queue.QueueSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

/**
 * REST controller for inspecting and administering the job queue.
 * Every non-GET endpoint requires an admin token (see {@code AuthFilter}).
 */
@RestController
@RequestMapping("/api/v1/queue")
public class QueueController {

    private static final Logger log = LoggerFactory.getLogger(QueueController.class);

    private final QueueService queueService;
    private final QueueStreamService streamService;

    public QueueController(QueueService queueService, QueueStreamService streamService) {
        this.queueService = queueService;
        this.streamService = streamService;
    }

    /**
     * GET /api/v1/queue/jobs: Page through jobs, newest first.
     */
    @GetMapping("/jobs")
    public JobPage listJobs(
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String projectId,
            @RequestParam(name = "q", required = false) String text,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "" + QueueService.DEFAULT_PAGE_SIZE) int pageSize) {
        return queueService.listJobs(filter(state, type, projectId, text), page, pageSize);
    }

    @GetMapping("/jobs/count")
    public Map<String, Object> countJobs(
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String projectId,
            @RequestParam(name = "q", required = false) String text) {
        return Map.of("count", queueService.countJobs(filter(state, type, projectId, text)));
    }

    @GetMapping("/jobs/{id}")
    public Job getJob(@PathVariable String id) {
        return queueService.getJob(id);
    }

    @PostMapping("/jobs/{id}/cancel")
    public Job cancel(@PathVariable String id) {
        log.info("Cancel requested for job {}", id);
        return queueService.cancel(id);
    }

    @PostMapping("/jobs/{id}/retry")
    public Job retry(@PathVariable String id) {
        log.info("Retry requested for job {}", id);
        return queueService.retry(id);
    }

    @PostMapping("/jobs/{id}/run-now")
    public Job runNow(@PathVariable String id) {
        return queueService.runNow(id);
    }

    @PostMapping("/jobs/{id}/force-unlock")
    public Job forceUnlock(@PathVariable String id) {
        log.warn("Force unlock requested for job {}", id);
        return queueService.forceUnlock(id);
    }

    @DeleteMapping("/jobs/{id}")
    public ResponseEntity<Void> deleteJob(@PathVariable String id) {
        queueService.deleteJob(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * DELETE /api/v1/queue/jobs?state=failed: Bulk delete terminal jobs.
     */
    @DeleteMapping("/jobs")
    public Map<String, Object> deleteJobsByState(@RequestParam String state) {
        int deleted = queueService.deleteJobsByState(JobState.fromValue(state));
        return Map.of("deleted", deleted, "state", state);
    }

    @GetMapping("/settings")
    public QueueSettings getSettings() {
        return queueService.getSettings();
    }

    @PutMapping("/settings/concurrency")
    public QueueSettings setConcurrency(@RequestBody ConcurrencyRequest request) {
        if (request == null || request.concurrency() == null) {
            throw new IllegalArgumentException("concurrency is required");
        }
        return queueService.setConcurrency(request.concurrency());
    }

    @PostMapping("/pause")
    public QueueSettings pause() {
        return queueService.setPaused(true);
    }

    @PostMapping("/resume")
    public QueueSettings resume() {
        return queueService.setPaused(false);
    }

    /**
     * GET /api/v1/queue/stream: SSE snapshot stream: one {@code init} event, then
     * an {@code update} event every couple of seconds.
     */
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String projectId,
            @RequestParam(name = "q", required = false) String text,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "" + QueueService.DEFAULT_PAGE_SIZE) int pageSize) {
        return streamService.createEmitter(filter(state, type, projectId, text), page, pageSize);
    }

    private static JobFilter filter(String state, String type, String projectId, String text) {
        JobState jobState = state == null || state.isBlank() ? null : JobState.fromValue(state);
        return new JobFilter(jobState, blankToNull(type), blankToNull(projectId), blankToNull(text));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    public record ConcurrencyRequest(Integer concurrency) {}
}
