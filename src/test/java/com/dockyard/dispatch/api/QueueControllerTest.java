package com.dockyard.dispatch.api;

import com.dockyard.core.queue.InvalidJobStateException;
import com.dockyard.core.queue.JobFilter;
import com.dockyard.core.queue.JobNotFoundException;
import com.dockyard.core.queue.JobPage;
import com.dockyard.core.queue.JobState;
import com.dockyard.core.queue.QueueService;
import com.dockyard.core.queue.QueueSettings;
import com.dockyard.core.security.AuthProperties;
import com.dockyard.core.security.JwtTokenService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

import static com.dockyard.dispatch.api.TestJobs.job;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(QueueController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class QueueControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private QueueService queueService;

    @MockitoBean
    private QueueStreamService streamService;

    @MockitoBean
    private AuthProperties authProperties;

    @MockitoBean
    private JwtTokenService tokenService;

    @BeforeEach
    void authDisabled() {
        when(authProperties.isEnabled()).thenReturn(false);
    }

    // ── Reads ────────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /jobs maps query parameters onto the filter")
    void listJobs() throws Exception {
        var expectedFilter = new JobFilter(JobState.FAILED, "docker.stop", "proj1", "timeout");
        when(queueService.listJobs(expectedFilter, 2, 50))
                .thenReturn(JobPage.of(List.of(job("j1", "docker.stop", JobState.FAILED)), 51, 2, 50));

        mockMvc.perform(get("/api/v1/queue/jobs")
                        .param("state", "failed")
                        .param("type", "docker.stop")
                        .param("projectId", "proj1")
                        .param("q", "timeout")
                        .param("page", "2")
                        .param("pageSize", "50"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobs", hasSize(1)))
                .andExpect(jsonPath("$.jobs[0].state").value("failed"))
                .andExpect(jsonPath("$.jobs[0].payload.projectId").value("proj1"))
                .andExpect(jsonPath("$.total").value(51))
                .andExpect(jsonPath("$.totalPages").value(2));
    }

    @Test
    @DisplayName("GET /jobs treats blank parameters as absent")
    void listJobsBlankParams() throws Exception {
        when(queueService.listJobs(JobFilter.none(), 1, 100)).thenReturn(JobPage.of(List.of(), 0, 1, 100));

        mockMvc.perform(get("/api/v1/queue/jobs").param("state", "").param("q", " "))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(0));
    }

    @Test
    @DisplayName("GET /jobs with an unknown state returns 400")
    void listJobsUnknownState() throws Exception {
        mockMvc.perform(get("/api/v1/queue/jobs").param("state", "sleeping"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown job state: sleeping"));
    }

    @Test
    @DisplayName("GET /jobs/count returns the filtered count")
    void countJobs() throws Exception {
        when(queueService.countJobs(new JobFilter(JobState.QUEUED, null, null, null))).thenReturn(7L);

        mockMvc.perform(get("/api/v1/queue/jobs/count").param("state", "queued"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(7));
    }

    @Test
    @DisplayName("GET /jobs/{id} for an unknown job returns 404")
    void getJobNotFound() throws Exception {
        when(queueService.getJob("missing")).thenThrow(new JobNotFoundException("missing"));

        mockMvc.perform(get("/api/v1/queue/jobs/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").exists());
    }

    // ── Actions ──────────────────────────────────────────────────────

    @Test
    @DisplayName("POST /jobs/{id}/cancel returns the updated job")
    void cancel() throws Exception {
        when(queueService.cancel("j1")).thenReturn(job("j1", "docker.composeUp", JobState.CANCELLED));

        mockMvc.perform(post("/api/v1/queue/jobs/j1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("cancelled"));
    }

    @Test
    @DisplayName("POST /jobs/{id}/force-unlock inside the lease returns 409")
    void forceUnlockConflict() throws Exception {
        when(queueService.forceUnlock("j1")).thenThrow(new InvalidJobStateException("Job j1 is not locked past its lease"));

        mockMvc.perform(post("/api/v1/queue/jobs/j1/force-unlock"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Job j1 is not locked past its lease"));
    }

    @Test
    @DisplayName("POST /jobs/{id}/retry returns the new job")
    void retry() throws Exception {
        when(queueService.retry("j1")).thenReturn(job("j2", "docker.stop", JobState.QUEUED));

        mockMvc.perform(post("/api/v1/queue/jobs/j1/retry"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("j2"));
    }

    @Test
    @DisplayName("DELETE /jobs/{id} returns 204")
    void deleteJob() throws Exception {
        mockMvc.perform(delete("/api/v1/queue/jobs/j1"))
                .andExpect(status().isNoContent());
        verify(queueService).deleteJob("j1");
    }

    @Test
    @DisplayName("DELETE /jobs?state=succeeded reports the number deleted")
    void deleteByState() throws Exception {
        when(queueService.deleteJobsByState(JobState.SUCCEEDED)).thenReturn(12);

        mockMvc.perform(delete("/api/v1/queue/jobs").param("state", "succeeded"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(12))
                .andExpect(jsonPath("$.state").value("succeeded"));
    }

    // ── Settings ─────────────────────────────────────────────────────

    @Test
    @DisplayName("PUT /settings/concurrency updates the limit")
    void setConcurrency() throws Exception {
        when(queueService.setConcurrency(5)).thenReturn(new QueueSettings(false, 5));

        mockMvc.perform(put("/api/v1/queue/settings/concurrency")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"concurrency\":5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.concurrency").value(5))
                .andExpect(jsonPath("$.paused").value(false));
    }

    @Test
    @DisplayName("PUT /settings/concurrency without a value returns 400")
    void setConcurrencyMissing() throws Exception {
        mockMvc.perform(put("/api/v1/queue/settings/concurrency")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
        verify(queueService, never()).setConcurrency(anyInt());
    }

    @Test
    @DisplayName("POST /pause and /resume toggle the queue")
    void pauseResume() throws Exception {
        when(queueService.setPaused(true)).thenReturn(new QueueSettings(true, 2));
        when(queueService.setPaused(false)).thenReturn(new QueueSettings(false, 2));

        mockMvc.perform(post("/api/v1/queue/pause"))
                .andExpect(jsonPath("$.paused").value(true));
        mockMvc.perform(post("/api/v1/queue/resume"))
                .andExpect(jsonPath("$.paused").value(false));
    }

    // ── Auth and streaming ───────────────────────────────────────────

    @Test
    @DisplayName("mutations without an admin token return 401 when auth is enabled")
    void adminTokenRequired() throws Exception {
        when(authProperties.isEnabled()).thenReturn(true);

        mockMvc.perform(post("/api/v1/queue/pause"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Admin token required"));
        verify(queueService, never()).setPaused(true);
    }

    @Test
    @DisplayName("mutations with an admin token pass when auth is enabled")
    void adminTokenAccepted() throws Exception {
        when(authProperties.isEnabled()).thenReturn(true);
        when(tokenService.isAdmin("good-token")).thenReturn(true);
        when(queueService.setPaused(true)).thenReturn(new QueueSettings(true, 2));

        mockMvc.perform(post("/api/v1/queue/pause").header("Authorization", "Bearer good-token"))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("GET /stream hands the filter to the stream service")
    void stream() throws Exception {
        when(streamService.createEmitter(any(), anyInt(), anyInt())).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/v1/queue/stream").param("projectId", "proj1").accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(status().isOk());
        verify(streamService).createEmitter(eq(new JobFilter(null, null, "proj1", null)), eq(1), eq(100));
    }
}
