package com.dockyard.core.presence;

import com.dockyard.core.MutableClock;
import com.dockyard.core.ports.FakePortProbe;
import com.dockyard.core.ports.InMemoryPortStore;
import com.dockyard.core.ports.PortAllocator;
import com.dockyard.core.project.InMemoryProjectStore;
import com.dockyard.core.project.ProjectNotFoundException;
import com.dockyard.core.project.ProjectService;
import com.dockyard.core.project.ProjectStatus;
import com.dockyard.core.queue.InMemoryJobStore;
import com.dockyard.core.queue.Job;
import com.dockyard.core.queue.JobFilter;
import com.dockyard.core.queue.QueueProperties;
import com.dockyard.core.queue.QueueService;
import com.dockyard.sandbox.HealthProbe;
import com.dockyard.sandbox.SandboxProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PresenceManagerTest {

    private static final String PROJECT = "proj1";

    private MutableClock clock;
    private InMemoryJobStore jobStore;
    private ProjectService projectService;
    private QueueService queueService;
    private HealthProbe probe;
    private PresenceProperties properties;
    private PresenceManager manager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        jobStore = new InMemoryJobStore();
        projectService = new ProjectService(new InMemoryProjectStore(clock),
                new PortAllocator(new InMemoryPortStore(), new FakePortProbe(), clock), clock);
        queueService = new QueueService(jobStore, new QueueProperties(), new ObjectMapper(), clock);
        probe = mock(HealthProbe.class);
        properties = new PresenceProperties();
        properties.setReaperEnabled(false);
        manager = new PresenceManager(projectService, queueService, probe, new SandboxProperties(),
                properties, clock, null);

        projectService.registerProject(PROJECT, "Site", "/srv/proj1");
    }

    @AfterEach
    void tearDown() {
        manager.stop();
    }

    private void probes(boolean preview, boolean runtime) {
        // Registration hands out 40000 for the preview and 40001 for the runtime
        when(probe.isUp(eq(40000), anyString(), any())).thenReturn(preview);
        when(probe.isUp(eq(40001), anyString(), any())).thenReturn(runtime);
    }

    private List<Job> jobsOfType(String type) {
        return queueService.listJobs(new JobFilter(null, type, PROJECT, null), 1, 100).jobs();
    }

    @Nested
    @DisplayName("heartbeat")
    class Heartbeat {

        @Test
        @DisplayName("a created project starts on its first heartbeat")
        void firstHeartbeatStarts() {
            probes(false, false);

            PresenceResponse response = manager.handleHeartbeat(PROJECT, "viewer-a");

            assertEquals(ProjectStatus.STARTING, response.status());
            assertEquals(PresenceManager.FAST_POLL_MS, response.nextPollMs());
            assertEquals(PresenceManager.MSG_STARTING, response.message());
            assertEquals(1, response.viewerCount());
            assertEquals("http://127.0.0.1:40000", response.previewUrl());
            assertEquals(1, jobsOfType("docker.composeUp").size());
        }

        @Test
        @DisplayName("heartbeats during startup do not enqueue another start")
        void startingIsIdempotent() {
            probes(false, false);
            manager.handleHeartbeat(PROJECT, "viewer-a");
            clock.advance(Duration.ofSeconds(2));

            PresenceResponse response = manager.handleHeartbeat(PROJECT, "viewer-b");

            assertEquals(ProjectStatus.STARTING, response.status());
            assertEquals(PresenceManager.MEDIUM_POLL_MS, response.nextPollMs());
            assertEquals(2, response.viewerCount());
            assertEquals(1, jobsOfType("docker.composeUp").size());
        }

        @Test
        @DisplayName("the waiting message names the container that is not up yet")
        void partialReadiness() {
            probes(false, false);
            manager.handleHeartbeat(PROJECT, "viewer-a");
            probes(true, false);

            PresenceResponse response = manager.handleHeartbeat(PROJECT, "viewer-a");

            assertTrue(response.previewReady());
            assertFalse(response.runtimeReady());
            assertEquals(PresenceManager.MSG_WAITING_RUNTIME, response.message());
        }

        @Test
        @DisplayName("both probes up marks the project running")
        void probesUpMeansRunning() {
            probes(true, true);

            PresenceResponse response = manager.handleHeartbeat(PROJECT, "viewer-a");

            assertEquals(ProjectStatus.RUNNING, response.status());
            assertNull(response.message());
            assertEquals(properties.getHeartbeatInterval().toMillis(), response.nextPollMs());
            assertEquals(ProjectStatus.RUNNING, projectService.getProject(PROJECT).status());
            assertTrue(jobsOfType("docker.composeUp").isEmpty());
        }

        @Test
        @DisplayName("a start that exceeds the ceiling is reported as failed")
        void startupCeiling() {
            probes(false, false);
            manager.handleHeartbeat(PROJECT, "viewer-a");
            clock.advance(properties.getStartupCeiling().plusSeconds(1));

            PresenceResponse response = manager.handleHeartbeat(PROJECT, "viewer-a");

            assertEquals(ProjectStatus.ERROR, response.status());
            assertEquals(PresenceManager.MSG_FAILED, response.message());
            assertEquals(PresenceManager.SLOW_POLL_MS, response.nextPollMs());
            assertEquals(ProjectStatus.ERROR, projectService.getProject(PROJECT).status());
        }

        @Test
        @DisplayName("a start in flight before a restart is picked up from the durable status")
        void resumesStartingStatus() {
            projectService.updateStatus(PROJECT, ProjectStatus.STARTING);
            probes(false, false);

            PresenceResponse response = manager.handleHeartbeat(PROJECT, "viewer-a");

            assertEquals(ProjectStatus.STARTING, response.status());
            assertTrue(jobsOfType("docker.composeUp").isEmpty());
        }

        @Test
        @DisplayName("a running project whose containers vanished is restarted")
        void crashedProjectRestarts() {
            projectService.updateStatus(PROJECT, ProjectStatus.RUNNING);
            probes(false, false);

            PresenceResponse response = manager.handleHeartbeat(PROJECT, "viewer-a");

            assertEquals(ProjectStatus.STARTING, response.status());
            assertEquals(PresenceManager.MSG_RESTARTING, response.message());
            List<Job> starts = jobsOfType("docker.composeUp");
            assertEquals(1, starts.size());
            assertTrue(starts.get(0).payload().contains("crash"));
        }

        @Test
        @DisplayName("a deleting project gets no start and no viewer")
        void deletingProject() {
            projectService.updateStatus(PROJECT, ProjectStatus.DELETING);

            PresenceResponse response = manager.handleHeartbeat(PROJECT, "viewer-a");

            assertEquals(ProjectStatus.DELETING, response.status());
            assertEquals(PresenceManager.MSG_DELETING, response.message());
            assertEquals(0, response.viewerCount());
            assertTrue(jobsOfType("docker.composeUp").isEmpty());
            verify(probe, never()).isUp(anyInt(), anyString(), any());
        }

        @Test
        @DisplayName("the last failed job is reported as a setup error")
        void setupError() {
            Job job = queueService.enqueueSessionCreate(PROJECT, "bootstrap");
            jobStore.claim(1, "worker-1", clock.instant(), Duration.ofMinutes(1));
            jobStore.markFailed(job.id(), "worker-1", 3, "agent runtime refused the session", clock.instant());
            probes(true, true);

            PresenceResponse response = manager.handleHeartbeat(PROJECT, "viewer-a");

            assertEquals("agent runtime refused the session", response.setupError());
        }

        @Test
        @DisplayName("unknown projects are rejected")
        void unknownProject() {
            assertThrows(ProjectNotFoundException.class, () -> manager.handleHeartbeat("nope", "viewer-a"));
        }
    }

    @Nested
    @DisplayName("reaper")
    class Reaper {

        @BeforeEach
        void runningWithOneViewer() {
            probes(true, true);
            manager.handleHeartbeat(PROJECT, "viewer-a");
        }

        @Test
        @DisplayName("an idle project is stopped exactly once after grace and idle timeout")
        void stopsIdleProject() {
            assertEquals(0, manager.runReaper(), "viewer is still fresh");

            clock.advance(Duration.ofSeconds(31));
            assertEquals(0, manager.runReaper(), "stale viewer pruned and stop scheduled");

            clock.advance(Duration.ofSeconds(30));
            assertEquals(1, manager.runReaper());
            assertEquals(1, jobsOfType("docker.stop").size());
            assertEquals(0, manager.trackedProjects());

            clock.advance(Duration.ofSeconds(60));
            assertEquals(0, manager.runReaper());
            assertEquals(1, jobsOfType("docker.stop").size());
        }

        @Test
        @DisplayName("a heartbeat before the deadline cancels the scheduled stop")
        void heartbeatCancelsStop() {
            clock.advance(Duration.ofSeconds(31));
            manager.runReaper();

            clock.advance(Duration.ofSeconds(10));
            manager.handleHeartbeat(PROJECT, "viewer-a");
            clock.advance(Duration.ofSeconds(25));

            assertEquals(0, manager.runReaper());
            assertTrue(jobsOfType("docker.stop").isEmpty());
            assertEquals(1, manager.trackedProjects());
        }

        @Test
        @DisplayName("a project that is already stopped is forgotten without a stop job")
        void alreadyStopped() {
            projectService.updateStatus(PROJECT, ProjectStatus.STOPPED);
            clock.advance(Duration.ofSeconds(31));
            manager.runReaper();
            clock.advance(Duration.ofSeconds(30));

            assertEquals(0, manager.runReaper());
            assertTrue(jobsOfType("docker.stop").isEmpty());
            assertEquals(0, manager.trackedProjects());
        }
    }

    @Test
    @DisplayName("the reaper never stops a project that is still starting")
    void reaperSkipsStartingProjects() {
        probes(false, false);
        manager.handleHeartbeat(PROJECT, "viewer-a");

        for (int i = 0; i < 10; i++) {
            clock.advance(Duration.ofSeconds(30));
            assertEquals(0, manager.runReaper());
        }
        assertTrue(jobsOfType("docker.stop").isEmpty());
        assertEquals(1, manager.trackedProjects());
    }

    @Test
    @DisplayName("once the start has finished the idle project is reaped")
    void reaperStopsAfterStartFinishes() {
        probes(false, false);
        manager.handleHeartbeat(PROJECT, "viewer-a");
        clock.advance(Duration.ofMinutes(5));
        projectService.updateStatus(PROJECT, ProjectStatus.RUNNING);

        assertEquals(0, manager.runReaper(), "start settled, stale viewer pruned and stop scheduled");
        clock.advance(Duration.ofSeconds(31));

        assertEquals(1, manager.runReaper());
        assertEquals(1, jobsOfType("docker.stop").size());
    }

    @Test
    @DisplayName("poll interval backs off as a start drags on")
    void adaptivePoll() {
        assertEquals(500, PresenceManager.adaptivePollMs(Duration.ZERO));
        assertEquals(1000, PresenceManager.adaptivePollMs(Duration.ofSeconds(3)));
        assertEquals(2000, PresenceManager.adaptivePollMs(Duration.ofSeconds(10)));
    }
}
