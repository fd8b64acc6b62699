package com.dockyard.dispatch.api;

import com.dockyard.core.MutableClock;
import com.dockyard.core.queue.InMemoryJobStore;
import com.dockyard.core.queue.JobFilter;
import com.dockyard.core.queue.QueueProperties;
import com.dockyard.core.queue.QueueService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QueueStreamServiceTest {

    private QueueService queueService;
    private QueueStreamService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        queueService = new QueueService(new InMemoryJobStore(), new QueueProperties(), new ObjectMapper(), clock);
        service = new QueueStreamService(queueService, 60_000, 60_000);
    }

    @Test
    @DisplayName("createEmitter registers a subscriber per call")
    void createEmitter() {
        SseEmitter first = service.createEmitter(JobFilter.none(), 1, 100);
        SseEmitter second = service.createEmitter(JobFilter.forProject("proj1"), 1, 100);

        assertNotSame(first, second);
        assertEquals(2, service.activeEmitterCount());
        service.broadcast();
        assertEquals(2, service.activeEmitterCount());
    }

    @Test
    @DisplayName("snapshot carries jobs, settings and pagination")
    @SuppressWarnings("unchecked")
    void snapshot() {
        queueService.enqueueComposeUp("proj1", "presence");
        queueService.enqueueComposeUp("proj2", "presence");
        queueService.enqueueDockerStop("proj3", "idle");
        queueService.setPaused(true);

        Map<String, Object> data = service.snapshot(JobFilter.none(), 1, 2);

        assertEquals(2, ((List<?>) data.get("jobs")).size());
        assertEquals(true, data.get("paused"));
        assertEquals(2, data.get("concurrency"));
        assertEquals(0, data.get("running"));
        Map<String, Object> pagination = (Map<String, Object>) data.get("pagination");
        assertEquals(3L, pagination.get("total"));
        assertEquals(2, pagination.get("totalPages"));
    }

    @Test
    @DisplayName("a subscriber whose snapshot fails is not registered")
    void failingSnapshot() {
        QueueService broken = mock(QueueService.class);
        when(broken.listJobs(any(), anyInt(), anyInt())).thenThrow(new IllegalStateException("database down"));
        var failing = new QueueStreamService(broken, 60_000, 60_000);

        failing.createEmitter(JobFilter.none(), 1, 100);

        assertEquals(0, failing.activeEmitterCount());
    }

    @Test
    @DisplayName("stopTicker completes and drops every subscriber")
    void stopTicker() {
        service.createEmitter(JobFilter.none(), 1, 100);

        service.stopTicker();

        assertEquals(0, service.activeEmitterCount());
    }
}
