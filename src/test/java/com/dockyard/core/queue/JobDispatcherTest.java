package com.dockyard.core.queue;

import com.dockyard.core.MutableClock;
import com.dockyard.core.metrics.OrchestratorMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

class JobDispatcherTest {

    private MutableClock clock;
    private InMemoryJobStore store;
    private QueueProperties properties;
    private QueueService queueService;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        store = new InMemoryJobStore();
        properties = new QueueProperties();
        queueService = new QueueService(store, properties, new ObjectMapper(), clock);
        registry = new SimpleMeterRegistry();
    }

    /** Runs each claimed job on the calling thread. */
    private JobDispatcher dispatcher(JobHandler... handlers) {
        return dispatcher(Runnable::run, handlers);
    }

    private JobDispatcher dispatcher(Executor executor, JobHandler... handlers) {
        return new JobDispatcher(store, properties, List.of(handlers), new ObjectMapper(), clock,
                new OrchestratorMetrics(registry), executor);
    }

    private Job enqueue(String type) {
        return queueService.enqueue(type, Map.of("projectId", "proj1"), EnqueueOptions.forProject("proj1", null));
    }

    private static JobHandler handler(String type, ThrowingHandler body) {
        return new JobHandler() {
            @Override
            public String type() {
                return type;
            }

            @Override
            public void handle(JobContext context) throws Exception {
                body.handle(context);
            }
        };
    }

    @FunctionalInterface
    interface ThrowingHandler {
        void handle(JobContext context) throws Exception;
    }

    @Nested
    @DisplayName("handler outcomes")
    class OutcomeTests {

        @Test
        @DisplayName("success marks the job succeeded and records a timer")
        void success() {
            Job job = enqueue("test.ok");
            var dispatcher = dispatcher(handler("test.ok", ctx -> assertEquals("proj1", ctx.projectId())));

            assertEquals(1, dispatcher.pollOnce());

            Job done = store.findById(job.id()).orElseThrow();
            assertEquals(JobState.SUCCEEDED, done.state());
            assertNull(done.lockedBy());
            assertEquals(0, dispatcher.inFlightCount());
            assertNotNull(registry.find("dockyard.job.duration").tag("outcome", "succeeded").timer());
        }

        @Test
        @DisplayName("an error with attempts left requeues with backoff and records the error")
        void retryWithBackoff() {
            Job job = enqueue("test.flaky");
            var dispatcher = dispatcher(handler("test.flaky", ctx -> {
                throw new IllegalStateException("connection refused");
            }));

            dispatcher.pollOnce();

            Job retried = store.findById(job.id()).orElseThrow();
            assertEquals(JobState.QUEUED, retried.state());
            assertEquals(1, retried.attempts());
            assertEquals("connection refused", retried.lastError());
            assertEquals(clock.instant().plusSeconds(2), retried.runAt());
        }

        @Test
        @DisplayName("the last allowed attempt fails the job")
        void exhaustsAttempts() {
            Job job = enqueue("test.flaky");
            var dispatcher = dispatcher(handler("test.flaky", ctx -> {
                throw new IllegalStateException("still down");
            }));

            for (int i = 0; i < 3; i++) {
                dispatcher.pollOnce();
                clock.advance(Duration.ofMinutes(2));
            }

            Job failed = store.findById(job.id()).orElseThrow();
            assertEquals(JobState.FAILED, failed.state());
            assertEquals(3, failed.attempts());
            assertEquals("still down", failed.lastError());
            assertFalse(failed.dedupeActive());
        }

        @Test
        @DisplayName("a non-retryable error fails on the first attempt")
        void nonRetryable() {
            Job job = enqueue("test.fatal");
            var dispatcher = dispatcher(handler("test.fatal", ctx -> {
                throw new NonRetryableJobException("project deleted");
            }));

            dispatcher.pollOnce();

            Job failed = store.findById(job.id()).orElseThrow();
            assertEquals(JobState.FAILED, failed.state());
            assertEquals(1, failed.attempts());
        }

        @Test
        @DisplayName("a reschedule requeues after the delay without counting an attempt")
        void reschedule() {
            Job job = enqueue("test.poll");
            var dispatcher = dispatcher(handler("test.poll", ctx -> {
                throw new RescheduleException(Duration.ofSeconds(1), "not ready");
            }));

            dispatcher.pollOnce();

            Job requeued = store.findById(job.id()).orElseThrow();
            assertEquals(JobState.QUEUED, requeued.state());
            assertEquals(0, requeued.attempts());
            assertEquals(clock.instant().plusSeconds(1), requeued.runAt());
            assertEquals(0, dispatcher.pollOnce(), "not runnable before the delay elapses");
        }

        @Test
        @DisplayName("a cancel observed by the handler ends the job cancelled")
        void cooperativeCancel() {
            Job job = enqueue("test.cancel");
            var dispatcher = dispatcher(handler("test.cancel", ctx -> {
                queueService.cancel(ctx.job().id());
                ctx.throwIfCancelRequested();
                fail("handler should have stopped at the checkpoint");
            }));

            dispatcher.pollOnce();

            Job cancelled = store.findById(job.id()).orElseThrow();
            assertEquals(JobState.CANCELLED, cancelled.state());
            assertNotNull(cancelled.cancelledAt());
        }

        @Test
        @DisplayName("a job without a registered handler fails immediately")
        void missingHandler() {
            Job job = enqueue("test.unknown");
            dispatcher().pollOnce();

            Job failed = store.findById(job.id()).orElseThrow();
            assertEquals(JobState.FAILED, failed.state());
            assertTrue(failed.lastError().contains("No handler"));
        }

        @Test
        @DisplayName("a payload of the wrong shape fails without retry")
        void malformedPayload() {
            Job job = queueService.enqueue("test.payload", "not json", EnqueueOptions.defaults());
            var dispatcher = dispatcher(handler("test.payload", ctx -> ctx.payload(JobPayloads.ProjectPayload.class)));

            dispatcher.pollOnce();

            assertEquals(JobState.FAILED, store.findById(job.id()).orElseThrow().state());
        }
    }

    @Nested
    @DisplayName("claim cycle")
    class ClaimTests {

        @Test
        @DisplayName("a paused queue claims nothing")
        void paused() {
            enqueue("test.ok");
            queueService.setPaused(true);

            assertEquals(0, dispatcher(handler("test.ok", ctx -> {})).pollOnce());
        }

        @Test
        @DisplayName("the global concurrency limit counts running jobs")
        void concurrencyLimit() {
            List<Runnable> parked = new ArrayList<>();
            queueService.setConcurrency(1);
            queueService.enqueue("test.ok", Map.of(), EnqueueOptions.forProject("a", null));
            queueService.enqueue("test.ok", Map.of(), EnqueueOptions.forProject("b", null));
            var dispatcher = dispatcher(parked::add, handler("test.ok", ctx -> {}));

            assertEquals(1, dispatcher.pollOnce());
            assertEquals(0, dispatcher.pollOnce());

            parked.remove(0).run();
            assertEquals(1, dispatcher.pollOnce());
        }

        @Test
        @DisplayName("lease renewal extends the lock of in-flight jobs")
        void renewLeases() {
            List<Runnable> parked = new ArrayList<>();
            Job job = enqueue("test.ok");
            var dispatcher = dispatcher(parked::add, handler("test.ok", ctx -> {}));
            dispatcher.pollOnce();
            assertEquals(1, dispatcher.inFlightCount());

            clock.advance(Duration.ofSeconds(30));
            dispatcher.renewLeases();

            Job running = store.findById(job.id()).orElseThrow();
            assertEquals(clock.instant().plus(properties.getLeaseDuration()), running.lockExpiresAt());
            assertEquals(dispatcher.getWorkerId(), running.lockedBy());
        }

        @Test
        @DisplayName("a force-unlocked job cannot be completed by its old holder")
        void lostLock() {
            List<Runnable> parked = new ArrayList<>();
            Job job = enqueue("test.ok");
            var dispatcher = dispatcher(parked::add, handler("test.ok", ctx -> {}));
            dispatcher.pollOnce();

            clock.advance(properties.getLeaseDuration().plusSeconds(1));
            queueService.forceUnlock(job.id());
            parked.remove(0).run();

            assertEquals(JobState.QUEUED, store.findById(job.id()).orElseThrow().state());
        }

        @Test
        @DisplayName("start does nothing when the dispatcher is disabled")
        void disabled() {
            properties.setEnabled(false);
            var dispatcher = dispatcher();
            dispatcher.start();
            assertFalse(dispatcher.isStarted());
            dispatcher.stop();
        }

        @Test
        @DisplayName("a stopped dispatcher refuses to start again")
        void restartAfterStop() {
            var dispatcher = dispatcher();
            dispatcher.start();
            dispatcher.stop();

            var e = assertThrows(IllegalStateException.class, dispatcher::start);
            assertTrue(e.getMessage().contains("cannot be restarted"));
            assertFalse(dispatcher.isStarted());
        }
    }

    @Test
    @DisplayName("backoff doubles from the base and caps at the maximum")
    void backoff() {
        Duration base = Duration.ofSeconds(2);
        Duration max = Duration.ofSeconds(60);
        assertEquals(Duration.ofSeconds(2), JobDispatcher.backoff(1, base, max));
        assertEquals(Duration.ofSeconds(4), JobDispatcher.backoff(2, base, max));
        assertEquals(Duration.ofSeconds(8), JobDispatcher.backoff(3, base, max));
        assertEquals(Duration.ofSeconds(32), JobDispatcher.backoff(5, base, max));
        assertEquals(Duration.ofSeconds(60), JobDispatcher.backoff(6, base, max));
        assertEquals(Duration.ofSeconds(60), JobDispatcher.backoff(40, base, max));
    }
}
