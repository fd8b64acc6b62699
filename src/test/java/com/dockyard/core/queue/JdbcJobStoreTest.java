package com.dockyard.core.queue;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the JDBC store against H2 in PostgreSQL mode.
 */
class JdbcJobStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Duration LEASE = Duration.ofSeconds(60);

    private JdbcJobStore store;

    @BeforeEach
    void setUp() throws Exception {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:jobs-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        store = new JdbcJobStore(dataSource);
        store.createTables();
    }

    private Job enqueue(String projectId, String dedupeKey) {
        return store.enqueue("docker.composeUp", "{\"projectId\":\"" + projectId + "\"}",
                EnqueueOptions.forProject(projectId, dedupeKey), 3, NOW);
    }

    @Test
    @DisplayName("createTables is idempotent")
    void createTablesIdempotent() throws Exception {
        store.createTables();
        assertEquals(0, store.count(JobFilter.none()));
    }

    @Test
    @DisplayName("enqueue persists every field")
    void enqueuePersists() {
        Job job = store.enqueue("production.build", "{\"projectId\":\"p1\"}",
                new EnqueueOptions("p1", 5, "production.build:p1", NOW.plusSeconds(30), 1), 3, NOW);

        Job loaded = store.findById(job.id()).orElseThrow();
        assertEquals("production.build", loaded.type());
        assertEquals(JobState.QUEUED, loaded.state());
        assertEquals("p1", loaded.projectId());
        assertEquals(5, loaded.priority());
        assertEquals(1, loaded.maxAttempts());
        assertEquals(NOW.plusSeconds(30), loaded.runAt());
        assertEquals("production.build:p1", loaded.dedupeKey());
        assertTrue(loaded.dedupeActive());
        assertEquals(NOW, loaded.createdAt());
    }

    @Test
    @DisplayName("active dedupe key returns the existing job")
    void dedupe() {
        Job first = enqueue("p1", "start:p1");
        Job second = enqueue("p1", "start:p1");

        assertEquals(first.id(), second.id());
        assertEquals(1, store.count(JobFilter.none()));
    }

    @Test
    @DisplayName("dedupe key is free again once the holder is terminal")
    void dedupeReleasedOnFinish() {
        Job first = enqueue("p1", "start:p1");
        assertTrue(store.cancelQueued(first.id(), NOW));

        Job second = enqueue("p1", "start:p1");
        assertNotEquals(first.id(), second.id());
        assertFalse(store.findById(first.id()).orElseThrow().dedupeActive());
    }

    @Test
    @DisplayName("claim orders by priority then runAt and sets the lease")
    void claimOrdering() {
        Job low = store.enqueue("t", "{}", new EnqueueOptions("a", 0, null, NOW.minusSeconds(10), null), 3, NOW);
        Job high = store.enqueue("t", "{}", new EnqueueOptions("b", 10, null, NOW, null), 3, NOW);

        List<Job> claimed = store.claim(1, "w1", NOW, LEASE);

        assertEquals(1, claimed.size());
        assertEquals(high.id(), claimed.get(0).id());
        Job running = store.findById(high.id()).orElseThrow();
        assertEquals(JobState.RUNNING, running.state());
        assertEquals("w1", running.lockedBy());
        assertEquals(NOW.plus(LEASE), running.lockExpiresAt());
        assertEquals(JobState.QUEUED, store.findById(low.id()).orElseThrow().state());
    }

    @Test
    @DisplayName("claim skips future jobs and projects that already have a running job")
    void claimExclusion() {
        enqueue("p1", null);
        Job second = enqueue("p1", null);
        store.enqueue("t", "{}", new EnqueueOptions("p2", 0, null, NOW.plusSeconds(60), null), 3, NOW);

        List<Job> claimed = store.claim(5, "w1", NOW, LEASE);

        assertEquals(1, claimed.size());
        assertEquals(JobState.QUEUED, store.findById(second.id()).orElseThrow().state());
        assertEquals(1, store.countRunning());
    }

    @Test
    @DisplayName("owned transitions require the caller to hold the lock")
    void ownedTransitions() {
        Job job = enqueue("p1", "start:p1");
        store.claim(1, "w1", NOW, LEASE);

        assertFalse(store.markSucceeded(job.id(), "w2", NOW));
        assertTrue(store.renewLease(job.id(), "w1", NOW.plusSeconds(120), NOW));
        assertTrue(store.markSucceeded(job.id(), "w1", NOW));

        Job done = store.findById(job.id()).orElseThrow();
        assertEquals(JobState.SUCCEEDED, done.state());
        assertNull(done.lockedBy());
        assertNull(done.lockExpiresAt());
        assertFalse(done.dedupeActive());
    }

    @Test
    @DisplayName("retryLater records attempts and error; reschedule does not")
    void retryAndReschedule() {
        Job job = enqueue("p1", null);
        store.claim(1, "w1", NOW, LEASE);
        assertTrue(store.retryLater(job.id(), "w1", 1, NOW.plusSeconds(2), "refused", NOW));

        Job retried = store.findById(job.id()).orElseThrow();
        assertEquals(JobState.QUEUED, retried.state());
        assertEquals(1, retried.attempts());
        assertEquals("refused", retried.lastError());
        assertEquals(NOW.plusSeconds(2), retried.runAt());

        store.claim(1, "w1", NOW.plusSeconds(2), LEASE);
        assertTrue(store.reschedule(job.id(), "w1", NOW.plusSeconds(5), NOW.plusSeconds(2)));
        assertEquals(1, store.findById(job.id()).orElseThrow().attempts());
    }

    @Test
    @DisplayName("markFailed ends the job and frees the dedupe key")
    void markFailed() {
        Job job = enqueue("p1", "start:p1");
        store.claim(1, "w1", NOW, LEASE);
        assertTrue(store.markFailed(job.id(), "w1", 3, "gave up", NOW));

        Job failed = store.findById(job.id()).orElseThrow();
        assertEquals(JobState.FAILED, failed.state());
        assertEquals(3, failed.attempts());
        assertEquals("gave up", failed.lastError());
        assertEquals(failed.id(), store.findLatestFailed("p1").orElseThrow().id());
    }

    @Test
    @DisplayName("force unlock only applies after the lease expired")
    void forceUnlock() {
        Job job = enqueue("p1", null);
        store.claim(1, "w1", NOW, LEASE);

        assertFalse(store.forceUnlock(job.id(), NOW.plusSeconds(30)));
        assertTrue(store.forceUnlock(job.id(), NOW.plusSeconds(61)));
        assertEquals(JobState.QUEUED, store.findById(job.id()).orElseThrow().state());
        assertFalse(store.markSucceeded(job.id(), "w1", NOW.plusSeconds(62)));
    }

    @Test
    @DisplayName("recoverExpired requeues only expired leases")
    void recoverExpired() {
        enqueue("p1", null);
        enqueue("p2", null);
        store.claim(1, "w1", NOW, LEASE);
        store.claim(1, "w1", NOW.plusSeconds(50), LEASE);

        assertEquals(1, store.recoverExpired(NOW.plusSeconds(70)));
        assertEquals(1, store.countRunning());
    }

    @Test
    @DisplayName("cancel request is recorded once on running jobs")
    void requestCancel() {
        Job job = enqueue("p1", null);
        assertFalse(store.requestCancel(job.id(), NOW));
        store.claim(1, "w1", NOW, LEASE);

        assertTrue(store.requestCancel(job.id(), NOW));
        assertTrue(store.requestCancel(job.id(), NOW.plusSeconds(5)));
        assertTrue(store.isCancelRequested(job.id()));
        assertEquals(NOW, store.findById(job.id()).orElseThrow().cancelRequestedAt());

        assertTrue(store.markCancelled(job.id(), "w1", NOW));
        assertEquals(JobState.CANCELLED, store.findById(job.id()).orElseThrow().state());
    }

    @Test
    @DisplayName("list filters by state, type, project and text")
    void listFilters() {
        Job a = enqueue("alpha", null);
        store.enqueue("docker.stop", "{\"projectId\":\"beta\"}", EnqueueOptions.forProject("beta", null), 3, NOW);
        store.cancelQueued(a.id(), NOW);

        assertEquals(1, store.list(new JobFilter(JobState.CANCELLED, null, null, null), 10, 0).size());
        assertEquals(1, store.list(new JobFilter(null, "docker.stop", null, null), 10, 0).size());
        assertEquals(1, store.list(new JobFilter(null, null, "alpha", null), 10, 0).size());
        assertEquals(1, store.count(new JobFilter(null, null, null, "BETA")));
        assertEquals(2, store.count(JobFilter.none()));
    }

    @Test
    @DisplayName("findActive returns non-terminal jobs of the given types")
    void findActive() {
        enqueue("p1", null);
        Job other = store.enqueue("docker.stop", "{}", EnqueueOptions.forProject("p1", null), 3, NOW);

        assertEquals(1, store.findActive("p1", Set.of("docker.composeUp")).size());
        store.cancelQueued(other.id(), NOW);
        assertTrue(store.findActive("p1", Set.of("docker.stop")).isEmpty());
        assertTrue(store.findActive("p1", Set.of()).isEmpty());
    }

    @Test
    @DisplayName("delete refuses non-terminal jobs; deleteByState removes one state")
    void deletes() {
        Job queued = enqueue("p1", null);
        Job cancelled = enqueue("p2", null);
        store.cancelQueued(cancelled.id(), NOW);

        assertFalse(store.delete(queued.id()));
        assertEquals(1, store.deleteByState(JobState.CANCELLED));
        assertTrue(store.findById(cancelled.id()).isEmpty());
        assertTrue(store.findById(queued.id()).isPresent());
    }

    @Test
    @DisplayName("settings default to running with concurrency 2 and persist changes")
    void settings() {
        assertEquals(QueueSettings.defaults(), store.getSettings());

        store.saveSettings(new QueueSettings(true, 7));
        assertEquals(new QueueSettings(true, 7), store.getSettings());
    }
}
