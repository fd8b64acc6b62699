package com.dockyard.core.queue;

import com.dockyard.core.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Many callers enqueueing the same start at once must end up sharing one job.
 */
class ConcurrentDedupeTest {

    private static final int CALLERS = 16;

    private static void assertSingleLineage(JobStore store) throws Exception {
        var service = new QueueService(store, new QueueProperties(), new ObjectMapper(),
                MutableClock.startingAt("2026-03-01T10:00:00Z"));
        CountDownLatch ready = new CountDownLatch(CALLERS);
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(CALLERS);
        try {
            List<Future<Job>> results = new ArrayList<>();
            for (int i = 0; i < CALLERS; i++) {
                results.add(pool.submit(() -> {
                    ready.countDown();
                    go.await();
                    return service.enqueueComposeUp("proj1", "presence");
                }));
            }
            assertTrue(ready.await(5, TimeUnit.SECONDS));
            go.countDown();

            Set<String> ids = new HashSet<>();
            for (Future<Job> result : results) {
                ids.add(result.get(10, TimeUnit.SECONDS).id());
            }

            assertEquals(1, ids.size(), "every caller gets the same job");
            List<Job> active = store.list(JobFilter.forProject("proj1"), 100, 0).stream()
                    .filter(job -> !job.state().isTerminal())
                    .collect(Collectors.toList());
            assertEquals(1, active.size());
            assertEquals(ids.iterator().next(), active.get(0).id());
            assertEquals(1, store.count(JobFilter.none()));
        } finally {
            pool.shutdownNow();
        }
    }

    @Nested
    @DisplayName("in-memory store")
    class InMemory {

        @Test
        @DisplayName("concurrent enqueues with one dedupe key yield one job")
        void concurrentEnqueue() throws Exception {
            assertSingleLineage(new InMemoryJobStore());
        }
    }

    @Nested
    @DisplayName("JDBC store on H2")
    class Jdbc {

        @Test
        @DisplayName("concurrent enqueues with one dedupe key yield one job")
        void concurrentEnqueue() throws Exception {
            var dataSource = new JdbcDataSource();
            dataSource.setURL("jdbc:h2:mem:dedupe-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
            var store = new JdbcJobStore(dataSource);
            store.createTables();

            assertSingleLineage(store);
        }
    }
}
