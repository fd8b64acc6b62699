package com.dockyard.core.presence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class KeyedLockRegistryTest {

    private final KeyedLockRegistry locks = new KeyedLockRegistry();

    @Test
    @DisplayName("actions on the same key never overlap")
    void sameKeySerializes() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 200; i++) {
                pool.submit(() -> locks.withLock("p1", () -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    Thread.yield();
                    inside.decrementAndGet();
                }));
            }
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }
        assertEquals(1, maxInside.get());
        assertEquals(0, locks.activeKeys());
    }

    @Test
    @DisplayName("different keys do not block each other")
    void differentKeysRunConcurrently() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = pool.submit(() -> locks.withLock("p1", () -> {
                holding.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertTrue(holding.await(5, TimeUnit.SECONDS));

            assertEquals("done", locks.withLock("p2", () -> "done"));
            assertEquals(1, locks.activeKeys());

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(0, locks.activeKeys());
    }

    @Test
    @DisplayName("the lock is released when the action throws")
    void releasedOnException() {
        assertThrows(IllegalStateException.class, () -> locks.withLock("p1", (Runnable) () -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals(0, locks.activeKeys());
        assertEquals(1, locks.withLock("p1", () -> 1));
    }
}
