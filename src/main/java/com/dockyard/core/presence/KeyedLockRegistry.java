package com.dockyard.core.presence;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair lock per key. Waiters on the same key are served in arrival order;
 * different keys never block each other. Entries are reference-counted and
 * dropped once no thread holds or waits for them.
 */
public class KeyedLockRegistry {

    private final Map<String, Entry> entries = new HashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        Entry entry = acquireEntry(key);
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            releaseEntry(key, entry);
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    /** Number of keys currently held or waited on. */
    public synchronized int activeKeys() {
        return entries.size();
    }

    private synchronized Entry acquireEntry(String key) {
        Entry entry = entries.computeIfAbsent(key, k -> new Entry());
        entry.refs++;
        return entry;
    }

    private synchronized void releaseEntry(String key, Entry entry) {
        if (--entry.refs == 0) {
            entries.remove(key);
        }
    }

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock(true);
        int refs;
    }
}
