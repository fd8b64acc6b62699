package com.dockyard.core.presence;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-memory presence state of one project. Only touched while holding the
 * project's lock in {@link PresenceManager}; not thread-safe on its own.
 */
class PresenceRecord {

    private final String projectId;
    private final Map<String, Instant> viewers = new LinkedHashMap<>();
    private Instant lastHeartbeatAt;
    private Instant stopAt;
    private Instant startedAt;
    private boolean starting;

    PresenceRecord(String projectId) {
        this.projectId = projectId;
    }

    /** Records a heartbeat and cancels any scheduled stop. */
    void touch(String viewerId, Instant now) {
        viewers.put(viewerId, now);
        lastHeartbeatAt = now;
        stopAt = null;
    }

    /**
     * Drops viewers last seen before {@code now - maxAge}.
     *
     * @return number of viewers removed
     */
    int pruneViewers(Instant now, Duration maxAge) {
        Instant threshold = now.minus(maxAge);
        int before = viewers.size();
        viewers.values().removeIf(lastSeen -> lastSeen.isBefore(threshold));
        return before - viewers.size();
    }

    void beginStarting(Instant now) {
        starting = true;
        startedAt = now;
    }

    void finishStarting() {
        starting = false;
        startedAt = null;
    }

    String projectId() { return projectId; }
    int viewerCount() { return viewers.size(); }
    Instant lastHeartbeatAt() { return lastHeartbeatAt; }
    Instant stopAt() { return stopAt; }
    void scheduleStop(Instant at) { this.stopAt = at; }
    void cancelStop() { this.stopAt = null; }
    Instant startedAt() { return startedAt; }
    boolean isStarting() { return starting; }
}
