package com.dockyard.dispatch.api;

import com.dockyard.core.queue.JobFilter;
import com.dockyard.core.queue.JobPage;
import com.dockyard.core.queue.QueueService;
import com.dockyard.core.queue.QueueSettings;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic queue snapshots over SSE.
 * <p>
 * Each client gets an {@code init} event on connect and then an {@code update}
 * event on every tick, computed by re-querying the queue with the client's own
 * filter and page. Nothing is pushed on change; clients see at most one tick of
 * staleness.
 */
@Service
public class QueueStreamService {

    private static final Logger log = LoggerFactory.getLogger(QueueStreamService.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;
    private static final long DEFAULT_INTERVAL_MS = 2000L;

    private final QueueService queueService;
    private final long timeoutMs;
    private final long intervalMs;

    private final CopyOnWriteArrayList<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService ticker = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "queue-stream");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public QueueStreamService(QueueService queueService) {
        this(queueService, DEFAULT_TIMEOUT_MS, DEFAULT_INTERVAL_MS);
    }

    QueueStreamService(QueueService queueService, long timeoutMs, long intervalMs) {
        this.queueService = queueService;
        this.timeoutMs = timeoutMs;
        this.intervalMs = intervalMs;
    }

    @PostConstruct
    void startTicker() {
        ticker.scheduleAtFixedRate(this::broadcast, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    void stopTicker() {
        ticker.shutdown();
        try {
            if (!ticker.awaitTermination(5, TimeUnit.SECONDS)) {
                ticker.shutdownNow();
            }
        } catch (InterruptedException e) {
            ticker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        subscriptions.forEach(s -> s.emitter().complete());
        subscriptions.clear();
    }

    public SseEmitter createEmitter(JobFilter filter, int page, int pageSize) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        var subscription = new Subscription(emitter, filter, page, pageSize);

        emitter.onCompletion(() -> subscriptions.remove(subscription));
        emitter.onTimeout(() -> subscriptions.remove(subscription));
        emitter.onError(ex -> {
            log.debug("Queue stream error: {}", ex.getMessage());
            subscriptions.remove(subscription);
        });

        if (send(subscription, "init")) {
            subscriptions.add(subscription);
            log.debug("Queue stream opened ({} active)", subscriptions.size());
        }
        return emitter;
    }

    public int activeEmitterCount() {
        return subscriptions.size();
    }

    void broadcast() {
        for (Subscription subscription : subscriptions) {
            if (!send(subscription, "update")) {
                subscriptions.remove(subscription);
            }
        }
    }

    Map<String, Object> snapshot(JobFilter filter, int page, int pageSize) {
        JobPage jobs = queueService.listJobs(filter, page, pageSize);
        QueueSettings settings = queueService.getSettings();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobs", jobs.jobs());
        data.put("paused", settings.paused());
        data.put("concurrency", settings.concurrency());
        data.put("running", queueService.countRunning());
        data.put("pagination", Map.of(
                "page", jobs.page(),
                "pageSize", jobs.pageSize(),
                "total", jobs.total(),
                "totalPages", jobs.totalPages()));
        return data;
    }

    private boolean send(Subscription subscription, String eventName) {
        try {
            subscription.emitter().send(SseEmitter.event()
                    .name(eventName)
                    .data(snapshot(subscription.filter(), subscription.page(), subscription.pageSize())));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping queue stream subscriber: {}", e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("Failed to build queue snapshot: {}", e.getMessage());
            subscription.emitter().completeWithError(e);
            return false;
        }
    }

    private record Subscription(SseEmitter emitter, JobFilter filter, int page, int pageSize) {}
}
