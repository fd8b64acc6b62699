package com.dockyard.core.queue;

/**
 * JSON payload shapes of the built-in job types.
 */
public final class JobPayloads {

    private JobPayloads() {}

    public record ProjectPayload(String projectId, String reason) {}

    public record WaitReadyPayload(String projectId, long startedAtMs) {}

    public record ReleasePayload(String projectId, String hash) {}

    /**
     * @param previousHash release that {@code current} pointed at before this promotion, if any
     */
    public record ReleaseReadyPayload(String projectId, String hash, int port, String previousHash, long startedAtMs) {}
}
