package com.dockyard.core.queue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Known job types with their wire names and dedupe key prefixes.
 * A dedupe key is {@code <prefix>:<projectId>}.
 */
public enum JobType {
    DOCKER_COMPOSE_UP("docker.composeUp", "start"),
    DOCKER_WAIT_READY("docker.waitReady", "ready"),
    DOCKER_STOP("docker.stop", "stop"),
    RUNTIME_SESSION_CREATE("runtime.sessionCreate", "session"),
    PRODUCTION_BUILD("production.build", "production.build"),
    PRODUCTION_START("production.start", "production.start"),
    PRODUCTION_WAIT_READY("production.waitReady", "production.waitReady"),
    PRODUCTION_STOP("production.stop", "production.stop");

    /** Job types that bring a preview environment up. */
    public static final Set<JobType> PREVIEW_START = EnumSet.of(DOCKER_COMPOSE_UP, DOCKER_WAIT_READY);

    /** Job types that belong to an in-flight production deployment. */
    public static final Set<JobType> PRODUCTION_DEPLOY = EnumSet.of(PRODUCTION_BUILD, PRODUCTION_START, PRODUCTION_WAIT_READY);

    private final String wireName;
    private final String dedupePrefix;

    JobType(String wireName, String dedupePrefix) {
        this.wireName = wireName;
        this.dedupePrefix = dedupePrefix;
    }

    public String wireName() {
        return wireName;
    }

    public String dedupeKey(String projectId) {
        return dedupePrefix + ":" + projectId;
    }

    public static Optional<JobType> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(wireName))
                .findFirst();
    }
}
