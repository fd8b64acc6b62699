package com.dockyard.core.production;

import java.time.Instant;

/**
 * Production deployment fields of a project.
 *
 * @param hash  release currently (or last) promoted
 * @param port  base port the production container is published on
 * @param error last deployment error, truncated
 */
public record ProductionState(
        ProductionStatus status,
        String hash,
        Integer port,
        String url,
        String error,
        Instant startedAt
) {

    public static final int MAX_ERROR_LENGTH = 500;

    public static ProductionState initial() {
        return new ProductionState(ProductionStatus.STOPPED, null, null, null, null, null);
    }

    public ProductionState withStatus(ProductionStatus status) {
        return new ProductionState(status, hash, port, url, error, startedAt);
    }

    public ProductionState withHash(String hash) {
        return new ProductionState(status, hash, port, url, error, startedAt);
    }

    public ProductionState withPort(Integer port) {
        return new ProductionState(status, hash, port, url, error, startedAt);
    }

    public ProductionState withUrl(String url) {
        return new ProductionState(status, hash, port, url, error, startedAt);
    }

    public ProductionState withError(String error) {
        String truncated = error != null && error.length() > MAX_ERROR_LENGTH
                ? error.substring(0, MAX_ERROR_LENGTH)
                : error;
        return new ProductionState(status, hash, port, url, truncated, startedAt);
    }

    public ProductionState withStartedAt(Instant startedAt) {
        return new ProductionState(status, hash, port, url, error, startedAt);
    }
}
