package com.dockyard.core.production;

import java.time.Instant;

/**
 * One staged release directory.
 *
 * @param active true when {@code current} points at this release
 */
public record ReleaseVersion(String hash, boolean active, Instant modifiedAt) {
}
