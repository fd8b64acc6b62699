package com.dockyard.core.presence;

import com.dockyard.core.project.ProjectStatus;

/**
 * Heartbeat answer. The caller must heartbeat again after {@code nextPollMs}.
 *
 * @param message    human-readable progress, null when nothing is pending
 * @param setupError last error of the project's most recent failed job, if any
 */
public record PresenceResponse(
        String projectId,
        ProjectStatus status,
        int viewerCount,
        String previewUrl,
        boolean previewReady,
        boolean runtimeReady,
        String message,
        long nextPollMs,
        String bootstrapSessionId,
        String setupError
) {
}
