package com.dockyard.dispatch.api;

import com.dockyard.core.presence.PresenceManager;
import com.dockyard.core.presence.PresenceResponse;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/presence")
public class PresenceController {

    private final PresenceManager presenceManager;

    public PresenceController(PresenceManager presenceManager) {
        this.presenceManager = presenceManager;
    }

    /**
     * POST /api/v1/presence/heartbeat: Register a viewer and reconcile the sandbox.
     * The client must call again after {@code nextPollMs}.
     */
    @PostMapping("/heartbeat")
    public PresenceResponse heartbeat(@RequestBody HeartbeatRequest request) {
        if (request == null || isBlank(request.projectId()) || isBlank(request.viewerId())) {
            throw new IllegalArgumentException("projectId and viewerId are required");
        }
        return presenceManager.handleHeartbeat(request.projectId(), request.viewerId());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record HeartbeatRequest(String projectId, String viewerId) {}
}
