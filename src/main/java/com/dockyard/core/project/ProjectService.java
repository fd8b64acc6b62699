package com.dockyard.core.project;

import com.dockyard.core.logging.MdcContext;
import com.dockyard.core.ports.PortAllocator;
import com.dockyard.core.ports.PortType;
import com.dockyard.core.production.ProductionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
public class ProjectService {

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    private final ProjectStore store;
    private final PortAllocator portAllocator;
    private final Clock clock;

    public ProjectService(ProjectStore store, PortAllocator portAllocator, Clock clock) {
        this.store = store;
        this.portAllocator = portAllocator;
        this.clock = clock;
    }

    /**
     * Registers a project with fresh OS-assigned ports for its preview server and agent runtime.
     */
    public Project registerProject(String id, String name, String path) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Project id is required");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Project path is required");
        }
        if (store.findById(id).isPresent()) {
            throw new IllegalArgumentException("Project already exists: " + id);
        }
        MdcContext.setProject(id);
        try {
            int devPort = portAllocator.allocatePort();
            int runtimePort = portAllocator.allocatePort();
            portAllocator.registerPort(devPort, PortType.DEV, id, null);
            portAllocator.registerPort(runtimePort, PortType.DEV, id, null);

            Instant now = clock.instant();
            Project project = store.insert(new Project(id, name != null && !name.isBlank() ? name : id, path,
                    ProjectStatus.CREATED, devPort, runtimePort, null, ProductionState.initial(), now, now));
            log.info("Registered project {} (dev port {}, runtime port {})", id, devPort, runtimePort);
            return project;
        } finally {
            MdcContext.clear();
        }
    }

    public Project getProject(String id) {
        return store.findById(id).orElseThrow(() -> new ProjectNotFoundException(id));
    }

    public Optional<Project> findProject(String id) {
        return store.findById(id);
    }

    public List<Project> listProjects() {
        return store.findAll();
    }

    public void updateStatus(String id, ProjectStatus status) {
        if (!store.updateStatus(id, status)) {
            throw new ProjectNotFoundException(id);
        }
        log.debug("Project {} status -> {}", id, status.value());
    }

    public void setBootstrapSession(String id, String sessionId) {
        if (!store.updateBootstrapSession(id, sessionId)) {
            throw new ProjectNotFoundException(id);
        }
    }
}
