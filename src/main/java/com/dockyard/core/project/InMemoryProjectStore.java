package com.dockyard.core.project;

import com.dockyard.core.production.ProductionState;
import com.dockyard.core.production.ProductionStatus;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Non-durable {@link ProjectStore} used when no DataSource is configured and in tests.
 */
public class InMemoryProjectStore implements ProjectStore {

    private final Map<String, Project> projects = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryProjectStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Project> findById(String id) {
        return Optional.ofNullable(projects.get(id));
    }

    @Override
    public List<Project> findAll() {
        List<Project> all = new ArrayList<>(projects.values());
        all.sort((a, b) -> a.createdAt().compareTo(b.createdAt()));
        return all;
    }

    @Override
    public Project insert(Project project) {
        if (projects.putIfAbsent(project.id(), project) != null) {
            throw new IllegalArgumentException("Project already exists: " + project.id());
        }
        return project;
    }

    @Override
    public boolean updateStatus(String id, ProjectStatus status) {
        return projects.computeIfPresent(id, (k, p) -> new Project(p.id(), p.name(), p.path(), status,
                p.devPort(), p.runtimePort(), p.bootstrapSessionId(), p.production(),
                p.createdAt(), clock.instant())) != null;
    }

    @Override
    public boolean updateBootstrapSession(String id, String sessionId) {
        return projects.computeIfPresent(id, (k, p) -> new Project(p.id(), p.name(), p.path(), p.status(),
                p.devPort(), p.runtimePort(), sessionId, p.production(),
                p.createdAt(), clock.instant())) != null;
    }

    @Override
    public boolean updateProduction(String id, ProductionStatus expected, ProductionState next) {
        AtomicBoolean applied = new AtomicBoolean(false);
        projects.computeIfPresent(id, (k, p) -> {
            if (p.production().status() != expected) {
                return p;
            }
            applied.set(true);
            return new Project(p.id(), p.name(), p.path(), p.status(), p.devPort(), p.runtimePort(),
                    p.bootstrapSessionId(), next, p.createdAt(), clock.instant());
        });
        return applied.get();
    }
}
