package com.dockyard.core.project;

import com.dockyard.core.production.ProductionState;
import com.dockyard.core.production.ProductionStatus;

import java.util.List;
import java.util.Optional;

/**
 * Persistent project registry. Updates touch only the columns they name so the
 * presence manager and the production handlers never overwrite each other.
 */
public interface ProjectStore {

    Optional<Project> findById(String id);

    List<Project> findAll();

    Project insert(Project project);

    boolean updateStatus(String id, ProjectStatus status);

    boolean updateBootstrapSession(String id, String sessionId);

    /**
     * Replaces the production fields only if the current production status is {@code expected}.
     */
    boolean updateProduction(String id, ProductionStatus expected, ProductionState next);
}
