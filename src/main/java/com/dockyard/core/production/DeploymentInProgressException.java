package com.dockyard.core.production;

/**
 * Thrown when a deploy, rollback or stop is requested while a deployment for
 * the same project is queued or building.
 */
public class DeploymentInProgressException extends RuntimeException {
    public DeploymentInProgressException(String projectId) {
        super("A production deployment is already in progress for project " + projectId);
    }
}
