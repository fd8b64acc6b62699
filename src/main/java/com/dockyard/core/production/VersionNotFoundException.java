package com.dockyard.core.production;

public class VersionNotFoundException extends RuntimeException {
    public VersionNotFoundException(String projectId, String hash) {
        super("Release " + hash + " not found for project " + projectId);
    }
}
