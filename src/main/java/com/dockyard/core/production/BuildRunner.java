package com.dockyard.core.production;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Runs a project's production build in its source directory.
 */
public interface BuildRunner {

    /**
     * @throws BuildFailedException if the build exits non-zero or exceeds {@code timeout}
     */
    void build(Path projectDir, String command, Duration timeout) throws IOException, InterruptedException;

    class BuildFailedException extends RuntimeException {
        public BuildFailedException(String message) {
            super(message);
        }
    }
}
