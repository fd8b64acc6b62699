package com.dockyard.core.production;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link BuildRunner} that shells out via {@code sh -c}. The last lines of
 * output are kept for the error message when the build fails.
 */
public class ProcessBuildRunner implements BuildRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessBuildRunner.class);

    private static final int TAIL_LINES = 20;

    @Override
    public void build(Path projectDir, String command, Duration timeout) throws IOException, InterruptedException {
        log.info("Running build '{}' in {}", command, projectDir);
        var process = new ProcessBuilder(List.of("sh", "-c", command))
                .directory(projectDir.toFile())
                .redirectErrorStream(true)
                .start();

        Deque<String> tail = new ArrayDeque<>();
        Thread reader = new Thread(() -> drain(process, tail), "build-output");
        reader.setDaemon(true);
        reader.start();

        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            throw new BuildFailedException("Build timed out after " + timeout.toSeconds() + "s");
        }
        reader.join(TimeUnit.SECONDS.toMillis(5));

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            String output;
            synchronized (tail) {
                output = String.join("\n", tail);
            }
            throw new BuildFailedException("Build failed with exit code " + exitCode + ": " + output);
        }
        log.info("Build finished in {}", projectDir);
    }

    private static void drain(Process process, Deque<String> tail) {
        try (var in = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                log.debug("build: {}", line);
                synchronized (tail) {
                    tail.addLast(line);
                    if (tail.size() > TAIL_LINES) {
                        tail.removeFirst();
                    }
                }
            }
        } catch (IOException e) {
            log.debug("Build output stream closed: {}", e.getMessage());
        }
    }
}
