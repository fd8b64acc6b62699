package com.dockyard.dispatch.cli;

import com.dockyard.core.queue.QueueService;
import com.dockyard.core.queue.QueueSettings;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: dockyard queue
 * <p>
 * Shows dispatcher settings, or changes them with {@code --pause},
 * {@code --resume} or {@code --concurrency N}.
 */
@Command(name = "queue", mixinStandardHelpOptions = true, description = "Show or change queue settings")
@Component
public class QueueCommand implements Runnable {

    @ArgGroup(exclusive = true)
    private PauseToggle pauseToggle;

    @Option(names = {"--concurrency", "-c"}, description = "Global concurrency limit (1..20)")
    private Integer concurrency;

    private final QueueService queueService;

    public QueueCommand(QueueService queueService) {
        this.queueService = queueService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (pauseToggle != null) {
            queueService.setPaused(pauseToggle.pause);
            ConsoleOutput.success(pauseToggle.pause ? "Queue paused" : "Queue resumed");
        }
        if (concurrency != null) {
            queueService.setConcurrency(concurrency);
            ConsoleOutput.success("Concurrency set to " + concurrency);
        }

        QueueSettings settings = queueService.getSettings();
        ConsoleOutput.info("Paused:      " + settings.paused());
        ConsoleOutput.info("Concurrency: " + settings.concurrency());
        ConsoleOutput.info("Running:     " + queueService.countRunning());
    }

    static class PauseToggle {
        @Option(names = "--pause", required = true, description = "Stop claiming new jobs")
        boolean pause;

        @Option(names = "--resume", required = true, description = "Resume claiming jobs")
        boolean resume;
    }
}
