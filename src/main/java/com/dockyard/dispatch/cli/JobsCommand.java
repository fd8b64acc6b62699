package com.dockyard.dispatch.cli;

import com.dockyard.core.queue.Job;
import com.dockyard.core.queue.JobFilter;
import com.dockyard.core.queue.JobPage;
import com.dockyard.core.queue.JobState;
import com.dockyard.core.queue.QueueService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: dockyard jobs
 * <p>
 * Lists jobs newest first as a table: ID | TYPE | STATE | PROJECT | ATTEMPTS | LAST ERROR.
 */
@Command(name = "jobs", mixinStandardHelpOptions = true, description = "List queued and finished jobs")
@Component
public class JobsCommand implements Runnable {

    @Option(names = {"--state", "-s"}, description = "Filter by state: queued, running, succeeded, failed, cancelled")
    private String state;

    @Option(names = {"--type", "-t"}, description = "Filter by job type, e.g. docker.composeUp")
    private String type;

    @Option(names = {"--project", "-p"}, description = "Filter by project id")
    private String projectId;

    @Option(names = {"--search", "-q"}, description = "Match text in payload or last error")
    private String text;

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "20")
    private int limit;

    private final QueueService queueService;

    public JobsCommand(QueueService queueService) {
        this.queueService = queueService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        JobState jobState = state != null ? JobState.fromValue(state) : null;
        JobPage page = queueService.listJobs(new JobFilter(jobState, type, projectId, text), 1, limit);
        if (page.jobs().isEmpty()) {
            ConsoleOutput.info("No jobs found.");
            return;
        }

        ConsoleOutput.info("Jobs (" + page.jobs().size() + " of " + page.total() + "):");
        System.out.println();
        System.out.printf("  %-38s %-22s %-10s %-16s %-8s %s%n",
                "ID", "TYPE", "STATE", "PROJECT", "ATTEMPTS", "LAST ERROR");
        System.out.println("  " + "-".repeat(120));

        for (Job job : page.jobs()) {
            System.out.printf("  %-38s %-22s %-10s %-16s %-8s %s%n",
                    job.id(), job.type(), job.state().value(),
                    ConsoleOutput.truncate(job.projectId(), 16),
                    job.attempts() + "/" + job.maxAttempts(),
                    ConsoleOutput.truncate(job.lastError(), 40));
        }
    }
}
