package com.dockyard.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: dockyard serve
 * <p>
 * Starts Dockyard as a long-running HTTP server with the job dispatcher and
 * presence reaper running. The web server is enabled by
 * {@link com.dockyard.DockyardApplication#main} detecting "serve" in args;
 * {@link CliRunner} then skips picocli entirely.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 dockyard serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Dockyard HTTP server, job dispatcher and reaper")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reachable through --help style invocations; CliRunner skips picocli in serve mode
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Dockyard server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        System.out.println("  Queue:      http://localhost:" + port + "/api/v1/queue/jobs");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
