package com.dockyard.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP reachability probe. Any HTTP response counts as up; connection
 * failures and timeouts count as down.
 */
public class HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(HealthProbe.class);

    private final HttpClient httpClient;

    public HealthProbe() {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build());
    }

    public HealthProbe(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public boolean isUp(int port, String path, Duration timeout) {
        String url = "http://127.0.0.1:" + port + (path.startsWith("/") ? path : "/" + path);
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .GET()
                .build();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            log.trace("Probe {} -> {}", url, response.statusCode());
            return true;
        } catch (IOException e) {
            log.trace("Probe {} failed: {}", url, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
