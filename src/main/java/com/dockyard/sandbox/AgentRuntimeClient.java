package com.dockyard.sandbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Minimal client for the agent runtime's HTTP API: just enough to bootstrap a session.
 */
public class AgentRuntimeClient {

    private static final Logger log = LoggerFactory.getLogger(AgentRuntimeClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public AgentRuntimeClient(ObjectMapper objectMapper, Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(), objectMapper, requestTimeout);
    }

    AgentRuntimeClient(HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Creates a session on the runtime listening on {@code port}.
     *
     * @return the session id assigned by the runtime
     * @throws IOException if the runtime is unreachable or answers with an error
     */
    public String createSession(int port) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/session"))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString("{}"))
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() >= 300) {
            throw new IOException("Agent runtime returned HTTP " + response.statusCode() + ": "
                    + abbreviate(response.body()));
        }
        JsonNode body = objectMapper.readTree(response.body());
        JsonNode id = body.get("id");
        if (id == null || id.asText().isBlank()) {
            throw new IOException("Agent runtime response has no session id");
        }
        log.info("Agent runtime on port {} created session {}", port, id.asText());
        return id.asText();
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
