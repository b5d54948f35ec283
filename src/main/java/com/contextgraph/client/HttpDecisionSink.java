package com.contextgraph.client;

import com.contextgraph.models.DecisionRecord;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Delivers records to a ContextGraph server with {@code POST /v1/decisions}.
 */
public class HttpDecisionSink implements DecisionSink {

    private static final String DECISIONS_PATH = "/v1/decisions";

    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final String endpoint;
    private final String apiKey;
    private final Duration timeout;

    public HttpDecisionSink(ClientConfig config, ObjectMapper mapper) {
        this(config, mapper, HttpClient.newBuilder().connectTimeout(config.getTimeout()).build());
    }

    public HttpDecisionSink(ClientConfig config, ObjectMapper mapper, HttpClient httpClient) {
        this.mapper = mapper;
        this.httpClient = httpClient;
        this.endpoint = normalizeBaseUrl(config.getServerUrl()) + DECISIONS_PATH;
        this.apiKey = config.getApiKey();
        this.timeout = config.getTimeout();
    }

    @Override
    public void deliver(DecisionRecord record) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(endpoint))
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(record)));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while delivering decision " + record.getDecisionId(), e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("Ingest request failed (" + status + "): " + response.body());
        }
    }

    @Override
    public String describe() {
        return "HTTP " + endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }

    static String normalizeBaseUrl(String baseUrl) {
        String url = (baseUrl == null || baseUrl.isBlank()) ? ClientConfig.DEFAULT_SERVER_URL : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }
}
