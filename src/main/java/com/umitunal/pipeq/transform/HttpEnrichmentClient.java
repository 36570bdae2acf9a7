package com.umitunal.pipeq.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.pipeq.model.Subject;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * Asks a text-generation endpoint for a subject's summary.
 *
 * Request: {@code {"url": ..., "model": ..., "context": {subject}}}.
 * Response: JSON with a {@code summary} string; a missing or blank summary means no result.
 */
public class HttpEnrichmentClient implements EnrichmentTransform {
    private final HttpClient client;
    private final ObjectMapper mapper;
    private final URI endpoint;
    private final String model;
    private final Duration timeout;

    public HttpEnrichmentClient(HttpClient client, ObjectMapper mapper, String endpoint, String model, Duration timeout) {
        this.client = client;
        this.mapper = mapper;
        this.endpoint = URI.create(endpoint);
        this.model = model;
        this.timeout = timeout;
    }

    @Override
    public Optional<String> enrich(String subjectUrl, Subject context) throws EnrichmentException, InterruptedException {
        ObjectNode body = mapper.createObjectNode();
        body.put("url", subjectUrl);
        if (model != null) {
            body.put("model", model);
        }
        body.set("context", mapper.valueToTree(context));

        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder(endpoint)
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EnrichmentException("Enrichment call failed for " + subjectUrl, e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new EnrichmentException("Enrichment service returned " + response.statusCode() + ": " + response.body());
        }

        try {
            JsonNode summary = mapper.readTree(response.body()).path("summary");
            if (!summary.isTextual() || summary.asText().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(summary.asText().trim());
        } catch (IOException e) {
            throw new EnrichmentException("Unreadable enrichment response for " + subjectUrl, e);
        }
    }
}
