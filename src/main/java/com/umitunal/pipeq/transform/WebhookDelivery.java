package com.umitunal.pipeq.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.pipeq.model.DeliveryJob;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Posts delivered subjects to a webhook as JSON. HTTP 429 is reported as
 * {@link RateLimitedException} so the job keeps its attempt budget.
 */
public class WebhookDelivery implements DeliveryTransform {
    private final HttpClient client;
    private final ObjectMapper mapper;
    private final URI webhook;
    private final Duration timeout;

    public WebhookDelivery(HttpClient client, ObjectMapper mapper, String webhookUrl, Duration timeout) {
        this.client = client;
        this.mapper = mapper;
        this.webhook = URI.create(webhookUrl);
        this.timeout = timeout;
    }

    @Override
    public void deliver(DeliveryJob job) throws DeliveryException, InterruptedException {
        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder(webhook)
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body(job)))
                    .build();
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DeliveryException("Webhook call failed for " + job.subjectUrl(), e);
        }

        int status = response.statusCode();
        if (status == 429) {
            Duration retryAfter = retryAfter(response.headers());
            throw new RateLimitedException("Webhook rate limit: retry after "
                    + (retryAfter == null ? "unknown" : retryAfter.toSeconds() + "s"), retryAfter);
        }
        if (status / 100 != 2) {
            throw new DeliveryException("Webhook failed (" + status + "): " + response.body(), status);
        }
    }

    private String body(DeliveryJob job) throws JsonProcessingException {
        ObjectNode body = mapper.createObjectNode();
        body.put("url", job.getSubject().getUrl());
        body.put("title", job.getSubject().getTitle());
        body.put("identifier", job.getSubject().getIdentifier());
        body.put("text", job.getEnrichedText());
        body.set("attributes", mapper.valueToTree(job.getSubject().getAttributes()));
        return mapper.writeValueAsString(body);
    }

    private static Duration retryAfter(HttpHeaders headers) {
        return headers.firstValue("Retry-After")
                .map(value -> {
                    try {
                        return Duration.ofSeconds((long) Math.ceil(Double.parseDouble(value.trim())));
                    } catch (NumberFormatException e) {
                        return null;
                    }
                })
                .orElse(null);
    }
}
