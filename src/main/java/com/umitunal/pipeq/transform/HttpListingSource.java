package com.umitunal.pipeq.transform;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Plain HTTP GET of the listing.
 */
public class HttpListingSource implements ListingSource {
    private static final String USER_AGENT = "Mozilla/5.0 (compatible; pipeq/1.0)";

    private final HttpClient client;
    private final Duration timeout;

    public HttpListingSource(HttpClient client, Duration timeout) {
        this.client = client;
        this.timeout = timeout;
    }

    @Override
    public String fetch(String url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();

        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            throw new IOException("Listing fetch failed: " + response.statusCode());
        }
        return response.body();
    }
}
