package com.tumorboard.llm.completion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Abstract base class for completion clients with shared HTTP logic.
 * A single call is made per {@link #complete}; retries belong to the caller.
 */
public abstract class AbstractCompletionClient implements CompletionClient {

    protected static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 300;

    protected final ObjectMapper mapper;
    protected final HttpClient httpClient;
    protected final String baseUrl;
    protected final String apiKey;
    protected final Duration timeout;

    protected AbstractCompletionClient(ObjectMapper mapper, HttpClient httpClient, String baseUrl,
                                       String defaultBaseUrl, String apiKey, Duration timeout) {
        this.mapper = mapper;
        this.httpClient = httpClient;
        this.baseUrl = normalizeBaseUrl(baseUrl, defaultBaseUrl);
        this.apiKey = apiKey;
        this.timeout = timeout != null ? timeout : Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS);
    }

    /**
     * Send a JSON POST request and return the parsed response.
     */
    protected JsonNode sendJsonPost(String url, JsonNode payload, Map<String, String> headers)
        throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)));
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (header.getValue() != null && !header.getValue().isBlank()) {
                builder.header(header.getKey(), header.getValue());
            }
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CompletionException(getProviderName() + " request failed: " + e.getMessage(), e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new CompletionException("Completion request failed (" + status + "): " + response.body());
        }
        try {
            return mapper.readTree(response.body());
        } catch (IOException e) {
            throw new CompletionException(getProviderName() + " returned a non-JSON envelope", e);
        }
    }

    protected String requireContent(JsonNode content) throws CompletionException {
        if (content == null || content.isMissingNode() || content.isNull() || content.asText().isBlank()) {
            throw new CompletionException("Empty response from LLM");
        }
        return content.asText();
    }

    /**
     * Normalize a base URL by removing trailing slashes.
     */
    protected static String normalizeBaseUrl(String baseUrl, String fallback) {
        String url = (baseUrl == null || baseUrl.isBlank()) ? fallback : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }
}
