package com.pibridge.historian;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Read-only access to a historian's HTTP API.
 */
public interface HistorianClient {

    /**
     * Issue one read. Errors surface as {@link UpstreamException}.
     */
    Mono<JsonNode> read(HistorianRequest request);

    /**
     * Issue a GET against a caller-supplied URL as-is.
     */
    Mono<JsonNode> readUrl(String url);

    /**
     * Check the historian answers. Any response below 500 counts as reachable.
     *
     * @param baseUrl historian base URL
     * @param timeout timeout of each request
     */
    Mono<Boolean> testConnection(String baseUrl, Duration timeout);

    /**
     * List the tags the historian exposes, trying its tag listing endpoints in turn.
     * Best effort: completes with an empty list when no endpoint answers with tags.
     *
     * @param baseUrl historian base URL
     * @param timeout per-endpoint timeout
     */
    Mono<List<String>> discoverTags(String baseUrl, Duration timeout);
}
