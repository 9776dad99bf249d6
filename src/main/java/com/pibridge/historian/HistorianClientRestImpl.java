package com.pibridge.historian;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * WebClient implementation of {@link HistorianClient}.
 *
 * Each instance owns a circuit breaker for one data source. Reads are attempted once;
 * there is no retry.
 */
public class HistorianClientRestImpl implements HistorianClient {

    private static final Logger log = LoggerFactory.getLogger(HistorianClientRestImpl.class);

    private static final List<String> CONNECTION_CHECK_PATHS = List.of("/pi/", "/pi/trn?tag=*&limit=1");

    /** Tag listing endpoints, tried in order until one yields tags. */
    static final List<String> TAG_DISCOVERY_PATHS = List.of(
        "/pi/search/tags?query=*&count=100",
        "/pi/dataservers/*/points?maxCount=100",
        "/pi/points?maxCount=100",
        "/pi/tags?query=*&count=100");

    private static final List<String> TAG_CONTAINERS = List.of("tags", "items", "data");
    private static final List<String> TAG_NAME_FIELDS = List.of("name", "tag", "webId");

    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;

    public HistorianClientRestImpl(WebClient.Builder webClientBuilder, String name) {
        this.webClient = webClientBuilder.clone()
            .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
            .build();

        // Opens when half of the last 10 calls failed, half-open after 30s. 4xx answers do not count.
        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
            .recordException(HistorianClientRestImpl::isHistorianFailure)
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .slidingWindowSize(10)
            .minimumNumberOfCalls(5)
            .build();

        this.circuitBreaker = CircuitBreaker.of("historian-" + name, cbConfig);
    }

    @Override
    public Mono<JsonNode> read(HistorianRequest request) {
        return Mono.fromCallable(request::toUri)
            .onErrorMap(e -> !(e instanceof UpstreamException), e -> UpstreamException.transport(request.getBaseUrl(), e))
            .flatMap(this::get);
    }

    @Override
    public Mono<JsonNode> readUrl(String url) {
        return Mono.fromCallable(() -> URI.create(url))
            .onErrorMap(IllegalArgumentException.class,
                e -> new UpstreamException("Invalid historian URL: " + url, url, null, e))
            .flatMap(this::get);
    }

    @Override
    public Mono<Boolean> testConnection(String baseUrl, Duration timeout) {
        String base = HistorianRequest.stripTrailingSlash(baseUrl);
        return Flux.fromIterable(CONNECTION_CHECK_PATHS)
            .concatMap(path -> answers(base + path, timeout))
            .any(Boolean::booleanValue)
            .doOnNext(reachable -> log.info("Historian {} reachable: {}", base, reachable));
    }

    @Override
    public Mono<List<String>> discoverTags(String baseUrl, Duration timeout) {
        String base = HistorianRequest.stripTrailingSlash(baseUrl);
        return Flux.fromIterable(TAG_DISCOVERY_PATHS)
            .concatMap(path -> tagsAt(base + path, timeout))
            .filter(tags -> !tags.isEmpty())
            .next()
            .defaultIfEmpty(List.of())
            .doOnNext(tags -> log.info("Discovered {} tags at {}", tags.size(), base));
    }

    private Mono<List<String>> tagsAt(String url, Duration timeout) {
        return Mono.fromCallable(() -> URI.create(url))
            .flatMap(this::get)
            .timeout(timeout)
            .map(HistorianClientRestImpl::tagNames)
            .onErrorResume(e -> {
                log.debug("Tag listing {} unavailable: {}", url, e.getMessage());
                return Mono.just(List.of());
            });
    }

    /**
     * Tag names from a listing body: a bare array, or an array under {@code tags}, {@code items}
     * or {@code data}. Entries are strings or objects named by {@code name}, {@code tag} or
     * {@code webId}. Returned distinct and sorted.
     */
    static List<String> tagNames(JsonNode body) {
        JsonNode entries = body;
        if (!body.isArray()) {
            entries = TAG_CONTAINERS.stream()
                .map(body::path)
                .filter(JsonNode::isArray)
                .findFirst()
                .orElse(null);
        }
        if (entries == null) {
            return List.of();
        }
        Set<String> names = new TreeSet<>();
        for (JsonNode entry : entries) {
            String name = entry.isTextual() ? entry.asText() : nameField(entry);
            if (name != null && !name.isBlank()) {
                names.add(name);
            }
        }
        return List.copyOf(names);
    }

    private static String nameField(JsonNode entry) {
        for (String field : TAG_NAME_FIELDS) {
            JsonNode value = entry.path(field);
            if (value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private static boolean isHistorianFailure(Throwable error) {
        if (error instanceof UpstreamException) {
            Integer status = ((UpstreamException) error).getStatus();
            return status == null || status >= 500;
        }
        return true;
    }

    private Mono<JsonNode> get(URI uri) {
        String url = uri.toString();
        log.debug("GET {}", url);

        return webClient.get()
            .uri(uri)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> UpstreamException.httpStatus(url, response.statusCode().value(), body)))
            .bodyToMono(JsonNode.class)
            .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
            .onErrorMap(e -> !(e instanceof UpstreamException), e -> UpstreamException.transport(url, e))
            .doOnError(e -> log.debug("GET {} failed: {}", url, e.getMessage()));
    }

    private Mono<Boolean> answers(String url, Duration timeout) {
        return webClient.get()
            .uri(URI.create(url))
            .exchangeToMono(response -> response.releaseBody()
                .thenReturn(response.statusCode().value()))
            .timeout(timeout)
            .map(status -> status < 500)
            .onErrorResume(e -> {
                log.debug("Connection check {} failed: {}", url, e.getMessage());
                return Mono.just(false);
            });
    }

    CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
