package com.pibridge.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.pibridge.domain.LegDiagnostics;
import com.pibridge.domain.StreamLeg;
import com.pibridge.historian.HistorianClient;
import com.pibridge.historian.HistorianRequest;
import com.pibridge.historian.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Issues the historian reads for one data source, one GET per leg.
 *
 * Every read carries its own timeout. Failures are reported as {@link UpstreamException}
 * tagged with the leg; nothing is retried.
 */
public class StreamExecutor {

    private static final Logger log = LoggerFactory.getLogger(StreamExecutor.class);

    private final HistorianClient client;
    private final ResponseNormalizer normalizer;
    private final TimeWindowPlanner planner;
    private final String baseUrl;
    private final Duration legTimeout;

    public StreamExecutor(HistorianClient client, ResponseNormalizer normalizer, TimeWindowPlanner planner,
                          String baseUrl, Duration legTimeout) {
        this.client = client;
        this.normalizer = normalizer;
        this.planner = planner;
        this.baseUrl = baseUrl;
        this.legTimeout = legTimeout;
    }

    /**
     * Freshest known value of {@code tag}.
     */
    public Mono<LegResult> fetchInstant(String tag) {
        return fetch(StreamLeg.INSTANT, tag, planner.planInstant());
    }

    /**
     * Interval-sampled read of {@code tag} over {@code window}.
     */
    public Mono<LegResult> fetchHistorical(String tag, TimeWindow window) {
        return fetch(StreamLeg.HISTORICAL, tag, window);
    }

    /**
     * GET a caller-supplied URL verbatim, stamping samples with {@code tag}.
     */
    public Mono<LegResult> fetchUrl(String url, String tag) {
        LegDiagnostics diagnostics = new LegDiagnostics(StreamLeg.HISTORICAL, url);
        return execute(StreamLeg.HISTORICAL, tag, url, client.readUrl(url), diagnostics);
    }

    private Mono<LegResult> fetch(StreamLeg leg, String tag, TimeWindow window) {
        HistorianRequest request = new HistorianRequest(baseUrl, tag, window.getInterval().toString(),
            window.getStart(), window.getEnd(), window.getMaxCount());
        String url = request.toUrl();

        LegDiagnostics diagnostics = new LegDiagnostics(leg, url);
        diagnostics.setStart(window.getStart());
        diagnostics.setEnd(window.getEnd());
        diagnostics.setInterval(window.getInterval().toString());
        diagnostics.setMaxCount(window.getMaxCount());

        log.debug("Dispatching {} leg for tag {}: {}", leg.getValue(), tag, window);
        return execute(leg, tag, url, client.read(request), diagnostics);
    }

    private Mono<LegResult> execute(StreamLeg leg, String tag, String url,
                                    Mono<JsonNode> response,
                                    LegDiagnostics diagnostics) {
        return response
            .timeout(legTimeout)
            .defaultIfEmpty(MissingNode.getInstance())
            .map(payload -> {
                LegResult result = new LegResult(leg, normalizer.normalize(payload, tag), diagnostics);
                diagnostics.setCount(result.getSamples().size());
                return result;
            })
            .onErrorMap(e -> UpstreamException.forLeg(leg, url, e));
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Duration getLegTimeout() {
        return legTimeout;
    }
}
