package com.pibridge.query;

import com.pibridge.domain.ExecutionMetadata;
import com.pibridge.domain.ExecutionResult;
import com.pibridge.domain.LegDiagnostics;
import com.pibridge.domain.QueryParameters;
import com.pibridge.domain.QueryType;
import com.pibridge.domain.Sample;
import com.pibridge.domain.StreamLeg;
import com.pibridge.historian.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs historian queries for one data source.
 *
 * Declarative queries are parsed, planned and executed in dual mode: an instant read of the
 * latest value and a historical read of the planned window, issued concurrently and merged.
 * A failed instant read degrades to the historical samples alone; a failed historical read
 * fails the query. Preset keywords and direct URLs run a single read.
 *
 * Parse and configuration errors are raised before any request is sent.
 */
public class PiQueryEngine {

    private static final Logger log = LoggerFactory.getLogger(PiQueryEngine.class);

    private static final String TAG_PLACEHOLDER = "{tag}";
    private static final Pattern TAG_BIND_PARAMETER = Pattern.compile("(?i)(\\btag\\s*=\\s*)\\?");

    private final QueryParser parser;
    private final TimeWindowPlanner planner;
    private final StreamExecutor executor;
    private final ResultMerger merger;
    private final PiQueryMetrics metrics;
    private final String defaultTag;
    private final int defaultLimit;

    public PiQueryEngine(QueryParser parser, TimeWindowPlanner planner, StreamExecutor executor,
                         ResultMerger merger, PiQueryMetrics metrics, String defaultTag, int defaultLimit) {
        this.parser = parser;
        this.planner = planner;
        this.executor = executor;
        this.merger = merger;
        this.metrics = metrics;
        this.defaultTag = defaultTag;
        this.defaultLimit = defaultLimit;
    }

    /**
     * Execute a query.
     *
     * @param rawText    preset keyword, direct URL or SELECT query
     * @param parameters caller tag override, limit and interval; may be null
     * @return the ordered samples and execution metadata, or an error signal carrying a
     *         {@link QueryParseException}, {@link ConfigurationException} or {@link UpstreamException}
     */
    public Mono<ExecutionResult> execute(String rawText, QueryParameters parameters) {
        QueryParameters params = parameters != null ? parameters : QueryParameters.none();
        long started = System.currentTimeMillis();

        return Mono.defer(() -> dispatch(rawText, params, started))
            .doOnSuccess(result -> {
                ExecutionMetadata metadata = result.getMetadata();
                metrics.recordExecuted(metadata.getQueryType(), metadata.getExecutionTimeMs(), result.getData().size());
                log.info("Query completed: type={}, tag={}, samples={}, time={}ms",
                    metadata.getQueryType().getValue(), metadata.getTag(), metadata.getTotalCount(),
                    metadata.getExecutionTimeMs());
            })
            .doOnError(error -> {
                metrics.recordFailed(elapsedSince(started));
                if (error instanceof UpstreamException) {
                    log.error("Query failed against the historian: {}", error.getMessage());
                } else {
                    log.warn("Query rejected: {}", error.getMessage());
                }
            });
    }

    private Mono<ExecutionResult> dispatch(String rawText, QueryParameters params, long started) {
        String text = substituteTag(rawText, params);
        QueryForm form = QueryForm.detect(text);
        log.debug("Executing {} query: {}", form, text);

        return switch (form) {
            case DIRECT_URL -> executeDirectUrl(text.trim(), params, started);
            case PRESET -> executePreset(PresetQuery.find(text).orElseThrow(), params, started);
            case DECLARATIVE -> executeDual(text, params, started);
        };
    }

    private Mono<ExecutionResult> executeDual(String text, QueryParameters params, long started) {
        Interval interval = requireInterval(params);
        ParsedQuery parsed = parser.parse(bindTagParameter(text, params));
        String tag = resolveTag(parsed.getTag(), params);

        Integer callerLimit = params.hasRequestedLimit() ? params.getRequestedLimit() : null;
        TimeWindow window = planner.plan(parsed, interval, null, callerLimit);
        int totalLimit = parsed.hasLimit() ? parsed.getLimit() : callerLimit != null ? callerLimit : defaultLimit;

        log.info("Dual query for tag {}: window={}, total limit={}", tag, window, totalLimit);

        Mono<InstantOutcome> instant = executor.fetchInstant(tag)
            .map(InstantOutcome::succeeded)
            .onErrorResume(error -> {
                log.warn("Instant read failed for tag {}, continuing with historical data only: {}",
                    tag, error.getMessage());
                metrics.recordInstantError();
                return Mono.just(InstantOutcome.failed(error));
            });
        Mono<LegResult> historical = executor.fetchHistorical(tag, window);

        return Mono.zip(instant, historical)
            .map(legs -> assembleDual(tag, interval, parsed, totalLimit, legs.getT1(), legs.getT2(), started));
    }

    private Mono<ExecutionResult> executePreset(PresetQuery preset, QueryParameters params, long started) {
        Interval interval = requireInterval(params);
        String tag = resolveTag(null, params);
        Integer limit = preset.getFixedLimit() != null
            ? preset.getFixedLimit()
            : params.hasRequestedLimit() ? params.getRequestedLimit() : null;

        TimeWindow window = planner.plan(ParsedQuery.empty(), interval, preset.range(), limit);
        log.info("Preset query '{}' for tag {}: window={}", preset.getKeyword(), tag, window);

        return executor.fetchHistorical(tag, window)
            .map(leg -> assembleSingle(tag, interval.toString(), limit, leg, started));
    }

    private Mono<ExecutionResult> executeDirectUrl(String url, QueryParameters params, long started) {
        String tag = resolveTag(queryParameter(url, "tag"), params);
        Integer limit = params.hasRequestedLimit() ? params.getRequestedLimit() : null;
        String interval = queryParameter(url, "interval");
        log.info("Direct URL query for tag {}", tag);

        return executor.fetchUrl(url, tag)
            .map(leg -> assembleSingle(tag, interval, limit, leg, started));
    }

    private ExecutionResult assembleDual(String tag, Interval interval, ParsedQuery parsed, int totalLimit,
                                         InstantOutcome instant, LegResult historical, long started) {
        List<Sample> historicalSamples = merger.filter(historical.getSamples(), parsed.getWhere());

        ExecutionMetadata metadata = new ExecutionMetadata();
        metadata.setTag(tag);
        metadata.setInterval(interval.toString());
        metadata.setRequestedLimit(totalLimit);
        metadata.setHistoricalLeg(historical.getDiagnostics());
        metadata.setHistoricalCount(historicalSamples.size());

        List<Sample> merged;
        if (instant.error != null) {
            metrics.recordFallback();
            metadata.setQueryType(QueryType.FALLBACK);
            metadata.setFallback(true);
            metadata.setFallbackReason(instant.error.getMessage());
            metadata.setRealTimeCount(0);
            metadata.setInstantLeg(failedInstantDiagnostics(instant.error));
            merged = merger.merge(Collections.emptyList(), historicalSamples, totalLimit);
        } else {
            List<Sample> instantSamples = merger.filter(instant.result.getSamples(), parsed.getWhere());
            metadata.setQueryType(QueryType.DUAL);
            metadata.setRealTimeCount(instantSamples.size());
            metadata.setInstantLeg(instant.result.getDiagnostics());
            merged = merger.merge(instantSamples, historicalSamples, totalLimit);
        }

        metadata.setTotalCount(merged.size());
        metadata.setExecutionTimeMs(elapsedSince(started));
        return new ExecutionResult(merged, metadata);
    }

    private ExecutionResult assembleSingle(String tag, String interval, Integer limit, LegResult leg, long started) {
        List<Sample> samples = merger.postProcess(leg.getSamples(), limit);

        ExecutionMetadata metadata = new ExecutionMetadata();
        metadata.setQueryType(QueryType.SINGLE);
        metadata.setTag(tag);
        metadata.setInterval(interval);
        metadata.setRequestedLimit(limit);
        metadata.setHistoricalLeg(leg.getDiagnostics());
        metadata.setHistoricalCount(leg.getSamples().size());
        metadata.setTotalCount(samples.size());
        metadata.setExecutionTimeMs(elapsedSince(started));
        return new ExecutionResult(samples, metadata);
    }

    private static LegDiagnostics failedInstantDiagnostics(Throwable error) {
        String url = error instanceof UpstreamException ? ((UpstreamException) error).getUrl() : null;
        LegDiagnostics diagnostics = new LegDiagnostics(StreamLeg.INSTANT, url);
        diagnostics.setError(error.getMessage());
        return diagnostics;
    }

    private static Interval requireInterval(QueryParameters params) {
        if (!params.hasRequestedInterval()) {
            throw new QueryParseException("An interval (for example 1m or 1h) is required for this query");
        }
        return Interval.parse(params.getRequestedInterval());
    }

    /**
     * Query tag, then caller override, then the data source default.
     */
    String resolveTag(String candidate, QueryParameters params) {
        if (candidate != null && !candidate.isBlank()) {
            return candidate;
        }
        if (params.hasTagOverride()) {
            return params.getTagOverride();
        }
        if (defaultTag != null && !defaultTag.isBlank()) {
            return defaultTag;
        }
        throw new ConfigurationException("No tag in the query and no default tag configured", "defaultTag");
    }

    private static String substituteTag(String text, QueryParameters params) {
        if (text == null || !params.hasTagOverride()) {
            return text;
        }
        return text.replace(TAG_PLACEHOLDER, params.getTagOverride());
    }

    /**
     * Bind {@code tag = ?} to the caller's or default tag when one is known.
     */
    private String bindTagParameter(String text, QueryParameters params) {
        String tag = params.hasTagOverride() ? params.getTagOverride() : defaultTag;
        if (tag == null || tag.isBlank()) {
            return text;
        }
        return bindTag(text, tag);
    }

    /**
     * Replace every {@code tag = ?} in {@code sql} with {@code tag} as a quoted SQL literal.
     * Other question marks are left alone.
     */
    public static String bindTag(String sql, String tag) {
        String literal = "'" + tag.replace("'", "''") + "'";
        return TAG_BIND_PARAMETER.matcher(sql).replaceAll("$1" + Matcher.quoteReplacement(literal));
    }

    /**
     * Decoded value of a query parameter in {@code url}, or null when absent or empty.
     */
    public static String queryParameter(String url, String name) {
        Matcher matcher = Pattern.compile("[?&]" + Pattern.quote(name) + "=([^&#]*)").matcher(url);
        if (!matcher.find() || matcher.group(1).isEmpty()) {
            return null;
        }
        try {
            return URLDecoder.decode(matcher.group(1), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new QueryParseException("Malformed '" + name + "' parameter in URL", url, e);
        }
    }

    private static long elapsedSince(long started) {
        return System.currentTimeMillis() - started;
    }

    String getDefaultTag() {
        return defaultTag;
    }

    /**
     * Result of the instant leg: samples on success, the error otherwise.
     */
    private static final class InstantOutcome {

        private final LegResult result;
        private final Throwable error;

        private InstantOutcome(LegResult result, Throwable error) {
            this.result = result;
            this.error = error;
        }

        static InstantOutcome succeeded(LegResult result) {
            return new InstantOutcome(result, null);
        }

        static InstantOutcome failed(Throwable error) {
            return new InstantOutcome(null, error);
        }
    }
}
