package com.pibridge.query;

import com.pibridge.domain.QueryType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for historian query execution.
 */
@Component
public class PiQueryMetrics {

    private final Map<QueryType, Counter> queriesExecuted = new EnumMap<>(QueryType.class);
    private final Counter queriesFailed;
    private final Counter fallbacks;
    private final Counter instantErrors;
    private final Timer executionLatency;
    private final DistributionSummary resultSize;

    public PiQueryMetrics(MeterRegistry registry) {
        for (QueryType type : QueryType.values()) {
            queriesExecuted.put(type, Counter.builder("pibridge.query.executed")
                .description("Number of historian queries completed")
                .tag("type", type.getValue())
                .register(registry));
        }

        this.queriesFailed = Counter.builder("pibridge.query.failed")
            .description("Number of historian queries that ended in an error")
            .register(registry);

        this.fallbacks = Counter.builder("pibridge.query.fallback")
            .description("Number of dual queries answered from the historical leg only")
            .register(registry);

        this.instantErrors = Counter.builder("pibridge.query.instant.errors")
            .description("Number of failed instant-leg reads")
            .register(registry);

        this.executionLatency = Timer.builder("pibridge.query.execution.latency")
            .description("End-to-end query execution time")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);

        this.resultSize = DistributionSummary.builder("pibridge.query.result.size")
            .description("Number of samples returned per query")
            .baseUnit("samples")
            .register(registry);
    }

    public void recordExecuted(QueryType type, long durationMs, int samples) {
        queriesExecuted.get(type).increment();
        executionLatency.record(durationMs, TimeUnit.MILLISECONDS);
        resultSize.record(samples);
    }

    public void recordFailed(long durationMs) {
        queriesFailed.increment();
        executionLatency.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordFallback() {
        fallbacks.increment();
    }

    public void recordInstantError() {
        instantErrors.increment();
    }

    Counter getQueriesExecuted(QueryType type) {
        return queriesExecuted.get(type);
    }

    Counter getQueriesFailed() {
        return queriesFailed;
    }

    Counter getFallbacks() {
        return fallbacks;
    }

    Counter getInstantErrors() {
        return instantErrors;
    }

    Timer getExecutionLatency() {
        return executionLatency;
    }

    DistributionSummary getResultSize() {
        return resultSize;
    }
}
