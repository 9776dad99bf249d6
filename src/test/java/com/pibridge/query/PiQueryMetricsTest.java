package com.pibridge.query;

import com.pibridge.domain.QueryType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PiQueryMetrics Tests")
class PiQueryMetricsTest {

    private MeterRegistry meterRegistry;
    private PiQueryMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new PiQueryMetrics(meterRegistry);
    }

    @Test
    @DisplayName("Should register one executed counter per query type")
    void shouldRegisterCountersPerType() {
        for (QueryType type : QueryType.values()) {
            assertThat(meterRegistry.find("pibridge.query.executed").tag("type", type.getValue()).counter())
                .isNotNull();
        }
        assertThat(meterRegistry.find("pibridge.query.failed").counter()).isNotNull();
        assertThat(meterRegistry.find("pibridge.query.fallback").counter()).isNotNull();
        assertThat(meterRegistry.find("pibridge.query.instant.errors").counter()).isNotNull();
    }

    @Test
    @DisplayName("Should record latency and result size for completed queries")
    void shouldRecordExecuted() {
        metrics.recordExecuted(QueryType.DUAL, 120, 7);
        metrics.recordExecuted(QueryType.SINGLE, 80, 3);

        assertThat(metrics.getQueriesExecuted(QueryType.DUAL).count()).isEqualTo(1.0);
        assertThat(metrics.getQueriesExecuted(QueryType.SINGLE).count()).isEqualTo(1.0);
        assertThat(metrics.getQueriesExecuted(QueryType.FALLBACK).count()).isZero();
        assertThat(metrics.getExecutionLatency().count()).isEqualTo(2);
        assertThat(metrics.getExecutionLatency().totalTime(TimeUnit.MILLISECONDS)).isEqualTo(200.0);
        assertThat(metrics.getResultSize().totalAmount()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Should count failures, fallbacks and instant errors separately")
    void shouldRecordFailures() {
        metrics.recordFailed(15);
        metrics.recordFallback();
        metrics.recordInstantError();
        metrics.recordInstantError();

        assertThat(metrics.getQueriesFailed().count()).isEqualTo(1.0);
        assertThat(metrics.getFallbacks().count()).isEqualTo(1.0);
        assertThat(metrics.getInstantErrors().count()).isEqualTo(2.0);
        assertThat(metrics.getExecutionLatency().count()).isEqualTo(1);
        assertThat(metrics.getResultSize().count()).isZero();
    }
}
