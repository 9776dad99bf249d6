package com.pibridge.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pibridge.domain.Sample;
import com.pibridge.domain.StreamLeg;
import com.pibridge.historian.HistorianClient;
import com.pibridge.historian.HistorianRequest;
import com.pibridge.historian.UpstreamException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StreamExecutorTest {

    private static final String BASE_URL = "http://pi:6066";

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock
    private HistorianClient client;

    private StreamExecutor executor;

    @BeforeEach
    void setUp() {
        TimeWindowPlanner planner = new TimeWindowPlanner(
            Clock.fixed(Instant.parse("2025-01-01T12:00:00Z"), ZoneOffset.UTC));
        executor = new StreamExecutor(client, new ResponseNormalizer(), planner, BASE_URL, Duration.ofMillis(200));
    }

    // ========== Instant Leg ==========

    @Test
    void testFetchInstant_WithTag_ShouldRequestLastHourAtOneSecond() throws Exception {
        // Given
        JsonNode body = mapper.readTree("[{\"v0\":\"2025-01-01T11:59:59Z\",\"v1\":\"42.5\"}]");
        when(client.read(any(HistorianRequest.class))).thenReturn(Mono.just(body));

        // When / Then
        StepVerifier.create(executor.fetchInstant("T1"))
            .assertNext(leg -> {
                assertThat(leg.getLeg()).isEqualTo(StreamLeg.INSTANT);
                assertThat(leg.getSamples()).containsExactly(new Sample(1, "T1", "2025-01-01T11:59:59Z", 42.5));
                assertThat(leg.getDiagnostics().getUrl())
                    .isEqualTo("http://pi:6066/pi/trn?tag=T1&interval=1s&start=%2A-1h&end=%2A&maxCount=1");
                assertThat(leg.getDiagnostics().getCount()).isEqualTo(1);
                assertThat(leg.getDiagnostics().getMaxCount()).isEqualTo(1);
            })
            .verifyComplete();

        ArgumentCaptor<HistorianRequest> captor = ArgumentCaptor.forClass(HistorianRequest.class);
        verify(client).read(captor.capture());
        assertThat(captor.getValue().getTag()).isEqualTo("T1");
        assertThat(captor.getValue().getInterval()).isEqualTo("1s");
    }

    // ========== Historical Leg ==========

    @Test
    void testFetchHistorical_WithWindow_ShouldRecordWindowInDiagnostics() throws Exception {
        // Given
        TimeWindow window = new TimeWindow("*-2h", "*", Interval.FIVE_MINUTES, null, PlanningRule.EXPLICIT_RANGE);
        when(client.read(any(HistorianRequest.class)))
            .thenReturn(Mono.just(mapper.readTree("{\"data\":[{\"v0\":\"a\",\"v1\":1},{\"v0\":\"b\",\"v1\":\"No Data\"}]}")));

        // When / Then
        StepVerifier.create(executor.fetchHistorical("T1", window))
            .assertNext(leg -> {
                assertThat(leg.getLeg()).isEqualTo(StreamLeg.HISTORICAL);
                assertThat(leg.getSamples()).hasSize(1);
                assertThat(leg.getDiagnostics().getStart()).isEqualTo("*-2h");
                assertThat(leg.getDiagnostics().getEnd()).isEqualTo("*");
                assertThat(leg.getDiagnostics().getInterval()).isEqualTo("5m");
                assertThat(leg.getDiagnostics().getMaxCount()).isNull();
                assertThat(leg.getDiagnostics().getUrl()).doesNotContain("maxCount");
            })
            .verifyComplete();
    }

    @Test
    void testFetchHistorical_WithEmptyResponse_ShouldReturnNoSamples() {
        // Given
        TimeWindow window = new TimeWindow("*-1h", "*", Interval.ONE_MINUTE, 10, PlanningRule.EXPLICIT_RANGE);
        when(client.read(any(HistorianRequest.class))).thenReturn(Mono.empty());

        // When / Then
        StepVerifier.create(executor.fetchHistorical("T1", window))
            .assertNext(leg -> {
                assertThat(leg.getSamples()).isEmpty();
                assertThat(leg.getDiagnostics().getCount()).isZero();
            })
            .verifyComplete();
    }

    // ========== Failures ==========

    @Test
    void testFetchHistorical_WithHttpError_ShouldKeepStatusAndTagLeg() {
        // Given
        TimeWindow window = new TimeWindow("*-1h", "*", Interval.ONE_MINUTE, null, PlanningRule.EXPLICIT_RANGE);
        when(client.read(any(HistorianRequest.class)))
            .thenReturn(Mono.error(UpstreamException.httpStatus("http://pi:6066/pi/trn", 503, "down")));

        // When / Then
        StepVerifier.create(executor.fetchHistorical("T1", window))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(UpstreamException.class);
                UpstreamException upstream = (UpstreamException) error;
                assertThat(upstream.getLeg()).isEqualTo(StreamLeg.HISTORICAL);
                assertThat(upstream.getStatus()).isEqualTo(503);
                assertThat(upstream.getMessage()).contains("HTTP 503", "leg=historical");
            })
            .verify();
    }

    @Test
    void testFetchInstant_WhenHistorianNeverAnswers_ShouldTimeOut() {
        // Given
        when(client.read(any(HistorianRequest.class))).thenReturn(Mono.never());

        // When / Then
        StepVerifier.create(executor.fetchInstant("T1"))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(UpstreamException.class);
                assertThat(((UpstreamException) error).getLeg()).isEqualTo(StreamLeg.INSTANT);
                assertThat(error.getCause()).isInstanceOf(TimeoutException.class);
                assertThat(error.getMessage()).contains("timed out");
            })
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void testFetchUrl_WithDirectUrl_ShouldReadVerbatim() throws Exception {
        // Given
        String url = "http://pi:6066/pi/trn?tag=T9&interval=1h&start=*-24h&end=*";
        when(client.readUrl(url)).thenReturn(Mono.just(mapper.readTree("[{\"v0\":\"a\",\"v1\":\"on\"}]")));

        // When / Then
        StepVerifier.create(executor.fetchUrl(url, "T9"))
            .assertNext(leg -> {
                assertThat(leg.getSamples()).containsExactly(new Sample(1, "T9", "a", "on"));
                assertThat(leg.getDiagnostics().getUrl()).isEqualTo(url);
            })
            .verifyComplete();
    }
}
