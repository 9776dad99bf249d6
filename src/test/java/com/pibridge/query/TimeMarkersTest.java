package com.pibridge.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TimeMarkers Tests")
class TimeMarkersTest {

    private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    @DisplayName("Should render relative markers in the largest integral unit")
    void shouldRenderRelativeMarkers() {
        assertThat(TimeMarkers.relative(Duration.ofHours(24))).isEqualTo("*-24h");
        assertThat(TimeMarkers.relative(Duration.ofMinutes(90))).isEqualTo("*-90m");
        assertThat(TimeMarkers.relative(Duration.ofSeconds(45))).isEqualTo("*-45s");
        assertThat(TimeMarkers.relative(Duration.ZERO)).isEqualTo("*");
    }

    @Test
    @DisplayName("Should resolve now, relative and absolute markers against the clock")
    void shouldResolveMarkers() {
        assertThat(TimeMarkers.resolve("*", clock)).contains(NOW);
        assertThat(TimeMarkers.resolve("*-2h", clock)).contains(NOW.minus(Duration.ofHours(2)));
        assertThat(TimeMarkers.resolve("*-1d", clock)).contains(NOW.minus(Duration.ofDays(1)));
        assertThat(TimeMarkers.resolve("2025-01-01T10:00:00Z", clock)).contains(Instant.parse("2025-01-01T10:00:00Z"));
        assertThat(TimeMarkers.resolve("yesterday", clock)).isEmpty();
    }

    @Test
    @DisplayName("Should parse the timestamp forms used by query authors and the historian")
    void shouldParseAbsoluteForms() {
        Instant ten = Instant.parse("2025-01-01T10:00:00Z");

        assertThat(TimeMarkers.parseAbsolute("2025-01-01T10:00:00Z")).contains(ten);
        assertThat(TimeMarkers.parseAbsolute("2025-01-01T17:00:00+07:00")).contains(ten);
        assertThat(TimeMarkers.parseAbsolute("2025-01-01T10:00:00")).contains(ten);
        assertThat(TimeMarkers.parseAbsolute("2025-01-01 10:00:00")).contains(ten);
        assertThat(TimeMarkers.parseAbsolute("2025-01-01T10:00:00.000")).contains(ten);
        assertThat(TimeMarkers.parseAbsolute("2025-01-01")).contains(Instant.parse("2025-01-01T00:00:00Z"));
        assertThat(TimeMarkers.parseAbsolute("*-1h")).isEmpty();
        assertThat(TimeMarkers.parseAbsolute("not a time")).isEmpty();
        assertThat(TimeMarkers.parseAbsolute(null)).isEmpty();
    }

    @Test
    @DisplayName("Should format a derived bound in the style of its template")
    void shouldFormatLikeTemplate() {
        Instant nine = Instant.parse("2025-01-01T09:00:00Z");

        assertThat(TimeMarkers.formatLike(nine, "2025-01-01T10:00:00Z")).isEqualTo("2025-01-01T09:00:00Z");
        assertThat(TimeMarkers.formatLike(nine, "2025-01-01 10:00:00")).isEqualTo("2025-01-01 09:00:00");
        assertThat(TimeMarkers.formatLike(nine, "2025-01-01T10:00:00")).isEqualTo("2025-01-01T09:00:00");
    }

    @Test
    @DisplayName("Should classify relative markers")
    void shouldClassifyMarkers() {
        assertThat(TimeMarkers.isRelative("*")).isTrue();
        assertThat(TimeMarkers.isRelative("*-15m")).isTrue();
        assertThat(TimeMarkers.isRelative("2025-01-01")).isFalse();
        assertThat(TimeMarkers.isNow("*")).isTrue();
    }
}
