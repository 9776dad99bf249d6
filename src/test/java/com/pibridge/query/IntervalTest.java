package com.pibridge.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Interval Tests")
class IntervalTest {

    @Test
    @DisplayName("Should parse count and unit, ignoring case and surrounding blanks")
    void shouldParseIntervals() {
        assertThat(Interval.parse("15m")).isEqualTo(Interval.FIFTEEN_MINUTES);
        assertThat(Interval.parse(" 1D ")).isEqualTo(Interval.ONE_DAY);
        assertThat(Interval.parse("30s").toDuration()).isEqualTo(Duration.ofSeconds(30));
        assertThat(Interval.parse("2h").toString()).isEqualTo("2h");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "abc", "5x", "m5", "1.5h", "0m", "-1h", "7m", "90s", "60m", "1s", "01h",
        "999999999999999d", "99999999999999999999s"})
    @DisplayName("Should reject anything outside the standard granularities")
    void shouldRejectInvalidIntervals(String text) {
        assertThatThrownBy(() -> Interval.parse(text)).isInstanceOf(QueryParseException.class);
    }

    @Test
    @DisplayName("Should accept every standard granularity by its own text")
    void shouldParseEveryStandardInterval() {
        for (Interval interval : Interval.STANDARD) {
            assertThat(Interval.parse(interval.toString())).isSameAs(interval);
        }
    }

    @Test
    @DisplayName("Should reject a missing interval")
    void shouldRejectNull() {
        assertThatThrownBy(() -> Interval.parse(null))
            .isInstanceOf(QueryParseException.class)
            .hasMessageContaining("required");
    }

    @Test
    @DisplayName("Should convert to fractional hours")
    void shouldConvertToHours() {
        assertThat(Interval.THIRTY_MINUTES.toHours()).isCloseTo(0.5, within(1e-9));
        assertThat(Interval.ONE_DAY.toHours()).isCloseTo(24.0, within(1e-9));
        assertThat(Interval.THIRTY_SECONDS.toHours()).isCloseTo(1.0 / 120, within(1e-9));
    }

    @Test
    @DisplayName("Standard set should be ordered by duration and exclude the instant granularity")
    void standardSetShouldBeOrdered() {
        List<Interval> sorted = new ArrayList<>(Interval.STANDARD);
        sorted.sort(null);

        assertThat(Interval.STANDARD).containsExactlyElementsOf(sorted);
        assertThat(Interval.STANDARD).hasSize(10);
        assertThat(Interval.ONE_SECOND.isStandard()).isFalse();
        assertThat(Interval.parse("12h").isStandard()).isTrue();
    }

    @Test
    @DisplayName("Should bucket window lengths at the documented boundaries")
    void shouldBucketWindows() {
        assertThat(Interval.optimalFor(Duration.ofMinutes(15))).isEqualTo(Interval.THIRTY_SECONDS);
        assertThat(Interval.optimalFor(Duration.ofMinutes(16))).isEqualTo(Interval.ONE_MINUTE);
        assertThat(Interval.optimalFor(Duration.ofHours(1))).isEqualTo(Interval.ONE_MINUTE);
        assertThat(Interval.optimalFor(Duration.ofHours(6))).isEqualTo(Interval.FIVE_MINUTES);
        assertThat(Interval.optimalFor(Duration.ofHours(24))).isEqualTo(Interval.FIFTEEN_MINUTES);
        assertThat(Interval.optimalFor(Duration.ofDays(7))).isEqualTo(Interval.ONE_HOUR);
        assertThat(Interval.optimalFor(Duration.ofDays(30))).isEqualTo(Interval.SIX_HOURS);
        assertThat(Interval.optimalFor(Duration.ofDays(31))).isEqualTo(Interval.ONE_DAY);
    }

    @Test
    @DisplayName("Granularity should never decrease as the window grows")
    void optimalIntervalShouldBeMonotonic() {
        Interval previous = Interval.optimalFor(Duration.ZERO);
        for (long minutes = 1; minutes <= 60L * 24 * 60; minutes += 7) {
            Interval current = Interval.optimalFor(Duration.ofMinutes(minutes));
            assertThat(current.compareTo(previous))
                .as("window of %d minutes", minutes)
                .isGreaterThanOrEqualTo(0);
            previous = current;
        }
    }
}
