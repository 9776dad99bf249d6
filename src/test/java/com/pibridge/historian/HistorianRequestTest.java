package com.pibridge.historian;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HistorianRequest Tests")
class HistorianRequestTest {

    @Test
    @DisplayName("Should build the read URL with maxCount when positive")
    void shouldBuildReadUrl() {
        HistorianRequest request = new HistorianRequest("http://pi:6066/", "SINUSOID", "1m", "*-1h", "*", 10);

        assertThat(request.toUrl())
            .isEqualTo("http://pi:6066/pi/trn?tag=SINUSOID&interval=1m&start=%2A-1h&end=%2A&maxCount=10");
    }

    @Test
    @DisplayName("Should omit maxCount when absent or not positive")
    void shouldOmitMaxCount() {
        assertThat(new HistorianRequest("http://pi:6066", "T", "1m", "*-1h", "*", null).toUrl())
            .doesNotContain("maxCount");
        assertThat(new HistorianRequest("http://pi:6066", "T", "1m", "*-1h", "*", 0).toUrl())
            .doesNotContain("maxCount");
    }

    @Test
    @DisplayName("Should percent-encode spaces and reserved characters in values")
    void shouldEncodeValues() {
        HistorianRequest request = new HistorianRequest("https://pi.example.com", "Unit 1&2", "5m",
            "2025-01-01 09:00:00", "2025-01-01 10:00:00", null);

        assertThat(request.toUrl()).isEqualTo("https://pi.example.com/pi/trn?tag=Unit%201%262&interval=5m"
            + "&start=2025-01-01%2009%3A00%3A00&end=2025-01-01%2010%3A00%3A00");
    }

    @Test
    @DisplayName("Should encode a plus sign so the historian does not read it as a space")
    void shouldEncodePlusInTag() {
        // Given
        HistorianRequest request = new HistorianRequest("http://pi:6066", "A+B C&D", "1h", "*-1d", "*", null);

        // When
        String url = request.toUrl();

        // Then
        assertThat(url).contains("tag=A%2BB%20C%26D&");
        assertThat(request.toUri().getQuery()).startsWith("tag=A+B C&D&interval=1h");
    }

    @Test
    @DisplayName("Should require the mandatory parameters")
    void shouldRequireParameters() {
        assertThatThrownBy(() -> new HistorianRequest("http://pi", null, "1m", "*-1h", "*", null))
            .isInstanceOf(NullPointerException.class)
            .hasMessage("tag");
    }
}
