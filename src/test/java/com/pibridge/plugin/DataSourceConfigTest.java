package com.pibridge.plugin;

import com.pibridge.query.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DataSourceConfig Tests")
class DataSourceConfigTest {

    @Test
    @DisplayName("Should derive the base URL from a full URL")
    void shouldDeriveBaseUrlFromUrl() {
        DataSourceConfig config = DataSourceConfig.forUrl("https://pi.example.com:5460/pi/trn?tag=SINUSOID", null);

        assertThatCode(config::validate).doesNotThrowAnyException();
        assertThat(config.baseUrl()).isEqualTo("https://pi.example.com:5460");
        assertThat(config.resolvedDefaultTag()).isEqualTo("SINUSOID");
    }

    @Test
    @DisplayName("Should accept the endpoint alias and decode its tag")
    void shouldUseEndpointAlias() {
        DataSourceConfig config = new DataSourceConfig();
        config.setEndpoint("http://pi/pi/trn?interval=1m&tag=Unit%201");

        config.validate();

        assertThat(config.baseUrl()).isEqualTo("http://pi");
        assertThat(config.resolvedDefaultTag()).isEqualTo("Unit 1");
    }

    @Test
    @DisplayName("Should prefer the configured default tag over the URL tag")
    void shouldPreferConfiguredTag() {
        DataSourceConfig config = DataSourceConfig.forUrl("http://pi:6066/pi/trn?tag=A", "B");

        assertThat(config.resolvedDefaultTag()).isEqualTo("B");
    }

    @Test
    @DisplayName("Should compose the base URL from host, port and protocol")
    void shouldComposeFromHostAndPort() {
        DataSourceConfig config = new DataSourceConfig();
        config.setHost("10.0.0.5");
        config.setPort(6066);

        config.validate();

        assertThat(config.baseUrl()).isEqualTo("http://10.0.0.5:6066");
        assertThat(config.resolvedDefaultTag()).isNull();

        config.setProtocol("https");
        assertThat(config.baseUrl()).isEqualTo("https://10.0.0.5:6066");
    }

    @Test
    @DisplayName("Should require a URL or a host and port")
    void shouldRequireLocation() {
        assertThatThrownBy(() -> new DataSourceConfig().validate())
            .isInstanceOf(ConfigurationException.class)
            .hasMessage("Either a historian URL or a host and port is required");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 65536})
    @DisplayName("Should reject ports outside 1..65535")
    void shouldRejectBadPorts(int port) {
        DataSourceConfig config = new DataSourceConfig();
        config.setHost("pi");
        config.setPort(port);

        assertThatThrownBy(config::validate)
            .isInstanceOf(ConfigurationException.class)
            .satisfies(e -> assertThat(((ConfigurationException) e).getField()).isEqualTo("port"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"pi:6066/pi/trn", "/pi/trn", "http://pi:6066/pi trn"})
    @DisplayName("Should reject relative or malformed URLs")
    void shouldRejectBadUrls(String url) {
        assertThatThrownBy(() -> DataSourceConfig.forUrl(url, "T").validate())
            .isInstanceOf(ConfigurationException.class)
            .satisfies(e -> assertThat(((ConfigurationException) e).getField()).isEqualTo("url"));
    }

    @Test
    @DisplayName("Should fall back to the default timeout when none is positive")
    void shouldDefaultTimeout() {
        DataSourceConfig config = new DataSourceConfig();
        assertThat(config.timeout()).isEqualTo(Duration.ofSeconds(10));

        config.setTimeoutMs(0);
        assertThat(config.timeout()).isEqualTo(Duration.ofSeconds(10));

        config.setTimeoutMs(2500);
        assertThat(config.timeout()).isEqualTo(Duration.ofMillis(2500));
    }
}
