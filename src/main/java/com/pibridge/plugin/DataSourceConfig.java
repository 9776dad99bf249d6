package com.pibridge.plugin;

import com.pibridge.query.ConfigurationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Connection settings of one historian data source.
 *
 * Either a full {@code url} (or its alias {@code endpoint}) or a {@code host} and {@code port}
 * must be given. When no default tag is set, the {@code tag} parameter of the URL is used.
 */
public class DataSourceConfig {

    public static final int DEFAULT_PORT = 6066;
    public static final String DEFAULT_PROTOCOL = "http";
    public static final int DEFAULT_TIMEOUT_MS = 10_000;
    public static final int DEFAULT_MAX_RETRIES = 3;

    private static final Pattern URL_TAG = Pattern.compile("[?&]tag=([^&#]+)");

    private String name = "default";
    private String url;
    private String endpoint;
    private String host;
    private Integer port;
    private String protocol = DEFAULT_PROTOCOL;
    private String defaultTag;
    private int timeoutMs = DEFAULT_TIMEOUT_MS;
    private int maxRetries = DEFAULT_MAX_RETRIES;

    public static DataSourceConfig forUrl(String url, String defaultTag) {
        DataSourceConfig config = new DataSourceConfig();
        config.setUrl(url);
        config.setDefaultTag(defaultTag);
        return config;
    }

    /**
     * @throws ConfigurationException if neither a parseable URL nor a valid host and port is set
     */
    public void validate() {
        String fullUrl = fullUrl();
        if (fullUrl != null) {
            URI uri = parseUri(fullUrl);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new ConfigurationException("Historian URL must be absolute: " + fullUrl, "url");
            }
            return;
        }
        if (isBlank(host) || port == null) {
            throw new ConfigurationException("Either a historian URL or a host and port is required", "url");
        }
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("Port must be between 1 and 65535, got " + port, "port");
        }
    }

    /**
     * Scheme, host and port of the configured URL, or the URL composed from host and port.
     */
    public String baseUrl() {
        String fullUrl = fullUrl();
        if (fullUrl != null) {
            URI uri = parseUri(fullUrl);
            String authority = uri.getPort() >= 0 ? uri.getHost() + ":" + uri.getPort() : uri.getHost();
            return uri.getScheme() + "://" + authority;
        }
        if (isBlank(host)) {
            throw new ConfigurationException("Historian base URL is not configured", "url");
        }
        String scheme = isBlank(protocol) ? DEFAULT_PROTOCOL : protocol;
        return scheme + "://" + host + ":" + (port != null ? port : DEFAULT_PORT);
    }

    /**
     * The configured default tag, else the {@code tag} parameter of the URL, else null.
     */
    public String resolvedDefaultTag() {
        if (!isBlank(defaultTag)) {
            return defaultTag;
        }
        for (String candidate : new String[]{url, endpoint}) {
            if (candidate == null) {
                continue;
            }
            Matcher matcher = URL_TAG.matcher(candidate);
            if (matcher.find()) {
                return URLDecoder.decode(matcher.group(1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    public Duration timeout() {
        return Duration.ofMillis(timeoutMs > 0 ? timeoutMs : DEFAULT_TIMEOUT_MS);
    }

    private String fullUrl() {
        if (!isBlank(url)) {
            return url.trim();
        }
        if (!isBlank(endpoint)) {
            return endpoint.trim();
        }
        return null;
    }

    private static URI parseUri(String value) {
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Invalid historian URL: " + value, "url", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public Integer getPort() {
        return port;
    }

    public void setPort(Integer port) {
        this.port = port;
    }

    public String getProtocol() {
        return protocol;
    }

    public void setProtocol(String protocol) {
        this.protocol = protocol;
    }

    public String getDefaultTag() {
        return defaultTag;
    }

    public void setDefaultTag(String defaultTag) {
        this.defaultTag = defaultTag;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    /**
     * Retry hint passed through for logging; reads are attempted once.
     */
    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    @Override
    public String toString() {
        return "DataSourceConfig{name=" + name + ", url=" + (url != null ? url : endpoint)
            + ", host=" + host + ", port=" + port + ", defaultTag=" + defaultTag
            + ", timeoutMs=" + timeoutMs + ", maxRetries=" + maxRetries + "}";
    }
}
