package com.pibridge.plugin;

import com.pibridge.domain.ExecutionResult;
import com.pibridge.domain.QueryParameters;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Capabilities every data source type provides.
 */
public interface DataSourcePlugin {

    /**
     * Type tag this plugin is registered under.
     */
    String type();

    List<ConfigField> configSchema();

    /**
     * Validate {@code config} and prepare the plugin for queries.
     *
     * @throws com.pibridge.query.ConfigurationException if the configuration is unusable
     */
    void connect(DataSourceConfig config);

    void disconnect();

    boolean isConnected();

    Mono<Boolean> testConnection();

    /**
     * Tables and columns queries can address, with any tags the server lists.
     */
    Mono<DataSourceSchema> discoverSchema();

    /**
     * A tag matching {@code pattern} (case-insensitive substring), else the first known tag.
     * Empty when the server lists no tags.
     */
    Mono<String> suggestTag(String pattern);

    Mono<ExecutionResult> executeQuery(String query, QueryParameters params);

    /**
     * Human-readable rendering of what {@code query} will do, without executing it.
     */
    String previewQuery(String query, QueryParameters params);
}
