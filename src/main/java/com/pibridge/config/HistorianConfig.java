package com.pibridge.config;

import com.pibridge.plugin.AvevaPiPlugin;
import com.pibridge.plugin.DataSourceConfig;
import com.pibridge.plugin.DataSourcePlugin;
import com.pibridge.plugin.PluginRegistry;
import com.pibridge.query.PiQueryMetrics;
import com.pibridge.query.QueryParser;
import com.pibridge.query.ResponseNormalizer;
import com.pibridge.query.ResultMerger;
import com.pibridge.query.TimeWindowPlanner;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Wires the plugin registry and the historian data source from {@code pibridge.*} properties.
 */
@Configuration
public class HistorianConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PluginRegistry pluginRegistry(
            QueryParser parser,
            TimeWindowPlanner planner,
            ResponseNormalizer normalizer,
            ResultMerger merger,
            PiQueryMetrics metrics,
            WebClient.Builder webClientBuilder,
            @Value("${pibridge.query.default-limit:10}") int defaultLimit) {
        return new PluginRegistry()
            .register(AvevaPiPlugin.TYPE,
                () -> new AvevaPiPlugin(parser, planner, normalizer, merger, metrics, webClientBuilder, defaultLimit));
    }

    @Bean
    public DataSourceConfig historianDataSourceConfig(
            @Value("${pibridge.historian.name:default}") String name,
            @Value("${pibridge.historian.url:}") String url,
            @Value("${pibridge.historian.host:}") String host,
            @Value("${pibridge.historian.port:" + DataSourceConfig.DEFAULT_PORT + "}") int port,
            @Value("${pibridge.historian.protocol:" + DataSourceConfig.DEFAULT_PROTOCOL + "}") String protocol,
            @Value("${pibridge.historian.default-tag:}") String defaultTag,
            @Value("${pibridge.historian.timeout-ms:" + DataSourceConfig.DEFAULT_TIMEOUT_MS + "}") int timeoutMs,
            @Value("${pibridge.historian.max-retries:" + DataSourceConfig.DEFAULT_MAX_RETRIES + "}") int maxRetries) {
        DataSourceConfig config = new DataSourceConfig();
        config.setName(name);
        config.setUrl(emptyToNull(url));
        config.setHost(emptyToNull(host));
        config.setPort(port);
        config.setProtocol(protocol);
        config.setDefaultTag(emptyToNull(defaultTag));
        config.setTimeoutMs(timeoutMs);
        config.setMaxRetries(maxRetries);
        return config;
    }

    /**
     * The historian data source, connected at startup.
     */
    @Bean(destroyMethod = "disconnect")
    public DataSourcePlugin historianDataSource(PluginRegistry registry, DataSourceConfig historianDataSourceConfig) {
        DataSourcePlugin plugin = registry.create(AvevaPiPlugin.TYPE);
        plugin.connect(historianDataSourceConfig);
        return plugin;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
