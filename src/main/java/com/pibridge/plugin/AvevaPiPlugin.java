package com.pibridge.plugin;

import com.pibridge.domain.ExecutionResult;
import com.pibridge.domain.QueryParameters;
import com.pibridge.historian.HistorianClient;
import com.pibridge.historian.HistorianClientRestImpl;
import com.pibridge.query.ConfigurationException;
import com.pibridge.query.PiQueryEngine;
import com.pibridge.query.PiQueryMetrics;
import com.pibridge.query.PresetQuery;
import com.pibridge.query.QueryParser;
import com.pibridge.query.ResponseNormalizer;
import com.pibridge.query.ResultMerger;
import com.pibridge.query.StreamExecutor;
import com.pibridge.query.TimeWindowPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static com.pibridge.plugin.ConfigField.FieldType.NUMBER;
import static com.pibridge.plugin.ConfigField.FieldType.SELECT;
import static com.pibridge.plugin.ConfigField.FieldType.STRING;

/**
 * AVEVA PI historian data source, read through its {@code /pi/trn} HTTP endpoint.
 */
public class AvevaPiPlugin implements DataSourcePlugin {

    private static final Logger log = LoggerFactory.getLogger(AvevaPiPlugin.class);

    public static final String TYPE = "aveva-pi";

    private static final List<ConfigField> CONFIG_SCHEMA = List.of(
        ConfigField.required("host", STRING, "Host", "AVEVA PI server hostname or IP address"),
        ConfigField.optional("port", NUMBER, "Port", "AVEVA PI server port", DataSourceConfig.DEFAULT_PORT),
        new ConfigField("protocol", SELECT, false, "Protocol", "Connection protocol",
            DataSourceConfig.DEFAULT_PROTOCOL, List.of("http", "https")),
        ConfigField.optional("timeout", NUMBER, "Timeout", "Request timeout in milliseconds",
            DataSourceConfig.DEFAULT_TIMEOUT_MS),
        ConfigField.optional("maxRetries", NUMBER, "Max Retries", "Maximum number of retry attempts",
            DataSourceConfig.DEFAULT_MAX_RETRIES),
        ConfigField.required("defaultTag", STRING, "Default AVEVA PI Tag",
            "Tag queried when a query names none")
    );

    private static final Map<String, List<SchemaField>> TABLES = tables();

    private final QueryParser parser;
    private final TimeWindowPlanner planner;
    private final ResponseNormalizer normalizer;
    private final ResultMerger merger;
    private final PiQueryMetrics metrics;
    private final Function<String, HistorianClient> clientFactory;
    private final int defaultLimit;

    private volatile Connection connection;

    public AvevaPiPlugin(QueryParser parser, TimeWindowPlanner planner, ResponseNormalizer normalizer,
                         ResultMerger merger, PiQueryMetrics metrics, WebClient.Builder webClientBuilder,
                         int defaultLimit) {
        this(parser, planner, normalizer, merger, metrics,
            name -> new HistorianClientRestImpl(webClientBuilder, name), defaultLimit);
    }

    AvevaPiPlugin(QueryParser parser, TimeWindowPlanner planner, ResponseNormalizer normalizer,
                  ResultMerger merger, PiQueryMetrics metrics, Function<String, HistorianClient> clientFactory,
                  int defaultLimit) {
        this.parser = parser;
        this.planner = planner;
        this.normalizer = normalizer;
        this.merger = merger;
        this.metrics = metrics;
        this.clientFactory = clientFactory;
        this.defaultLimit = defaultLimit;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public List<ConfigField> configSchema() {
        return CONFIG_SCHEMA;
    }

    @Override
    public void connect(DataSourceConfig config) {
        config.validate();
        String defaultTag = config.resolvedDefaultTag();
        if (defaultTag == null) {
            throw new ConfigurationException(
                "No default tag configured and none found in the URL's tag parameter", "defaultTag");
        }
        String baseUrl = config.baseUrl();

        HistorianClient client = clientFactory.apply(config.getName());
        StreamExecutor executor = new StreamExecutor(client, normalizer, planner, baseUrl, config.timeout());
        PiQueryEngine engine = new PiQueryEngine(parser, planner, executor, merger, metrics, defaultTag, defaultLimit);

        this.connection = new Connection(config, baseUrl, defaultTag, client, engine);
        log.info("AVEVA PI data source '{}' configured at {} with default tag {} (timeout={}ms, maxRetries={})",
            config.getName(), baseUrl, defaultTag, config.getTimeoutMs(), config.getMaxRetries());
    }

    @Override
    public void disconnect() {
        Connection current = this.connection;
        if (current != null) {
            this.connection = null;
            log.info("Disconnected AVEVA PI data source '{}'", current.config.getName());
        }
    }

    @Override
    public boolean isConnected() {
        return connection != null;
    }

    @Override
    public Mono<Boolean> testConnection() {
        return Mono.defer(() -> {
            Connection current = requireConnection();
            return current.client.testConnection(current.baseUrl, current.config.timeout());
        });
    }

    /**
     * The fixed {@code tags}/{@code points}/{@code values} tables, with whatever tags the
     * historian's listing endpoints return. Tag discovery failures leave the tag list empty.
     */
    @Override
    public Mono<DataSourceSchema> discoverSchema() {
        return Mono.defer(() -> {
            Connection current = requireConnection();
            return current.client.discoverTags(current.baseUrl, current.config.timeout())
                .map(tags -> new DataSourceSchema(TABLES, tags))
                .doOnNext(schema -> log.info("AVEVA PI schema for '{}': tables={}, {} tags",
                    current.config.getName(), schema.getTables(), schema.getTagCount()));
        });
    }

    @Override
    public Mono<String> suggestTag(String pattern) {
        return Mono.defer(() -> {
            Connection current = requireConnection();
            return current.client.discoverTags(current.baseUrl, current.config.timeout())
                .flatMap(tags -> Mono.justOrEmpty(pickTag(tags, pattern)));
        });
    }

    /**
     * First tag containing {@code pattern} case-insensitively, else the first tag.
     */
    static Optional<String> pickTag(List<String> tags, String pattern) {
        if (tags.isEmpty()) {
            return Optional.empty();
        }
        if (pattern != null && !pattern.isBlank()) {
            String needle = pattern.toLowerCase(Locale.ROOT);
            Optional<String> match = tags.stream()
                .filter(tag -> tag.toLowerCase(Locale.ROOT).contains(needle))
                .findFirst();
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.of(tags.get(0));
    }

    @Override
    public Mono<ExecutionResult> executeQuery(String query, QueryParameters params) {
        return Mono.defer(() -> requireConnection().engine.execute(query, params));
    }

    @Override
    public String previewQuery(String query, QueryParameters params) {
        QueryParameters parameters = params != null ? params : QueryParameters.none();
        Connection current = this.connection;
        String tag = parameters.hasTagOverride()
            ? parameters.getTagOverride()
            : current != null ? current.defaultTag : "unknown";

        if (query == null || query.isBlank()) {
            return "Unknown query format: " + query;
        }
        String text = query.replace("{tag}", tag).trim();

        Optional<PresetQuery> preset = PresetQuery.find(text);
        if (preset.isPresent()) {
            return preset.get().toSql(tag);
        }
        if (text.toLowerCase(Locale.ROOT).startsWith("http")) {
            String urlTag = PiQueryEngine.queryParameter(text, "tag");
            return "Direct AVEVA PI URL Query\nTag: " + (urlTag != null ? urlTag : "unknown") + "\nURL: " + text;
        }
        if (text.toUpperCase(Locale.ROOT).startsWith("SELECT")) {
            return PiQueryEngine.bindTag(text, tag);
        }
        return "Unknown query format: " + query;
    }

    private static Map<String, List<SchemaField>> tables() {
        Map<String, List<SchemaField>> tables = new LinkedHashMap<>();
        tables.put("tags", List.of(
            SchemaField.primaryKey("name", "string"),
            SchemaField.nullable("description", "string"),
            SchemaField.nullable("units", "string"),
            SchemaField.nullable("pointtype", "string")));
        tables.put("points", List.of(
            SchemaField.primaryKey("tag", "string"),
            SchemaField.required("timestamp", "datetime"),
            SchemaField.required("value", "number"),
            SchemaField.nullable("status", "number")));
        tables.put("values", List.of(
            SchemaField.required("tag", "string"),
            SchemaField.required("start_time", "datetime"),
            SchemaField.required("end_time", "datetime"),
            SchemaField.required("interval", "string"),
            SchemaField.required("values", "array")));
        return tables;
    }

    private Connection requireConnection() {
        Connection current = this.connection;
        if (current == null) {
            throw new ConfigurationException("AVEVA PI data source is not connected");
        }
        return current;
    }

    /**
     * State created by {@link #connect(DataSourceConfig)}.
     */
    private static final class Connection {

        private final DataSourceConfig config;
        private final String baseUrl;
        private final String defaultTag;
        private final HistorianClient client;
        private final PiQueryEngine engine;

        private Connection(DataSourceConfig config, String baseUrl, String defaultTag, HistorianClient client,
                           PiQueryEngine engine) {
            this.config = config;
            this.baseUrl = baseUrl;
            this.defaultTag = defaultTag;
            this.client = client;
            this.engine = engine;
        }
    }
}
