package com.pibridge.plugin;

import com.pibridge.query.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Explicit registry of data source types. Plugins are registered by type tag with a factory;
 * nothing is discovered from the classpath.
 */
public class PluginRegistry {

    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    private final Map<String, Supplier<DataSourcePlugin>> factories = new LinkedHashMap<>();

    public PluginRegistry register(String type, Supplier<DataSourcePlugin> factory) {
        if (factories.putIfAbsent(type, factory) != null) {
            throw new IllegalArgumentException("Data source type already registered: " + type);
        }
        log.info("Registered data source type '{}'", type);
        return this;
    }

    /**
     * A fresh, unconnected plugin instance of {@code type}.
     *
     * @throws ConfigurationException if the type is unknown
     */
    public DataSourcePlugin create(String type) {
        Supplier<DataSourcePlugin> factory = factories.get(type);
        if (factory == null) {
            throw new ConfigurationException("Unknown data source type '" + type + "'. Known types: "
                + factories.keySet(), "type");
        }
        return factory.get();
    }

    public boolean supports(String type) {
        return factories.containsKey(type);
    }

    public Set<String> types() {
        return Collections.unmodifiableSet(factories.keySet());
    }
}
