package com.pibridge.plugin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tables and columns a data source exposes, plus the tags found on the server.
 */
public class DataSourceSchema {

    private final Map<String, List<SchemaField>> fields;
    private final List<String> availableTags;

    public DataSourceSchema(Map<String, List<SchemaField>> fields, List<String> availableTags) {
        Map<String, List<SchemaField>> copy = new LinkedHashMap<>();
        fields.forEach((table, columns) -> copy.put(table, List.copyOf(columns)));
        this.fields = Collections.unmodifiableMap(copy);
        this.availableTags = availableTags != null ? List.copyOf(availableTags) : List.of();
    }

    /**
     * Table names, in declaration order.
     */
    public List<String> getTables() {
        return new ArrayList<>(fields.keySet());
    }

    public Map<String, List<SchemaField>> getFields() {
        return fields;
    }

    public List<String> getAvailableTags() {
        return availableTags;
    }

    public int getTagCount() {
        return availableTags.size();
    }
}
