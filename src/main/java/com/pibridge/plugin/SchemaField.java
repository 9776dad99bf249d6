package com.pibridge.plugin;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One column of a table a data source exposes to queries.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SchemaField {

    private final String name;
    private final String type;
    private final boolean nullable;
    private final String key;

    public SchemaField(String name, String type, boolean nullable, String key) {
        this.name = name;
        this.type = type;
        this.nullable = nullable;
        this.key = key;
    }

    public static SchemaField primaryKey(String name, String type) {
        return new SchemaField(name, type, false, "PRIMARY");
    }

    public static SchemaField required(String name, String type) {
        return new SchemaField(name, type, false, null);
    }

    public static SchemaField nullable(String name, String type) {
        return new SchemaField(name, type, true, null);
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public boolean isNullable() {
        return nullable;
    }

    public String getKey() {
        return key;
    }
}
