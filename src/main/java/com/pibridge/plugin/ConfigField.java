package com.pibridge.plugin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * One entry of a data source's configuration form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConfigField {

    public enum FieldType {
        STRING("string"),
        NUMBER("number"),
        SELECT("select");

        private final String value;

        FieldType(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    private final String name;
    private final FieldType type;
    private final boolean required;
    private final String label;
    private final String description;
    private final Object defaultValue;
    private final List<String> options;

    public ConfigField(String name, FieldType type, boolean required, String label, String description,
                       Object defaultValue, List<String> options) {
        this.name = name;
        this.type = type;
        this.required = required;
        this.label = label;
        this.description = description;
        this.defaultValue = defaultValue;
        this.options = options != null ? List.copyOf(options) : null;
    }

    public static ConfigField required(String name, FieldType type, String label, String description) {
        return new ConfigField(name, type, true, label, description, null, null);
    }

    public static ConfigField optional(String name, FieldType type, String label, String description,
                                       Object defaultValue) {
        return new ConfigField(name, type, false, label, description, defaultValue, null);
    }

    public String getName() {
        return name;
    }

    public FieldType getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public List<String> getOptions() {
        return options;
    }
}
