package com.pibridge.query;

/**
 * Thrown when the data source cannot support an execution: no tag and no configured
 * default tag, a missing base URL, or an invalid connection setting.
 */
public class ConfigurationException extends RuntimeException {

    private final String field;

    public ConfigurationException(String message) {
        super(message);
        this.field = null;
    }

    public ConfigurationException(String message, String field) {
        super(message);
        this.field = field;
    }

    public ConfigurationException(String message, String field, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
