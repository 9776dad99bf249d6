package com.pibridge.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How an execution was carried out against the historian.
 */
public enum QueryType {

    /**
     * One ranged read (preset keywords and direct URLs).
     */
    SINGLE("single"),

    /**
     * Instant read merged with a historical read.
     */
    DUAL("dual"),

    /**
     * Dual execution whose instant read failed; historical read only.
     */
    FALLBACK("fallback");

    private final String value;

    QueryType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
