package com.pibridge.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The two independent reads issued for a dual execution.
 */
public enum StreamLeg {

    /**
     * Latest known value: one-hour lookback at 1s granularity, capped to one row.
     */
    INSTANT("real-time"),

    /**
     * Ranged, interval-sampled read over the planned window.
     */
    HISTORICAL("historical");

    private final String value;

    StreamLeg(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
