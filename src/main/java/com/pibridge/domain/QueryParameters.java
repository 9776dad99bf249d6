package com.pibridge.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Caller-supplied execution parameters that accompany the raw query text.
 * All fields are optional at this level; which ones are mandatory depends on the query form.
 */
public class QueryParameters {

    @JsonProperty("tag")
    private String tagOverride;

    @JsonProperty("limit")
    private Integer requestedLimit;

    @JsonProperty("interval")
    private String requestedInterval;

    public QueryParameters() {
    }

    public QueryParameters(String tagOverride, Integer requestedLimit, String requestedInterval) {
        this.tagOverride = tagOverride;
        this.requestedLimit = requestedLimit;
        this.requestedInterval = requestedInterval;
    }

    public static QueryParameters none() {
        return new QueryParameters();
    }

    public static QueryParameters withInterval(String interval) {
        return new QueryParameters(null, null, interval);
    }

    public String getTagOverride() {
        return tagOverride;
    }

    public void setTagOverride(String tagOverride) {
        this.tagOverride = tagOverride;
    }

    public Integer getRequestedLimit() {
        return requestedLimit;
    }

    public void setRequestedLimit(Integer requestedLimit) {
        this.requestedLimit = requestedLimit;
    }

    public String getRequestedInterval() {
        return requestedInterval;
    }

    public void setRequestedInterval(String requestedInterval) {
        this.requestedInterval = requestedInterval;
    }

    public boolean hasTagOverride() {
        return tagOverride != null && !tagOverride.isBlank();
    }

    public boolean hasRequestedLimit() {
        return requestedLimit != null && requestedLimit > 0;
    }

    public boolean hasRequestedInterval() {
        return requestedInterval != null && !requestedInterval.isBlank();
    }

    @Override
    public String toString() {
        return "QueryParameters{tag=" + tagOverride + ", limit=" + requestedLimit
            + ", interval=" + requestedInterval + "}";
    }
}
