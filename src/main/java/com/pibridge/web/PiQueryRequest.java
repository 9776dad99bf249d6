package com.pibridge.web;

import com.pibridge.domain.QueryParameters;

/**
 * Body of {@code POST /api/pi/query} and {@code POST /api/pi/preview}.
 */
public class PiQueryRequest {

    private String query;
    private String tag;
    private Integer limit;
    private String interval;

    public PiQueryRequest() {
    }

    public PiQueryRequest(String query, String tag, Integer limit, String interval) {
        this.query = query;
        this.tag = tag;
        this.limit = limit;
        this.interval = interval;
    }

    public QueryParameters toParameters() {
        return new QueryParameters(tag, limit, interval);
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getTag() {
        return tag;
    }

    public void setTag(String tag) {
        this.tag = tag;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public String getInterval() {
        return interval;
    }

    public void setInterval(String interval) {
        this.interval = interval;
    }
}
