package com.pibridge.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-leg diagnostic information recorded in {@link ExecutionMetadata}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LegDiagnostics {

    @JsonProperty("leg")
    private StreamLeg leg;

    @JsonProperty("url")
    private String url;

    @JsonProperty("start")
    private String start;

    @JsonProperty("end")
    private String end;

    @JsonProperty("interval")
    private String interval;

    @JsonProperty("max_count")
    private Integer maxCount;

    @JsonProperty("count")
    private int count;

    @JsonProperty("error")
    private String error;

    public LegDiagnostics() {
    }

    public LegDiagnostics(StreamLeg leg, String url) {
        this.leg = leg;
        this.url = url;
    }

    public StreamLeg getLeg() {
        return leg;
    }

    public void setLeg(StreamLeg leg) {
        this.leg = leg;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = start;
    }

    public String getEnd() {
        return end;
    }

    public void setEnd(String end) {
        this.end = end;
    }

    public String getInterval() {
        return interval;
    }

    public void setInterval(String interval) {
        this.interval = interval;
    }

    public Integer getMaxCount() {
        return maxCount;
    }

    public void setMaxCount(Integer maxCount) {
        this.maxCount = maxCount;
    }

    public int getCount() {
        return count;
    }

    public void setCount(int count) {
        this.count = count;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
