package com.pibridge.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Execution details returned alongside the samples of an {@link ExecutionResult}.
 *
 * Leg counts are taken before the merged sequence is truncated to the requested limit.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionMetadata {

    @JsonProperty("query_type")
    private QueryType queryType;

    @JsonProperty("tag")
    private String tag;

    @JsonProperty("interval")
    private String interval;

    @JsonProperty("real_time_count")
    private int realTimeCount;

    @JsonProperty("historical_count")
    private int historicalCount;

    @JsonProperty("total_count")
    private int totalCount;

    @JsonProperty("requested_limit")
    private Integer requestedLimit;

    @JsonProperty("is_fallback")
    private boolean fallback;

    @JsonProperty("fallback_reason")
    private String fallbackReason;

    @JsonProperty("real_time")
    private LegDiagnostics instantLeg;

    @JsonProperty("historical")
    private LegDiagnostics historicalLeg;

    @JsonProperty("execution_time_ms")
    private long executionTimeMs;

    public QueryType getQueryType() {
        return queryType;
    }

    public void setQueryType(QueryType queryType) {
        this.queryType = queryType;
    }

    public String getTag() {
        return tag;
    }

    public void setTag(String tag) {
        this.tag = tag;
    }

    public String getInterval() {
        return interval;
    }

    public void setInterval(String interval) {
        this.interval = interval;
    }

    public int getRealTimeCount() {
        return realTimeCount;
    }

    public void setRealTimeCount(int realTimeCount) {
        this.realTimeCount = realTimeCount;
    }

    public int getHistoricalCount() {
        return historicalCount;
    }

    public void setHistoricalCount(int historicalCount) {
        this.historicalCount = historicalCount;
    }

    public int getTotalCount() {
        return totalCount;
    }

    public void setTotalCount(int totalCount) {
        this.totalCount = totalCount;
    }

    public Integer getRequestedLimit() {
        return requestedLimit;
    }

    public void setRequestedLimit(Integer requestedLimit) {
        this.requestedLimit = requestedLimit;
    }

    public boolean isFallback() {
        return fallback;
    }

    public void setFallback(boolean fallback) {
        this.fallback = fallback;
    }

    public String getFallbackReason() {
        return fallbackReason;
    }

    public void setFallbackReason(String fallbackReason) {
        this.fallbackReason = fallbackReason;
    }

    public LegDiagnostics getInstantLeg() {
        return instantLeg;
    }

    public void setInstantLeg(LegDiagnostics instantLeg) {
        this.instantLeg = instantLeg;
    }

    public LegDiagnostics getHistoricalLeg() {
        return historicalLeg;
    }

    public void setHistoricalLeg(LegDiagnostics historicalLeg) {
        this.historicalLeg = historicalLeg;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public void setExecutionTimeMs(long executionTimeMs) {
        this.executionTimeMs = executionTimeMs;
    }
}
