package com.pibridge.historian;

import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One read against the historian's {@code /pi/trn} endpoint.
 */
public class HistorianRequest {

    static final String READ_PATH = "/pi/trn";

    private final String baseUrl;
    private final String tag;
    private final String interval;
    private final String start;
    private final String end;
    private final Integer maxCount;

    public HistorianRequest(String baseUrl, String tag, String interval, String start, String end, Integer maxCount) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.tag = Objects.requireNonNull(tag, "tag");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        this.maxCount = maxCount;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getTag() {
        return tag;
    }

    public String getInterval() {
        return interval;
    }

    public String getStart() {
        return start;
    }

    public String getEnd() {
        return end;
    }

    public Integer getMaxCount() {
        return maxCount;
    }

    /**
     * {@code {baseUrl}/pi/trn?tag=&interval=&start=&end=[&maxCount=]}. Values are expanded as URI
     * variables, so every character outside the unreserved set is percent-encoded, {@code +} and
     * {@code *} included.
     */
    public URI toUri() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("tag", tag);
        values.put("interval", interval);
        values.put("start", start);
        values.put("end", end);
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(stripTrailingSlash(baseUrl))
            .path(READ_PATH)
            .queryParam("tag", "{tag}")
            .queryParam("interval", "{interval}")
            .queryParam("start", "{start}")
            .queryParam("end", "{end}");
        if (maxCount != null && maxCount > 0) {
            builder.queryParam("maxCount", "{maxCount}");
            values.put("maxCount", maxCount);
        }
        return builder.encode().buildAndExpand(values).toUri();
    }

    public String toUrl() {
        return toUri().toString();
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public String toString() {
        return toUrl();
    }
}
