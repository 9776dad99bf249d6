package com.pibridge.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.pibridge.domain.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Flattens historian read responses into {@link Sample}s.
 *
 * Accepted envelopes:
 * <ul>
 *   <li>a bare array of {@code {v0, v1}} rows</li>
 *   <li>an array whose first element wraps the rows in {@code data}</li>
 *   <li>an object with a top-level {@code data} array</li>
 * </ul>
 * Rows whose {@code v1} is missing, null or {@code "No Data"} are dropped.
 */
@Component
public class ResponseNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ResponseNormalizer.class);

    public static final String NO_DATA = "No Data";

    private static final String TIMESTAMP_FIELD = "v0";
    private static final String VALUE_FIELD = "v1";
    private static final String DATA_FIELD = "data";

    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    /**
     * @param payload response body, may be null or missing
     * @param tag     tag stamped on every sample
     * @return samples in response order with ids 1..N
     */
    public List<Sample> normalize(JsonNode payload, String tag) {
        List<JsonNode> rows = rows(payload);
        if (rows.isEmpty()) {
            return Collections.emptyList();
        }

        List<Sample> samples = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            if (!row.isObject() || isSentinel(row.get(VALUE_FIELD))) {
                continue;
            }
            JsonNode timestamp = row.get(TIMESTAMP_FIELD);
            if (timestamp == null || timestamp.isNull()) {
                continue;
            }
            samples.add(new Sample(samples.size() + 1, tag, timestamp.asText(), toValue(row.get(VALUE_FIELD))));
        }

        if (samples.size() < rows.size()) {
            log.debug("Dropped {} of {} rows without a usable value for tag {}",
                rows.size() - samples.size(), rows.size(), tag);
        }
        return samples;
    }

    private List<JsonNode> rows(JsonNode payload) {
        if (payload == null || payload.isMissingNode() || payload.isNull()) {
            return Collections.emptyList();
        }
        JsonNode array;
        if (payload.isArray()) {
            JsonNode first = payload.size() > 0 ? payload.get(0) : null;
            if (first != null && first.isObject() && first.path(DATA_FIELD).isArray()) {
                array = first.get(DATA_FIELD);
            } else {
                array = payload;
            }
        } else if (payload.path(DATA_FIELD).isArray()) {
            array = payload.get(DATA_FIELD);
        } else {
            log.warn("Unrecognized historian response shape: {}", payload.getNodeType());
            return Collections.emptyList();
        }

        List<JsonNode> rows = new ArrayList<>(array.size());
        array.forEach(rows::add);
        return rows;
    }

    static boolean isSentinel(JsonNode value) {
        return value == null
            || value.isNull()
            || value.isMissingNode()
            || (value.isTextual() && NO_DATA.equals(value.asText()));
    }

    /**
     * Numeric nodes and strings that read fully as a decimal become {@link Double};
     * anything else is kept as its raw JSON value.
     */
    static Object toValue(JsonNode value) {
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            String text = value.asText();
            String trimmed = text.trim();
            if (DECIMAL.matcher(trimmed).matches()) {
                return Double.parseDouble(trimmed);
            }
            return text;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return value.toString();
    }
}
