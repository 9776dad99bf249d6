package com.pibridge.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A single historian reading for one tag.
 *
 * The timestamp is kept in the provider's own string form. The value is a {@link Double}
 * when the raw reading parses cleanly as a number, otherwise the raw reading itself.
 */
@JsonPropertyOrder({"id", "tag", "timestamp", "value"})
public class Sample {

    @JsonProperty("id")
    private final int id;

    @JsonProperty("tag")
    private final String tag;

    @JsonProperty("timestamp")
    private final String timestamp;

    @JsonProperty("value")
    private final Object value;

    public Sample(int id, String tag, String timestamp, Object value) {
        this.id = id;
        this.tag = tag;
        this.timestamp = timestamp;
        this.value = value;
    }

    public Sample(String tag, String timestamp, Object value) {
        this(0, tag, timestamp, value);
    }

    public int getId() {
        return id;
    }

    public String getTag() {
        return tag;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public Object getValue() {
        return value;
    }

    /**
     * Copy of this sample carrying a new sequential id.
     */
    public Sample withId(int newId) {
        return new Sample(newId, tag, timestamp, value);
    }

    @JsonIgnore
    public boolean isNumeric() {
        return value instanceof Number;
    }

    public OptionalDouble numericValue() {
        if (value instanceof Number) {
            return OptionalDouble.of(((Number) value).doubleValue());
        }
        return OptionalDouble.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Sample)) {
            return false;
        }
        Sample sample = (Sample) o;
        return id == sample.id
            && Objects.equals(tag, sample.tag)
            && Objects.equals(timestamp, sample.timestamp)
            && Objects.equals(value, sample.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, tag, timestamp, value);
    }

    @Override
    public String toString() {
        return "Sample{id=" + id + ", tag='" + tag + "', timestamp='" + timestamp + "', value=" + value + "}";
    }
}
