package com.pibridge.query;

import java.util.Objects;

/**
 * A caller-fixed time range expressed in historian markers.
 */
public class TimeRange {

    private final String start;
    private final String end;

    public TimeRange(String start, String end) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = end != null ? end : TimeMarkers.NOW;
    }

    /**
     * Range from {@code start} up to now.
     */
    public static TimeRange since(String start) {
        return new TimeRange(start, TimeMarkers.NOW);
    }

    public String getStart() {
        return start;
    }

    public String getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
