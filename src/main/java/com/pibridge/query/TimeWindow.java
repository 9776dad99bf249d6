package com.pibridge.query;

import java.util.Objects;

/**
 * A resolved read window: start and end markers, sampling interval and optional row cap.
 */
public class TimeWindow {

    private final String start;
    private final String end;
    private final Interval interval;
    private final Integer maxCount;
    private final PlanningRule rule;

    public TimeWindow(String start, String end, Interval interval, Integer maxCount, PlanningRule rule) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.maxCount = maxCount;
        this.rule = rule;
    }

    public String getStart() {
        return start;
    }

    public String getEnd() {
        return end;
    }

    public Interval getInterval() {
        return interval;
    }

    public Integer getMaxCount() {
        return maxCount;
    }

    public boolean hasMaxCount() {
        return maxCount != null && maxCount > 0;
    }

    /**
     * The rule that produced this window.
     */
    public PlanningRule getRule() {
        return rule;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeWindow)) {
            return false;
        }
        TimeWindow that = (TimeWindow) o;
        return start.equals(that.start)
            && end.equals(that.end)
            && interval.equals(that.interval)
            && Objects.equals(maxCount, that.maxCount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, interval, maxCount);
    }

    @Override
    public String toString() {
        return "TimeWindow{" + start + ".." + end + ", interval=" + interval
            + (maxCount != null ? ", maxCount=" + maxCount : "")
            + (rule != null ? ", rule=" + rule : "") + "}";
    }
}
