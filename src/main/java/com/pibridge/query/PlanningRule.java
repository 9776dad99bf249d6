package com.pibridge.query;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Window resolution rules in priority order. {@link TimeWindowPlanner} takes the first rule
 * whose {@link #applies(PlanningRequest)} holds.
 */
public enum PlanningRule {

    /** Caller-fixed range, as used by the instant leg. */
    EXPLICIT_RANGE {
        @Override
        boolean applies(PlanningRequest request) {
            return request.getExplicitRange() != null;
        }

        @Override
        TimeWindow resolve(PlanningRequest request) {
            TimeRange range = request.getExplicitRange();
            Interval interval = request.getExplicitInterval();
            if (interval == null) {
                Optional<Instant> start = TimeMarkers.resolve(range.getStart(), request.getClock());
                Optional<Instant> end = TimeMarkers.resolve(range.getEnd(), request.getClock());
                interval = start.isPresent() && end.isPresent()
                    ? Interval.optimalFor(Duration.between(start.get(), end.get()).abs())
                    : Interval.ONE_MINUTE;
            }
            return window(range.getStart(), range.getEnd(), interval, request);
        }
    },

    /** Interval and limit known: the window spans exactly {@code limit} intervals. */
    INTERVAL_WITH_LIMIT {
        @Override
        boolean applies(PlanningRequest request) {
            return request.hasExplicitInterval() && request.hasKnownLimit();
        }

        @Override
        TimeWindow resolve(PlanningRequest request) {
            Interval interval = request.getExplicitInterval();
            double hours = request.getKnownLimit() * interval.toHours();
            Duration span = Duration.ofSeconds(Math.round(hours * SECONDS_PER_HOUR));
            return window(TimeMarkers.relative(span), TimeMarkers.NOW, interval, request);
        }
    },

    /** Interval alone: lookback sized to the granularity. */
    INTERVAL_LOOKBACK {
        @Override
        boolean applies(PlanningRequest request) {
            return request.hasExplicitInterval();
        }

        @Override
        TimeWindow resolve(PlanningRequest request) {
            Interval interval = request.getExplicitInterval();
            return window(TimeMarkers.relative(lookbackFor(interval)), TimeMarkers.NOW, interval, request);
        }
    },

    TIMESTAMP_BETWEEN {
        @Override
        boolean applies(PlanningRequest request) {
            WhereConditions.Bounds<String> between = request.getWhere().getTimestampBetween();
            return between != null
                && TimeMarkers.parseAbsolute(between.getLower()).isPresent()
                && TimeMarkers.parseAbsolute(between.getUpper()).isPresent();
        }

        @Override
        TimeWindow resolve(PlanningRequest request) {
            WhereConditions.Bounds<String> between = request.getWhere().getTimestampBetween();
            Instant start = TimeMarkers.parseAbsolute(between.getLower()).orElseThrow();
            Instant end = TimeMarkers.parseAbsolute(between.getUpper()).orElseThrow();
            Interval interval = Interval.optimalFor(Duration.between(start, end).abs());
            return window(between.getLower(), between.getUpper(), interval, request);
        }
    },

    /** Lower bound only: up to now. */
    TIMESTAMP_FROM {
        @Override
        boolean applies(PlanningRequest request) {
            return TimeMarkers.parseAbsolute(request.getWhere().getTimestampGte()).isPresent();
        }

        @Override
        TimeWindow resolve(PlanningRequest request) {
            String from = request.getWhere().getTimestampGte();
            Instant start = TimeMarkers.parseAbsolute(from).orElseThrow();
            Duration span = Duration.between(start, request.getClock().instant()).abs();
            return window(from, TimeMarkers.NOW, Interval.optimalFor(span), request);
        }
    },

    /** Upper bound only: one hour back from it. */
    TIMESTAMP_UNTIL {
        @Override
        boolean applies(PlanningRequest request) {
            return TimeMarkers.parseAbsolute(request.getWhere().getTimestampLte()).isPresent();
        }

        @Override
        TimeWindow resolve(PlanningRequest request) {
            String until = request.getWhere().getTimestampLte();
            Instant end = TimeMarkers.parseAbsolute(until).orElseThrow();
            String start = TimeMarkers.formatLike(end.minus(UNTIL_LOOKBACK), until);
            return window(start, until, Interval.optimalFor(UNTIL_LOOKBACK), request);
        }
    },

    LEGACY_DATE_SUB {
        @Override
        boolean applies(PlanningRequest request) {
            return request.getParsed().getLegacyTimeRange() != null;
        }

        @Override
        TimeWindow resolve(PlanningRequest request) {
            LegacyTimeRange legacy = request.getParsed().getLegacyTimeRange();
            return window(legacy.toStartMarker(), TimeMarkers.NOW,
                Interval.optimalFor(legacy.toDuration()), request);
        }
    },

    /** Limit alone: assume about one sample per minute with some headroom. */
    LIMIT_ESTIMATE {
        @Override
        boolean applies(PlanningRequest request) {
            return request.hasKnownLimit();
        }

        @Override
        TimeWindow resolve(PlanningRequest request) {
            long minutes = Math.max(MIN_ESTIMATE_MINUTES, (long) Math.ceil(request.getKnownLimit() * LIMIT_HEADROOM));
            Duration span = Duration.ofMinutes(minutes);
            return window(TimeMarkers.relative(span), TimeMarkers.NOW, Interval.optimalFor(span), request);
        }
    },

    DEFAULT_LOOKBACK {
        @Override
        boolean applies(PlanningRequest request) {
            return true;
        }

        @Override
        TimeWindow resolve(PlanningRequest request) {
            return window(TimeMarkers.relative(DEFAULT_SPAN), TimeMarkers.NOW,
                Interval.optimalFor(DEFAULT_SPAN), request);
        }
    };

    private static final Duration UNTIL_LOOKBACK = Duration.ofHours(1);
    private static final Duration DEFAULT_SPAN = Duration.ofHours(1);
    private static final long MIN_ESTIMATE_MINUTES = 5;
    private static final double LIMIT_HEADROOM = 1.2;
    private static final double SECONDS_PER_HOUR = 3600.0;

    abstract boolean applies(PlanningRequest request);

    abstract TimeWindow resolve(PlanningRequest request);

    TimeWindow window(String start, String end, Interval interval, PlanningRequest request) {
        return new TimeWindow(start, end, interval, request.hasKnownLimit() ? request.getKnownLimit() : null, this);
    }

    /**
     * Lookback used when only the interval is known: sub-minute and minute intervals look back
     * 15 minutes, 5m and 15m an hour, 30m and 1h a day, multi-hour a week, daily a month.
     */
    static Duration lookbackFor(Interval interval) {
        Duration step = interval.toDuration();
        if (step.compareTo(Duration.ofMinutes(1)) <= 0) {
            return Duration.ofMinutes(15);
        }
        if (step.compareTo(Duration.ofMinutes(15)) <= 0) {
            return Duration.ofHours(1);
        }
        if (step.compareTo(Duration.ofHours(1)) <= 0) {
            return Duration.ofHours(24);
        }
        if (step.compareTo(Duration.ofHours(12)) <= 0) {
            return Duration.ofDays(7);
        }
        return Duration.ofDays(30);
    }
}
