package com.pibridge.query;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Sampling granularity requested from the historian, written as {@code <n><unit>} with
 * unit one of s, m, h, d. Callers pick from {@link #STANDARD}; intervals order by their duration.
 */
public final class Interval implements Comparable<Interval> {

    public static final Interval ONE_SECOND = new Interval(1, 's');
    public static final Interval THIRTY_SECONDS = new Interval(30, 's');
    public static final Interval ONE_MINUTE = new Interval(1, 'm');
    public static final Interval FIVE_MINUTES = new Interval(5, 'm');
    public static final Interval FIFTEEN_MINUTES = new Interval(15, 'm');
    public static final Interval THIRTY_MINUTES = new Interval(30, 'm');
    public static final Interval ONE_HOUR = new Interval(1, 'h');
    public static final Interval TWO_HOURS = new Interval(2, 'h');
    public static final Interval SIX_HOURS = new Interval(6, 'h');
    public static final Interval TWELVE_HOURS = new Interval(12, 'h');
    public static final Interval ONE_DAY = new Interval(1, 'd');

    /**
     * Granularities a caller may pick. 1s is reserved for the instant read.
     */
    public static final List<Interval> STANDARD = List.of(
        THIRTY_SECONDS, ONE_MINUTE, FIVE_MINUTES, FIFTEEN_MINUTES, THIRTY_MINUTES,
        ONE_HOUR, TWO_HOURS, SIX_HOURS, TWELVE_HOURS, ONE_DAY);

    private static final Duration FIFTEEN_MINUTE_SPAN = Duration.ofMinutes(15);
    private static final Duration HOUR_SPAN = Duration.ofHours(1);
    private static final Duration SIX_HOUR_SPAN = Duration.ofHours(6);
    private static final Duration DAY_SPAN = Duration.ofHours(24);
    private static final Duration WEEK_SPAN = Duration.ofHours(168);
    private static final Duration MONTH_SPAN = Duration.ofHours(720);

    private final long amount;
    private final char unit;

    private Interval(long amount, char unit) {
        this.amount = amount;
        this.unit = unit;
    }

    /**
     * Parse a caller-supplied interval such as {@code 15m}.
     *
     * @throws QueryParseException if the text is not one of {@link #STANDARD}
     */
    public static Interval parse(String text) {
        if (text == null) {
            throw new QueryParseException("Interval is required");
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        for (Interval candidate : STANDARD) {
            if (candidate.toString().equals(normalized)) {
                return candidate;
            }
        }
        throw new QueryParseException("Invalid interval '" + text + "'. Use one of " + STANDARD, text);
    }

    /**
     * Granularity bucket for a window of the given length.
     * Windows up to 15 minutes get 30s, up to an hour 1m, up to 6 hours 5m,
     * up to a day 15m, up to a week 1h, up to 30 days 6h, anything longer 1d.
     */
    public static Interval optimalFor(Duration window) {
        if (window.compareTo(FIFTEEN_MINUTE_SPAN) <= 0) {
            return THIRTY_SECONDS;
        }
        if (window.compareTo(HOUR_SPAN) <= 0) {
            return ONE_MINUTE;
        }
        if (window.compareTo(SIX_HOUR_SPAN) <= 0) {
            return FIVE_MINUTES;
        }
        if (window.compareTo(DAY_SPAN) <= 0) {
            return FIFTEEN_MINUTES;
        }
        if (window.compareTo(WEEK_SPAN) <= 0) {
            return ONE_HOUR;
        }
        if (window.compareTo(MONTH_SPAN) <= 0) {
            return SIX_HOURS;
        }
        return ONE_DAY;
    }

    public long getAmount() {
        return amount;
    }

    public char getUnit() {
        return unit;
    }

    public Duration toDuration() {
        return switch (unit) {
            case 's' -> Duration.ofSeconds(amount);
            case 'm' -> Duration.ofMinutes(amount);
            case 'h' -> Duration.ofHours(amount);
            case 'd' -> Duration.ofDays(amount);
            default -> throw new IllegalStateException("Unknown interval unit: " + unit);
        };
    }

    /**
     * Length of one interval in hours, possibly fractional.
     */
    public double toHours() {
        return toDuration().toMillis() / 3_600_000.0;
    }

    public boolean isStandard() {
        return STANDARD.contains(this);
    }

    @Override
    public int compareTo(Interval other) {
        return toDuration().compareTo(other.toDuration());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Interval)) {
            return false;
        }
        Interval interval = (Interval) o;
        return amount == interval.amount && unit == interval.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, unit);
    }

    @Override
    public String toString() {
        return amount + String.valueOf(unit);
    }
}
