package com.pibridge.query;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Older-style time range written as {@code DATE_SUB(NOW(), INTERVAL <n> HOUR|DAY|MINUTE|SECOND)}.
 */
public class LegacyTimeRange {

    private final long amount;
    private final ChronoUnit unit;

    public LegacyTimeRange(long amount, ChronoUnit unit) {
        this.amount = amount;
        this.unit = unit;
    }

    /**
     * @param keyword one of HOUR, DAY, MINUTE, SECOND (any case)
     */
    public static LegacyTimeRange of(long amount, String keyword) {
        ChronoUnit unit = switch (keyword.toUpperCase(Locale.ROOT)) {
            case "HOUR" -> ChronoUnit.HOURS;
            case "DAY" -> ChronoUnit.DAYS;
            case "MINUTE" -> ChronoUnit.MINUTES;
            case "SECOND" -> ChronoUnit.SECONDS;
            default -> throw new QueryParseException("Unsupported DATE_SUB unit: " + keyword);
        };
        return new LegacyTimeRange(amount, unit);
    }

    public long getAmount() {
        return amount;
    }

    public ChronoUnit getUnit() {
        return unit;
    }

    public Duration toDuration() {
        return Duration.of(amount, unit);
    }

    /**
     * Start marker in the unit the query was written in, e.g. {@code *-24h} or {@code *-7d}.
     */
    public String toStartMarker() {
        char suffix = switch (unit) {
            case DAYS -> 'd';
            case HOURS -> 'h';
            case MINUTES -> 'm';
            default -> 's';
        };
        return "*-" + amount + suffix;
    }

    @Override
    public String toString() {
        return amount + " " + unit.name().toLowerCase(Locale.ROOT);
    }
}
