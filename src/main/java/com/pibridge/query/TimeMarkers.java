package com.pibridge.query;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for the historian's time marker alphabet: {@code *} for now, {@code *-<n><unit>}
 * for an offset back from now, or an absolute ISO-8601 timestamp.
 *
 * Timestamps without an offset are read as UTC.
 */
public final class TimeMarkers {

    public static final String NOW = "*";

    private static final Pattern RELATIVE = Pattern.compile("^\\*-(\\d+)([smhd])$");

    private static final DateTimeFormatter FLEXIBLE = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
        .optionalStart().appendLiteral('T').optionalEnd()
        .optionalStart().appendLiteral(' ').optionalEnd()
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart().appendOffsetId().optionalEnd()
        .optionalEnd()
        .toFormatter();

    private static final DateTimeFormatter SPACE_SEPARATED_OUT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private TimeMarkers() {
    }

    /**
     * Relative marker reaching {@code lookback} into the past, in the largest of h, m or s
     * that keeps the count integral.
     */
    public static String relative(Duration lookback) {
        long seconds = Math.max(0, lookback.getSeconds());
        if (seconds == 0) {
            return NOW;
        }
        if (seconds % 3600 == 0) {
            return "*-" + (seconds / 3600) + "h";
        }
        if (seconds % 60 == 0) {
            return "*-" + (seconds / 60) + "m";
        }
        return "*-" + seconds + "s";
    }

    public static boolean isNow(String marker) {
        return NOW.equals(marker);
    }

    public static boolean isRelative(String marker) {
        return marker != null && (isNow(marker) || RELATIVE.matcher(marker).matches());
    }

    /**
     * Resolve any marker to an instant against the given clock.
     */
    public static Optional<Instant> resolve(String marker, Clock clock) {
        if (marker == null) {
            return Optional.empty();
        }
        if (isNow(marker)) {
            return Optional.of(clock.instant());
        }
        Matcher matcher = RELATIVE.matcher(marker);
        if (matcher.matches()) {
            long amount = Long.parseLong(matcher.group(1));
            Duration offset = switch (matcher.group(2).charAt(0)) {
                case 's' -> Duration.ofSeconds(amount);
                case 'm' -> Duration.ofMinutes(amount);
                case 'h' -> Duration.ofHours(amount);
                default -> Duration.ofDays(amount);
            };
            return Optional.of(clock.instant().minus(offset));
        }
        return parseAbsolute(marker);
    }

    /**
     * Parse an absolute timestamp in any of the forms the historian and query authors use:
     * ISO with offset or {@code Z}, ISO local date-time, space-separated date-time, or a bare date.
     */
    public static Optional<Instant> parseAbsolute(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        TemporalAccessor parsed;
        try {
            parsed = FLEXIBLE.parseBest(text.trim(), OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
        if (parsed instanceof OffsetDateTime) {
            return Optional.of(((OffsetDateTime) parsed).toInstant());
        }
        if (parsed instanceof LocalDateTime) {
            return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        }
        return Optional.of(((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC));
    }

    /**
     * Render {@code instant} in the same style as {@code template}, so a derived bound reads
     * like the bound the query author wrote.
     */
    public static String formatLike(Instant instant, String template) {
        String value = template != null ? template.trim() : "";
        if (value.endsWith("Z") || value.matches(".*[+-]\\d{2}:\\d{2}$")) {
            return DateTimeFormatter.ISO_INSTANT.format(instant);
        }
        LocalDateTime local = LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        if (value.length() > 10 && value.charAt(10) == ' ') {
            return SPACE_SEPARATED_OUT.format(local);
        }
        return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(local);
    }
}
