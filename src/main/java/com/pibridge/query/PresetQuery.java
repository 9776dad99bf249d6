package com.pibridge.query;

import java.util.Locale;
import java.util.Optional;

/**
 * Keyword queries and the fixed windows they stand for.
 */
public enum PresetQuery {

    LATEST("latest", "*-1h", 1, "ORDER BY timestamp DESC\nLIMIT 1"),
    LAST_HOUR("1h", "*-1h", null, "  AND timestamp >= DATE_SUB(NOW(), INTERVAL 1 HOUR)\nORDER BY timestamp DESC"),
    LAST_DAY("24h", "*-24h", null, "  AND timestamp >= DATE_SUB(NOW(), INTERVAL 24 HOUR)\nORDER BY timestamp DESC");

    private final String keyword;
    private final String start;
    private final Integer fixedLimit;
    private final String sqlTail;

    PresetQuery(String keyword, String start, Integer fixedLimit, String sqlTail) {
        this.keyword = keyword;
        this.start = start;
        this.fixedLimit = fixedLimit;
        this.sqlTail = sqlTail;
    }

    public static Optional<PresetQuery> find(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        for (PresetQuery preset : values()) {
            if (preset.keyword.equals(normalized)) {
                return Optional.of(preset);
            }
        }
        return Optional.empty();
    }

    public String getKeyword() {
        return keyword;
    }

    public TimeRange range() {
        return TimeRange.since(start);
    }

    /**
     * Limit implied by the keyword itself, or null.
     */
    public Integer getFixedLimit() {
        return fixedLimit;
    }

    /**
     * Equivalent SQL, for previews.
     */
    public String toSql(String tag) {
        return "SELECT * FROM points\nWHERE tag = '" + tag.replace("'", "''") + "'\n" + sqlTail;
    }
}
