package com.pibridge.query;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The three accepted shapes of query text.
 */
public enum QueryForm {

    /** A full historian URL, sent as-is. */
    DIRECT_URL,

    /** A symbolic keyword such as {@code latest}, see {@link PresetQuery}. */
    PRESET,

    /** Restricted SQL starting with SELECT. */
    DECLARATIVE;

    private static final Pattern SELECT_PREFIX = Pattern.compile("^\\s*SELECT\\b", Pattern.CASE_INSENSITIVE);

    /**
     * @throws QueryParseException if the text matches none of the forms
     */
    public static QueryForm detect(String text) {
        if (text == null || text.isBlank()) {
            throw new QueryParseException("Query text is required", text);
        }
        String trimmed = text.trim();
        if (trimmed.toLowerCase(Locale.ROOT).startsWith("http")) {
            return DIRECT_URL;
        }
        if (PresetQuery.find(trimmed).isPresent()) {
            return PRESET;
        }
        if (SELECT_PREFIX.matcher(trimmed).find()) {
            return DECLARATIVE;
        }
        throw new QueryParseException(
            "Unsupported query format. Use a preset (latest, 1h, 24h), a SELECT query or a URL starting with http",
            text);
    }
}
