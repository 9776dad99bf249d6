package com.pibridge.query;

/**
 * Thrown when query text or execution parameters are unusable: malformed declarative text,
 * an unsupported query form, or a missing/invalid interval.
 * Raised before any request reaches the historian.
 */
public class QueryParseException extends RuntimeException {

    private final String query;

    public QueryParseException(String message) {
        super(message);
        this.query = null;
    }

    public QueryParseException(String message, String query) {
        super(message);
        this.query = query;
    }

    public QueryParseException(String message, String query, Throwable cause) {
        super(message, cause);
        this.query = query;
    }

    public String getQuery() {
        return query;
    }
}
