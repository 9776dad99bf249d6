package com.pibridge.query;

import java.time.Clock;

/**
 * Inputs to a single planning pass.
 */
public class PlanningRequest {

    private final ParsedQuery parsed;
    private final Interval explicitInterval;
    private final TimeRange explicitRange;
    private final Integer knownLimit;
    private final Clock clock;

    public PlanningRequest(ParsedQuery parsed, Interval explicitInterval, TimeRange explicitRange,
                           Integer knownLimit, Clock clock) {
        this.parsed = parsed != null ? parsed : ParsedQuery.empty();
        this.explicitInterval = explicitInterval;
        this.explicitRange = explicitRange;
        this.knownLimit = knownLimit;
        this.clock = clock;
    }

    public ParsedQuery getParsed() {
        return parsed;
    }

    public WhereConditions getWhere() {
        return parsed.getWhere();
    }

    public Interval getExplicitInterval() {
        return explicitInterval;
    }

    public boolean hasExplicitInterval() {
        return explicitInterval != null;
    }

    public TimeRange getExplicitRange() {
        return explicitRange;
    }

    /**
     * Parsed LIMIT/TOP when present, else the caller's limit; null when neither is known.
     */
    public Integer getKnownLimit() {
        return knownLimit;
    }

    public boolean hasKnownLimit() {
        return knownLimit != null && knownLimit > 0;
    }

    public Clock getClock() {
        return clock;
    }
}
