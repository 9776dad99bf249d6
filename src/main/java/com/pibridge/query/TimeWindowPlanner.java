package com.pibridge.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Resolves the read window for a query from its parsed predicates, caller parameters and
 * defaults. Planning never fails: {@link PlanningRule#DEFAULT_LOOKBACK} always applies.
 */
@Component
public class TimeWindowPlanner {

    private static final Logger log = LoggerFactory.getLogger(TimeWindowPlanner.class);

    /** Window for the freshest-value read, independent of the query. */
    static final TimeRange INSTANT_RANGE = TimeRange.since("*-1h");

    private final Clock clock;

    public TimeWindowPlanner(Clock clock) {
        this.clock = clock;
    }

    /**
     * Resolve the historical window.
     *
     * @param parsed           parsed declarative query, or {@link ParsedQuery#empty()} for other forms
     * @param explicitInterval caller interval, may be null
     * @param explicitRange    caller-fixed range, may be null
     * @param callerLimit      caller limit, used when the query carries no LIMIT/TOP; may be null
     * @return the window produced by the first applicable {@link PlanningRule}
     */
    public TimeWindow plan(ParsedQuery parsed, Interval explicitInterval, TimeRange explicitRange, Integer callerLimit) {
        ParsedQuery query = parsed != null ? parsed : ParsedQuery.empty();
        Integer knownLimit = query.hasLimit() ? query.getLimit() : callerLimit;
        PlanningRequest request = new PlanningRequest(query, explicitInterval, explicitRange, knownLimit, clock);

        for (PlanningRule rule : PlanningRule.values()) {
            if (rule.applies(request)) {
                TimeWindow window = rule.resolve(request);
                log.debug("Planned {} via {}", window, rule);
                return window;
            }
        }
        // DEFAULT_LOOKBACK always applies
        throw new IllegalStateException("No planning rule applied");
    }

    /**
     * The instant leg's window: the last hour at one-second granularity, one sample.
     */
    public TimeWindow planInstant() {
        return plan(ParsedQuery.empty(), Interval.ONE_SECOND, INSTANT_RANGE, 1);
    }

    public Clock getClock() {
        return clock;
    }
}
