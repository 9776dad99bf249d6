package com.pibridge.query;

import com.pibridge.domain.Sample;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Filters, orders, trims and re-indexes samples.
 *
 * Ordering is newest first. Timestamps that read as instants are compared as instants and
 * sort ahead of unreadable ones, which fall back to descending string order. Sorting is stable,
 * so equal timestamps keep their input order.
 */
@Component
public class ResultMerger {

    public static final Comparator<Sample> NEWEST_FIRST = (a, b) -> {
        Optional<Instant> left = TimeMarkers.parseAbsolute(a.getTimestamp());
        Optional<Instant> right = TimeMarkers.parseAbsolute(b.getTimestamp());
        if (left.isPresent() && right.isPresent()) {
            return right.get().compareTo(left.get());
        }
        if (left.isPresent()) {
            return -1;
        }
        if (right.isPresent()) {
            return 1;
        }
        return nullSafe(b.getTimestamp()).compareTo(nullSafe(a.getTimestamp()));
    };

    /**
     * Keep the samples matching every extracted WHERE predicate.
     */
    public List<Sample> filter(List<Sample> samples, WhereConditions where) {
        if (where == null || where.isEmpty()) {
            return samples;
        }
        Pattern likePattern = where.getTagLike() != null ? where.tagLikePattern() : null;
        Set<String> tagSet = where.getTagIn() != null ? new HashSet<>(where.getTagIn()) : null;

        List<Sample> kept = new ArrayList<>(samples.size());
        for (Sample sample : samples) {
            if (matchesTimestamp(sample, where)
                    && matchesValue(sample, where)
                    && matchesTag(sample, where, tagSet, likePattern)) {
                kept.add(sample);
            }
        }
        return kept;
    }

    /**
     * Order newest first, keep at most {@code limit} samples when a limit is given, and
     * number the survivors 1..N.
     */
    public List<Sample> postProcess(List<Sample> samples, Integer limit) {
        List<Sample> sorted = new ArrayList<>(samples);
        sorted.sort(NEWEST_FIRST);
        return reindex(truncate(sorted, limit));
    }

    /**
     * Merge the two legs of a dual read. Instant samples precede historical ones with the
     * same timestamp.
     */
    public List<Sample> merge(List<Sample> instant, List<Sample> historical, Integer totalLimit) {
        List<Sample> combined = new ArrayList<>(instant.size() + historical.size());
        combined.addAll(instant);
        combined.addAll(historical);
        return postProcess(combined, totalLimit);
    }

    private static List<Sample> truncate(List<Sample> samples, Integer limit) {
        if (limit == null || limit < 0 || samples.size() <= limit) {
            return samples;
        }
        return samples.subList(0, limit);
    }

    private static List<Sample> reindex(List<Sample> samples) {
        List<Sample> numbered = new ArrayList<>(samples.size());
        for (int i = 0; i < samples.size(); i++) {
            numbered.add(samples.get(i).withId(i + 1));
        }
        return numbered;
    }

    private static boolean matchesTimestamp(Sample sample, WhereConditions where) {
        String ts = sample.getTimestamp();
        if (where.getTimestampGte() != null && compareBound(ts, where.getTimestampGte()) < 0) {
            return false;
        }
        if (where.getTimestampLte() != null && compareBound(ts, where.getTimestampLte()) > 0) {
            return false;
        }
        WhereConditions.Bounds<String> between = where.getTimestampBetween();
        if (between != null) {
            return compareBound(ts, between.getLower()) >= 0 && compareBound(ts, between.getUpper()) <= 0;
        }
        return true;
    }

    /**
     * Compare a sample timestamp with a predicate bound. Relative bounds are left to the
     * historian and always match.
     */
    static int compareBound(String timestamp, String bound) {
        if (TimeMarkers.isRelative(bound)) {
            return 0;
        }
        Optional<Instant> left = TimeMarkers.parseAbsolute(timestamp);
        Optional<Instant> right = TimeMarkers.parseAbsolute(bound);
        if (left.isPresent() && right.isPresent()) {
            return left.get().compareTo(right.get());
        }
        return nullSafe(timestamp).compareTo(bound);
    }

    private static boolean matchesValue(Sample sample, WhereConditions where) {
        if (!where.hasValuePredicate()) {
            return true;
        }
        OptionalDouble number = sample.numericValue();
        if (number.isEmpty()) {
            return false;
        }
        double value = number.getAsDouble();
        if (where.getValueGt() != null && !(value > where.getValueGt())) {
            return false;
        }
        if (where.getValueLt() != null && !(value < where.getValueLt())) {
            return false;
        }
        WhereConditions.Bounds<Double> between = where.getValueBetween();
        return between == null || (value >= between.getLower() && value <= between.getUpper());
    }

    private static boolean matchesTag(Sample sample, WhereConditions where, Set<String> tagSet, Pattern likePattern) {
        String tag = sample.getTag();
        if (where.getTagEq() != null && !where.getTagEq().equalsIgnoreCase(nullSafe(tag))) {
            return false;
        }
        if (tagSet != null && !tagSet.contains(tag)) {
            return false;
        }
        return likePattern == null || (tag != null && likePattern.matcher(tag).matches());
    }

    private static String nullSafe(String value) {
        return value != null ? value : "";
    }
}
