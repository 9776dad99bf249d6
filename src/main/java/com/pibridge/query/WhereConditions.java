package com.pibridge.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Predicates extracted from a WHERE clause. Each slot keeps the first occurrence in the text.
 */
public class WhereConditions {

    private String timestampGte;
    private String timestampLte;
    private Bounds<String> timestampBetween;
    private Double valueGt;
    private Double valueLt;
    private Bounds<Double> valueBetween;
    private String tagEq;
    private List<String> tagIn;
    private String tagLike;

    public String getTimestampGte() {
        return timestampGte;
    }

    public void setTimestampGte(String timestampGte) {
        this.timestampGte = timestampGte;
    }

    public String getTimestampLte() {
        return timestampLte;
    }

    public void setTimestampLte(String timestampLte) {
        this.timestampLte = timestampLte;
    }

    public Bounds<String> getTimestampBetween() {
        return timestampBetween;
    }

    public void setTimestampBetween(Bounds<String> timestampBetween) {
        this.timestampBetween = timestampBetween;
    }

    public Double getValueGt() {
        return valueGt;
    }

    public void setValueGt(Double valueGt) {
        this.valueGt = valueGt;
    }

    public Double getValueLt() {
        return valueLt;
    }

    public void setValueLt(Double valueLt) {
        this.valueLt = valueLt;
    }

    public Bounds<Double> getValueBetween() {
        return valueBetween;
    }

    public void setValueBetween(Bounds<Double> valueBetween) {
        this.valueBetween = valueBetween;
    }

    public String getTagEq() {
        return tagEq;
    }

    public void setTagEq(String tagEq) {
        this.tagEq = tagEq;
    }

    public List<String> getTagIn() {
        return tagIn;
    }

    public void setTagIn(List<String> tagIn) {
        this.tagIn = tagIn != null ? Collections.unmodifiableList(new ArrayList<>(tagIn)) : null;
    }

    public String getTagLike() {
        return tagLike;
    }

    public void setTagLike(String tagLike) {
        this.tagLike = tagLike;
    }

    public boolean hasTimestampPredicate() {
        return timestampGte != null || timestampLte != null || timestampBetween != null;
    }

    public boolean hasValuePredicate() {
        return valueGt != null || valueLt != null || valueBetween != null;
    }

    public boolean hasTagPredicate() {
        return tagEq != null || tagIn != null || tagLike != null;
    }

    public boolean isEmpty() {
        return !hasTimestampPredicate() && !hasValuePredicate() && !hasTagPredicate();
    }

    /**
     * The LIKE pattern as an anchored, case-insensitive regex. {@code %} is the only wildcard;
     * every other character matches literally.
     */
    public Pattern tagLikePattern() {
        if (tagLike == null) {
            return null;
        }
        StringBuilder regex = new StringBuilder("^");
        int from = 0;
        int wildcard;
        while ((wildcard = tagLike.indexOf('%', from)) >= 0) {
            if (wildcard > from) {
                regex.append(Pattern.quote(tagLike.substring(from, wildcard)));
            }
            regex.append(".*");
            from = wildcard + 1;
        }
        if (from < tagLike.length()) {
            regex.append(Pattern.quote(tagLike.substring(from)));
        }
        regex.append('$');
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("WhereConditions{");
        if (timestampGte != null) sb.append(" timestampGte=").append(timestampGte);
        if (timestampLte != null) sb.append(" timestampLte=").append(timestampLte);
        if (timestampBetween != null) sb.append(" timestampBetween=").append(timestampBetween);
        if (valueGt != null) sb.append(" valueGt=").append(valueGt);
        if (valueLt != null) sb.append(" valueLt=").append(valueLt);
        if (valueBetween != null) sb.append(" valueBetween=").append(valueBetween);
        if (tagEq != null) sb.append(" tagEq=").append(tagEq);
        if (tagIn != null) sb.append(" tagIn=").append(tagIn);
        if (tagLike != null) sb.append(" tagLike=").append(tagLike);
        return sb.append(" }").toString();
    }

    /**
     * Inclusive lower and upper bound of a BETWEEN predicate.
     */
    public static final class Bounds<T> {

        private final T lower;
        private final T upper;

        public Bounds(T lower, T upper) {
            this.lower = lower;
            this.upper = upper;
        }

        public T getLower() {
            return lower;
        }

        public T getUpper() {
            return upper;
        }

        @Override
        public String toString() {
            return "[" + lower + ", " + upper + "]";
        }
    }
}
