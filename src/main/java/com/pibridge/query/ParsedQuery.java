package com.pibridge.query;

/**
 * Structured form of a declarative query. Derived once per execution and passed explicitly
 * to every later stage.
 */
public class ParsedQuery {

    private String text;
    private String tag;
    private Integer limit;
    private boolean limitFromTop;
    private String orderByColumn;
    private WhereConditions where = new WhereConditions();
    private LegacyTimeRange legacyTimeRange;

    /**
     * A query with no declarative content, used for preset and direct-URL executions.
     */
    public static ParsedQuery empty() {
        return new ParsedQuery();
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getTag() {
        return tag;
    }

    public void setTag(String tag) {
        this.tag = tag;
    }

    public boolean hasTag() {
        return tag != null && !tag.isBlank();
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public boolean hasLimit() {
        return limit != null;
    }

    /**
     * Whether the limit came from {@code SELECT TOP n} rather than {@code LIMIT n}.
     */
    public boolean isLimitFromTop() {
        return limitFromTop;
    }

    public void setLimitFromTop(boolean limitFromTop) {
        this.limitFromTop = limitFromTop;
    }

    public String getOrderByColumn() {
        return orderByColumn;
    }

    public void setOrderByColumn(String orderByColumn) {
        this.orderByColumn = orderByColumn;
    }

    public WhereConditions getWhere() {
        return where;
    }

    public void setWhere(WhereConditions where) {
        this.where = where != null ? where : new WhereConditions();
    }

    public LegacyTimeRange getLegacyTimeRange() {
        return legacyTimeRange;
    }

    public void setLegacyTimeRange(LegacyTimeRange legacyTimeRange) {
        this.legacyTimeRange = legacyTimeRange;
    }

    @Override
    public String toString() {
        return "ParsedQuery{tag=" + tag + ", limit=" + limit + (limitFromTop ? " (top)" : "")
            + ", orderBy=" + orderByColumn + ", where=" + where + ", legacy=" + legacyTimeRange + "}";
    }
}
