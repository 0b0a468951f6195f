package com.example.pos.report;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A WHERE predicate paired with its positional parameters. Values always travel in
 * {@code params} and are bound by the driver, never spliced into {@code clause}.
 */
public record SqlFilter(String clause, List<Object> params) {

    private static final SqlFilter NONE = new SqlFilter("", List.of());

    public SqlFilter {
        clause = clause == null ? "" : clause.trim();
        params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
    }

    public static SqlFilter none() {
        return NONE;
    }

    public static SqlFilter of(String clause, Object... params) {
        return new SqlFilter(clause, Arrays.asList(params));
    }

    /**
     * {@code column = ?} bound to {@code value}, or no predicate when value is null.
     */
    public static SqlFilter equalTo(String column, Object value) {
        return value == null ? NONE : of(column + " = ?", value);
    }

    public boolean isEmpty() {
        return clause.isEmpty();
    }

    public SqlFilter and(SqlFilter other) {
        if (other == null || other.isEmpty())
            return this;
        if (isEmpty())
            return other;
        List<Object> merged = new ArrayList<>(params);
        merged.addAll(other.params);
        return new SqlFilter(clause + " AND " + other.clause, merged);
    }

    /** " WHERE ..." or an empty string. */
    public String where() {
        return isEmpty() ? "" : " WHERE " + clause;
    }

    public Object[] args() {
        return params.toArray();
    }

    /** Parameters followed by extra trailing values, for queries that bind more after the filter. */
    public Object[] argsWith(Object... trailing) {
        Object[] out = Arrays.copyOf(params.toArray(), params.size() + trailing.length);
        System.arraycopy(trailing, 0, out, params.size(), trailing.length);
        return out;
    }
}
