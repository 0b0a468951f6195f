package com.example.pos.report;

/**
 * Named date predicates used by reporting. Labels match case-sensitively; anything else,
 * null included, means {@link #ALL}.
 */
public enum ReportPeriod {
    TODAY("Today"),
    THIS_MONTH("This Month"),
    ALL("All");

    private final String label;

    ReportPeriod(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static ReportPeriod fromLabel(String label) {
        for (ReportPeriod period : values()) {
            if (period.label.equals(label)) {
                return period;
            }
        }
        return ALL;
    }

    /**
     * Predicate on a {@code created_at} column, stored by SQLite as {@code datetime('now')}
     * text.
     */
    public SqlFilter on(String createdAtColumn) {
        return switch (this) {
            case TODAY -> SqlFilter.of("date(" + createdAtColumn + ") = date('now')");
            case THIS_MONTH -> SqlFilter.of("strftime('%Y-%m', " + createdAtColumn + ") = strftime('%Y-%m', 'now')");
            case ALL -> SqlFilter.none();
        };
    }
}
