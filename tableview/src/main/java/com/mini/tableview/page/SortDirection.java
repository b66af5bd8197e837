package com.mini.tableview.page;

/**
 * 排序方向
 */
public enum SortDirection {
    ASCENDING("ASC"),
    DESCENDING("DESC");

    private final String sql;

    SortDirection(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }

    public SortDirection reverse() {
        return this == ASCENDING ? DESCENDING : ASCENDING;
    }
}
