package com.mini.tableview.page;

import com.mini.tableview.data.Row;

import java.util.Locale;
import java.util.Objects;

/**
 * 行搜索过滤器
 * 任一单元格的文本形式包含搜索词（忽略大小写）即命中
 */
public final class SearchFilter {
    public static final SearchFilter NONE = new SearchFilter("");

    private final String query;
    private final String normalized;

    private SearchFilter(String query) {
        this.query = query;
        this.normalized = query.toLowerCase(Locale.ROOT);
    }

    /**
     * 空白搜索词等价于 {@link #NONE}
     */
    public static SearchFilter of(String query) {
        if (query == null || query.trim().isEmpty()) {
            return NONE;
        }
        return new SearchFilter(query);
    }

    public boolean isNone() {
        return query.isEmpty();
    }

    public String getQuery() {
        return query;
    }

    public boolean matches(Row row) {
        if (isNone()) {
            return true;
        }
        for (int i = 0; i < row.getFieldCount(); i++) {
            Object value = row.getValue(i);
            if (value != null && !(value instanceof byte[])
                    && value.toString().toLowerCase(Locale.ROOT).contains(normalized)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchFilter)) return false;
        return query.equals(((SearchFilter) o).query);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query);
    }

    @Override
    public String toString() {
        return isNone() ? "NONE" : "'" + query + "'";
    }
}
