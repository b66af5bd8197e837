package com.mini.tableview.page;

import com.google.common.collect.ImmutableList;
import com.mini.tableview.data.Row;
import com.mini.tableview.schema.Schema;

import java.util.List;
import java.util.Objects;

/**
 * 分页结果
 * 一页有序行、对应的请求以及读取时已知的总行数（过滤后）
 */
public final class PageResult {
    private final PageRequest request;
    private final Schema schema;
    private final ImmutableList<Row> rows;
    private final long totalRows;

    public PageResult(PageRequest request, Schema schema, List<Row> rows, long totalRows) {
        this.request = Objects.requireNonNull(request, "Request cannot be null");
        this.schema = Objects.requireNonNull(schema, "Schema cannot be null");
        this.rows = ImmutableList.copyOf(rows);
        if (totalRows < 0) {
            throw new IllegalArgumentException("Total rows must be >= 0: " + totalRows);
        }
        this.totalRows = totalRows;
    }

    public PageRequest getRequest() {
        return request;
    }

    public Schema getSchema() {
        return schema;
    }

    public List<Row> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public long getTotalRows() {
        return totalRows;
    }

    public int getPageCount() {
        return PagePlanner.pageCount(totalRows, request.getPageSize());
    }

    /**
     * 本页第一行的行号（从 1 开始），空页返回 0
     */
    public long getFirstRowNumber() {
        return rows.isEmpty() ? 0 : request.getOffset() + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PageResult)) return false;
        PageResult that = (PageResult) o;
        return totalRows == that.totalRows &&
                request.equals(that.request) &&
                schema.equals(that.schema) &&
                rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(request, schema, rows, totalRows);
    }

    @Override
    public String toString() {
        return "PageResult{" +
                "request=" + request +
                ", rows=" + rows.size() +
                ", totalRows=" + totalRows +
                '}';
    }
}
