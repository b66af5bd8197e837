package com.mini.tableview.page;

import com.mini.tableview.source.SourceIdentity;

import java.util.Objects;

/**
 * 分页请求
 * 值对象，所有字段相等时两个请求相等，可直接作为缓存键
 */
public final class PageRequest {
    private final SourceIdentity source;
    private final SortSpec sort;
    private final SearchFilter filter;
    private final int pageIndex;
    private final int pageSize;

    public PageRequest(SourceIdentity source, SortSpec sort, SearchFilter filter, int pageIndex, int pageSize) {
        this.source = Objects.requireNonNull(source, "Source cannot be null");
        this.sort = Objects.requireNonNull(sort, "Sort cannot be null");
        this.filter = Objects.requireNonNull(filter, "Search filter cannot be null");
        if (pageIndex < 0) {
            throw new IllegalArgumentException("Page index must be >= 0: " + pageIndex);
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be > 0: " + pageSize);
        }
        this.pageIndex = pageIndex;
        this.pageSize = pageSize;
    }

    /**
     * 数据源原始顺序、无过滤的第一页
     */
    public static PageRequest firstPage(SourceIdentity source, int pageSize) {
        return new PageRequest(source, SortSpec.NONE, SearchFilter.NONE, 0, pageSize);
    }

    public SourceIdentity getSource() {
        return source;
    }

    public SortSpec getSort() {
        return sort;
    }

    public SearchFilter getFilter() {
        return filter;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public int getPageSize() {
        return pageSize;
    }

    /**
     * 本页第一行在（过滤、排序后）结果集中的偏移
     */
    public long getOffset() {
        return (long) pageIndex * pageSize;
    }

    public PageRequest withSource(SourceIdentity newSource) {
        return new PageRequest(newSource, sort, filter, pageIndex, pageSize);
    }

    public PageRequest withSort(SortSpec newSort) {
        return new PageRequest(source, newSort, filter, pageIndex, pageSize);
    }

    public PageRequest withFilter(SearchFilter newFilter) {
        return new PageRequest(source, sort, newFilter, pageIndex, pageSize);
    }

    public PageRequest withPageIndex(int newPageIndex) {
        return new PageRequest(source, sort, filter, newPageIndex, pageSize);
    }

    public PageRequest withPage(int newPageIndex, int newPageSize) {
        return new PageRequest(source, sort, filter, newPageIndex, newPageSize);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PageRequest)) return false;
        PageRequest that = (PageRequest) o;
        return pageIndex == that.pageIndex &&
                pageSize == that.pageSize &&
                source.equals(that.source) &&
                sort.equals(that.sort) &&
                filter.equals(that.filter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, sort, filter, pageIndex, pageSize);
    }

    @Override
    public String toString() {
        return "PageRequest{" +
                "source=" + source +
                ", sort=" + sort +
                ", filter=" + filter +
                ", page=" + pageIndex +
                ", size=" + pageSize +
                '}';
    }
}
