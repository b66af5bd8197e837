package com.mini.tableview.page;

import java.util.Objects;

/**
 * 排序规格
 * 至多一个排序列；{@link #NONE} 表示保持数据源原始顺序
 */
public final class SortSpec {
    public static final SortSpec NONE = new SortSpec(-1, null);

    private final int columnIndex;
    private final SortDirection direction;

    private SortSpec(int columnIndex, SortDirection direction) {
        this.columnIndex = columnIndex;
        this.direction = direction;
    }

    public static SortSpec by(int columnIndex, SortDirection direction) {
        if (columnIndex < 0) {
            throw new IllegalArgumentException("Sort column index must be >= 0: " + columnIndex);
        }
        return new SortSpec(columnIndex, Objects.requireNonNull(direction, "Sort direction cannot be null"));
    }

    public static SortSpec ascending(int columnIndex) {
        return by(columnIndex, SortDirection.ASCENDING);
    }

    public static SortSpec descending(int columnIndex) {
        return by(columnIndex, SortDirection.DESCENDING);
    }

    public boolean isNone() {
        return direction == null;
    }

    /**
     * 排序列索引，NONE 时为 -1
     */
    public int getColumnIndex() {
        return columnIndex;
    }

    /**
     * 排序方向，NONE 时为 null
     */
    public SortDirection getDirection() {
        return direction;
    }

    public SortSpec reverse() {
        return isNone() ? this : new SortSpec(columnIndex, direction.reverse());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SortSpec)) return false;
        SortSpec that = (SortSpec) o;
        return columnIndex == that.columnIndex && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnIndex, direction);
    }

    @Override
    public String toString() {
        return isNone() ? "NONE" : columnIndex + " " + direction.sql();
    }
}
