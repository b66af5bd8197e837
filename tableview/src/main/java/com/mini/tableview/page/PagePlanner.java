package com.mini.tableview.page;

import com.mini.tableview.exception.SourceException;
import com.mini.tableview.schema.Field;
import com.mini.tableview.schema.Schema;

/**
 * 排序/分页规划器
 *
 * 纯函数，无副作用：把期望的排序、页码、页大小和已知总行数
 * 转换为规范化的 {@link PageRequest}，并校验边界。
 */
public final class PagePlanner {

    private PagePlanner() {
    }

    /**
     * pageCount = ceil(rowCount / pageSize)，rowCount 为 0 时为 0
     */
    public static int pageCount(long rowCount, int pageSize) {
        validatePageSize(pageSize);
        if (rowCount < 0) {
            throw new IllegalArgumentException("Row count must be >= 0: " + rowCount);
        }
        long pages = (rowCount + pageSize - 1) / pageSize;
        return (int) Math.min(pages, Integer.MAX_VALUE);
    }

    /**
     * 把页码限制在 [0, max(pageCount - 1, 0)]
     */
    public static int clampPageIndex(int pageIndex, int pageCount) {
        int last = Math.max(pageCount - 1, 0);
        if (pageIndex < 0) {
            return 0;
        }
        return Math.min(pageIndex, last);
    }

    /**
     * 生成规范化请求：页码按总行数夹紧
     */
    public static PageRequest plan(PageRequest desired, long rowCount) {
        int pages = pageCount(rowCount, desired.getPageSize());
        int clamped = clampPageIndex(desired.getPageIndex(), pages);
        return clamped == desired.getPageIndex() ? desired : desired.withPageIndex(clamped);
    }

    /**
     * 修改页大小时保持当前第一行可见：floor(oldIndex * oldSize / newSize)
     */
    public static int resizePageIndex(int oldPageIndex, int oldPageSize, int newPageSize) {
        validatePageSize(oldPageSize);
        validatePageSize(newPageSize);
        long firstVisibleRow = (long) oldPageIndex * oldPageSize;
        return (int) (firstVisibleRow / newPageSize);
    }

    /**
     * 请求窗口的起始行，offset = pageIndex * pageSize
     */
    public static long offset(PageRequest request) {
        return request.getOffset();
    }

    public static PageRequest resize(PageRequest current, int newPageSize) {
        int newIndex = resizePageIndex(current.getPageIndex(), current.getPageSize(), newPageSize);
        return current.withPage(newIndex, newPageSize);
    }

    /**
     * 下一页；到达末页时 wrap 为 true 则回到第一页，否则停在末页
     */
    public static int nextPageIndex(int pageIndex, int pageCount, boolean wrap) {
        if (pageCount <= 0) {
            return 0;
        }
        if (pageIndex + 1 >= pageCount) {
            return wrap ? 0 : pageCount - 1;
        }
        return Math.max(pageIndex + 1, 0);
    }

    /**
     * 上一页；位于第一页时 wrap 为 true 则跳到末页，否则停在第一页
     */
    public static int previousPageIndex(int pageIndex, int pageCount, boolean wrap) {
        if (pageCount <= 0) {
            return 0;
        }
        if (pageIndex <= 0) {
            return wrap ? pageCount - 1 : 0;
        }
        return Math.min(pageIndex - 1, pageCount - 1);
    }

    /**
     * 点击列头时的排序切换：升序 -> 降序 -> 原始顺序；点击其他列从升序开始
     */
    public static SortSpec toggleSort(SortSpec current, int columnIndex) {
        if (current.isNone() || current.getColumnIndex() != columnIndex) {
            return SortSpec.ascending(columnIndex);
        }
        if (current.getDirection() == SortDirection.ASCENDING) {
            return SortSpec.descending(columnIndex);
        }
        return SortSpec.NONE;
    }

    /**
     * 校验排序列：必须在 Schema 范围内且类型可排序
     *
     * @throws SourceException.InvalidSortException 校验失败
     */
    public static void validateSort(SortSpec sort, Schema schema) {
        if (sort.isNone()) {
            return;
        }
        int column = sort.getColumnIndex();
        if (!schema.isValidColumn(column)) {
            throw new SourceException.InvalidSortException(column,
                    "column index out of bounds [0, " + schema.getFieldCount() + ")");
        }
        Field field = schema.getField(column);
        if (!field.isSortable()) {
            throw new SourceException.InvalidSortException(column,
                    "column '" + field.getName() + "' of type " + field.getType() + " is not sortable");
        }
    }

    public static void validatePageSize(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be > 0: " + pageSize);
        }
    }
}
