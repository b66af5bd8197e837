package com.mini.tableview.source;

import com.google.common.collect.Ordering;
import com.mini.tableview.data.Row;
import com.mini.tableview.page.SortDirection;
import com.mini.tableview.page.SortSpec;
import com.mini.tableview.schema.DataType;
import com.mini.tableview.schema.Schema;

import java.util.Comparator;

/**
 * 行比较器
 * 按列类型选择比较规则；无论升序还是降序，空值都排在最后
 */
public final class RowComparators {

    private RowComparators() {
    }

    public static Comparator<Row> forSort(Schema schema, SortSpec sort) {
        if (sort.isNone()) {
            throw new IllegalArgumentException("No comparator for unsorted order");
        }
        int column = sort.getColumnIndex();
        DataType type = schema.getField(column).getType();

        Ordering<Object> values = Ordering.from(type::compareValues);
        if (sort.getDirection() == SortDirection.DESCENDING) {
            values = values.reverse();
        }
        // 先反转再 nullsLast，保证降序时空值仍然在末尾
        return values.<Object>nullsLast().onResultOf((Row row) -> row.getValue(column));
    }
}
