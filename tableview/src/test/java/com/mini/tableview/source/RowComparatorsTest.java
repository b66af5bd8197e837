package com.mini.tableview.source;

import com.mini.tableview.data.Row;
import com.mini.tableview.page.SortSpec;
import com.mini.tableview.schema.DataType;
import com.mini.tableview.schema.Field;
import com.mini.tableview.schema.Schema;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 行比较器测试：类型感知的比较和空值位置
 */
public class RowComparatorsTest {

    private static final Schema SCHEMA = new Schema(Arrays.asList(
            new Field("amount", DataType.DOUBLE()),
            new Field("name", DataType.STRING()),
            new Field("created", DataType.TIMESTAMP()),
            new Field("active", DataType.BOOLEAN())));

    private static List<Object> column(List<Row> rows, int index) {
        List<Object> values = new ArrayList<>();
        for (Row row : rows) {
            values.add(row.getValue(index));
        }
        return values;
    }

    private static List<Row> sorted(List<Row> rows, SortSpec sort) {
        List<Row> copy = new ArrayList<>(rows);
        copy.sort(RowComparators.forSort(SCHEMA, sort));
        return copy;
    }

    @Test
    public void testNumericNotLexicographic() {
        List<Row> rows = Arrays.asList(
                Row.of(10.0, "a", null, true),
                Row.of(9L, "b", null, true),
                Row.of(null, "c", null, true),
                Row.of(100, "d", null, true));

        assertEquals(Arrays.asList(9L, 10.0, 100, null), column(sorted(rows, SortSpec.ascending(0)), 0));
        // 降序时空值仍在最后
        assertEquals(Arrays.asList(100, 10.0, 9L, null), column(sorted(rows, SortSpec.descending(0)), 0));
    }

    @Test
    public void testTemporalIsChronological() {
        List<Row> rows = Arrays.asList(
                Row.of(1.0, "a", "2024-02-01 08:00:00", true),
                Row.of(2.0, "b", LocalDateTime.of(2023, 12, 31, 23, 59), true),
                Row.of(3.0, "c", LocalDate.of(2024, 1, 15), true),
                Row.of(4.0, "d", null, true));

        List<Object> ascending = column(sorted(rows, SortSpec.ascending(2)), 0);
        assertEquals(Arrays.asList(2.0, 3.0, 1.0, 4.0), ascending);
    }

    @Test
    public void testBooleanFalseBeforeTrue() {
        List<Row> rows = Arrays.asList(
                Row.of(1.0, "a", null, true),
                Row.of(2.0, "b", null, null),
                Row.of(3.0, "c", null, false));

        assertEquals(Arrays.asList(false, true, null), column(sorted(rows, SortSpec.ascending(3)), 3));
        assertEquals(Arrays.asList(true, false, null), column(sorted(rows, SortSpec.descending(3)), 3));
    }

    @Test
    public void testStableForEqualKeys() {
        List<Row> rows = Arrays.asList(
                Row.of(1.0, "x", null, true),
                Row.of(2.0, "y", null, true),
                Row.of(3.0, "x", null, true),
                Row.of(4.0, "y", null, true));

        assertEquals(Arrays.asList(1.0, 3.0, 2.0, 4.0), column(sorted(rows, SortSpec.ascending(1)), 0));
        assertEquals(Arrays.asList(2.0, 4.0, 1.0, 3.0), column(sorted(rows, SortSpec.descending(1)), 0));
    }

    @Test
    public void testReversingKeepsTheSameRows() {
        List<Row> rows = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            rows.add(Row.of((double) ((i * 13) % 17), "n" + i, null, i % 2 == 0));
        }
        List<Row> ascending = sorted(rows, SortSpec.ascending(0));
        List<Row> descending = sorted(rows, SortSpec.descending(0));

        assertEquals(rows.size(), descending.size());
        assertTrue(ascending.containsAll(descending) && descending.containsAll(ascending));
        List<Object> reversedKeys = column(descending, 0);
        Collections.reverse(reversedKeys);
        assertEquals(column(ascending, 0), reversedKeys);
    }

    @Test
    public void testUnsortedHasNoComparator() {
        assertThrows(IllegalArgumentException.class, () -> RowComparators.forSort(SCHEMA, SortSpec.NONE));
    }
}
