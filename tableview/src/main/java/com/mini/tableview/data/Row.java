package com.mini.tableview.data;

import java.util.Arrays;

/**
 * 数据行
 * 表示一行数据，字段值与 Schema 的列一一对应
 */
public class Row {
    /** 字段值数组 */
    private final Object[] values;

    /**
     * 构造函数
     *
     * @param values 字段值数组
     */
    public Row(Object[] values) {
        this.values = values != null ? values.clone() : new Object[0];
    }

    public static Row of(Object... values) {
        return new Row(values);
    }

    /**
     * 获取指定索引的字段值，越界返回 null
     */
    public Object getValue(int index) {
        if (index < 0 || index >= values.length) {
            return null;
        }
        return values[index];
    }

    public int getFieldCount() {
        return values.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Row row = (Row) o;
        return Arrays.deepEquals(values, row.values);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return "Row{" + "values=" + Arrays.toString(values) + '}';
    }
}
