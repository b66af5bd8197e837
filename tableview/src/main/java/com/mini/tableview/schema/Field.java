package com.mini.tableview.schema;

import java.util.Objects;

/**
 * 字段定义类
 * 表示数据源中的一个列
 */
public class Field {
    /** 字段名 */
    private final String name;

    /** 字段类型 */
    private final DataType type;

    /** 是否可为空 */
    private final boolean nullable;

    public Field(String name, DataType type) {
        this(name, type, true);
    }

    public Field(String name, DataType type, boolean nullable) {
        this.name = Objects.requireNonNull(name, "Field name cannot be null");
        this.type = Objects.requireNonNull(type, "Field type cannot be null");
        this.nullable = nullable;
    }

    public String getName() {
        return name;
    }

    public DataType getType() {
        return type;
    }

    public boolean isNullable() {
        return nullable;
    }

    public boolean isSortable() {
        return type.isSortable();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Field field = (Field) o;
        return nullable == field.nullable &&
                name.equals(field.name) &&
                type.equals(field.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, nullable);
    }

    @Override
    public String toString() {
        return "Field{" +
                "name='" + name + '\'' +
                ", type=" + type +
                ", nullable=" + nullable +
                '}';
    }
}
