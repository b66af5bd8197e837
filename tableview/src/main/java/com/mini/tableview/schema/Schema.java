package com.mini.tableview.schema;

import com.google.common.collect.ImmutableList;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Schema 类
 * 数据源的列定义，加载后不可变
 */
public class Schema {
    public static final Schema EMPTY = new Schema(ImmutableList.of());

    /** 字段列表 */
    private final ImmutableList<Field> fields;

    public Schema(List<Field> fields) {
        this.fields = ImmutableList.copyOf(Objects.requireNonNull(fields, "Fields cannot be null"));
        validate();
    }

    /**
     * 验证Schema的有效性
     */
    private void validate() {
        Set<String> names = new HashSet<>();
        for (Field field : fields) {
            if (!names.add(field.getName())) {
                throw new IllegalArgumentException("Duplicate column name: " + field.getName());
            }
        }
    }

    public List<Field> getFields() {
        return fields;
    }

    public int getFieldCount() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public Field getField(int index) {
        return fields.get(index);
    }

    /**
     * 根据字段名获取字段
     */
    public Field getField(String name) {
        return fields.stream()
                .filter(f -> f.getName().equals(name))
                .findFirst()
                .orElse(null);
    }

    public boolean isValidColumn(int index) {
        return index >= 0 && index < fields.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Schema schema = (Schema) o;
        return fields.equals(schema.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Schema{fields=" + fields + '}';
    }
}
