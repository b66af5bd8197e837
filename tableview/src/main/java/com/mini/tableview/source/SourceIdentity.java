package com.mini.tableview.source;

import java.io.Serializable;
import java.util.Objects;

/**
 * 数据源标识符
 *
 * 用于唯一标识一个数据源（location#object），例如
 * {@code /data/shop.db#orders} 或 {@code /data/report.xlsx#Sheet1}
 */
public class SourceIdentity implements Serializable {
    private static final long serialVersionUID = 1L;

    /** 位置与对象名之间的分隔符 */
    public static final String OBJECT_SPLITTER = "#";

    /** 文件路径或 JDBC URL */
    private final String location;

    /** 表名或工作表名 */
    private final String object;

    public SourceIdentity(String location, String object) {
        this.location = Objects.requireNonNull(location, "Location cannot be null");
        this.object = Objects.requireNonNull(object, "Object name cannot be null");

        validateName(location, "location");
        validateName(object, "object");
    }

    /**
     * 从字符串创建标识符（格式：location#object），以最后一个分隔符切分
     */
    public static SourceIdentity fromString(String fullName) {
        Objects.requireNonNull(fullName, "Full name cannot be null");

        int split = fullName.lastIndexOf(OBJECT_SPLITTER);
        if (split <= 0 || split == fullName.length() - 1) {
            throw new IllegalArgumentException(
                    "Invalid source identifier: " + fullName + ". Expected format: location#object");
        }
        return new SourceIdentity(fullName.substring(0, split), fullName.substring(split + 1));
    }

    private static void validateName(String name, String kind) {
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("Source " + kind + " cannot be empty");
        }
    }

    public String getLocation() {
        return location;
    }

    public String getObject() {
        return object;
    }

    public String getFullName() {
        return location + OBJECT_SPLITTER + object;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceIdentity that = (SourceIdentity) o;
        return location.equals(that.location) && object.equals(that.object);
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, object);
    }

    @Override
    public String toString() {
        return getFullName();
    }
}
