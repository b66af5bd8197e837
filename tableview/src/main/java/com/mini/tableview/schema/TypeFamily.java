package com.mini.tableview.schema;

/**
 * 类型族
 * 决定列的展示方式以及排序比较器的选择
 */
public enum TypeFamily {
    /** 数值: 按数值大小比较 */
    NUMERIC,
    /** 文本: 按字典序比较 */
    TEXT,
    /** 时间: 按时间先后比较 */
    TEMPORAL,
    /** 布尔: false 在前 */
    BOOLEAN,
    /** 二进制: 不支持排序 */
    BLOB
}
