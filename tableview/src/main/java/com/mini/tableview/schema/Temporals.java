package com.mini.tableview.schema;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Date;

/**
 * 时间值工具类
 * 把各种来源的时间值统一成 LocalDateTime 以便比较
 */
public final class Temporals {

    /** yyyy-MM-dd[ HH:mm[:ss[.SSS]]] 或 ISO 的 'T' 分隔 */
    private static final DateTimeFormatter DATE_TIME = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd")
            .optionalStart()
            .appendLiteral(' ')
            .optionalEnd()
            .optionalStart()
            .appendLiteral('T')
            .optionalEnd()
            .optionalStart()
            .appendPattern("HH:mm")
            .optionalStart()
            .appendPattern(":ss")
            .optionalEnd()
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
            .toFormatter();

    private Temporals() {
    }

    /**
     * 转换为 LocalDateTime，无法识别时返回 null
     */
    public static LocalDateTime toDateTime(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) value).toLocalDateTime();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().atStartOfDay();
        }
        if (value instanceof Date) {
            return LocalDateTime.ofInstant(((Date) value).toInstant(), ZoneId.systemDefault());
        }
        if (value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, ZoneId.systemDefault());
        }
        if (value instanceof CharSequence) {
            return parse(value.toString());
        }
        return null;
    }

    /**
     * 解析日期或日期时间字符串，失败返回 null
     */
    public static LocalDateTime parse(String text) {
        String trimmed = text.trim();
        // 最短的合法值是 yyyy-MM-dd
        if (trimmed.length() < 10 || trimmed.charAt(4) != '-') {
            return null;
        }
        try {
            return LocalDateTime.parse(trimmed, DATE_TIME);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
