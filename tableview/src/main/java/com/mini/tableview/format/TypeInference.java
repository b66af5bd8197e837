package com.mini.tableview.format;

import com.mini.tableview.schema.DataType;
import com.mini.tableview.schema.Temporals;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

/**
 * 列类型推断
 *
 * 文本来源（分隔文件）：依次尝试 BIGINT、DOUBLE、BOOLEAN、DATE、TIMESTAMP，都不满足时为 STRING。
 * 对象来源（电子表格）：按单元格值的 Java 类型推断，类型混杂时为 STRING。
 * 空值不参与推断；全部为空的列推断为 STRING。
 */
public final class TypeInference {

    private TypeInference() {
    }

    public static DataType inferFromText(List<String> values) {
        boolean any = false;
        boolean allLong = true;
        boolean allDouble = true;
        boolean allBoolean = true;
        boolean allDate = true;
        boolean allTemporal = true;

        for (String value : values) {
            if (value == null || value.isEmpty()) {
                continue;
            }
            any = true;
            if (allLong && parseLong(value) == null) {
                allLong = false;
            }
            if (allDouble && parseDouble(value) == null) {
                allDouble = false;
            }
            if (allBoolean && parseBoolean(value) == null) {
                allBoolean = false;
            }
            if (allTemporal) {
                LocalDateTime parsed = Temporals.parse(value);
                if (parsed == null) {
                    allTemporal = false;
                    allDate = false;
                } else if (value.trim().length() != 10) {
                    allDate = false;
                }
            }
            if (!allLong && !allDouble && !allBoolean && !allTemporal) {
                break;
            }
        }

        if (!any) {
            return DataType.STRING();
        }
        if (allLong) {
            return DataType.LONG();
        }
        if (allDouble) {
            return DataType.DOUBLE();
        }
        if (allBoolean) {
            return DataType.BOOLEAN();
        }
        if (allDate) {
            return DataType.DATE();
        }
        if (allTemporal) {
            return DataType.TIMESTAMP();
        }
        return DataType.STRING();
    }

    /**
     * 把文本转换为推断出的类型；空串为 null
     */
    public static Object convertText(String value, DataType type) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        if (type instanceof DataType.LongType) {
            return parseLong(value);
        } else if (type instanceof DataType.DoubleType) {
            return parseDouble(value);
        } else if (type instanceof DataType.BooleanType) {
            return parseBoolean(value);
        } else if (type instanceof DataType.DateType) {
            LocalDateTime parsed = Temporals.parse(value);
            return parsed == null ? null : parsed.toLocalDate();
        } else if (type instanceof DataType.TimestampType) {
            return Temporals.parse(value);
        }
        return value;
    }

    public static DataType inferFromObjects(List<Object> values) {
        boolean any = false;
        boolean allIntegral = true;
        boolean allNumber = true;
        boolean allBoolean = true;
        boolean allTemporal = true;

        for (Object value : values) {
            if (value == null) {
                continue;
            }
            any = true;
            if (value instanceof Number) {
                if (!isIntegral((Number) value)) {
                    allIntegral = false;
                }
            } else {
                allNumber = false;
                allIntegral = false;
            }
            if (!(value instanceof Boolean)) {
                allBoolean = false;
            }
            if (!(value instanceof LocalDateTime) && !(value instanceof LocalDate)) {
                allTemporal = false;
            }
        }

        if (!any) {
            return DataType.STRING();
        }
        if (allNumber) {
            return allIntegral ? DataType.LONG() : DataType.DOUBLE();
        }
        if (allBoolean) {
            return DataType.BOOLEAN();
        }
        if (allTemporal) {
            return DataType.TIMESTAMP();
        }
        return DataType.STRING();
    }

    /**
     * 把对象值规整到推断出的类型
     */
    public static Object coerce(Object value, DataType type) {
        if (value == null) {
            return null;
        }
        if (type instanceof DataType.LongType && value instanceof Number) {
            return ((Number) value).longValue();
        } else if (type instanceof DataType.DoubleType && value instanceof Number) {
            return ((Number) value).doubleValue();
        } else if (type instanceof DataType.TimestampType) {
            LocalDateTime dateTime = Temporals.toDateTime(value);
            return dateTime != null ? dateTime : value;
        } else if (type instanceof DataType.StringType && !(value instanceof String)) {
            return formatCell(value);
        }
        return value;
    }

    /**
     * 整数值的 double 去掉多余的 ".0"
     */
    public static String formatCell(Object value) {
        if (value instanceof Double) {
            double d = (Double) value;
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
        }
        return value.toString();
    }

    private static boolean isIntegral(Number number) {
        if (number instanceof Long || number instanceof Integer
                || number instanceof Short || number instanceof Byte) {
            return true;
        }
        double d = number.doubleValue();
        return d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15;
    }

    static Long parseLong(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Double parseDouble(String value) {
        String trimmed = value.trim();
        // Double.parseDouble 接受 "NaN"、"Infinity"、"1d" 之类的写法，这里只认普通数字
        if (trimmed.isEmpty() || !Character.isDigit(trimmed.charAt(trimmed.length() - 1))) {
            return null;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Boolean parseBoolean(String value) {
        String lower = value.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(lower)) {
            return Boolean.TRUE;
        }
        if ("false".equals(lower)) {
            return Boolean.FALSE;
        }
        return null;
    }
}
