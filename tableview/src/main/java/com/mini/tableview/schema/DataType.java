package com.mini.tableview.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 列数据类型
 *
 * 每种类型归属一个 {@link TypeFamily}，由类型族决定比较规则。
 * 比较方法只接收非空值，空值的位置由排序器统一处理。
 */
public abstract class DataType {

    public abstract String typeName();

    public abstract TypeFamily family();

    /**
     * 比较两个非空值
     */
    public abstract int compareValues(Object left, Object right);

    public boolean isSortable() {
        return family() != TypeFamily.BLOB;
    }

    public static DataType LONG() {
        return LongType.INSTANCE;
    }

    public static DataType DOUBLE() {
        return DoubleType.INSTANCE;
    }

    public static DataType DECIMAL(int precision, int scale) {
        return new DecimalType(precision, scale);
    }

    public static DataType STRING() {
        return StringType.INSTANCE;
    }

    public static DataType BOOLEAN() {
        return BooleanType.INSTANCE;
    }

    public static DataType TIMESTAMP() {
        return TimestampType.INSTANCE;
    }

    public static DataType DATE() {
        return DateType.INSTANCE;
    }

    public static DataType BINARY() {
        return BinaryType.INSTANCE;
    }

    /**
     * 数值比较: 数值排在非数值之前，非数值之间按文本比较
     *
     * <p>整数与浮点数混合时按精确值比较，超过 2^53 的 long 不会因转换为 double 而相等。
     */
    static int compareNumeric(Object left, Object right) {
        boolean leftNumber = left instanceof Number;
        boolean rightNumber = right instanceof Number;
        if (leftNumber && rightNumber) {
            Number l = (Number) left;
            Number r = (Number) right;
            if (isIntegral(l) && isIntegral(r)) {
                return Long.compare(l.longValue(), r.longValue());
            }
            if (isFloating(l) && isFloating(r)) {
                double a = l.doubleValue();
                double b = r.doubleValue();
                // -0.0 与 0.0 视为相等，和精确值比较保持一致
                return a == b ? 0 : Double.compare(a, b);
            }
            // NaN 与无穷大没有 BigDecimal 表示，按 Double.compare 的顺序处理
            if (!isFinite(l) || !isFinite(r)) {
                return Double.compare(l.doubleValue(), r.doubleValue());
            }
            return toBigDecimal(l).compareTo(toBigDecimal(r));
        }
        if (leftNumber != rightNumber) {
            return leftNumber ? -1 : 1;
        }
        return left.toString().compareTo(right.toString());
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer
                || number instanceof Short || number instanceof Byte;
    }

    private static boolean isFloating(Number number) {
        return number instanceof Double || number instanceof Float;
    }

    private static boolean isFinite(Number number) {
        return !isFloating(number) || Double.isFinite(number.doubleValue());
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger) number);
        }
        if (isIntegral(number)) {
            return BigDecimal.valueOf(number.longValue());
        }
        return new BigDecimal(number.doubleValue());
    }

    public static class LongType extends DataType {
        public static final LongType INSTANCE = new LongType();

        private LongType() {}

        @Override
        public String typeName() {
            return "BIGINT";
        }

        @Override
        public TypeFamily family() {
            return TypeFamily.NUMERIC;
        }

        @Override
        public int compareValues(Object left, Object right) {
            return compareNumeric(left, right);
        }

        @Override
        public String toString() {
            return "BIGINT";
        }
    }

    public static class DoubleType extends DataType {
        public static final DoubleType INSTANCE = new DoubleType();

        private DoubleType() {}

        @Override
        public String typeName() {
            return "DOUBLE";
        }

        @Override
        public TypeFamily family() {
            return TypeFamily.NUMERIC;
        }

        @Override
        public int compareValues(Object left, Object right) {
            return compareNumeric(left, right);
        }

        @Override
        public String toString() {
            return "DOUBLE";
        }
    }

    public static class DecimalType extends DataType {
        private final int precision;
        private final int scale;

        public DecimalType(int precision, int scale) {
            this.precision = precision;
            this.scale = scale;
        }

        @Override
        public String typeName() {
            return "DECIMAL";
        }

        @Override
        public TypeFamily family() {
            return TypeFamily.NUMERIC;
        }

        @Override
        public int compareValues(Object left, Object right) {
            return compareNumeric(left, right);
        }

        public int getPrecision() {
            return precision;
        }

        public int getScale() {
            return scale;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof DecimalType)) return false;
            DecimalType that = (DecimalType) o;
            return precision == that.precision && scale == that.scale;
        }

        @Override
        public int hashCode() {
            return Objects.hash(precision, scale);
        }

        @Override
        public String toString() {
            return "DECIMAL(" + precision + "," + scale + ")";
        }
    }

    public static class StringType extends DataType {
        public static final StringType INSTANCE = new StringType();

        private StringType() {}

        @Override
        public String typeName() {
            return "STRING";
        }

        @Override
        public TypeFamily family() {
            return TypeFamily.TEXT;
        }

        @Override
        public int compareValues(Object left, Object right) {
            return left.toString().compareTo(right.toString());
        }

        @Override
        public String toString() {
            return "STRING";
        }
    }

    public static class BooleanType extends DataType {
        public static final BooleanType INSTANCE = new BooleanType();

        private BooleanType() {}

        @Override
        public String typeName() {
            return "BOOLEAN";
        }

        @Override
        public TypeFamily family() {
            return TypeFamily.BOOLEAN;
        }

        @Override
        public int compareValues(Object left, Object right) {
            if (left instanceof Boolean && right instanceof Boolean) {
                return Boolean.compare((Boolean) left, (Boolean) right);
            }
            // SQLite 等来源会把布尔存成 0/1
            return compareNumeric(asNumber(left), asNumber(right));
        }

        private static Object asNumber(Object value) {
            if (value instanceof Boolean) {
                return ((Boolean) value) ? 1L : 0L;
            }
            return value;
        }

        @Override
        public String toString() {
            return "BOOLEAN";
        }
    }

    /**
     * 时间类型的公共比较逻辑: 可识别的时间值按先后比较，无法识别的排在后面并按文本比较
     */
    abstract static class TemporalType extends DataType {

        @Override
        public TypeFamily family() {
            return TypeFamily.TEMPORAL;
        }

        @Override
        public int compareValues(Object left, Object right) {
            LocalDateTime l = Temporals.toDateTime(left);
            LocalDateTime r = Temporals.toDateTime(right);
            if (l != null && r != null) {
                return l.compareTo(r);
            }
            if ((l == null) != (r == null)) {
                return l != null ? -1 : 1;
            }
            return left.toString().compareTo(right.toString());
        }
    }

    public static class TimestampType extends TemporalType {
        public static final TimestampType INSTANCE = new TimestampType();

        private TimestampType() {}

        @Override
        public String typeName() {
            return "TIMESTAMP";
        }

        @Override
        public String toString() {
            return "TIMESTAMP";
        }
    }

    public static class DateType extends TemporalType {
        public static final DateType INSTANCE = new DateType();

        private DateType() {}

        @Override
        public String typeName() {
            return "DATE";
        }

        @Override
        public String toString() {
            return "DATE";
        }
    }

    public static class BinaryType extends DataType {
        public static final BinaryType INSTANCE = new BinaryType();

        private BinaryType() {}

        @Override
        public String typeName() {
            return "BINARY";
        }

        @Override
        public TypeFamily family() {
            return TypeFamily.BLOB;
        }

        @Override
        public int compareValues(Object left, Object right) {
            throw new UnsupportedOperationException("BINARY values are not comparable");
        }

        @Override
        public String toString() {
            return "BINARY";
        }
    }
}
