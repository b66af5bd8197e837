package com.mini.tableview.schema;

import com.mini.tableview.data.Row;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 列描述性统计
 *
 * 统计信息包括:
 * 1. 非空值数量与空值数量
 * 2. 不同值数量
 * 3. 最小值/最大值 (按列类型比较)
 * 4. 数值列的均值与样本标准差
 * 5. 出现次数最多的值
 */
public class ColumnStatistics {

    private final String columnName;
    private final DataType dataType;

    /** 非空值数量 */
    private final long count;

    /** 空值数量 */
    private final long nullCount;

    /** 不同值数量(基数) */
    private final long distinctCount;

    private final Object minValue;
    private final Object maxValue;

    /** 均值，非数值列为 null */
    private final Double mean;

    /** 样本标准差，非数值列或样本不足时为 null */
    private final Double stdDev;

    /** 出现次数最多的值 */
    private final Object topValue;
    private final long topFrequency;

    public ColumnStatistics(String columnName, DataType dataType, long count, long nullCount,
                            long distinctCount, Object minValue, Object maxValue,
                            Double mean, Double stdDev, Object topValue, long topFrequency) {
        this.columnName = columnName;
        this.dataType = dataType;
        this.count = count;
        this.nullCount = nullCount;
        this.distinctCount = distinctCount;
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.mean = mean;
        this.stdDev = stdDev;
        this.topValue = topValue;
        this.topFrequency = topFrequency;
    }

    /**
     * 基于全部行计算某一列的统计信息
     */
    public static ColumnStatistics compute(Field field, int columnIndex, List<Row> rows) {
        DataType type = field.getType();
        boolean numeric = type.family() == TypeFamily.NUMERIC;
        boolean comparable = type.isSortable();

        long count = 0;
        long nullCount = 0;
        Object min = null;
        Object max = null;
        Map<Object, Long> frequencies = new HashMap<>();

        // Welford 算法，单次遍历求均值和方差
        long numericCount = 0;
        double runningMean = 0.0;
        double m2 = 0.0;

        for (Row row : rows) {
            Object value = row.getValue(columnIndex);
            if (value == null) {
                nullCount++;
                continue;
            }
            count++;
            if (!(value instanceof byte[])) {
                frequencies.merge(value, 1L, Long::sum);
            }

            if (comparable) {
                if (min == null || type.compareValues(value, min) < 0) {
                    min = value;
                }
                if (max == null || type.compareValues(value, max) > 0) {
                    max = value;
                }
            }

            if (numeric && value instanceof Number) {
                double x = ((Number) value).doubleValue();
                numericCount++;
                double delta = x - runningMean;
                runningMean += delta / numericCount;
                m2 += delta * (x - runningMean);
            }
        }

        Object top = null;
        long topFrequency = 0;
        for (Map.Entry<Object, Long> entry : frequencies.entrySet()) {
            if (entry.getValue() > topFrequency) {
                top = entry.getKey();
                topFrequency = entry.getValue();
            }
        }

        Double mean = numeric && numericCount > 0 ? runningMean : null;
        Double stdDev = numeric && numericCount > 1 ? Math.sqrt(m2 / (numericCount - 1)) : null;

        return new ColumnStatistics(field.getName(), type, count, nullCount, frequencies.size(),
                min, max, mean, stdDev, top, topFrequency);
    }

    public String getColumnName() {
        return columnName;
    }

    public DataType getDataType() {
        return dataType;
    }

    public long getCount() {
        return count;
    }

    public long getNullCount() {
        return nullCount;
    }

    public long getDistinctCount() {
        return distinctCount;
    }

    public Object getMinValue() {
        return minValue;
    }

    public Object getMaxValue() {
        return maxValue;
    }

    public Double getMean() {
        return mean;
    }

    public Double getStdDev() {
        return stdDev;
    }

    public Object getTopValue() {
        return topValue;
    }

    public long getTopFrequency() {
        return topFrequency;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(columnName).append(" (").append(dataType).append("):\n");
        sb.append("  count    ").append(count).append('\n');
        sb.append("  nulls    ").append(nullCount).append('\n');
        sb.append("  unique   ").append(distinctCount).append('\n');
        if (mean != null) {
            sb.append("  mean     ").append(String.format("%.6g", mean)).append('\n');
        }
        if (stdDev != null) {
            sb.append("  std      ").append(String.format("%.6g", stdDev)).append('\n');
        }
        if (minValue != null) {
            sb.append("  min      ").append(minValue).append('\n');
            sb.append("  max      ").append(maxValue).append('\n');
        }
        if (topValue != null) {
            sb.append("  top      ").append(topValue).append(" (").append(topFrequency).append(")\n");
        }
        return sb.toString();
    }
}
