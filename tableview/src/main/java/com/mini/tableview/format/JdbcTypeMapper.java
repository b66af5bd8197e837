package com.mini.tableview.format;

import com.mini.tableview.schema.DataType;

import java.sql.Types;
import java.util.Locale;

/**
 * 数据库列类型映射
 *
 * 先按声明的类型名匹配（与 SQLite 的类型亲和规则一致），
 * 类型名无法识别时退回 {@link java.sql.Types} 代码。
 */
public final class JdbcTypeMapper {

    private JdbcTypeMapper() {
    }

    public static DataType map(String typeName, int sqlType, int precision, int scale) {
        String name = typeName == null ? "" : typeName.toUpperCase(Locale.ROOT);

        if (name.contains("INT")) {
            return DataType.LONG();
        }
        if (name.contains("CHAR") || name.contains("CLOB") || name.contains("TEXT")) {
            return DataType.STRING();
        }
        if (name.contains("BLOB") || name.contains("BINARY")) {
            return DataType.BINARY();
        }
        if (name.contains("REAL") || name.contains("FLOA") || name.contains("DOUB")) {
            return DataType.DOUBLE();
        }
        if (name.contains("BOOL")) {
            return DataType.BOOLEAN();
        }
        if (name.startsWith("DATETIME") || name.startsWith("TIMESTAMP")) {
            return DataType.TIMESTAMP();
        }
        if (name.equals("DATE")) {
            return DataType.DATE();
        }
        if (name.contains("DEC") || name.contains("NUM")) {
            return precision > 0 ? DataType.DECIMAL(precision, Math.max(scale, 0)) : DataType.DOUBLE();
        }
        return fromSqlType(sqlType);
    }

    static DataType fromSqlType(int sqlType) {
        switch (sqlType) {
            case Types.TINYINT:
            case Types.SMALLINT:
            case Types.INTEGER:
            case Types.BIGINT:
                return DataType.LONG();
            case Types.FLOAT:
            case Types.REAL:
            case Types.DOUBLE:
            case Types.NUMERIC:
            case Types.DECIMAL:
                return DataType.DOUBLE();
            case Types.BIT:
            case Types.BOOLEAN:
                return DataType.BOOLEAN();
            case Types.DATE:
                return DataType.DATE();
            case Types.TIME:
            case Types.TIMESTAMP:
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return DataType.TIMESTAMP();
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
            case Types.BLOB:
                return DataType.BINARY();
            default:
                return DataType.STRING();
        }
    }
}
