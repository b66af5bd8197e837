package com.mini.tableview.source;

import com.mini.tableview.data.Row;
import com.mini.tableview.exception.SourceException;
import com.mini.tableview.format.JdbcTypeMapper;
import com.mini.tableview.page.PagePlanner;
import com.mini.tableview.page.PageRequest;
import com.mini.tableview.page.PageResult;
import com.mini.tableview.page.SearchFilter;
import com.mini.tableview.page.SortSpec;
import com.mini.tableview.schema.DataType;
import com.mini.tableview.schema.Field;
import com.mini.tableview.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * 数据库表数据源
 *
 * 无搜索条件时排序和分页下推到数据库：
 * {@code ORDER BY (col IS NULL), col ASC|DESC LIMIT ? OFFSET ?}，空值总在最后。
 * 有搜索条件时退回基类的内存过滤和排序。
 * 每次操作打开独立连接，可在任意工作线程上调用。
 */
public class JdbcTableSource extends AbstractTabularSource {
    private static final Logger logger = LoggerFactory.getLogger(JdbcTableSource.class);

    private final String jdbcUrl;
    private final String tableName;
    private final Path databaseFile;

    private volatile FileFingerprint fingerprint = FileFingerprint.MISSING;

    /**
     * @param databaseFile 数据库文件，用于检测外部修改；非文件型数据库传 null
     */
    public JdbcTableSource(SourceIdentity identity, String jdbcUrl, String tableName,
                           Path databaseFile, SourceOptions options) {
        super(identity, options);
        this.jdbcUrl = jdbcUrl;
        this.tableName = tableName;
        this.databaseFile = databaseFile;
    }

    public static JdbcTableSource sqlite(Path databaseFile, String tableName, SourceOptions options) {
        String location = databaseFile.toString();
        return new JdbcTableSource(new SourceIdentity(location, tableName),
                "jdbc:sqlite:" + location, tableName, databaseFile, options);
    }

    @Override
    protected Schema loadSchema() throws IOException {
        if (databaseFile != null) {
            fingerprint = FileFingerprint.of(databaseFile);
        }
        try (Connection connection = connect()) {
            DatabaseMetaData metaData = connection.getMetaData();
            List<Field> fields = new ArrayList<>();
            try (ResultSet columns = metaData.getColumns(null, null, tableName, null)) {
                while (columns.next()) {
                    // 表名参数是 LIKE 模式，a_b 也会匹配 axb，只保留同名表的列
                    if (!tableName.equals(columns.getString("TABLE_NAME"))) {
                        continue;
                    }
                    String name = columns.getString("COLUMN_NAME");
                    DataType type = JdbcTypeMapper.map(
                            columns.getString("TYPE_NAME"),
                            columns.getInt("DATA_TYPE"),
                            columns.getInt("COLUMN_SIZE"),
                            columns.getInt("DECIMAL_DIGITS"));
                    boolean nullable = columns.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls;
                    fields.add(new Field(name, type, nullable));
                }
            }
            if (fields.isEmpty()) {
                throw new IOException("Table '" + tableName + "' not found or has no columns");
            }
            return new Schema(fields);
        } catch (SQLException e) {
            throw new IOException("Failed to read columns of " + tableName + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected List<Row> loadRows(Schema schema, Deadline deadline) throws IOException {
        String sql = "SELECT * FROM " + quote(tableName);
        try (Connection connection = connect();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            applyTimeout(statement, deadline);
            List<Row> rows = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    rows.add(readRow(resultSet, schema.getFieldCount()));
                    if ((rows.size() & 0x3FF) == 0) {
                        deadline.check(identity);
                    }
                }
            }
            return rows;
        } catch (SQLException e) {
            throw translate(e, deadline);
        }
    }

    @Override
    public long rowCount(SearchFilter filter) {
        if (!filter.isNone()) {
            return super.rowCount(filter);
        }
        ensureOpen();
        detectChanges();
        loadedSchema();

        Deadline deadline = options.newDeadline();
        String sql = "SELECT COUNT(*) FROM " + quote(tableName);
        try (Connection connection = connect();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            applyTimeout(statement, deadline);
            try (ResultSet resultSet = statement.executeQuery()) {
                resultSet.next();
                return resultSet.getLong(1);
            }
        } catch (SQLException e) {
            throw translate(e, deadline);
        }
    }

    @Override
    public PageResult fetchPage(PageRequest request) {
        if (!request.getFilter().isNone()) {
            return super.fetchPage(request);
        }
        ensureOpen();
        checkRequest(request);
        detectChanges();

        Schema schema = loadedSchema();
        SortSpec sort = request.getSort();
        PagePlanner.validateSort(sort, schema);

        Deadline deadline = options.newDeadline();
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(quote(tableName));
        if (!sort.isNone()) {
            String column = quote(schema.getField(sort.getColumnIndex()).getName());
            sql.append(" ORDER BY CASE WHEN ").append(column).append(" IS NULL THEN 1 ELSE 0 END, ")
                    .append(column).append(' ').append(sort.getDirection().sql());
        }
        sql.append(" LIMIT ? OFFSET ?");

        long start = System.currentTimeMillis();
        try (Connection connection = connect()) {
            long total = count(connection, deadline);
            List<Row> rows = new ArrayList<>(request.getPageSize());
            try (PreparedStatement statement = connection.prepareStatement(sql.toString())) {
                applyTimeout(statement, deadline);
                statement.setInt(1, request.getPageSize());
                statement.setLong(2, request.getOffset());
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        rows.add(readRow(resultSet, schema.getFieldCount()));
                    }
                }
            }
            deadline.check(identity);
            logger.debug("Fetched page {} of {} ({} rows) in {} ms",
                    request.getPageIndex(), identity, rows.size(), System.currentTimeMillis() - start);
            return new PageResult(request, schema, rows, total);
        } catch (SQLException e) {
            throw translate(e, deadline);
        }
    }

    private long count(Connection connection, Deadline deadline) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT COUNT(*) FROM " + quote(tableName))) {
            applyTimeout(statement, deadline);
            try (ResultSet resultSet = statement.executeQuery()) {
                resultSet.next();
                return resultSet.getLong(1);
            }
        }
    }

    @Override
    protected boolean hasChangedSinceLoad() {
        return databaseFile != null && !fingerprint.equals(FileFingerprint.of(databaseFile));
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    private static Row readRow(ResultSet resultSet, int width) throws SQLException {
        Object[] values = new Object[width];
        for (int i = 0; i < width; i++) {
            values[i] = resultSet.getObject(i + 1);
        }
        return new Row(values);
    }

    private static void applyTimeout(Statement statement, Deadline deadline) throws SQLException {
        if (deadline.isBounded()) {
            statement.setQueryTimeout(deadline.remainingSeconds());
        }
    }

    /**
     * 标识符加双引号，内部的双引号加倍
     */
    static String quote(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    private SourceException translate(SQLException e, Deadline deadline) {
        if (e instanceof SQLTimeoutException || deadline.isExpired()) {
            return new SourceException.FetchTimeoutException(identity, deadline.getTimeoutMillis(), e);
        }
        return new SourceException.SourceUnavailableException(identity, e);
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public String getTableName() {
        return tableName;
    }
}
