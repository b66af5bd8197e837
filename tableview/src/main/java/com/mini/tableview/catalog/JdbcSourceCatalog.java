package com.mini.tableview.catalog;

import com.mini.tableview.exception.CatalogException;
import com.mini.tableview.source.JdbcTableSource;
import com.mini.tableview.source.SourceOptions;
import com.mini.tableview.source.TabularSource;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * SQLite 数据库文件目录，每张表一个数据源
 * SQLite 内部表（sqlite_ 前缀）不可见
 */
public class JdbcSourceCatalog extends AbstractSourceCatalog {

    private static final String INTERNAL_PREFIX = "sqlite_";

    private final Path databaseFile;
    private final String jdbcUrl;

    public JdbcSourceCatalog(Path databaseFile, SourceOptions options) {
        super(databaseFile.toString(), options);
        this.databaseFile = databaseFile;
        this.jdbcUrl = "jdbc:sqlite:" + databaseFile;
    }

    @Override
    protected List<String> listObjectNames() {
        try (Connection connection = DriverManager.getConnection(jdbcUrl);
             ResultSet tables = connection.getMetaData().getTables(null, null, "%", new String[]{"TABLE"})) {
            List<String> names = new ArrayList<>();
            while (tables.next()) {
                String name = tables.getString("TABLE_NAME");
                if (!name.toLowerCase(Locale.ROOT).startsWith(INTERNAL_PREFIX)) {
                    names.add(name);
                }
            }
            return names;
        } catch (SQLException e) {
            throw new CatalogException("Failed to list tables of " + databaseFile + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected TabularSource createSource(String objectName) {
        return JdbcTableSource.sqlite(databaseFile, objectName, options);
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }
}
