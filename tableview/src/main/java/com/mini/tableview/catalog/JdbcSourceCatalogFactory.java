package com.mini.tableview.catalog;

import com.google.common.collect.ImmutableSet;

import java.nio.file.Path;
import java.util.Set;

/**
 * SQLite 数据库文件目录工厂，通过 SPI 机制注册
 *
 * <p>每张用户表对应一个数据源，sqlite_ 开头的内部表不暴露。
 */
public class JdbcSourceCatalogFactory implements SourceCatalogFactory {

    public static final String IDENTIFIER = "sqlite";

    private static final Set<String> EXTENSIONS = ImmutableSet.of("db", "db3", "sqlite", "sqlite3");

    @Override
    public String identifier() {
        return IDENTIFIER;
    }

    @Override
    public Set<String> supportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public SourceCatalog create(Path file, CatalogContext context) {
        return new JdbcSourceCatalog(file, context.toSourceOptions());
    }
}
