package com.mini.tableview.catalog;

import com.google.common.collect.ImmutableSet;

import java.nio.file.Path;
import java.util.Set;

/**
 * 电子表格目录工厂，通过 SPI 机制注册
 */
public class SpreadsheetCatalogFactory implements SourceCatalogFactory {

    public static final String IDENTIFIER = "xlsx";

    private static final Set<String> EXTENSIONS = ImmutableSet.of("xlsx");

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
        return new SpreadsheetCatalog(file, context.toSourceOptions());
    }
}
