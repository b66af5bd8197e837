package com.mini.tableview.catalog;

import com.google.common.collect.ImmutableSet;

import java.nio.file.Path;
import java.util.Set;

/**
 * 分隔文件目录工厂，通过 SPI 机制注册
 */
public class DelimitedFileCatalogFactory implements SourceCatalogFactory {

    public static final String IDENTIFIER = "delimited";

    private static final Set<String> EXTENSIONS = ImmutableSet.of("csv", "tsv");

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
        return new DelimitedFileCatalog(file, context.toSourceOptions());
    }
}
