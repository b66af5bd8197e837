package com.mini.tableview.catalog;

import java.nio.file.Path;
import java.util.Set;

/**
 * 目录工厂接口
 *
 * 通过 SPI (Service Provider Interface) 机制加载，
 * 每种文件格式提供一个工厂实现，按文件扩展名选择
 */
public interface SourceCatalogFactory {

    /**
     * 工厂的唯一标识符，例如 "sqlite"、"delimited"
     */
    String identifier();

    /**
     * 支持的文件扩展名（小写，不含点）
     */
    Set<String> supportedExtensions();

    /**
     * 打开数据文件
     */
    SourceCatalog create(Path file, CatalogContext context);
}
