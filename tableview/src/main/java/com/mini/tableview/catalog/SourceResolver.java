package com.mini.tableview.catalog;

import com.mini.tableview.source.SourceIdentity;
import com.mini.tableview.source.TabularSource;

/**
 * 按标识符查找数据源
 */
@FunctionalInterface
public interface SourceResolver {

    /**
     * @throws com.mini.tableview.exception.CatalogException.SourceNotExistException 数据源不存在
     */
    TabularSource resolve(SourceIdentity identity);
}
