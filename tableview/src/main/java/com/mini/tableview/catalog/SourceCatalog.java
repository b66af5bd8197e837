package com.mini.tableview.catalog;

import com.mini.tableview.exception.CatalogException;
import com.mini.tableview.source.SourceIdentity;
import com.mini.tableview.source.TabularSource;

import java.util.List;

/**
 * 数据源目录
 *
 * 一个数据文件暴露的全部数据源：数据库文件中的表、工作簿中的工作表，
 * 或分隔文件本身。目录关闭时关闭它打开的所有数据源。
 */
public interface SourceCatalog extends SourceResolver, AutoCloseable {

    /**
     * 文件路径或 JDBC URL
     */
    String location();

    /**
     * 列出所有数据源，顺序与文件中一致
     */
    List<SourceIdentity> listSources();

    /**
     * 获取数据源，同一个对象名返回同一个实例直到它被关闭
     *
     * @throws CatalogException.SourceNotExistException 对象不存在
     */
    TabularSource getSource(String objectName);

    @Override
    default TabularSource resolve(SourceIdentity identity) {
        if (!location().equals(identity.getLocation())) {
            throw new CatalogException.SourceNotExistException(identity.getLocation(), identity.getObject());
        }
        return getSource(identity.getObject());
    }

    @Override
    void close();
}
