package com.mini.tableview.catalog;

import com.mini.tableview.exception.CatalogException;
import com.mini.tableview.source.SourceIdentity;
import com.mini.tableview.source.SourceOptions;
import com.mini.tableview.source.TabularSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 目录基类：按需创建数据源并缓存已打开的实例
 */
public abstract class AbstractSourceCatalog implements SourceCatalog {
    private static final Logger logger = LoggerFactory.getLogger(AbstractSourceCatalog.class);

    protected final String location;
    protected final SourceOptions options;

    private final Map<String, TabularSource> opened = new ConcurrentHashMap<>();
    private volatile boolean closed = false;

    protected AbstractSourceCatalog(String location, SourceOptions options) {
        this.location = location;
        this.options = options;
    }

    /**
     * 文件中的对象名（表名、工作表名）
     */
    protected abstract List<String> listObjectNames();

    protected abstract TabularSource createSource(String objectName);

    @Override
    public String location() {
        return location;
    }

    @Override
    public List<SourceIdentity> listSources() {
        ensureOpen();
        List<SourceIdentity> identities = new ArrayList<>();
        for (String name : listObjectNames()) {
            identities.add(new SourceIdentity(location, name));
        }
        return identities;
    }

    @Override
    public TabularSource getSource(String objectName) {
        ensureOpen();
        TabularSource existing = opened.get(objectName);
        if (existing != null && !existing.isClosed()) {
            return existing;
        }
        if (!listObjectNames().contains(objectName)) {
            throw new CatalogException.SourceNotExistException(location, objectName);
        }
        return opened.compute(objectName, (name, current) -> {
            if (current != null && !current.isClosed()) {
                return current;
            }
            logger.info("Opening source {}#{}", location, name);
            return createSource(name);
        });
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (TabularSource source : opened.values()) {
            source.close();
        }
        opened.clear();
        logger.info("Catalog {} closed", location);
    }

    protected void ensureOpen() {
        if (closed) {
            throw new CatalogException("Catalog is closed: " + location);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + location + "}";
    }
}
