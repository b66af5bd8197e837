package com.mini.tableview.catalog;

import com.mini.tableview.source.DelimitedFileSource;
import com.mini.tableview.source.SourceIdentity;
import com.mini.tableview.source.SourceOptions;
import com.mini.tableview.source.TabularSource;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * 分隔文件目录，只有一个以文件名命名的数据源
 */
public class DelimitedFileCatalog extends AbstractSourceCatalog {

    private final Path file;
    private final String objectName;

    public DelimitedFileCatalog(Path file, SourceOptions options) {
        super(file.toString(), options);
        this.file = file;
        this.objectName = file.getFileName().toString();
    }

    @Override
    protected List<String> listObjectNames() {
        return Collections.singletonList(objectName);
    }

    @Override
    protected TabularSource createSource(String name) {
        return new DelimitedFileSource(new SourceIdentity(location, name), file, options);
    }
}
