package com.mini.tableview.catalog;

import com.mini.tableview.exception.CatalogException;
import com.mini.tableview.format.SpreadsheetReader;
import com.mini.tableview.source.SourceIdentity;
import com.mini.tableview.source.SourceOptions;
import com.mini.tableview.source.SpreadsheetSheetSource;
import com.mini.tableview.source.TabularSource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 电子表格目录，每个工作表一个数据源
 */
public class SpreadsheetCatalog extends AbstractSourceCatalog {

    private final Path file;
    private final List<String> sheetNames;

    public SpreadsheetCatalog(Path file, SourceOptions options) {
        super(file.toString(), options);
        this.file = file;
        try {
            this.sheetNames = new SpreadsheetReader(file).sheetNames();
        } catch (IOException e) {
            throw new CatalogException("Failed to read sheets of " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected List<String> listObjectNames() {
        return sheetNames;
    }

    @Override
    protected TabularSource createSource(String sheetName) {
        return new SpreadsheetSheetSource(new SourceIdentity(location, sheetName), file, sheetName, options);
    }
}
