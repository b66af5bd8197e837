package com.mini.tableview.source;

import com.mini.tableview.data.Row;
import com.mini.tableview.format.HeaderNames;
import com.mini.tableview.format.SpreadsheetReader;
import com.mini.tableview.format.TypeInference;
import com.mini.tableview.schema.DataType;
import com.mini.tableview.schema.Field;
import com.mini.tableview.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 电子表格工作表数据源，一个工作表对应一个数据源
 */
public class SpreadsheetSheetSource extends AbstractTabularSource {
    private static final Logger logger = LoggerFactory.getLogger(SpreadsheetSheetSource.class);

    private final Path filePath;
    private final String sheetName;

    private volatile Parsed parsed;
    private volatile FileFingerprint fingerprint = FileFingerprint.MISSING;

    public SpreadsheetSheetSource(SourceIdentity identity, Path filePath, String sheetName,
                                  SourceOptions options) {
        super(identity, options);
        this.filePath = filePath;
        this.sheetName = sheetName;
    }

    @Override
    protected Schema loadSchema() throws IOException {
        return parse().schema;
    }

    @Override
    protected List<Row> loadRows(Schema schema, Deadline deadline) throws IOException {
        Parsed current = parsed;
        if (current == null || !current.schema.equals(schema)) {
            current = parse();
        }
        deadline.check(identity);
        return current.rows;
    }

    private synchronized Parsed parse() throws IOException {
        FileFingerprint before = FileFingerprint.of(filePath);
        SpreadsheetReader.SheetData sheet = new SpreadsheetReader(filePath).readSheet(sheetName);

        if (sheet.isEmpty()) {
            Parsed empty = new Parsed(Schema.EMPTY, new ArrayList<>());
            parsed = empty;
            fingerprint = before;
            return empty;
        }

        List<String> names = HeaderNames.normalize(sheet.getHeader());
        List<List<Object>> records = sheet.getRecords();
        int width = names.size();

        List<Field> fields = new ArrayList<>(width);
        List<DataType> types = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            List<Object> column = new ArrayList<>(records.size());
            for (List<Object> record : records) {
                column.add(record.get(c));
            }
            DataType type = TypeInference.inferFromObjects(column);
            types.add(type);
            fields.add(new Field(names.get(c), type));
        }

        List<Row> rows = new ArrayList<>(records.size());
        for (List<Object> record : records) {
            Object[] values = new Object[width];
            for (int c = 0; c < width; c++) {
                values[c] = TypeInference.coerce(record.get(c), types.get(c));
            }
            rows.add(new Row(values));
        }

        Parsed result = new Parsed(new Schema(fields), rows);
        parsed = result;
        fingerprint = before;
        logger.debug("Read sheet '{}' of {}: {} columns, {} rows", sheetName, filePath, width, rows.size());
        return result;
    }

    @Override
    protected boolean hasChangedSinceLoad() {
        return !fingerprint.equals(FileFingerprint.of(filePath));
    }

    @Override
    protected void onRefresh() {
        parsed = null;
    }

    public String getSheetName() {
        return sheetName;
    }

    private static final class Parsed {
        final Schema schema;
        final List<Row> rows;

        Parsed(Schema schema, List<Row> rows) {
            this.schema = schema;
            this.rows = rows;
        }
    }
}
