package com.mini.tableview.source;

import com.mini.tableview.data.Row;
import com.mini.tableview.format.DelimitedFileReader;
import com.mini.tableview.format.HeaderNames;
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
 * 分隔文件数据源（CSV/TSV）
 *
 * 列类型由全部数据推断，因此 Schema 和数据在一次解析中得到。
 * 文件修改时间或大小变化时视为外部修改。
 */
public class DelimitedFileSource extends AbstractTabularSource {
    private static final Logger logger = LoggerFactory.getLogger(DelimitedFileSource.class);

    private final Path filePath;

    private volatile Parsed parsed;
    private volatile FileFingerprint fingerprint = FileFingerprint.MISSING;

    public DelimitedFileSource(SourceIdentity identity, Path filePath, SourceOptions options) {
        super(identity, options);
        this.filePath = filePath;
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
        DelimitedFileReader.DelimitedTable table =
                new DelimitedFileReader(filePath, options.getDelimiter()).read();

        if (table.isEmpty()) {
            logger.info("File {} is empty", filePath);
            Parsed empty = new Parsed(Schema.EMPTY, new ArrayList<>());
            parsed = empty;
            fingerprint = before;
            return empty;
        }

        List<String> names = HeaderNames.normalize(table.getHeader());
        List<List<String>> records = table.getRecords();
        int width = names.size();

        List<Field> fields = new ArrayList<>(width);
        List<DataType> types = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            List<String> column = new ArrayList<>(records.size());
            for (List<String> record : records) {
                column.add(record.get(c));
            }
            DataType type = TypeInference.inferFromText(column);
            types.add(type);
            fields.add(new Field(names.get(c), type));
        }

        List<Row> rows = new ArrayList<>(records.size());
        for (List<String> record : records) {
            Object[] values = new Object[width];
            for (int c = 0; c < width; c++) {
                values[c] = TypeInference.convertText(record.get(c), types.get(c));
            }
            rows.add(new Row(values));
        }

        Parsed result = new Parsed(new Schema(fields), rows);
        parsed = result;
        fingerprint = before;
        logger.debug("Parsed {}: {} columns, {} rows, delimiter '{}'",
                filePath, width, rows.size(), table.getDelimiter());
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

    public Path getFilePath() {
        return filePath;
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
