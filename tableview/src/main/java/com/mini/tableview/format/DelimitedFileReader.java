package com.mini.tableview.format;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 分隔文件读取器
 *
 * 读取 UTF-8 编码的 CSV/TSV 文件，第一条记录为表头。
 * 支持双引号包裹的字段、"" 转义以及字段内换行；空行被忽略。
 * 未指定分隔符时 .tsv 使用制表符，其余先按逗号解析，
 * 列数不齐时回退为分号。
 */
public class DelimitedFileReader {
    private static final Logger logger = LoggerFactory.getLogger(DelimitedFileReader.class);

    private static final char COMMA = ',';
    private static final char SEMICOLON = ';';
    private static final char TAB = '\t';
    private static final char QUOTE = '"';

    private final Path filePath;
    private final Character delimiter;

    public DelimitedFileReader(Path filePath) {
        this(filePath, null);
    }

    /**
     * @param delimiter 分隔符，null 表示自动识别
     */
    public DelimitedFileReader(Path filePath, Character delimiter) {
        this.filePath = filePath;
        this.delimiter = delimiter;
    }

    /**
     * 读取整个文件
     *
     * @throws IOException 文件无法读取，或任何分隔符下都出现列数不齐的记录
     */
    public DelimitedTable read() throws IOException {
        String content = new String(Files.readAllBytes(filePath), StandardCharsets.UTF_8);
        if (!content.isEmpty() && content.charAt(0) == '\uFEFF') {
            content = content.substring(1);
        }

        if (delimiter != null) {
            List<List<String>> records = parse(content, delimiter);
            checkRectangular(records, delimiter);
            return toTable(records, delimiter);
        }

        if (filePath.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".tsv")) {
            List<List<String>> records = parse(content, TAB);
            checkRectangular(records, TAB);
            return toTable(records, TAB);
        }

        List<List<String>> commaRecords = parse(content, COMMA);
        int raggedLine = findRaggedRecord(commaRecords);
        boolean singleColumn = !commaRecords.isEmpty() && commaRecords.get(0).size() == 1;
        if (raggedLine < 0 && !singleColumn) {
            return toTable(commaRecords, COMMA);
        }

        // 逗号解析失败或只得到一列时，尝试分号
        List<List<String>> semicolonRecords = parse(content, SEMICOLON);
        boolean semicolonUsable = findRaggedRecord(semicolonRecords) < 0
                && !semicolonRecords.isEmpty() && semicolonRecords.get(0).size() > 1;
        if (semicolonUsable) {
            logger.warn("File {} is not comma separated, falling back to ';'", filePath);
            return toTable(semicolonRecords, SEMICOLON);
        }
        checkRectangular(commaRecords, COMMA);
        return toTable(commaRecords, COMMA);
    }

    private DelimitedTable toTable(List<List<String>> records, char used) {
        if (records.isEmpty()) {
            return new DelimitedTable(Collections.emptyList(), Collections.emptyList(), used);
        }
        List<String> header = records.get(0);
        return new DelimitedTable(header, records.subList(1, records.size()), used);
    }

    private void checkRectangular(List<List<String>> records, char used) throws IOException {
        int ragged = findRaggedRecord(records);
        if (ragged >= 0) {
            throw new IOException(String.format(
                    "%s: record %d has %d fields, header has %d (delimiter '%s')",
                    filePath, ragged + 1, records.get(ragged).size(), records.get(0).size(),
                    used == TAB ? "\\t" : String.valueOf(used)));
        }
    }

    private static int findRaggedRecord(List<List<String>> records) {
        if (records.isEmpty()) {
            return -1;
        }
        int width = records.get(0).size();
        for (int i = 1; i < records.size(); i++) {
            if (records.get(i).size() != width) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 解析记录，处理引号和转义字符
     */
    static List<List<String>> parse(String content, char separator) {
        List<List<String>> records = new ArrayList<>();
        List<String> current = new ArrayList<>();
        StringBuilder value = new StringBuilder();
        boolean inQuotes = false;
        boolean lastCharWasQuote = false;
        boolean recordHasContent = false;

        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);

            if (c == QUOTE) {
                recordHasContent = true;
                if (inQuotes) {
                    if (lastCharWasQuote) {
                        // 双引号转义
                        value.append(c);
                        lastCharWasQuote = false;
                    } else {
                        lastCharWasQuote = true;
                    }
                } else {
                    inQuotes = true;
                }
                continue;
            }

            if (lastCharWasQuote) {
                inQuotes = false;
                lastCharWasQuote = false;
            }

            if (inQuotes) {
                value.append(c);
            } else if (c == separator) {
                current.add(value.toString());
                value.setLength(0);
                recordHasContent = true;
            } else if (c == '\n' || c == '\r') {
                if (c == '\r' && i + 1 < content.length() && content.charAt(i + 1) == '\n') {
                    i++;
                }
                if (recordHasContent || value.length() > 0) {
                    current.add(value.toString());
                    records.add(current);
                }
                current = new ArrayList<>();
                value.setLength(0);
                recordHasContent = false;
            } else {
                value.append(c);
                recordHasContent = true;
            }
        }

        if (recordHasContent || value.length() > 0) {
            current.add(value.toString());
            records.add(current);
        }
        return records;
    }

    public Path getFilePath() {
        return filePath;
    }

    /**
     * 解析结果：表头和数据记录
     */
    public static class DelimitedTable {
        private final List<String> header;
        private final List<List<String>> records;
        private final char delimiter;

        DelimitedTable(List<String> header, List<List<String>> records, char delimiter) {
            this.header = header;
            this.records = records;
            this.delimiter = delimiter;
        }

        public List<String> getHeader() {
            return header;
        }

        public List<List<String>> getRecords() {
            return records;
        }

        public char getDelimiter() {
            return delimiter;
        }

        public boolean isEmpty() {
            return header.isEmpty();
        }
    }
}
