package com.mini.tableview.format;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 电子表格读取器（.xlsx）
 *
 * 每个工作表的第一行为表头。日期格式的数值单元格读为 LocalDateTime，
 * 公式单元格取缓存的计算结果，空白和错误单元格为 null，完全空白的行被忽略。
 */
public class SpreadsheetReader {

    private final Path filePath;

    public SpreadsheetReader(Path filePath) {
        this.filePath = filePath;
    }

    /**
     * 按工作簿中的顺序列出工作表名
     */
    public List<String> sheetNames() throws IOException {
        try (Workbook workbook = open()) {
            List<String> names = new ArrayList<>(workbook.getNumberOfSheets());
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                names.add(workbook.getSheetName(i));
            }
            return names;
        }
    }

    /**
     * 读取一个工作表
     *
     * @throws IOException 文件无法读取或工作表不存在
     */
    public SheetData readSheet(String sheetName) throws IOException {
        try (Workbook workbook = open()) {
            Sheet sheet = workbook.getSheet(sheetName);
            if (sheet == null) {
                throw new IOException("Sheet '" + sheetName + "' not found in " + filePath);
            }
            return readSheet(sheet);
        }
    }

    private SheetData readSheet(Sheet sheet) {
        if (sheet.getPhysicalNumberOfRows() == 0) {
            return new SheetData(Collections.emptyList(), Collections.emptyList());
        }

        DataFormatter formatter = new DataFormatter();
        int firstRow = sheet.getFirstRowNum();
        Row headerRow = sheet.getRow(firstRow);
        int width = headerRow == null ? 0 : Math.max(headerRow.getLastCellNum(), 0);

        List<String> header = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            Cell cell = headerRow.getCell(c);
            header.add(cell == null ? "" : formatter.formatCellValue(cell));
        }

        List<List<Object>> records = new ArrayList<>();
        for (int r = firstRow + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            List<Object> values = new ArrayList<>(width);
            boolean blank = true;
            for (int c = 0; c < width; c++) {
                Object value = cellValue(row.getCell(c));
                if (value != null) {
                    blank = false;
                }
                values.add(value);
            }
            if (!blank) {
                records.add(values);
            }
        }
        return new SheetData(header, records);
    }

    static Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                return cell.getNumericCellValue();
            case STRING:
                String text = cell.getStringCellValue();
                return text.isEmpty() ? null : text;
            case BOOLEAN:
                return cell.getBooleanCellValue();
            default:
                return null;
        }
    }

    private Workbook open() throws IOException {
        try {
            return WorkbookFactory.create(filePath.toFile(), null, true);
        } catch (RuntimeException e) {
            // POI 对损坏或加密的文件抛出运行时异常
            throw new IOException("Cannot open workbook " + filePath + ": " + e.getMessage(), e);
        }
    }

    public Path getFilePath() {
        return filePath;
    }

    /**
     * 工作表内容：表头和数据行
     */
    public static class SheetData {
        private final List<String> header;
        private final List<List<Object>> records;

        SheetData(List<String> header, List<List<Object>> records) {
            this.header = header;
            this.records = records;
        }

        public List<String> getHeader() {
            return header;
        }

        public List<List<Object>> getRecords() {
            return records;
        }

        public boolean isEmpty() {
            return header.isEmpty();
        }
    }
}
