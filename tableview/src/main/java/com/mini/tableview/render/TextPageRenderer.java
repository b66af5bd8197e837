package com.mini.tableview.render;

import com.mini.tableview.data.Row;
import com.mini.tableview.format.TypeInference;
import com.mini.tableview.page.PageRequest;
import com.mini.tableview.page.PageResult;
import com.mini.tableview.page.SortSpec;
import com.mini.tableview.schema.Schema;
import com.mini.tableview.view.ViewSnapshot;
import com.mini.tableview.view.ViewStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 文本渲染器
 *
 * 把视图快照渲染为等宽文本表格和状态行，并把选中的行复制为制表符分隔文本。
 */
public class TextPageRenderer {

    public static final int DEFAULT_MAX_COLUMN_WIDTH = 30;

    private final int maxColumnWidth;

    public TextPageRenderer() {
        this(DEFAULT_MAX_COLUMN_WIDTH);
    }

    public TextPageRenderer(int maxColumnWidth) {
        if (maxColumnWidth < 4) {
            throw new IllegalArgumentException("Column width must be >= 4: " + maxColumnWidth);
        }
        this.maxColumnWidth = maxColumnWidth;
    }

    /**
     * 表格加状态行；没有已提交结果时只有状态行
     */
    public String render(ViewSnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        PageResult result = snapshot.getResult();
        if (result != null && !result.getSchema().isEmpty()) {
            renderTable(result, sb);
        }
        sb.append(statusLine(snapshot)).append('\n');
        return sb.toString();
    }

    /**
     * 例如 "Showing table: orders, rows: 1,000, page: 3 of 40"
     */
    public String statusLine(ViewSnapshot snapshot) {
        PageResult result = snapshot.getResult();
        StringBuilder sb = new StringBuilder();

        if (result == null) {
            sb.append(snapshot.getDesired() == null ? "No source open" : "Processing...");
        } else if (result.getTotalRows() == 0) {
            sb.append("No data found in table");
        } else {
            PageRequest request = result.getRequest();
            sb.append(String.format(Locale.ROOT, "Showing table: %s, rows: %,d, page: %,d of %,d",
                    request.getSource().getObject(), result.getTotalRows(),
                    request.getPageIndex() + 1, result.getPageCount()));
            SortSpec sort = request.getSort();
            if (!sort.isNone() && result.getSchema().isValidColumn(sort.getColumnIndex())) {
                sb.append(", sorted by \"").append(result.getSchema().getField(sort.getColumnIndex()).getName())
                        .append("\" ").append(sort.getDirection() == null ? "" : sort.getDirection().sql());
            }
            if (!request.getFilter().isNone()) {
                sb.append(", search: \"").append(request.getFilter().getQuery()).append('"');
            }
        }

        if (snapshot.getStatus() == ViewStatus.LOADING && result != null) {
            sb.append(" [loading]");
        } else if (snapshot.getStatus() == ViewStatus.ERROR) {
            Throwable error = snapshot.getError();
            sb.append(" [error: ").append(error == null ? "unknown" : error.getMessage()).append(']');
        }
        return sb.toString();
    }

    private void renderTable(PageResult result, StringBuilder sb) {
        Schema schema = result.getSchema();
        int columns = schema.getFieldCount();
        long firstRow = result.getFirstRowNumber();

        List<String[]> cells = new ArrayList<>(result.size());
        for (Row row : result.getRows()) {
            String[] text = new String[columns];
            for (int c = 0; c < columns; c++) {
                text[c] = truncate(cellText(row.getValue(c)));
            }
            cells.add(text);
        }

        String lastNumber = Long.toString(firstRow + Math.max(result.size() - 1, 0));
        int numberWidth = Math.max(1, lastNumber.length());
        int[] widths = new int[columns];
        for (int c = 0; c < columns; c++) {
            widths[c] = truncate(schema.getField(c).getName()).length();
            for (String[] text : cells) {
                widths[c] = Math.max(widths[c], text[c].length());
            }
        }

        sb.append(pad("#", numberWidth));
        for (int c = 0; c < columns; c++) {
            sb.append(" | ").append(pad(truncate(schema.getField(c).getName()), widths[c]));
        }
        sb.append('\n');

        sb.append(repeat('-', numberWidth));
        for (int c = 0; c < columns; c++) {
            sb.append("-+-").append(repeat('-', widths[c]));
        }
        sb.append('\n');

        long number = firstRow;
        for (String[] text : cells) {
            sb.append(pad(Long.toString(number++), numberWidth));
            for (int c = 0; c < columns; c++) {
                sb.append(" | ").append(pad(text[c], widths[c]));
            }
            sb.append('\n');
        }
    }

    /**
     * 复制选中的行（页内下标），行内以制表符分隔，行间以换行分隔，可直接粘贴到电子表格
     */
    public static String copyAsTsv(PageResult result, int... rowIndexes) {
        List<Row> rows = result.getRows();
        StringBuilder sb = new StringBuilder();
        for (int index : rowIndexes) {
            if (index < 0 || index >= rows.size()) {
                throw new IndexOutOfBoundsException("Row " + index + " not on page of " + rows.size() + " rows");
            }
            if (sb.length() > 0) {
                sb.append('\n');
            }
            Row row = rows.get(index);
            for (int c = 0; c < row.getFieldCount(); c++) {
                if (c > 0) {
                    sb.append('\t');
                }
                sb.append(cellText(row.getValue(c)).replace('\t', ' ').replace('\n', ' ').replace('\r', ' '));
            }
        }
        return sb.toString();
    }

    static String cellText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof byte[]) {
            return "<" + ((byte[]) value).length + " bytes>";
        }
        return TypeInference.formatCell(value);
    }

    private String truncate(String text) {
        String singleLine = text.replace('\n', ' ').replace('\r', ' ');
        if (singleLine.length() <= maxColumnWidth) {
            return singleLine;
        }
        return singleLine.substring(0, maxColumnWidth - 3) + "...";
    }

    private static String pad(String text, int width) {
        StringBuilder sb = new StringBuilder(text);
        while (sb.length() < width) {
            sb.append(' ');
        }
        return sb.toString();
    }

    private static String repeat(char c, int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            sb.append(c);
        }
        return sb.toString();
    }
}
