package com.mini.tableview.exception;

import com.mini.tableview.source.SourceIdentity;

/**
 * 数据源异常类
 *
 * 数据源适配器抛出的所有错误都归入以下几类:
 * 数据源不可用、排序列非法、读取超时。
 */
public class SourceException extends TableViewException {
    private static final long serialVersionUID = 1L;

    public SourceException(String message) {
        super(message);
    }

    public SourceException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 数据源已关闭或无法访问
     */
    public static class SourceUnavailableException extends SourceException {
        public SourceUnavailableException(SourceIdentity identity, String reason) {
            super("Source unavailable: " + identity + " (" + reason + ")");
        }

        public SourceUnavailableException(SourceIdentity identity, Throwable cause) {
            super("Source unavailable: " + identity + " (" + cause.getMessage() + ")", cause);
        }
    }

    /**
     * 排序列越界或该列类型不支持排序
     */
    public static class InvalidSortException extends SourceException {
        private final int columnIndex;

        public InvalidSortException(int columnIndex, String reason) {
            super("Invalid sort column " + columnIndex + ": " + reason);
            this.columnIndex = columnIndex;
        }

        public int getColumnIndex() {
            return columnIndex;
        }
    }

    /**
     * 读取超过截止时间
     */
    public static class FetchTimeoutException extends SourceException {
        private final long timeoutMillis;

        public FetchTimeoutException(SourceIdentity identity, long timeoutMillis) {
            super("Fetch from " + identity + " exceeded " + timeoutMillis + " ms");
            this.timeoutMillis = timeoutMillis;
        }

        public FetchTimeoutException(SourceIdentity identity, long timeoutMillis, Throwable cause) {
            super("Fetch from " + identity + " exceeded " + timeoutMillis + " ms", cause);
            this.timeoutMillis = timeoutMillis;
        }

        public long getTimeoutMillis() {
            return timeoutMillis;
        }
    }
}
