package com.mini.tableview.source;

/**
 * 数据源读取选项
 */
public class SourceOptions {

    public static final SourceOptions DEFAULT = builder().build();

    /** 单次读取超时时间（毫秒），<= 0 表示不限时，默认30秒 */
    private final long fetchTimeoutMillis;

    /** 分隔文件的分隔符，null 表示自动识别 */
    private final Character delimiter;

    public SourceOptions(long fetchTimeoutMillis, Character delimiter) {
        this.fetchTimeoutMillis = fetchTimeoutMillis;
        this.delimiter = delimiter;
    }

    public long getFetchTimeoutMillis() {
        return fetchTimeoutMillis;
    }

    public Character getDelimiter() {
        return delimiter;
    }

    public Deadline newDeadline() {
        return Deadline.after(fetchTimeoutMillis);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long fetchTimeoutMillis = 30 * 1000L;
        private Character delimiter;

        public Builder fetchTimeoutMillis(long fetchTimeoutMillis) {
            this.fetchTimeoutMillis = fetchTimeoutMillis;
            return this;
        }

        public Builder delimiter(Character delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        public SourceOptions build() {
            return new SourceOptions(fetchTimeoutMillis, delimiter);
        }
    }

    @Override
    public String toString() {
        return "SourceOptions{" +
                "fetchTimeoutMillis=" + fetchTimeoutMillis +
                ", delimiter=" + (delimiter == null ? "auto" : "'" + delimiter + "'") +
                '}';
    }
}
