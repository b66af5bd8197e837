package com.mini.tableview.catalog;

import com.mini.tableview.exception.ConfigException;
import com.mini.tableview.source.SourceOptions;

import java.util.HashMap;
import java.util.Map;

/**
 * 目录上下文配置
 *
 * 打开数据文件时使用的字符串选项，转换为 {@link SourceOptions}
 */
public class CatalogContext {

    /** 分隔符覆盖，单个字符，或 "tab" */
    public static final String DELIMITER = "delimiter";

    /** 单次读取超时（毫秒） */
    public static final String FETCH_TIMEOUT_MS = "fetch-timeout-ms";

    private final Map<String, String> options;

    private CatalogContext(Map<String, String> options) {
        this.options = new HashMap<>(options);
    }

    public static CatalogContext empty() {
        return builder().build();
    }

    public Map<String, String> getOptions() {
        return new HashMap<>(options);
    }

    public String getOption(String key) {
        return options.get(key);
    }

    public String getOption(String key, String defaultValue) {
        return options.getOrDefault(key, defaultValue);
    }

    /**
     * @throws ConfigException 选项值非法
     */
    public SourceOptions toSourceOptions() {
        SourceOptions.Builder builder = SourceOptions.builder();

        String timeout = options.get(FETCH_TIMEOUT_MS);
        if (timeout != null) {
            try {
                builder.fetchTimeoutMillis(Long.parseLong(timeout.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigException("Invalid " + FETCH_TIMEOUT_MS + ": " + timeout, e);
            }
        }

        String delimiter = options.get(DELIMITER);
        if (delimiter != null) {
            builder.delimiter(parseDelimiter(delimiter));
        }
        return builder.build();
    }

    private static Character parseDelimiter(String value) {
        if ("tab".equalsIgnoreCase(value) || "\\t".equals(value)) {
            return '\t';
        }
        if (value.length() != 1 || value.charAt(0) == '"' || value.charAt(0) == '\n' || value.charAt(0) == '\r') {
            throw new ConfigException("Invalid " + DELIMITER + ": '" + value + "'");
        }
        return value.charAt(0);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> options = new HashMap<>();

        public Builder option(String key, String value) {
            this.options.put(key, value);
            return this;
        }

        public Builder options(Map<String, String> options) {
            this.options.putAll(options);
            return this;
        }

        public Builder fetchTimeoutMillis(long millis) {
            return option(FETCH_TIMEOUT_MS, Long.toString(millis));
        }

        public CatalogContext build() {
            return new CatalogContext(options);
        }
    }

    @Override
    public String toString() {
        return "CatalogContext{" + "options=" + options + '}';
    }
}
