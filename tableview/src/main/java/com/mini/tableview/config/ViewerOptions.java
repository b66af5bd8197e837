package com.mini.tableview.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.mini.tableview.exception.ConfigException;
import com.mini.tableview.page.PageSizeOptions;
import com.mini.tableview.source.SourceOptions;

import java.util.List;

/**
 * 查看器配置选项
 * JSON 中缺省的键取默认值，未知的键被忽略
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ViewerOptions {

    public static final int DEFAULT_CACHE_CAPACITY = 64;
    public static final int DEFAULT_WORKER_THREADS = 2;
    public static final int DEFAULT_WORKER_QUEUE_CAPACITY = 100;
    public static final long DEFAULT_FETCH_TIMEOUT_MILLIS = 30 * 1000L;
    public static final int DEFAULT_PAGE_SIZE = 250;
    public static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 5L;

    /** 分页缓存容量（页数），默认64 */
    private final int cacheCapacity;

    /** 后台工作线程数，默认2 */
    private final int workerThreads;

    /** 工作队列容量，默认100 */
    private final int workerQueueCapacity;

    /** 单次读取超时（毫秒），<= 0 表示不限时，默认30秒 */
    private final long fetchTimeoutMillis;

    /** 打开数据源时的页大小，默认250 */
    private final int defaultPageSize;

    /** 页大小菜单的预设值 */
    private final List<Integer> pageSizeOptions;

    /** 翻页到头时是否循环，默认否 */
    private final boolean wrapPageNavigation;

    /** 数据源变更后是否自动重新加载当前页，默认是 */
    private final boolean reloadOnMutation;

    /** 关闭时等待线程池结束的时间（秒），默认5秒 */
    private final long shutdownTimeoutSeconds;

    @JsonCreator
    public ViewerOptions(
            @JsonProperty("cacheCapacity") Integer cacheCapacity,
            @JsonProperty("workerThreads") Integer workerThreads,
            @JsonProperty("workerQueueCapacity") Integer workerQueueCapacity,
            @JsonProperty("fetchTimeoutMillis") Long fetchTimeoutMillis,
            @JsonProperty("defaultPageSize") Integer defaultPageSize,
            @JsonProperty("pageSizeOptions") List<Integer> pageSizeOptions,
            @JsonProperty("wrapPageNavigation") Boolean wrapPageNavigation,
            @JsonProperty("reloadOnMutation") Boolean reloadOnMutation,
            @JsonProperty("shutdownTimeoutSeconds") Long shutdownTimeoutSeconds) {
        this.cacheCapacity = positive("cacheCapacity", cacheCapacity, DEFAULT_CACHE_CAPACITY);
        this.workerThreads = positive("workerThreads", workerThreads, DEFAULT_WORKER_THREADS);
        this.workerQueueCapacity = positive("workerQueueCapacity", workerQueueCapacity,
                DEFAULT_WORKER_QUEUE_CAPACITY);
        this.fetchTimeoutMillis = fetchTimeoutMillis != null ? fetchTimeoutMillis : DEFAULT_FETCH_TIMEOUT_MILLIS;
        this.defaultPageSize = positive("defaultPageSize", defaultPageSize, DEFAULT_PAGE_SIZE);
        this.pageSizeOptions = pageSizeOptions != null
                ? validatePageSizes(pageSizeOptions)
                : PageSizeOptions.DEFAULT.getPresets();
        this.wrapPageNavigation = wrapPageNavigation != null && wrapPageNavigation;
        this.reloadOnMutation = reloadOnMutation == null || reloadOnMutation;
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds != null
                ? shutdownTimeoutSeconds : DEFAULT_SHUTDOWN_TIMEOUT_SECONDS;
        if (this.shutdownTimeoutSeconds < 0) {
            throw new ConfigException("shutdownTimeoutSeconds must be >= 0: " + this.shutdownTimeoutSeconds);
        }
    }

    public static ViewerOptions defaults() {
        return builder().build();
    }

    private static int positive(String key, Integer value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value <= 0) {
            throw new ConfigException(key + " must be > 0: " + value);
        }
        return value;
    }

    private static List<Integer> validatePageSizes(List<Integer> sizes) {
        if (sizes.isEmpty()) {
            throw new ConfigException("pageSizeOptions must not be empty");
        }
        try {
            return new PageSizeOptions(sizes).getPresets();
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid pageSizeOptions " + sizes + ": " + e.getMessage(), e);
        }
    }

    public int getCacheCapacity() {
        return cacheCapacity;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public int getWorkerQueueCapacity() {
        return workerQueueCapacity;
    }

    public long getFetchTimeoutMillis() {
        return fetchTimeoutMillis;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public List<Integer> getPageSizeOptions() {
        return pageSizeOptions;
    }

    public boolean isWrapPageNavigation() {
        return wrapPageNavigation;
    }

    public boolean isReloadOnMutation() {
        return reloadOnMutation;
    }

    public long getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    public PageSizeOptions pageSizes() {
        return new PageSizeOptions(pageSizeOptions);
    }

    public SourceOptions toSourceOptions() {
        return SourceOptions.builder().fetchTimeoutMillis(fetchTimeoutMillis).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Integer cacheCapacity;
        private Integer workerThreads;
        private Integer workerQueueCapacity;
        private Long fetchTimeoutMillis;
        private Integer defaultPageSize;
        private List<Integer> pageSizeOptions;
        private Boolean wrapPageNavigation;
        private Boolean reloadOnMutation;
        private Long shutdownTimeoutSeconds;

        public Builder cacheCapacity(int cacheCapacity) {
            this.cacheCapacity = cacheCapacity;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder workerQueueCapacity(int workerQueueCapacity) {
            this.workerQueueCapacity = workerQueueCapacity;
            return this;
        }

        public Builder fetchTimeoutMillis(long fetchTimeoutMillis) {
            this.fetchTimeoutMillis = fetchTimeoutMillis;
            return this;
        }

        public Builder defaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
            return this;
        }

        public Builder pageSizeOptions(Integer... sizes) {
            this.pageSizeOptions = ImmutableList.copyOf(sizes);
            return this;
        }

        public Builder wrapPageNavigation(boolean wrapPageNavigation) {
            this.wrapPageNavigation = wrapPageNavigation;
            return this;
        }

        public Builder reloadOnMutation(boolean reloadOnMutation) {
            this.reloadOnMutation = reloadOnMutation;
            return this;
        }

        public Builder shutdownTimeoutSeconds(long shutdownTimeoutSeconds) {
            this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
            return this;
        }

        public ViewerOptions build() {
            return new ViewerOptions(cacheCapacity, workerThreads, workerQueueCapacity, fetchTimeoutMillis,
                    defaultPageSize, pageSizeOptions, wrapPageNavigation, reloadOnMutation,
                    shutdownTimeoutSeconds);
        }
    }

    @Override
    public String toString() {
        return "ViewerOptions{" +
                "cacheCapacity=" + cacheCapacity +
                ", workerThreads=" + workerThreads +
                ", workerQueueCapacity=" + workerQueueCapacity +
                ", fetchTimeoutMillis=" + fetchTimeoutMillis +
                ", defaultPageSize=" + defaultPageSize +
                ", pageSizeOptions=" + pageSizeOptions +
                ", wrapPageNavigation=" + wrapPageNavigation +
                ", reloadOnMutation=" + reloadOnMutation +
                ", shutdownTimeoutSeconds=" + shutdownTimeoutSeconds +
                '}';
    }
}
