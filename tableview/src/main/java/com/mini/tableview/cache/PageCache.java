package com.mini.tableview.cache;

import com.mini.tableview.page.PageRequest;
import com.mini.tableview.page.PageResult;
import com.mini.tableview.source.SourceIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Page Cache
 * 缓存已读取的分页结果，键为 {@link PageRequest}
 *
 * 特性:
 * 1. LRU 淘汰策略，容量按条目数计
 * 2. 线程安全
 * 3. 按数据源整体失效
 * 4. 统计信息(命中率、驱逐次数等)
 *
 * 缓存只影响延迟，不影响正确性：任何时候清空都可以重新读取。
 */
public class PageCache {
    private static final Logger logger = LoggerFactory.getLogger(PageCache.class);

    public static final int DEFAULT_CAPACITY = 64;

    private final int capacity;

    /** LRU 缓存，访问顺序 */
    private final LinkedHashMap<PageRequest, PageResult> cache;

    /** 统计信息 */
    private final AtomicLong hitCount = new AtomicLong(0);
    private final AtomicLong missCount = new AtomicLong(0);
    private final AtomicLong evictionCount = new AtomicLong(0);

    public PageCache() {
        this(DEFAULT_CAPACITY);
    }

    public PageCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be > 0: " + capacity);
        }
        this.capacity = capacity;
        this.cache = new LinkedHashMap<PageRequest, PageResult>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<PageRequest, PageResult> eldest) {
                if (size() > PageCache.this.capacity) {
                    evictionCount.incrementAndGet();
                    logger.debug("Evicted page: {}", eldest.getKey());
                    return true;
                }
                return false;
            }
        };

        logger.info("PageCache initialized with capacity: {} pages", capacity);
    }

    /**
     * 获取缓存的分页结果，未命中返回 null
     */
    public synchronized PageResult get(PageRequest request) {
        PageResult result = cache.get(request);

        if (result != null) {
            hitCount.incrementAndGet();
            logger.trace("Page cache hit: {}", request);
            return result;
        }

        missCount.incrementAndGet();
        logger.trace("Page cache miss: {}", request);
        return null;
    }

    /**
     * 不影响 LRU 顺序和统计的存在性检查
     */
    public synchronized boolean contains(PageRequest request) {
        return cache.containsKey(request);
    }

    public synchronized void put(PageRequest request, PageResult result) {
        if (!request.equals(result.getRequest())) {
            throw new IllegalArgumentException(
                    "Result answers " + result.getRequest() + ", not " + request);
        }
        cache.put(request, result);
        logger.trace("Page cached: {}", request);
    }

    /**
     * 删除某个数据源的全部缓存页
     *
     * @return 删除的条目数
     */
    public synchronized int invalidateSource(SourceIdentity source) {
        int before = cache.size();
        cache.keySet().removeIf(request -> request.getSource().equals(source));
        int removed = before - cache.size();
        logger.debug("Invalidated {} cached pages for source: {}", removed, source);
        return removed;
    }

    /**
     * 清空缓存
     */
    public synchronized void clear() {
        cache.clear();
        logger.info("Page cache cleared");
    }

    public synchronized int size() {
        return cache.size();
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * 获取缓存统计信息
     */
    public synchronized CacheStats getStats() {
        long hits = hitCount.get();
        long misses = missCount.get();
        long total = hits + misses;
        double hitRate = total > 0 ? (double) hits / total : 0.0;

        return new CacheStats(hits, misses, hitRate, evictionCount.get(), cache.size(), capacity);
    }

    /**
     * 缓存统计信息
     */
    public static class CacheStats {
        public final long hitCount;
        public final long missCount;
        public final double hitRate;
        public final long evictionCount;
        public final int entryCount;
        public final int capacity;

        CacheStats(long hitCount, long missCount, double hitRate,
                   long evictionCount, int entryCount, int capacity) {
            this.hitCount = hitCount;
            this.missCount = missCount;
            this.hitRate = hitRate;
            this.evictionCount = evictionCount;
            this.entryCount = entryCount;
            this.capacity = capacity;
        }

        @Override
        public String toString() {
            return String.format(
                "CacheStats{hits=%d, misses=%d, hitRate=%.2f%%, evictions=%d, entries=%d/%d}",
                hitCount, missCount, hitRate * 100, evictionCount, entryCount, capacity
            );
        }
    }
}
