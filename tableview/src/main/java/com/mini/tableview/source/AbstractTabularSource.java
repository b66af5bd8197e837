package com.mini.tableview.source;

import com.mini.tableview.data.Row;
import com.mini.tableview.exception.SourceException;
import com.mini.tableview.page.PagePlanner;
import com.mini.tableview.page.PageRequest;
import com.mini.tableview.page.PageResult;
import com.mini.tableview.page.SearchFilter;
import com.mini.tableview.page.SortSpec;
import com.mini.tableview.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 数据源基类
 *
 * 无法在源端排序的数据源由这里完成排序：一次性加载全部行，
 * 过滤、按列类型排序后截取请求的窗口。最近一次排序/过滤后的视图被保留，
 * 翻页时无需重复排序，刷新或变更时丢弃。
 */
public abstract class AbstractTabularSource implements TabularSource {
    private static final Logger logger = LoggerFactory.getLogger(AbstractTabularSource.class);

    protected final SourceIdentity identity;
    protected final SourceOptions options;

    private final List<SourceMutationListener> listeners = new CopyOnWriteArrayList<>();
    private final Object loadLock = new Object();

    private volatile boolean closed = false;
    private volatile Schema schema;
    private volatile List<Row> rows;
    private volatile SortedView lastView;
    /** 每次刷新递增，旧代的排序结果不会被缓存 */
    private volatile long generation = 0;

    protected AbstractTabularSource(SourceIdentity identity, SourceOptions options) {
        this.identity = Objects.requireNonNull(identity, "Identity cannot be null");
        this.options = Objects.requireNonNull(options, "Options cannot be null");
    }

    /**
     * 加载列定义
     */
    protected abstract Schema loadSchema() throws IOException;

    /**
     * 以原始顺序加载全部行，实现需要在循环中检查截止时间
     */
    protected abstract List<Row> loadRows(Schema schema, Deadline deadline) throws IOException;

    /**
     * 检测底层数据是否在加载后被修改，默认不检测
     */
    protected boolean hasChangedSinceLoad() {
        return false;
    }

    /**
     * 刷新时调用，子类在此丢弃自己持有的加载结果
     */
    protected void onRefresh() {
    }

    @Override
    public SourceIdentity identity() {
        return identity;
    }

    @Override
    public Schema schema() {
        ensureOpen();
        detectChanges();
        return loadedSchema();
    }

    @Override
    public long rowCount() {
        return rowCount(SearchFilter.NONE);
    }

    @Override
    public long rowCount(SearchFilter filter) {
        ensureOpen();
        detectChanges();
        return view(SortSpec.NONE, filter, options.newDeadline()).size();
    }

    @Override
    public PageResult fetchPage(PageRequest request) {
        ensureOpen();
        checkRequest(request);
        detectChanges();

        Schema currentSchema = loadedSchema();
        PagePlanner.validateSort(request.getSort(), currentSchema);

        Deadline deadline = options.newDeadline();
        List<Row> sorted = view(request.getSort(), request.getFilter(), deadline);
        return new PageResult(request, currentSchema, slice(sorted, request), sorted.size());
    }

    @Override
    public List<Row> readAll() {
        ensureOpen();
        detectChanges();
        return loadedRows(options.newDeadline());
    }

    @Override
    public void refresh() {
        synchronized (loadLock) {
            generation++;
            schema = null;
            rows = null;
            lastView = null;
            onRefresh();
        }
        logger.debug("Source {} refreshed", identity);
    }

    /**
     * 由写入方或变更检测调用：丢弃已加载数据并通知监听器
     */
    public void signalMutation() {
        refresh();
        logger.info("Source {} mutated, notifying {} listeners", identity, listeners.size());
        for (SourceMutationListener listener : listeners) {
            listener.onSourceMutated(identity);
        }
    }

    @Override
    public void addMutationListener(SourceMutationListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    @Override
    public void removeMutationListener(SourceMutationListener listener) {
        listeners.remove(listener);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        refresh();
        for (SourceMutationListener listener : listeners) {
            listener.onSourceClosed(identity);
        }
        listeners.clear();
        logger.info("Source {} closed", identity);
    }

    protected void ensureOpen() {
        if (closed) {
            throw new SourceException.SourceUnavailableException(identity, "source is closed");
        }
    }

    protected void checkRequest(PageRequest request) {
        if (!identity.equals(request.getSource())) {
            throw new IllegalArgumentException(
                    "Request for " + request.getSource() + " sent to source " + identity);
        }
    }

    protected Schema loadedSchema() {
        Schema current = schema;
        if (current != null) {
            return current;
        }
        synchronized (loadLock) {
            if (schema == null) {
                try {
                    schema = loadSchema();
                } catch (IOException e) {
                    throw new SourceException.SourceUnavailableException(identity, e);
                }
                logger.debug("Loaded schema of {}: {} columns", identity, schema.getFieldCount());
            }
            return schema;
        }
    }

    protected List<Row> loadedRows(Deadline deadline) {
        List<Row> current = rows;
        if (current != null) {
            return current;
        }
        Schema currentSchema = loadedSchema();
        synchronized (loadLock) {
            if (rows == null) {
                long start = System.currentTimeMillis();
                try {
                    rows = Collections.unmodifiableList(loadRows(currentSchema, deadline));
                } catch (IOException e) {
                    throw new SourceException.SourceUnavailableException(identity, e);
                }
                logger.debug("Loaded {} rows from {} in {} ms",
                        rows.size(), identity, System.currentTimeMillis() - start);
            }
            return rows;
        }
    }

    /**
     * 获取过滤并排序后的全部行，保留最近一次的结果
     */
    protected List<Row> view(SortSpec sort, SearchFilter filter, Deadline deadline) {
        long startGeneration = generation;
        SortedView cached = lastView;
        if (cached != null && cached.matches(startGeneration, sort, filter)) {
            return cached.rows;
        }

        List<Row> all = loadedRows(deadline);
        List<Row> result;
        if (filter.isNone()) {
            result = new ArrayList<>(all);
        } else {
            result = new ArrayList<>();
            for (Row row : all) {
                if (filter.matches(row)) {
                    result.add(row);
                }
            }
        }
        deadline.check(identity);

        if (!sort.isNone()) {
            // List.sort 是稳定排序，相等的键保持原始顺序
            result.sort(RowComparators.forSort(loadedSchema(), sort));
            deadline.check(identity);
        }

        List<Row> unmodifiable = Collections.unmodifiableList(result);
        synchronized (loadLock) {
            if (generation == startGeneration) {
                lastView = new SortedView(startGeneration, sort, filter, unmodifiable);
            }
        }
        return unmodifiable;
    }

    protected static List<Row> slice(List<Row> rows, PageRequest request) {
        long offset = request.getOffset();
        if (offset >= rows.size()) {
            return Collections.emptyList();
        }
        int from = (int) offset;
        int to = (int) Math.min((long) from + request.getPageSize(), rows.size());
        return new ArrayList<>(rows.subList(from, to));
    }

    protected void detectChanges() {
        if (schema != null && hasChangedSinceLoad()) {
            logger.info("Detected external change of {}", identity);
            signalMutation();
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + identity + '}';
    }

    /**
     * 最近一次排序/过滤结果
     */
    private static final class SortedView {
        final long generation;
        final SortSpec sort;
        final SearchFilter filter;
        final List<Row> rows;

        SortedView(long generation, SortSpec sort, SearchFilter filter, List<Row> rows) {
            this.generation = generation;
            this.sort = sort;
            this.filter = filter;
            this.rows = rows;
        }

        boolean matches(long currentGeneration, SortSpec otherSort, SearchFilter otherFilter) {
            return generation == currentGeneration && sort.equals(otherSort) && filter.equals(otherFilter);
        }
    }
}
