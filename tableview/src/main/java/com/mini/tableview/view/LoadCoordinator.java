package com.mini.tableview.view;

import com.mini.tableview.cache.PageCache;
import com.mini.tableview.catalog.SourceResolver;
import com.mini.tableview.config.ViewerOptions;
import com.mini.tableview.data.Row;
import com.mini.tableview.exception.SourceException;
import com.mini.tableview.page.PagePlanner;
import com.mini.tableview.page.PageRequest;
import com.mini.tableview.page.PageResult;
import com.mini.tableview.schema.ColumnStatistics;
import com.mini.tableview.schema.Schema;
import com.mini.tableview.source.SourceIdentity;
import com.mini.tableview.source.SourceMutationListener;
import com.mini.tableview.source.TabularSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 后台加载协调器
 *
 * 核心功能：
 * 1. 每个新的期望请求分配单调递增的编号，页缓存命中时直接提交
 * 2. 未命中时在工作线程上读取数据源，控制线程上按编号比较后提交
 * 3. 过期的完成消息被丢弃，不会覆盖更新的已提交结果
 * 4. 数据源变更时使该数据源的缓存失效，并按配置重新加载
 *
 * 所有视图状态写入都发生在控制执行器上（默认是一个守护线程，可以注入界面事件队列），
 * 工作线程只向控制执行器投递完成消息。
 */
public class LoadCoordinator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LoadCoordinator.class);

    private final SourceResolver resolver;
    private final ViewerOptions options;
    private final PageCache cache;
    private final ViewState state = new ViewState();

    private final ThreadPoolExecutor workers;
    private final Executor controlExecutor;
    /** 自己创建的控制线程，注入的执行器不由这里关闭 */
    private final ExecutorService ownedControl;

    /** 控制侧状态锁：注入的执行器不是串行时也不会交错提交 */
    private final Object controlLock = new Object();

    private final List<ViewListener> listeners = new CopyOnWriteArrayList<>();
    private final Set<TabularSource> watchedSources = ConcurrentHashMap.newKeySet();
    private final SourceMutationListener mutationListener = new MutationHandler();

    /** 每次缓存失效递增，派发之后发生过失效的结果不写入缓存 */
    private final AtomicLong invalidationEpoch = new AtomicLong(0);

    // 统计信息
    private final AtomicLong dispatchedCount = new AtomicLong(0);
    private final AtomicLong appliedCount = new AtomicLong(0);
    private final AtomicLong discardedCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);
    private final AtomicLong cancelledCount = new AtomicLong(0);
    private final AtomicLong cacheHitCount = new AtomicLong(0);

    // 以下字段只在 controlLock 内访问
    private Future<?> inFlight;
    /** 已提交结果所属的失效周期，周期变化后不能再直接复用 */
    private long committedEpoch;
    private long pendingId;
    private CompletableFuture<ViewSnapshot> pendingFuture;

    private volatile boolean closed = false;

    public LoadCoordinator(SourceResolver resolver, ViewerOptions options) {
        this(resolver, options, null);
    }

    /**
     * @param controlExecutor 控制执行器，null 表示创建一个专用守护线程
     */
    public LoadCoordinator(SourceResolver resolver, ViewerOptions options, Executor controlExecutor) {
        this.resolver = resolver;
        this.options = options;
        this.cache = new PageCache(options.getCacheCapacity());

        this.workers = new ThreadPoolExecutor(
            options.getWorkerThreads(),
            options.getWorkerThreads(),
            60L, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(options.getWorkerQueueCapacity()),
            new ThreadFactory() {
                private final AtomicLong counter = new AtomicLong(0);
                @Override
                public Thread newThread(Runnable r) {
                    Thread t = new Thread(r, "tableview-worker-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                }
            },
            new ThreadPoolExecutor.AbortPolicy()  // 队列满时拒绝，由请求失败处理
        );

        if (controlExecutor == null) {
            this.ownedControl = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "tableview-control");
                t.setDaemon(true);
                return t;
            });
            this.controlExecutor = ownedControl;
        } else {
            this.ownedControl = null;
            this.controlExecutor = controlExecutor;
        }

        logger.info("LoadCoordinator initialized with {} workers, cache capacity {}",
                options.getWorkerThreads(), options.getCacheCapacity());
    }

    // ==================== 意图 ====================

    /**
     * 在当前期望请求的基础上生成新请求并加载
     *
     * @param planner 在控制线程上执行；抛出异常表示拒绝该意图，不会分发任何请求
     */
    public CompletableFuture<ViewSnapshot> request(Function<ViewSnapshot, PageRequest> planner) {
        return onControl(future -> {
            ViewSnapshot current = state.snapshot();
            if (current.getDesired() == null) {
                throw new IllegalStateException("No source is open");
            }
            PageRequest desired = planner.apply(current);
            dispatch(desired, current.getSchema(), false, future);
        });
    }

    /**
     * 打开数据源，从第一页、原始顺序、无搜索条件开始
     */
    public CompletableFuture<ViewSnapshot> open(SourceIdentity identity, int pageSize) {
        PagePlanner.validatePageSize(pageSize);
        return onControl(future -> {
            logger.info("Switching view to source {}", identity);
            dispatch(PageRequest.firstPage(identity, pageSize), null, false, future);
        });
    }

    /**
     * 重新加载当前数据源的 Schema、行数和当前页
     */
    public CompletableFuture<ViewSnapshot> refresh() {
        return onControl(future -> {
            PageRequest desired = requireDesired();
            invalidate(desired.getSource());
            dispatch(desired, state.snapshot().getSchema(), true, future);
        });
    }

    /**
     * 重新分发当前期望请求，失败后由调用方显式重试
     */
    public CompletableFuture<ViewSnapshot> retry() {
        return onControl(future -> dispatch(requireDesired(), state.snapshot().getSchema(), false, future));
    }

    /**
     * 在工作线程上计算列的描述性统计（不受搜索条件影响）
     */
    public CompletableFuture<List<ColumnStatistics>> describeColumns(List<Integer> columns) {
        PageRequest desired = state.snapshot().getDesired();
        if (desired == null) {
            return failed(new IllegalStateException("No source is open"));
        }
        try {
            return CompletableFuture.supplyAsync(() -> {
                TabularSource source = resolver.resolve(desired.getSource());
                Schema schema = source.schema();
                List<Row> rows = source.readAll();
                List<ColumnStatistics> statistics = new ArrayList<>(columns.size());
                for (int column : columns) {
                    if (!schema.isValidColumn(column)) {
                        throw new IllegalArgumentException("Column index out of bounds: " + column);
                    }
                    statistics.add(ColumnStatistics.compute(schema.getField(column), column, rows));
                }
                return statistics;
            }, workers);
        } catch (RejectedExecutionException e) {
            return failed(e);
        }
    }

    // ==================== 读取 ====================

    public ViewSnapshot snapshot() {
        return state.snapshot();
    }

    public void addListener(ViewListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ViewListener listener) {
        listeners.remove(listener);
    }

    public PageCache getCache() {
        return cache;
    }

    public ViewerOptions getOptions() {
        return options;
    }

    public CoordinatorStats getStats() {
        return new CoordinatorStats(
            dispatchedCount.get(),
            appliedCount.get(),
            discardedCount.get(),
            failedCount.get(),
            cancelledCount.get(),
            cacheHitCount.get()
        );
    }

    // ==================== 控制线程 ====================

    private CompletableFuture<ViewSnapshot> onControl(Consumer<CompletableFuture<ViewSnapshot>> action) {
        CompletableFuture<ViewSnapshot> future = new CompletableFuture<>();
        if (closed) {
            future.completeExceptionally(new IllegalStateException("LoadCoordinator is closed"));
            return future;
        }
        try {
            controlExecutor.execute(() -> {
                synchronized (controlLock) {
                    try {
                        action.accept(future);
                    } catch (RuntimeException e) {
                        logger.debug("Intent rejected: {}", e.toString());
                        future.completeExceptionally(e);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    private void postToControl(long id, Runnable completion) {
        try {
            controlExecutor.execute(() -> {
                synchronized (controlLock) {
                    completion.run();
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug("Control executor rejected completion of request {}: {}", id, e.toString());
        }
    }

    private PageRequest requireDesired() {
        PageRequest desired = state.snapshot().getDesired();
        if (desired == null) {
            throw new IllegalStateException("No source is open");
        }
        return desired;
    }

    /**
     * 分发新的期望请求；缓存命中时直接提交
     */
    private void dispatch(PageRequest desired, Schema schema, boolean refreshSource,
                          CompletableFuture<ViewSnapshot> future) {
        ViewSnapshot current = state.snapshot();

        if (!refreshSource && schema != null) {
            PageResult cached = lookupCache(current, desired);
            if (cached != null) {
                supersede();
                if (cached != current.getResult()) {
                    committedEpoch = invalidationEpoch.get();
                }
                ViewSnapshot committed = state.commitNew(cached);
                cacheHitCount.incrementAndGet();
                appliedCount.incrementAndGet();
                logger.debug("Request {} served from cache: {}", committed.getRequestId(), cached.getRequest());
                publish(committed);
                if (future != null) {
                    future.complete(committed);
                }
                return;
            }
        }

        supersede();
        long epoch = invalidationEpoch.get();
        ViewSnapshot loading = state.begin(desired, schema);
        long id = loading.getRequestId();
        pendingId = id;
        pendingFuture = future;
        dispatchedCount.incrementAndGet();
        logger.debug("Dispatching request {}: {}", id, desired);
        publish(loading);

        try {
            inFlight = workers.submit(() -> runJob(id, desired, refreshSource, epoch));
        } catch (RejectedExecutionException e) {
            inFlight = null;
            handleFailure(id, e);
        }
    }

    /**
     * 已知总行数时（同一数据源、同一搜索条件）先规划再查缓存
     */
    private PageResult lookupCache(ViewSnapshot current, PageRequest desired) {
        PageResult committed = current.getResult();
        if (committed == null) {
            return null;
        }
        PageRequest committedRequest = committed.getRequest();
        if (!committedRequest.getSource().equals(desired.getSource())
                || !committedRequest.getFilter().equals(desired.getFilter())) {
            return null;
        }
        PageRequest planned = PagePlanner.plan(desired, committed.getTotalRows());
        if (planned.equals(committedRequest) && current.getStatus() == ViewStatus.IDLE
                && committedEpoch == invalidationEpoch.get()) {
            return committed;
        }
        return cache.get(planned);
    }

    /**
     * 取消排队中的旧请求并结束它的意图
     */
    private void supersede() {
        if (inFlight != null && !inFlight.isDone() && inFlight.cancel(false)) {
            cancelledCount.incrementAndGet();
            logger.debug("Cancelled queued request {}", pendingId);
        }
        inFlight = null;
        if (pendingFuture != null) {
            pendingFuture.complete(state.snapshot());
            pendingFuture = null;
        }
    }

    private void handleSuccess(long id, PageResult result, long epoch) {
        if (epoch == invalidationEpoch.get()) {
            cache.put(result.getRequest(), result);
        }
        ViewSnapshot committed = state.apply(id, result);
        if (committed == null) {
            discardedCount.incrementAndGet();
            logger.debug("Discarded stale result of request {} (latest is {})", id, state.latestId());
            return;
        }
        appliedCount.incrementAndGet();
        committedEpoch = epoch;
        inFlight = null;
        logger.debug("Committed request {}: {} of {} rows", id, result.size(), result.getTotalRows());
        publish(committed);
        completePending(id, committed, null);
    }

    private void handleFailure(long id, Throwable cause) {
        boolean invalidSort = cause instanceof SourceException.InvalidSortException;
        ViewSnapshot failed = state.fail(id, cause, invalidSort);
        if (failed == null) {
            discardedCount.incrementAndGet();
            logger.debug("Ignored failure of superseded request {}: {}", id, cause.toString());
            return;
        }
        failedCount.incrementAndGet();
        inFlight = null;
        if (cause instanceof SourceException) {
            logger.error("Request {} failed: {}", id, cause.getMessage());
        } else {
            logger.error("Request {} failed", id, cause);
        }
        publish(failed);
        completePending(id, failed, cause);
    }

    private void completePending(long id, ViewSnapshot snapshot, Throwable cause) {
        if (pendingFuture == null || pendingId != id) {
            return;
        }
        if (cause == null) {
            pendingFuture.complete(snapshot);
        } else {
            pendingFuture.completeExceptionally(cause);
        }
        pendingFuture = null;
    }

    private void publish(ViewSnapshot snapshot) {
        for (ViewListener listener : listeners) {
            try {
                listener.onViewChanged(snapshot);
            } catch (RuntimeException e) {
                logger.error("View listener {} failed", listener, e);
            }
        }
    }

    private void invalidate(SourceIdentity source) {
        invalidationEpoch.incrementAndGet();
        cache.invalidateSource(source);
    }

    // ==================== 工作线程 ====================

    private void runJob(long id, PageRequest desired, boolean refreshSource, long epoch) {
        long start = System.currentTimeMillis();
        try {
            TabularSource source = resolver.resolve(desired.getSource());
            watch(source);
            if (refreshSource) {
                source.refresh();
            }
            if (abandoned(id)) {
                return;
            }

            source.schema();
            if (abandoned(id)) {
                return;
            }

            long total = source.rowCount(desired.getFilter());
            PageRequest planned = PagePlanner.plan(desired, total);
            PageResult result = refreshSource ? null : cache.get(planned);
            if (result != null) {
                cacheHitCount.incrementAndGet();
            } else {
                if (abandoned(id)) {
                    return;
                }
                result = source.fetchPage(planned);
            }

            logger.debug("Request {} fetched in {} ms", id, System.currentTimeMillis() - start);
            PageResult fetched = result;
            postToControl(id, () -> handleSuccess(id, fetched, epoch));
        } catch (Throwable e) {
            // 工作线程的 Future 无人读取，Error 也必须回报给控制线程，否则视图停在 LOADING
            postToControl(id, () -> handleFailure(id, e));
        }
    }

    private boolean abandoned(long id) {
        if (state.isLatest(id)) {
            return false;
        }
        cancelledCount.incrementAndGet();
        logger.debug("Request {} superseded by {}, stopping early", id, state.latestId());
        return true;
    }

    private void watch(TabularSource source) {
        if (watchedSources.add(source)) {
            source.addMutationListener(mutationListener);
        }
    }

    /**
     * 数据源变更：立即使缓存失效，再在控制线程上决定是否重新加载
     */
    private class MutationHandler implements SourceMutationListener {

        @Override
        public void onSourceMutated(SourceIdentity identity) {
            invalidate(identity);
            if (!options.isReloadOnMutation() || closed) {
                return;
            }
            postToControl(state.latestId(), () -> {
                ViewSnapshot current = state.snapshot();
                PageRequest desired = current.getDesired();
                if (desired != null && desired.getSource().equals(identity)) {
                    logger.info("Source {} mutated, reloading current page", identity);
                    dispatch(desired, current.getSchema(), false, null);
                }
            });
        }

        @Override
        public void onSourceClosed(SourceIdentity identity) {
            invalidate(identity);
            watchedSources.removeIf(source -> source.identity().equals(identity) && source.isClosed());
        }
    }

    // ==================== 生命周期 ====================

    /**
     * 关闭线程池，等待最多 shutdownTimeoutSeconds 后强制结束
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.info("Shutting down LoadCoordinator");

        for (TabularSource source : watchedSources) {
            source.removeMutationListener(mutationListener);
        }
        watchedSources.clear();

        workers.shutdown();
        if (ownedControl != null) {
            ownedControl.shutdown();
        }

        try {
            if (!workers.awaitTermination(options.getShutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                logger.warn("Workers did not terminate in time, forcing shutdown");
                workers.shutdownNow();
            }
            if (ownedControl != null
                    && !ownedControl.awaitTermination(options.getShutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                ownedControl.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for shutdown", e);
            workers.shutdownNow();
            if (ownedControl != null) {
                ownedControl.shutdownNow();
            }
            Thread.currentThread().interrupt();
        }

        synchronized (controlLock) {
            if (pendingFuture != null) {
                pendingFuture.complete(state.snapshot());
                pendingFuture = null;
            }
        }
        logger.info("LoadCoordinator shut down, {}", getStats());
    }

    public boolean isClosed() {
        return closed;
    }

    private static <T> CompletableFuture<T> failed(Throwable cause) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(cause);
        return future;
    }
}
