package com.mini.tableview.view;

import com.google.common.primitives.Ints;
import com.mini.tableview.config.ViewerOptions;
import com.mini.tableview.exception.SourceException;
import com.mini.tableview.page.PagePlanner;
import com.mini.tableview.page.PageRequest;
import com.mini.tableview.page.PageResult;
import com.mini.tableview.page.PageSizeOptions;
import com.mini.tableview.page.SearchFilter;
import com.mini.tableview.page.SortDirection;
import com.mini.tableview.page.SortSpec;
import com.mini.tableview.schema.ColumnStatistics;
import com.mini.tableview.source.SourceIdentity;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * 视图控制器
 *
 * 渲染层使用的门面：读取快照、订阅变更、发出意图。
 * 每个意图在控制线程上经过规划器生成新的期望请求，返回的 Future
 * 在请求结束（提交、失败或被新请求取代）时完成；被拒绝的意图异常完成且不分发请求。
 */
public class ViewController implements AutoCloseable {

    private final LoadCoordinator coordinator;
    private final PageSizeOptions pageSizes;
    private final boolean wrapNavigation;
    private final int defaultPageSize;

    public ViewController(LoadCoordinator coordinator) {
        ViewerOptions options = coordinator.getOptions();
        this.coordinator = coordinator;
        this.pageSizes = options.pageSizes();
        this.wrapNavigation = options.isWrapPageNavigation();
        this.defaultPageSize = options.getDefaultPageSize();
    }

    // 读取

    public ViewSnapshot snapshot() {
        return coordinator.snapshot();
    }

    public PageRequest desiredRequest() {
        return snapshot().getDesired();
    }

    public PageResult committedResult() {
        return snapshot().getResult();
    }

    public ViewStatus status() {
        return snapshot().getStatus();
    }

    public PageSizeOptions pageSizeOptions() {
        return pageSizes;
    }

    public CoordinatorStats getStats() {
        return coordinator.getStats();
    }

    public void addListener(ViewListener listener) {
        coordinator.addListener(listener);
    }

    public void removeListener(ViewListener listener) {
        coordinator.removeListener(listener);
    }

    // 排序

    /**
     * 按列排序并回到第一页；列越界或不可排序时拒绝，保留原排序
     */
    public CompletableFuture<ViewSnapshot> setSort(int columnIndex, SortDirection direction) {
        return applySort(current -> SortSpec.by(columnIndex, direction), columnIndex);
    }

    /**
     * 点击列头：升序 -> 降序 -> 原始顺序
     */
    public CompletableFuture<ViewSnapshot> toggleSort(int columnIndex) {
        return applySort(current -> PagePlanner.toggleSort(current, columnIndex), columnIndex);
    }

    public CompletableFuture<ViewSnapshot> clearSort() {
        return coordinator.request(snapshot -> snapshot.getDesired().withSort(SortSpec.NONE).withPageIndex(0));
    }

    private CompletableFuture<ViewSnapshot> applySort(UnaryOperator<SortSpec> next,
                                                      int columnIndex) {
        return coordinator.request(snapshot -> {
            if (snapshot.getSchema() == null) {
                throw new SourceException.InvalidSortException(columnIndex, "schema not loaded yet");
            }
            SortSpec sort = next.apply(snapshot.getDesired().getSort());
            PagePlanner.validateSort(sort, snapshot.getSchema());
            return snapshot.getDesired().withSort(sort).withPageIndex(0);
        });
    }

    // 翻页

    /**
     * 跳转到指定页；超出末页时落在末页，小于 0 时落在第一页
     */
    public CompletableFuture<ViewSnapshot> goToPage(int pageIndex) {
        return coordinator.request(snapshot -> snapshot.getDesired().withPageIndex(Math.max(pageIndex, 0)));
    }

    public CompletableFuture<ViewSnapshot> nextPage() {
        return coordinator.request(snapshot -> {
            PageRequest desired = snapshot.getDesired();
            int index = snapshot.isResultForDesiredRows()
                    ? PagePlanner.nextPageIndex(desired.getPageIndex(), pageCountOf(snapshot), wrapNavigation)
                    : desired.getPageIndex() + 1;
            return desired.withPageIndex(index);
        });
    }

    public CompletableFuture<ViewSnapshot> previousPage() {
        return coordinator.request(snapshot -> {
            PageRequest desired = snapshot.getDesired();
            int index = snapshot.isResultForDesiredRows()
                    ? PagePlanner.previousPageIndex(desired.getPageIndex(), pageCountOf(snapshot), wrapNavigation)
                    : Math.max(desired.getPageIndex() - 1, 0);
            return desired.withPageIndex(index);
        });
    }

    private static int pageCountOf(ViewSnapshot snapshot) {
        return PagePlanner.pageCount(snapshot.getResult().getTotalRows(), snapshot.getDesired().getPageSize());
    }

    /**
     * 修改页大小，保持当前第一行可见
     */
    public CompletableFuture<ViewSnapshot> setPageSize(int pageSize) {
        int size;
        try {
            size = pageSizes.select(pageSize);
        } catch (IllegalArgumentException e) {
            CompletableFuture<ViewSnapshot> rejected = new CompletableFuture<>();
            rejected.completeExceptionally(e);
            return rejected;
        }
        return coordinator.request(snapshot -> PagePlanner.resize(snapshot.getDesired(), size));
    }

    // 搜索

    /**
     * 设置搜索条件并回到第一页
     */
    public CompletableFuture<ViewSnapshot> setSearch(String query) {
        SearchFilter filter = SearchFilter.of(query);
        return coordinator.request(snapshot -> snapshot.getDesired().withFilter(filter).withPageIndex(0));
    }

    public CompletableFuture<ViewSnapshot> clearSearch() {
        return setSearch(null);
    }

    // 数据源

    /**
     * 切换数据源：排序和搜索条件重置，页大小沿用当前值
     */
    public CompletableFuture<ViewSnapshot> switchSource(SourceIdentity identity) {
        PageRequest desired = desiredRequest();
        int pageSize = desired != null ? desired.getPageSize() : defaultPageSize;
        return coordinator.open(identity, pageSize);
    }

    public CompletableFuture<ViewSnapshot> refresh() {
        return coordinator.refresh();
    }

    public CompletableFuture<ViewSnapshot> retry() {
        return coordinator.retry();
    }

    /**
     * 描述性统计，不受搜索条件影响
     */
    public CompletableFuture<List<ColumnStatistics>> describeColumns(int... columns) {
        return coordinator.describeColumns(Ints.asList(columns));
    }

    @Override
    public void close() {
        coordinator.close();
    }
}
