package com.mini.tableview.view;

import com.mini.tableview.config.ViewerOptions;
import com.mini.tableview.exception.SourceException;
import com.mini.tableview.page.SortDirection;
import com.mini.tableview.page.SortSpec;
import com.mini.tableview.schema.ColumnStatistics;
import com.mini.tableview.source.InMemorySource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.mini.tableview.view.LoadCoordinatorTest.await;
import static com.mini.tableview.view.LoadCoordinatorTest.awaitFailure;
import static com.mini.tableview.view.LoadCoordinatorTest.resolverOf;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 视图控制器测试：排序、翻页、页大小、搜索和切换数据源
 */
public class ViewControllerTest {

    private InMemorySource users;
    private InMemorySource orders;
    private ViewController controller;

    @BeforeEach
    public void setUp() throws Exception {
        users = InMemorySource.numbered("users", 100);
        orders = InMemorySource.numbered("orders", 30);
        controller = newController(ViewerOptions.builder().defaultPageSize(10).build());
        await(controller.switchSource(users.identity()));
    }

    @AfterEach
    public void tearDown() {
        controller.close();
        users.close();
        orders.close();
    }

    private ViewController newController(ViewerOptions options) {
        return new ViewController(new LoadCoordinator(resolverOf(users, orders), options));
    }

    private static long firstId(ViewSnapshot snapshot) {
        return (Long) snapshot.getResult().getRows().get(0).getValue(0);
    }

    @Test
    public void testSwitchSourceUsesDefaultPageSize() {
        ViewSnapshot snapshot = controller.snapshot();

        assertEquals(ViewStatus.IDLE, controller.status());
        assertEquals(10, controller.desiredRequest().getPageSize());
        assertEquals(100, controller.committedResult().getTotalRows());
        assertEquals(10, snapshot.getPageCount());
    }

    @Test
    public void testToggleSortCycle() throws Exception {
        await(controller.goToPage(3));

        ViewSnapshot ascending = await(controller.toggleSort(0));
        assertEquals(SortSpec.ascending(0), ascending.getCommittedRequest().getSort());
        assertEquals(0, ascending.getCommittedRequest().getPageIndex());
        assertEquals(0L, firstId(ascending));

        ViewSnapshot descending = await(controller.toggleSort(0));
        assertEquals(SortSpec.descending(0), descending.getCommittedRequest().getSort());
        assertEquals(99L, firstId(descending));

        ViewSnapshot unsorted = await(controller.toggleSort(0));
        assertTrue(unsorted.getCommittedRequest().getSort().isNone());
        assertEquals(0L, firstId(unsorted));
    }

    @Test
    public void testSortOnOtherColumnStartsAscending() throws Exception {
        await(controller.setSort(0, SortDirection.DESCENDING));

        ViewSnapshot byScore = await(controller.toggleSort(2));

        assertEquals(SortSpec.ascending(2), byScore.getCommittedRequest().getSort());
        assertEquals(0.0, byScore.getResult().getRows().get(0).getValue(2));
    }

    @Test
    public void testInvalidSortIsRejectedWithoutDispatch() throws Exception {
        await(controller.setSort(1, SortDirection.ASCENDING));
        long dispatched = controller.getStats().getDispatchedCount();
        long requestId = controller.snapshot().getRequestId();

        Throwable binary = awaitFailure(controller.setSort(3, SortDirection.ASCENDING));
        Throwable missing = awaitFailure(controller.toggleSort(12));

        assertTrue(binary instanceof SourceException.InvalidSortException, binary.toString());
        assertTrue(missing instanceof SourceException.InvalidSortException, missing.toString());
        assertEquals(dispatched, controller.getStats().getDispatchedCount());
        assertEquals(requestId, controller.snapshot().getRequestId());
        assertEquals(SortSpec.ascending(1), controller.desiredRequest().getSort());
    }

    @Test
    public void testSortBeforeSchemaIsLoaded() throws Exception {
        orders.setLoadDelayMillis(300);
        orders.setFetchDelay(request -> 0L);
        controller.switchSource(orders.identity());

        Throwable cause = awaitFailure(controller.setSort(0, SortDirection.ASCENDING));

        assertTrue(cause instanceof SourceException.InvalidSortException, cause.toString());
    }

    @Test
    public void testNextAndPreviousClampAtEnds() throws Exception {
        assertEquals(0, await(controller.previousPage()).getCommittedRequest().getPageIndex());

        await(controller.goToPage(9));
        assertEquals(9, await(controller.nextPage()).getCommittedRequest().getPageIndex());
        assertEquals(8, await(controller.previousPage()).getCommittedRequest().getPageIndex());
        assertEquals(0, await(controller.goToPage(-4)).getCommittedRequest().getPageIndex());
    }

    @Test
    public void testWrappingNavigation() throws Exception {
        try (ViewController wrapping = newController(
                ViewerOptions.builder().defaultPageSize(10).wrapPageNavigation(true).build())) {
            await(wrapping.switchSource(users.identity()));

            assertEquals(9, await(wrapping.previousPage()).getCommittedRequest().getPageIndex());
            assertEquals(0, await(wrapping.nextPage()).getCommittedRequest().getPageIndex());
        }
    }

    @Test
    public void testPageSizeChangeKeepsFirstRowVisible() throws Exception {
        await(controller.goToPage(5));

        ViewSnapshot resized = await(controller.setPageSize(25));

        assertEquals(25, resized.getCommittedRequest().getPageSize());
        assertEquals(2, resized.getCommittedRequest().getPageIndex());
        assertEquals(50L, firstId(resized));
        assertEquals(4, resized.getPageCount());

        Throwable cause = awaitFailure(controller.setPageSize(0));
        assertTrue(cause instanceof IllegalArgumentException);
        assertEquals(25, controller.desiredRequest().getPageSize());
    }

    @Test
    public void testCustomPageSizeIsAllowed() throws Exception {
        assertFalse(controller.pageSizeOptions().isPreset(7));

        ViewSnapshot snapshot = await(controller.setPageSize(7));

        assertEquals(7, snapshot.getResult().size());
        assertEquals(15, snapshot.getPageCount());
    }

    @Test
    public void testSearchResetsToFirstPage() throws Exception {
        await(controller.goToPage(4));

        ViewSnapshot searched = await(controller.setSearch("user_1"));
        assertEquals(0, searched.getCommittedRequest().getPageIndex());
        assertEquals(11, searched.getResult().getTotalRows());
        assertEquals(2, searched.getPageCount());

        ViewSnapshot cleared = await(controller.clearSearch());
        assertTrue(cleared.getCommittedRequest().getFilter().isNone());
        assertEquals(100, cleared.getResult().getTotalRows());
    }

    @Test
    public void testSwitchSourceResetsSortAndSearch() throws Exception {
        await(controller.setPageSize(25));
        await(controller.setSort(2, SortDirection.DESCENDING));
        await(controller.setSearch("user"));

        ViewSnapshot switched = await(controller.switchSource(orders.identity()));

        assertEquals(orders.identity(), switched.getCommittedRequest().getSource());
        assertEquals(25, switched.getCommittedRequest().getPageSize());
        assertTrue(switched.getCommittedRequest().getSort().isNone());
        assertTrue(switched.getCommittedRequest().getFilter().isNone());
        assertEquals(30, switched.getResult().getTotalRows());
    }

    @Test
    public void testClearSortAndRefresh() throws Exception {
        await(controller.setSort(0, SortDirection.DESCENDING));
        await(controller.goToPage(2));

        ViewSnapshot cleared = await(controller.clearSort());
        assertTrue(cleared.getCommittedRequest().getSort().isNone());
        assertEquals(0, cleared.getCommittedRequest().getPageIndex());

        int loads = users.loadCount.get();
        ViewSnapshot refreshed = await(controller.refresh());
        assertEquals(ViewStatus.IDLE, refreshed.getStatus());
        assertEquals(loads + 1, users.loadCount.get());
    }

    @Test
    public void testDescribeColumns() throws Exception {
        List<ColumnStatistics> stats = await(controller.describeColumns(1, 2));

        assertEquals("name", stats.get(0).getColumnName());
        assertEquals(100, stats.get(0).getDistinctCount());
        assertEquals(90, stats.get(1).getCount());
    }
}
