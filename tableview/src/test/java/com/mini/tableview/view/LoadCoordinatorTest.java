package com.mini.tableview.view;

import com.mini.tableview.catalog.SourceResolver;
import com.mini.tableview.config.ViewerOptions;
import com.mini.tableview.exception.SourceException;
import com.mini.tableview.page.PageRequest;
import com.mini.tableview.page.PageResult;
import com.mini.tableview.page.SearchFilter;
import com.mini.tableview.page.SortSpec;
import com.mini.tableview.schema.ColumnStatistics;
import com.mini.tableview.source.InMemorySource;
import com.mini.tableview.source.SourceIdentity;
import com.mini.tableview.source.SourceOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 后台加载协调器测试：编号提交、过期结果丢弃、缓存、失败和变更重载
 */
public class LoadCoordinatorTest {

    private static final int PAGE_SIZE = 10;

    private InMemorySource source;
    private LoadCoordinator coordinator;

    @BeforeEach
    public void setUp() {
        source = InMemorySource.numbered("users", 100);
        coordinator = new LoadCoordinator(resolverOf(source), ViewerOptions.builder().workerThreads(2).build());
    }

    @AfterEach
    public void tearDown() {
        coordinator.close();
        source.close();
    }

    static SourceResolver resolverOf(InMemorySource... sources) {
        return identity -> {
            for (InMemorySource candidate : sources) {
                if (candidate.identity().equals(identity)) {
                    return candidate;
                }
            }
            throw new SourceException.SourceUnavailableException(identity, "unknown source");
        };
    }

    static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    static Throwable awaitFailure(CompletableFuture<?> future) throws Exception {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return e.getCause();
    }

    static void waitUntil(BooleanSupplier condition, String description) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for " + description);
            }
            Thread.sleep(10);
        }
    }

    private ViewSnapshot goTo(int pageIndex) throws Exception {
        return await(coordinator.request(snapshot -> snapshot.getDesired().withPageIndex(pageIndex)));
    }

    @Test
    public void testOpenCommitsFirstPage() throws Exception {
        List<ViewSnapshot> published = new CopyOnWriteArrayList<>();
        coordinator.addListener(published::add);

        ViewSnapshot snapshot = await(coordinator.open(source.identity(), PAGE_SIZE));

        assertEquals(ViewStatus.IDLE, snapshot.getStatus());
        assertEquals(10, snapshot.getResult().size());
        assertEquals(100, snapshot.getResult().getTotalRows());
        assertEquals(InMemorySource.numberedSchema(), snapshot.getSchema());
        assertEquals(snapshot.getDesired(), snapshot.getCommittedRequest());

        assertEquals(2, published.size());
        assertEquals(ViewStatus.LOADING, published.get(0).getStatus());
        assertFalse(published.get(0).hasResult());
        assertSame(snapshot, published.get(1));
        assertSame(snapshot, coordinator.snapshot());
    }

    @Test
    public void testStaleResultIsDiscarded() throws Exception {
        await(coordinator.open(source.identity(), PAGE_SIZE));
        source.setFetchDelay(request -> request.getPageIndex() == 1 ? 500L : 10L);
        int fetchesBefore = source.fetchCount.get();

        CompletableFuture<ViewSnapshot> slow = coordinator.request(s -> s.getDesired().withPageIndex(1));
        waitUntil(() -> source.fetchCount.get() > fetchesBefore, "slow fetch to start");
        CompletableFuture<ViewSnapshot> fast = coordinator.request(s -> s.getDesired().withPageIndex(2));

        ViewSnapshot committed = await(fast);
        assertEquals(2, committed.getCommittedRequest().getPageIndex());
        assertEquals(20L, committed.getResult().getRows().get(0).getValue(0));

        // 被取代的意图正常完成，不抛异常
        ViewSnapshot superseded = await(slow);
        assertTrue(superseded.getRequestId() < committed.getRequestId());

        waitUntil(() -> coordinator.getStats().getDiscardedCount() >= 1, "stale result to be discarded");
        ViewSnapshot after = coordinator.snapshot();
        assertEquals(committed.getRequestId(), after.getRequestId());
        assertEquals(2, after.getCommittedRequest().getPageIndex());
        assertEquals(ViewStatus.IDLE, after.getStatus());
    }

    @Test
    public void testCommittedRequestIdsOnlyIncrease() throws Exception {
        await(coordinator.open(source.identity(), PAGE_SIZE));
        List<Long> committedIds = new CopyOnWriteArrayList<>();
        coordinator.addListener(snapshot -> {
            if (snapshot.getStatus() == ViewStatus.IDLE) {
                committedIds.add(snapshot.getRequestId());
            }
        });
        source.setFetchDelay(request -> (long) ((9 - request.getPageIndex()) * 15));

        CompletableFuture<ViewSnapshot> last = null;
        for (int page = 1; page < 10; page++) {
            int index = page;
            last = coordinator.request(s -> s.getDesired().withPageIndex(index));
        }
        ViewSnapshot finalSnapshot = await(last);
        waitUntil(() -> {
            CoordinatorStats stats = coordinator.getStats();
            return stats.getAppliedCount() + stats.getDiscardedCount() + stats.getCancelledCount()
                    >= stats.getDispatchedCount();
        }, "all requests to settle");

        assertEquals(9, finalSnapshot.getCommittedRequest().getPageIndex());
        assertEquals(9, coordinator.snapshot().getCommittedRequest().getPageIndex());
        for (int i = 1; i < committedIds.size(); i++) {
            assertTrue(committedIds.get(i) > committedIds.get(i - 1), "ids " + committedIds);
        }
    }

    @Test
    public void testCachedPageIsCommittedWithoutFetch() throws Exception {
        await(coordinator.open(source.identity(), PAGE_SIZE));
        ViewSnapshot second = goTo(1);
        int fetches = source.fetchCount.get();

        ViewSnapshot back = goTo(0);

        assertEquals(fetches, source.fetchCount.get());
        assertEquals(0L, back.getResult().getRows().get(0).getValue(0));
        assertTrue(back.getRequestId() > second.getRequestId());
        assertTrue(coordinator.getStats().getCacheHitCount() >= 1);
    }

    @Test
    public void testPageBeyondLastIsClamped() throws Exception {
        await(coordinator.open(source.identity(), PAGE_SIZE));

        ViewSnapshot snapshot = goTo(50);

        assertEquals(9, snapshot.getCommittedRequest().getPageIndex());
        assertEquals(9, snapshot.getDesired().getPageIndex());
        assertEquals(90L, snapshot.getResult().getRows().get(0).getValue(0));
    }

    @Test
    public void testFailureKeepsLastPageUntilRetry() throws Exception {
        ViewSnapshot first = await(coordinator.open(source.identity(), PAGE_SIZE));
        source.setFetchFailure(new SourceException.SourceUnavailableException(source.identity(), "offline"));

        Throwable cause = awaitFailure(coordinator.request(s -> s.getDesired().withPageIndex(1)));

        assertTrue(cause instanceof SourceException.SourceUnavailableException, cause.toString());
        ViewSnapshot failed = coordinator.snapshot();
        assertEquals(ViewStatus.ERROR, failed.getStatus());
        assertSame(cause, failed.getError());
        assertSame(first.getResult(), failed.getResult());
        assertEquals(1, failed.getDesired().getPageIndex());

        source.setFetchFailure(null);
        ViewSnapshot retried = await(coordinator.retry());
        assertEquals(ViewStatus.IDLE, retried.getStatus());
        assertNull(retried.getError());
        assertEquals(1, retried.getCommittedRequest().getPageIndex());
        assertEquals(1, coordinator.getStats().getFailedCount());
    }

    @Test
    public void testErrorFromSourceSettlesTheView() throws Exception {
        ViewSnapshot first = await(coordinator.open(source.identity(), PAGE_SIZE));
        OutOfMemoryError error = new OutOfMemoryError("table too large");
        source.setFetchFailure(error);

        Throwable cause = awaitFailure(coordinator.request(s -> s.getDesired().withPageIndex(2)));

        assertSame(error, cause);
        ViewSnapshot failed = coordinator.snapshot();
        assertEquals(ViewStatus.ERROR, failed.getStatus());
        assertSame(first.getResult(), failed.getResult());
        assertEquals(1, coordinator.getStats().getFailedCount());
    }

    @Test
    public void testInvalidSortFailureRevertsDesiredSort() throws Exception {
        await(coordinator.open(source.identity(), PAGE_SIZE));
        source.setFetchFailure(new SourceException.InvalidSortException(2, "rejected by source"));

        Throwable cause = awaitFailure(coordinator.request(
                s -> s.getDesired().withSort(SortSpec.ascending(2)).withPageIndex(0)));

        assertTrue(cause instanceof SourceException.InvalidSortException);
        ViewSnapshot snapshot = coordinator.snapshot();
        assertEquals(ViewStatus.ERROR, snapshot.getStatus());
        assertTrue(snapshot.getDesired().getSort().isNone());
        assertTrue(snapshot.getCommittedRequest().getSort().isNone());
    }

    @Test
    public void testTimeoutIsReportedAsFailure() throws Exception {
        InMemorySource slow = InMemorySource.numbered("slow", 20,
                SourceOptions.builder().fetchTimeoutMillis(50).build());
        slow.setLoadDelayMillis(300);
        try (LoadCoordinator slowCoordinator = new LoadCoordinator(resolverOf(slow), ViewerOptions.defaults())) {
            Throwable cause = awaitFailure(slowCoordinator.open(slow.identity(), PAGE_SIZE));

            assertTrue(cause instanceof SourceException.FetchTimeoutException, cause.toString());
            assertEquals(ViewStatus.ERROR, slowCoordinator.snapshot().getStatus());
            assertFalse(slowCoordinator.snapshot().hasResult());
        } finally {
            slow.close();
        }
    }

    @Test
    public void testMutationInvalidatesCacheAndReloads() throws Exception {
        await(coordinator.open(source.identity(), PAGE_SIZE));
        PageRequest secondPage = goTo(1).getCommittedRequest();
        goTo(0);
        assertTrue(coordinator.getCache().contains(secondPage));

        source.replaceRows(InMemorySource.numberedRows(40));

        assertFalse(coordinator.getCache().contains(secondPage));
        waitUntil(() -> {
            PageResult result = coordinator.snapshot().getResult();
            return result != null && result.getTotalRows() == 40 && !coordinator.snapshot().isLoading();
        }, "reload after mutation");
        assertEquals(0, coordinator.snapshot().getCommittedRequest().getPageIndex());
    }

    @Test
    public void testMutationWithoutAutoReload() throws Exception {
        try (LoadCoordinator manual = new LoadCoordinator(resolverOf(source),
                ViewerOptions.builder().reloadOnMutation(false).build())) {
            await(manual.open(source.identity(), PAGE_SIZE));
            long requestId = manual.snapshot().getRequestId();

            source.replaceRows(InMemorySource.numberedRows(40));
            Thread.sleep(100);

            assertEquals(requestId, manual.snapshot().getRequestId());
            assertEquals(0, manual.getCache().size());
            assertEquals(40, await(manual.refresh()).getResult().getTotalRows());
        }
    }

    @Test
    public void testInjectedControlExecutorServesCacheHitsSynchronously() throws Exception {
        try (LoadCoordinator direct = new LoadCoordinator(resolverOf(source), ViewerOptions.defaults(),
                Runnable::run)) {
            await(direct.open(source.identity(), PAGE_SIZE));

            CompletableFuture<ViewSnapshot> again = direct.request(ViewSnapshot::getDesired);

            assertTrue(again.isDone());
            assertEquals(0, again.get().getCommittedRequest().getPageIndex());
        }
    }

    @Test
    public void testListenerFailureDoesNotBreakCommit() throws Exception {
        coordinator.addListener(snapshot -> {
            throw new IllegalStateException("broken listener");
        });

        ViewSnapshot snapshot = await(coordinator.open(source.identity(), PAGE_SIZE));

        assertEquals(ViewStatus.IDLE, snapshot.getStatus());
    }

    @Test
    public void testDescribeColumnsIgnoresSearch() throws Exception {
        await(coordinator.open(source.identity(), PAGE_SIZE));
        await(coordinator.request(s -> s.getDesired()
                .withFilter(SearchFilter.of("user_1")).withPageIndex(0)));

        List<ColumnStatistics> stats =
                await(coordinator.describeColumns(Arrays.asList(0, 2)));

        assertEquals(2, stats.size());
        assertEquals(100, stats.get(0).getCount());
        assertEquals(0L, stats.get(0).getMinValue());
        assertEquals(99L, stats.get(0).getMaxValue());
        assertEquals(10, stats.get(1).getNullCount());

        Throwable cause = awaitFailure(coordinator.describeColumns(Collections.singletonList(7)));
        assertTrue(cause instanceof IllegalArgumentException, cause.toString());
    }

    @Test
    public void testIntentsBeforeOpenAndAfterClose() throws Exception {
        assertTrue(awaitFailure(coordinator.retry()) instanceof IllegalStateException);
        assertTrue(awaitFailure(coordinator.request(ViewSnapshot::getDesired)) instanceof IllegalStateException);
        assertThrows(IllegalArgumentException.class,
                () -> coordinator.open(new SourceIdentity("memory", "users"), 0));

        coordinator.close();

        assertTrue(coordinator.isClosed());
        assertTrue(awaitFailure(coordinator.open(source.identity(), PAGE_SIZE)) instanceof IllegalStateException);
    }
}
