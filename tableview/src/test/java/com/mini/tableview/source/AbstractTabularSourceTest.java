package com.mini.tableview.source;

import com.mini.tableview.data.Row;
import com.mini.tableview.exception.SourceException;
import com.mini.tableview.page.PageRequest;
import com.mini.tableview.page.PageResult;
import com.mini.tableview.page.SearchFilter;
import com.mini.tableview.page.SortSpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 内存排序数据源测试：分页窗口、排序、搜索、变更通知和超时
 */
public class AbstractTabularSourceTest {

    private InMemorySource source;

    @BeforeEach
    public void setUp() {
        source = InMemorySource.numbered("users", 100);
    }

    @AfterEach
    public void tearDown() {
        source.close();
    }

    private PageRequest page(int index, int size) {
        return PageRequest.firstPage(source.identity(), size).withPageIndex(index);
    }

    @Test
    public void testUnsortedPagesFollowSourceOrder() {
        PageResult second = source.fetchPage(page(1, 25));

        assertEquals(25, second.size());
        assertEquals(100, second.getTotalRows());
        assertEquals(25L, second.getRows().get(0).getValue(0));
        assertEquals(49L, second.getRows().get(24).getValue(0));
        assertEquals(source.schema(), second.getSchema());
    }

    @Test
    public void testLastPageIsPartialAndBeyondIsEmpty() {
        PageResult last = source.fetchPage(page(3, 30));
        assertEquals(10, last.size());
        assertEquals(90L, last.getRows().get(0).getValue(0));

        PageResult beyond = source.fetchPage(page(7, 30));
        assertTrue(beyond.isEmpty());
        assertEquals(100, beyond.getTotalRows());
    }

    @Test
    public void testFetchIsIdempotent() {
        PageRequest request = page(2, 10).withSort(SortSpec.descending(2));
        PageResult first = source.fetchPage(request);
        PageResult second = source.fetchPage(request);

        assertEquals(first.getRows(), second.getRows());
        assertEquals(first.getTotalRows(), second.getTotalRows());
        // 数据只加载一次
        assertEquals(1, source.loadCount.get());
    }

    @Test
    public void testSortedPagesPutNullsLast() {
        PageResult ascending = source.fetchPage(page(0, 10).withSort(SortSpec.ascending(2)));
        assertEquals(0.0, ascending.getRows().get(0).getValue(2));
        assertNotNull(ascending.getRows().get(9).getValue(2));

        // 100 行中 10 行为空值，正好落在末页
        for (SortSpec sort : new SortSpec[]{SortSpec.ascending(2), SortSpec.descending(2)}) {
            PageResult tail = source.fetchPage(page(9, 10).withSort(sort));
            for (Row row : tail.getRows()) {
                assertNull(row.getValue(2), "sort " + sort);
            }
        }

        PageResult descending = source.fetchPage(page(0, 1).withSort(SortSpec.descending(2)));
        double max = 0;
        for (Row row : source.readAll()) {
            if (row.getValue(2) != null) {
                max = Math.max(max, (Double) row.getValue(2));
            }
        }
        assertEquals(max, descending.getRows().get(0).getValue(2));
    }

    @Test
    public void testSortOnBinaryOrMissingColumnIsRejected() {
        assertThrows(SourceException.InvalidSortException.class,
                () -> source.fetchPage(page(0, 10).withSort(SortSpec.ascending(3))));
        SourceException.InvalidSortException e = assertThrows(SourceException.InvalidSortException.class,
                () -> source.fetchPage(page(0, 10).withSort(SortSpec.ascending(4))));
        assertEquals(4, e.getColumnIndex());
    }

    @Test
    public void testSearchFilterNarrowsRowsAndTotal() {
        SearchFilter filter = SearchFilter.of("USER_1");
        assertEquals(11, source.rowCount(filter));

        PageResult result = source.fetchPage(page(0, 5).withFilter(filter).withSort(SortSpec.descending(0)));
        assertEquals(11, result.getTotalRows());
        assertEquals(19L, result.getRows().get(0).getValue(0));
        assertEquals(100, source.rowCount());
    }

    @Test
    public void testMutationRefreshesAndNotifiesListeners() {
        AtomicInteger notified = new AtomicInteger();
        source.addMutationListener(identity -> {
            assertEquals(source.identity(), identity);
            notified.incrementAndGet();
        });
        assertEquals(100, source.fetchPage(page(0, 10)).getTotalRows());

        List<Row> fewer = new ArrayList<>(InMemorySource.numberedRows(40));
        source.replaceRows(fewer);

        assertEquals(1, notified.get());
        assertEquals(40, source.fetchPage(page(0, 10)).getTotalRows());
        assertEquals(2, source.loadCount.get());
    }

    @Test
    public void testClosedSourceIsUnavailable() {
        AtomicInteger closedCallbacks = new AtomicInteger();
        source.addMutationListener(new SourceMutationListener() {
            @Override
            public void onSourceMutated(SourceIdentity identity) {
            }

            @Override
            public void onSourceClosed(SourceIdentity identity) {
                closedCallbacks.incrementAndGet();
            }
        });
        source.close();

        assertTrue(source.isClosed());
        assertEquals(1, closedCallbacks.get());
        assertThrows(SourceException.SourceUnavailableException.class, () -> source.fetchPage(page(0, 10)));
        assertThrows(SourceException.SourceUnavailableException.class, () -> source.schema());
    }

    @Test
    public void testRequestForOtherSourceIsRejected() {
        PageRequest foreign = PageRequest.firstPage(new SourceIdentity("memory", "other"), 10);
        assertThrows(IllegalArgumentException.class, () -> source.fetchPage(foreign));
    }

    @Test
    public void testSlowLoadTimesOut() {
        InMemorySource slow = InMemorySource.numbered("slow", 10,
                SourceOptions.builder().fetchTimeoutMillis(50).build());
        slow.setLoadDelayMillis(300);
        try {
            SourceException.FetchTimeoutException e = assertThrows(SourceException.FetchTimeoutException.class,
                    () -> slow.fetchPage(PageRequest.firstPage(slow.identity(), 5)));
            assertEquals(50, e.getTimeoutMillis());
        } finally {
            slow.close();
        }
    }
}
