package com.mini.tableview.view;

import com.mini.tableview.page.PageRequest;
import com.mini.tableview.page.PageResult;
import com.mini.tableview.page.SortSpec;
import com.mini.tableview.schema.Schema;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 视图状态
 *
 * 只由 {@link LoadCoordinator} 写入。每次写入在锁内完成"比较编号再提交"，
 * 然后整体替换不可变快照；读者通过原子引用读取快照，不需要加锁。
 * 编号单调递增，只有最新编号的结果可以提交，因此提交顺序与编号顺序一致。
 */
final class ViewState {

    private final Object lock = new Object();
    private final AtomicReference<ViewSnapshot> current = new AtomicReference<>(ViewSnapshot.INITIAL);
    private final AtomicLong latestId = new AtomicLong(0);

    ViewSnapshot snapshot() {
        return current.get();
    }

    long latestId() {
        return latestId.get();
    }

    boolean isLatest(long id) {
        return latestId.get() == id;
    }

    /**
     * 分配新编号并进入 LOADING，保留已提交结果
     */
    ViewSnapshot begin(PageRequest desired, Schema schema) {
        synchronized (lock) {
            long id = latestId.incrementAndGet();
            ViewSnapshot next = current.get().loading(id, desired, schema);
            current.set(next);
            return next;
        }
    }

    /**
     * 缓存命中：分配新编号并直接提交
     */
    ViewSnapshot commitNew(PageResult result) {
        synchronized (lock) {
            long id = latestId.incrementAndGet();
            ViewSnapshot next = current.get().committed(id, result);
            current.set(next);
            return next;
        }
    }

    /**
     * 提交编号为 id 的结果，编号已过期时返回 null
     */
    ViewSnapshot apply(long id, PageResult result) {
        synchronized (lock) {
            if (latestId.get() != id) {
                return null;
            }
            ViewSnapshot next = current.get().committed(id, result);
            current.set(next);
            return next;
        }
    }

    /**
     * 记录编号为 id 的失败，编号已过期时返回 null
     *
     * @param revertSort 为 true 时期望请求的排序恢复为已提交的排序
     */
    ViewSnapshot fail(long id, Throwable cause, boolean revertSort) {
        synchronized (lock) {
            if (latestId.get() != id) {
                return null;
            }
            ViewSnapshot previous = current.get();
            PageRequest desired = previous.getDesired();
            if (revertSort && desired != null) {
                desired = desired.withSort(committedSortFor(previous, desired));
            }
            ViewSnapshot next = previous.failed(desired, cause);
            current.set(next);
            return next;
        }
    }

    private static SortSpec committedSortFor(ViewSnapshot snapshot, PageRequest desired) {
        PageRequest committed = snapshot.getCommittedRequest();
        if (committed != null && committed.getSource().equals(desired.getSource())) {
            return committed.getSort();
        }
        return SortSpec.NONE;
    }
}
