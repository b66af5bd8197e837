package com.mini.tableview.view;

/**
 * 加载协调器统计信息
 */
public class CoordinatorStats {
    /** 分发到工作线程的请求数 */
    private final long dispatchedCount;
    /** 提交到视图的结果数（包括缓存命中） */
    private final long appliedCount;
    /** 因过期被丢弃的完成消息数（成功和失败） */
    private final long discardedCount;
    /** 提交到视图的失败数 */
    private final long failedCount;
    /** 在队列中被取消或提前停止的请求数 */
    private final long cancelledCount;
    private final long cacheHitCount;

    public CoordinatorStats(long dispatchedCount, long appliedCount, long discardedCount,
                            long failedCount, long cancelledCount, long cacheHitCount) {
        this.dispatchedCount = dispatchedCount;
        this.appliedCount = appliedCount;
        this.discardedCount = discardedCount;
        this.failedCount = failedCount;
        this.cancelledCount = cancelledCount;
        this.cacheHitCount = cacheHitCount;
    }

    public long getDispatchedCount() {
        return dispatchedCount;
    }

    public long getAppliedCount() {
        return appliedCount;
    }

    public long getDiscardedCount() {
        return discardedCount;
    }

    public long getFailedCount() {
        return failedCount;
    }

    public long getCancelledCount() {
        return cancelledCount;
    }

    public long getCacheHitCount() {
        return cacheHitCount;
    }

    @Override
    public String toString() {
        return String.format(
                "CoordinatorStats{dispatched=%d, applied=%d, discarded=%d, failed=%d, cancelled=%d, cacheHits=%d}",
                dispatchedCount, appliedCount, discardedCount, failedCount, cancelledCount, cacheHitCount);
    }
}
