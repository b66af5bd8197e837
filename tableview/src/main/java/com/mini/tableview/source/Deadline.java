package com.mini.tableview.source;

import com.mini.tableview.exception.SourceException;

import java.util.concurrent.TimeUnit;

/**
 * 单次读取的截止时间
 */
public final class Deadline {
    private static final Deadline NONE = new Deadline(0, Long.MAX_VALUE);

    private final long timeoutMillis;
    private final long deadlineNanos;

    private Deadline(long timeoutMillis, long deadlineNanos) {
        this.timeoutMillis = timeoutMillis;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * timeoutMillis <= 0 表示不限时
     */
    public static Deadline after(long timeoutMillis) {
        if (timeoutMillis <= 0) {
            return NONE;
        }
        return new Deadline(timeoutMillis, System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis));
    }

    public boolean isBounded() {
        return this != NONE;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public boolean isExpired() {
        return isBounded() && System.nanoTime() - deadlineNanos > 0;
    }

    /**
     * JDBC 查询超时以秒计，至少 1 秒；不限时返回 0
     */
    public int remainingSeconds() {
        if (!isBounded()) {
            return 0;
        }
        long remaining = TimeUnit.NANOSECONDS.toSeconds(deadlineNanos - System.nanoTime());
        return (int) Math.max(1, Math.min(remaining, Integer.MAX_VALUE));
    }

    public void check(SourceIdentity source) {
        if (isExpired()) {
            throw new SourceException.FetchTimeoutException(source, timeoutMillis);
        }
    }
}
