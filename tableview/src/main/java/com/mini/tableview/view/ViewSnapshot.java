package com.mini.tableview.view;

import com.mini.tableview.page.PageRequest;
import com.mini.tableview.page.PageResult;
import com.mini.tableview.schema.Schema;

/**
 * 视图状态快照（不可变）
 *
 * 期望请求是用户最近一次操作希望看到的页；已提交结果是当前可以安全渲染的页，
 * 两者可能不同（加载中或出错时）。
 */
public final class ViewSnapshot {

    static final ViewSnapshot INITIAL = new ViewSnapshot(0L, ViewStatus.IDLE, null, null, null, null);

    /** 最近一次分发的请求编号 */
    private final long requestId;
    private final ViewStatus status;
    private final PageRequest desired;
    private final PageResult result;
    /** 期望数据源的 Schema，新数据源尚未加载完成时为 null */
    private final Schema schema;
    private final Throwable error;

    ViewSnapshot(long requestId, ViewStatus status, PageRequest desired, PageResult result,
                 Schema schema, Throwable error) {
        this.requestId = requestId;
        this.status = status;
        this.desired = desired;
        this.result = result;
        this.schema = schema;
        this.error = error;
    }

    ViewSnapshot loading(long id, PageRequest newDesired, Schema newSchema) {
        return new ViewSnapshot(id, ViewStatus.LOADING, newDesired, result, newSchema, null);
    }

    ViewSnapshot committed(long id, PageResult newResult) {
        return new ViewSnapshot(id, ViewStatus.IDLE, newResult.getRequest(), newResult, newResult.getSchema(), null);
    }

    ViewSnapshot failed(PageRequest newDesired, Throwable cause) {
        return new ViewSnapshot(requestId, ViewStatus.ERROR, newDesired, result, schema, cause);
    }

    public long getRequestId() {
        return requestId;
    }

    public ViewStatus getStatus() {
        return status;
    }

    public PageRequest getDesired() {
        return desired;
    }

    /**
     * 已提交的请求（经过页码夹紧），没有结果时为 null
     */
    public PageRequest getCommittedRequest() {
        return result == null ? null : result.getRequest();
    }

    public PageResult getResult() {
        return result;
    }

    public boolean hasResult() {
        return result != null;
    }

    public Schema getSchema() {
        return schema;
    }

    public Throwable getError() {
        return error;
    }

    public boolean isLoading() {
        return status == ViewStatus.LOADING;
    }

    /**
     * 已提交结果的总页数；只有当它与期望请求属于同一数据源和搜索条件时才有意义
     */
    public int getPageCount() {
        return result == null ? 0 : result.getPageCount();
    }

    /**
     * 已提交结果与期望请求是否是同一组行（数据源、搜索条件相同）
     */
    public boolean isResultForDesiredRows() {
        if (result == null || desired == null) {
            return false;
        }
        PageRequest committed = result.getRequest();
        return committed.getSource().equals(desired.getSource())
                && committed.getFilter().equals(desired.getFilter());
    }

    @Override
    public String toString() {
        return "ViewSnapshot{" +
                "requestId=" + requestId +
                ", status=" + status +
                ", desired=" + desired +
                ", committed=" + getCommittedRequest() +
                (error != null ? ", error=" + error : "") +
                '}';
    }
}
