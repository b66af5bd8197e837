package com.mini.tableview.source;

/**
 * 数据源变更监听器
 * 回调可能发生在任意线程，实现方不应在回调中做耗时操作
 */
public interface SourceMutationListener {

    /**
     * 数据源的行发生了插入或删除
     */
    void onSourceMutated(SourceIdentity source);

    /**
     * 数据源已关闭
     */
    default void onSourceClosed(SourceIdentity source) {
    }
}
