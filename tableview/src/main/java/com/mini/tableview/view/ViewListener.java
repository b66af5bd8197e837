package com.mini.tableview.view;

/**
 * 视图变更监听器
 * 在控制线程上回调，实现不得阻塞
 */
@FunctionalInterface
public interface ViewListener {

    void onViewChanged(ViewSnapshot snapshot);
}
