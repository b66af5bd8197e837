package com.mini.tableview.view;

/**
 * 视图状态
 */
public enum ViewStatus {
    /** 已提交结果，没有进行中的请求 */
    IDLE,
    /** 最新请求正在后台加载 */
    LOADING,
    /** 最新请求失败，保留上一次成功的结果 */
    ERROR
}
