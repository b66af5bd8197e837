package com.mini.tableview.exception;

/**
 * Mini TableView 基础异常类
 */
public class TableViewException extends RuntimeException {

    public TableViewException(String message) {
        super(message);
    }

    public TableViewException(String message, Throwable cause) {
        super(message, cause);
    }

    public TableViewException(Throwable cause) {
        super(cause);
    }
}
