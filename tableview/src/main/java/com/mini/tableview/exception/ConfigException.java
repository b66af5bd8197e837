package com.mini.tableview.exception;

/**
 * 配置相关异常
 */
public class ConfigException extends TableViewException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
