package com.mini.tableview.exception;

/**
 * 目录异常类
 * 打开数据文件或查找其中的数据源失败时抛出
 */
public class CatalogException extends TableViewException {
    private static final long serialVersionUID = 1L;

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 文件类型不受支持
     */
    public static class UnsupportedTypeException extends CatalogException {
        private final String extension;

        public UnsupportedTypeException(String file, String extension) {
            super("Unsupported file type '" + extension + "': " + file);
            this.extension = extension;
        }

        public String getExtension() {
            return extension;
        }
    }

    /**
     * 目录中不存在该数据源
     */
    public static class SourceNotExistException extends CatalogException {
        public SourceNotExistException(String location, String object) {
            super("Source does not exist: " + location + "#" + object);
        }
    }
}
