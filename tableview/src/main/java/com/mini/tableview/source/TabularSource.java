package com.mini.tableview.source;

import com.mini.tableview.data.Row;
import com.mini.tableview.page.PageRequest;
import com.mini.tableview.page.PageResult;
import com.mini.tableview.page.SearchFilter;
import com.mini.tableview.schema.Schema;

import java.util.List;

/**
 * 表格数据源
 *
 * 数据库表、分隔文件、电子表格工作表统一暴露的查询能力：
 * Schema、行数以及按排序规格截取的分页数据。
 * 实现必须可以在后台工作线程上安全调用，且不得访问任何界面状态。
 */
public interface TabularSource extends AutoCloseable {

    SourceIdentity identity();

    /**
     * 获取列定义
     *
     * @throws com.mini.tableview.exception.SourceException.SourceUnavailableException 数据源已关闭或无法读取
     */
    Schema schema();

    /**
     * 总行数
     *
     * @throws com.mini.tableview.exception.SourceException.SourceUnavailableException 数据源已关闭或无法读取
     */
    long rowCount();

    /**
     * 满足搜索条件的行数
     */
    long rowCount(SearchFilter filter);

    /**
     * 读取一页数据；页码超出末页时返回空行列表和正确的总行数
     *
     * @throws com.mini.tableview.exception.SourceException.SourceUnavailableException 数据源已关闭或无法读取
     * @throws com.mini.tableview.exception.SourceException.InvalidSortException 排序列非法
     * @throws com.mini.tableview.exception.SourceException.FetchTimeoutException 读取超时
     */
    PageResult fetchPage(PageRequest request);

    /**
     * 读取全部行（原始顺序），用于统计
     */
    List<Row> readAll();

    /**
     * 丢弃已加载的 Schema 和数据，下次访问时重新加载
     */
    void refresh();

    void addMutationListener(SourceMutationListener listener);

    void removeMutationListener(SourceMutationListener listener);

    boolean isClosed();

    @Override
    void close();
}
