package com.mini.tableview.source;

import com.mini.tableview.data.Row;
import com.mini.tableview.page.PageRequest;
import com.mini.tableview.page.PageResult;
import com.mini.tableview.schema.DataType;
import com.mini.tableview.schema.Field;
import com.mini.tableview.schema.Schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.ToLongFunction;

/**
 * 测试用内存数据源
 * 可以为每个请求设置读取延迟、注入失败，并直接修改数据
 */
public class InMemorySource extends AbstractTabularSource {

    private final Schema schema;
    private volatile List<Row> rows;
    private volatile ToLongFunction<PageRequest> fetchDelay = request -> 0L;
    private volatile long loadDelayMillis = 0L;
    private volatile Throwable fetchFailure;

    public final AtomicInteger fetchCount = new AtomicInteger(0);
    public final AtomicInteger loadCount = new AtomicInteger(0);

    public InMemorySource(SourceIdentity identity, Schema schema, List<Row> rows) {
        this(identity, schema, rows, SourceOptions.DEFAULT);
    }

    public InMemorySource(SourceIdentity identity, Schema schema, List<Row> rows, SourceOptions options) {
        super(identity, options);
        this.schema = schema;
        this.rows = new ArrayList<>(rows);
    }

    /**
     * id (BIGINT), name (STRING), score (DOUBLE，每 10 行一个空值)
     */
    public static InMemorySource numbered(String name, int count) {
        return numbered(name, count, SourceOptions.DEFAULT);
    }

    public static InMemorySource numbered(String name, int count, SourceOptions options) {
        return new InMemorySource(new SourceIdentity("memory", name), numberedSchema(), numberedRows(count), options);
    }

    public static Schema numberedSchema() {
        return new Schema(Arrays.asList(
                new Field("id", DataType.LONG()),
                new Field("name", DataType.STRING()),
                new Field("score", DataType.DOUBLE()),
                new Field("payload", DataType.BINARY())));
    }

    public static List<Row> numberedRows(int count) {
        List<Row> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Double score = i % 10 == 9 ? null : (double) ((i * 37) % 101);
            result.add(Row.of((long) i, "user_" + i, score, new byte[]{(byte) i}));
        }
        return result;
    }

    public void setFetchDelay(ToLongFunction<PageRequest> fetchDelay) {
        this.fetchDelay = fetchDelay;
    }

    public void setLoadDelayMillis(long loadDelayMillis) {
        this.loadDelayMillis = loadDelayMillis;
    }

    /**
     * 设置下一次取页时抛出的异常，RuntimeException 或 Error
     */
    public void setFetchFailure(Throwable fetchFailure) {
        this.fetchFailure = fetchFailure;
    }

    /**
     * 替换数据并发出变更通知
     */
    public void replaceRows(List<Row> newRows) {
        this.rows = new ArrayList<>(newRows);
        signalMutation();
    }

    @Override
    protected Schema loadSchema() {
        return schema;
    }

    @Override
    protected List<Row> loadRows(Schema schema, Deadline deadline) {
        loadCount.incrementAndGet();
        sleep(loadDelayMillis);
        return new ArrayList<>(rows);
    }

    @Override
    public PageResult fetchPage(PageRequest request) {
        fetchCount.incrementAndGet();
        sleep(fetchDelay.applyAsLong(request));
        Throwable failure = fetchFailure;
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        if (failure != null) {
            throw (RuntimeException) failure;
        }
        return super.fetchPage(request);
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted", e);
        }
    }
}
