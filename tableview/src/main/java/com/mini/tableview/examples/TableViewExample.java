package com.mini.tableview.examples;

import com.mini.tableview.catalog.SourceCatalog;
import com.mini.tableview.catalog.SourceCatalogLoader;
import com.mini.tableview.config.ViewerOptions;
import com.mini.tableview.config.ViewerOptionsLoader;
import com.mini.tableview.page.SortDirection;
import com.mini.tableview.render.TextPageRenderer;
import com.mini.tableview.schema.ColumnStatistics;
import com.mini.tableview.source.SourceIdentity;
import com.mini.tableview.view.LoadCoordinator;
import com.mini.tableview.view.ViewController;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Mini TableView 示例
 * 打开一个数据文件（没有参数时生成示例 CSV），演示排序、翻页、搜索和统计
 *
 * 用法: TableViewExample [数据文件] [配置文件]
 */
public class TableViewExample {

    public static void main(String[] args) throws IOException, InterruptedException, ExecutionException {
        System.out.println("=== Mini TableView 示例 ===");

        Path file = args.length > 0 ? Paths.get(args[0]) : createSampleCsv();
        ViewerOptionsLoader loader = new ViewerOptionsLoader();
        ViewerOptions options = args.length > 1 ? loader.load(Paths.get(args[1])) : loader.loadDefaults();

        TextPageRenderer renderer = new TextPageRenderer();
        try (SourceCatalog catalog = SourceCatalogLoader.open(file);
             ViewController view = new ViewController(new LoadCoordinator(catalog, options))) {

            List<SourceIdentity> sources = catalog.listSources();
            System.out.println("\n1. 数据源: " + sources);
            if (sources.isEmpty()) {
                return;
            }

            System.out.println("\n2. 第一页");
            System.out.print(renderer.render(view.switchSource(sources.get(0)).get()));

            System.out.println("\n3. 按第一列降序");
            System.out.print(renderer.render(view.setSort(0, SortDirection.DESCENDING).get()));

            System.out.println("\n4. 页大小改为 10");
            System.out.print(renderer.render(view.setPageSize(10).get()));

            System.out.println("\n5. 下一页");
            System.out.print(renderer.render(view.nextPage().get()));

            System.out.println("\n6. 搜索 \"7\"");
            System.out.print(renderer.render(view.setSearch("7").get()));

            System.out.println("\n7. 复制前两行");
            if (view.committedResult().size() >= 2) {
                System.out.println(TextPageRenderer.copyAsTsv(view.committedResult(), 0, 1));
            }

            System.out.println("\n8. 第一列的描述性统计");
            for (ColumnStatistics statistics : view.describeColumns(0).get()) {
                System.out.println(statistics);
            }

            System.out.println("\n" + view.getStats());
        }
    }

    private static Path createSampleCsv() throws IOException {
        Path file = Files.createTempFile("tableview-sample", ".csv");
        StringBuilder sb = new StringBuilder("id,name,score,joined\n");
        for (int i = 1; i <= 120; i++) {
            sb.append(i).append(",user_").append(i).append(',')
              .append(i % 7 == 0 ? "" : String.valueOf((i * 37) % 100 + 0.5)).append(',')
              .append(String.format("2024-%02d-%02d", i % 12 + 1, i % 28 + 1)).append('\n');
        }
        Files.write(file, sb.toString().getBytes(StandardCharsets.UTF_8));
        file.toFile().deleteOnExit();
        System.out.println("生成示例文件: " + file);
        return file;
    }
}
