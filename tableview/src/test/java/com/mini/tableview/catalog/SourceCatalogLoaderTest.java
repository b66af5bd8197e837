package com.mini.tableview.catalog;

import com.mini.tableview.exception.CatalogException;
import com.mini.tableview.exception.ConfigException;
import com.mini.tableview.page.PageRequest;
import com.mini.tableview.source.SourceIdentity;
import com.mini.tableview.source.TabularSource;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 目录加载测试：SPI 注册、按扩展名打开和数据源查找
 */
public class SourceCatalogLoaderTest {

    @TempDir
    Path tempDir;

    private Path writeText(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void testFactoriesAreRegistered() {
        assertTrue(SourceCatalogLoader.getAvailableIdentifiers().containsAll(
                Arrays.asList("delimited", "xlsx", "sqlite")));
        assertTrue(SourceCatalogLoader.getSupportedExtensions().containsAll(
                Arrays.asList("csv", "tsv", "xlsx", "db", "sqlite", "sqlite3", "db3")));
        assertTrue(SourceCatalogLoader.isSupported(Path.of("data", "REPORT.CSV")));
        assertFalse(SourceCatalogLoader.isSupported(Path.of("notes.txt")));
        assertEquals("", SourceCatalogLoader.extensionOf(Path.of("Makefile")));
    }

    @Test
    public void testUnsupportedExtension() throws IOException {
        Path file = writeText("notes.txt", "hello");

        CatalogException.UnsupportedTypeException e = assertThrows(
                CatalogException.UnsupportedTypeException.class, () -> SourceCatalogLoader.open(file));
        assertEquals("txt", e.getExtension());
    }

    @Test
    public void testMissingFile() {
        assertThrows(CatalogException.class, () -> SourceCatalogLoader.open(tempDir.resolve("absent.csv")));
    }

    @Test
    public void testDelimitedFileHasOneSource() throws IOException {
        Path file = writeText("cities.csv", "name,pop\nOslo,709000\n");

        try (SourceCatalog catalog = SourceCatalogLoader.open(file)) {
            List<SourceIdentity> sources = catalog.listSources();
            assertEquals(1, sources.size());
            assertEquals("cities.csv", sources.get(0).getObject());

            TabularSource source = catalog.resolve(sources.get(0));
            assertSame(source, catalog.getSource("cities.csv"));
            assertEquals(1, source.fetchPage(PageRequest.firstPage(source.identity(), 10)).getTotalRows());

            assertThrows(CatalogException.SourceNotExistException.class, () -> catalog.getSource("other"));
            assertThrows(CatalogException.SourceNotExistException.class,
                    () -> catalog.resolve(new SourceIdentity("/elsewhere.csv", "cities.csv")));
        }
    }

    @Test
    public void testDelimiterOption() throws IOException {
        Path file = writeText("piped.csv", "a|b\n1|2\n");
        CatalogContext context = CatalogContext.builder().option(CatalogContext.DELIMITER, "|").build();

        try (SourceCatalog catalog = SourceCatalogLoader.open(file, context)) {
            assertEquals(2, catalog.getSource("piped.csv").schema().getFieldCount());
        }

        CatalogContext bad = CatalogContext.builder().option(CatalogContext.DELIMITER, "\"").build();
        assertThrows(ConfigException.class, () -> SourceCatalogLoader.open(file, bad));
        CatalogContext badTimeout = CatalogContext.builder().option(CatalogContext.FETCH_TIMEOUT_MS, "soon").build();
        assertThrows(ConfigException.class, () -> SourceCatalogLoader.open(file, badTimeout));
    }

    @Test
    public void testSqliteTablesWithoutInternalTables() throws IOException, SQLException {
        Path file = tempDir.resolve("app.sqlite");
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + file);
             Statement statement = connection.createStatement()) {
            statement.execute("CREATE TABLE orders (id INTEGER PRIMARY KEY AUTOINCREMENT, item TEXT)");
            statement.execute("CREATE TABLE customers (id INTEGER, name TEXT)");
            statement.execute("INSERT INTO orders (item) VALUES ('pen'), ('ink')");
        }

        try (SourceCatalog catalog = SourceCatalogLoader.open(file)) {
            List<String> names = catalog.listSources().stream()
                    .map(SourceIdentity::getObject)
                    .sorted()
                    .collect(Collectors.toList());
            assertEquals(Arrays.asList("customers", "orders"), names);
            assertEquals(2, catalog.getSource("orders").rowCount());
        }
    }

    @Test
    public void testWorkbookSheetsAreSources() throws IOException {
        Path file = tempDir.resolve("book.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            workbook.createSheet("2023").createRow(0).createCell(0).setCellValue("total");
            workbook.createSheet("2024").createRow(0).createCell(0).setCellValue("total");
            try (OutputStream out = Files.newOutputStream(file)) {
                workbook.write(out);
            }
        }

        try (SourceCatalog catalog = SourceCatalogLoader.open(file)) {
            assertEquals(2, catalog.listSources().size());
            assertEquals("2023", catalog.listSources().get(0).getObject());
            assertEquals(0, catalog.getSource("2024").rowCount());
        }
    }

    @Test
    public void testClosedCatalogClosesSources() throws IOException {
        Path file = writeText("a.csv", "x\n1\n");
        SourceCatalog catalog = SourceCatalogLoader.open(file);
        TabularSource source = catalog.getSource("a.csv");

        catalog.close();

        assertTrue(source.isClosed());
        assertThrows(CatalogException.class, catalog::listSources);
    }
}
