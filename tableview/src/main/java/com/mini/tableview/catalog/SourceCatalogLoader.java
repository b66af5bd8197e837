package com.mini.tableview.catalog;

import com.mini.tableview.exception.CatalogException;
import com.mini.tableview.exception.TableViewException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * 目录加载器
 *
 * 通过 SPI 机制加载所有 {@link SourceCatalogFactory}，按文件扩展名打开数据文件
 */
public class SourceCatalogLoader {
    private static final Logger logger = LoggerFactory.getLogger(SourceCatalogLoader.class);

    /** 标识符 -> 工厂 */
    private static final Map<String, SourceCatalogFactory> FACTORY_CACHE = new HashMap<>();

    /** 扩展名 -> 工厂 */
    private static final Map<String, SourceCatalogFactory> EXTENSIONS = new HashMap<>();

    static {
        ServiceLoader<SourceCatalogFactory> serviceLoader = ServiceLoader.load(SourceCatalogFactory.class);
        for (SourceCatalogFactory factory : serviceLoader) {
            String identifier = factory.identifier();
            if (FACTORY_CACHE.containsKey(identifier)) {
                throw new IllegalStateException("Duplicate SourceCatalogFactory identifier: " + identifier);
            }
            FACTORY_CACHE.put(identifier, factory);
            for (String extension : factory.supportedExtensions()) {
                SourceCatalogFactory previous = EXTENSIONS.put(extension, factory);
                if (previous != null) {
                    throw new IllegalStateException("Extension '" + extension + "' claimed by both "
                            + previous.identifier() + " and " + identifier);
                }
            }
        }
    }

    private SourceCatalogLoader() {
    }

    public static SourceCatalog open(Path file) {
        return open(file, CatalogContext.empty());
    }

    /**
     * 按扩展名打开数据文件
     *
     * @throws CatalogException.UnsupportedTypeException 扩展名不受支持
     * @throws CatalogException 文件不存在或打开失败
     */
    public static SourceCatalog open(Path file, CatalogContext context) {
        String extension = extensionOf(file);
        SourceCatalogFactory factory = EXTENSIONS.get(extension);
        if (factory == null) {
            throw new CatalogException.UnsupportedTypeException(file.toString(), extension);
        }
        if (!Files.isRegularFile(file)) {
            throw new CatalogException("File does not exist: " + file);
        }
        try {
            SourceCatalog catalog = factory.create(file, context);
            logger.info("Opened {} with catalog '{}'", file, factory.identifier());
            return catalog;
        } catch (TableViewException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CatalogException("Failed to open " + file + " with catalog " + factory.identifier(), e);
        }
    }

    /**
     * 按标识符打开，忽略扩展名
     */
    public static SourceCatalog open(String identifier, Path file, CatalogContext context) {
        SourceCatalogFactory factory = FACTORY_CACHE.get(identifier);
        if (factory == null) {
            throw new CatalogException("Cannot find SourceCatalogFactory for identifier: " + identifier
                    + ". Available identifiers: " + FACTORY_CACHE.keySet());
        }
        return factory.create(file, context);
    }

    public static boolean isSupported(Path file) {
        return EXTENSIONS.containsKey(extensionOf(file));
    }

    public static Set<String> getAvailableIdentifiers() {
        return Collections.unmodifiableSet(FACTORY_CACHE.keySet());
    }

    public static Set<String> getSupportedExtensions() {
        return Collections.unmodifiableSet(EXTENSIONS.keySet());
    }

    static String extensionOf(Path file) {
        Path fileName = file.getFileName();
        String name = fileName == null ? "" : fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
