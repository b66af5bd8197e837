package com.mini.tableview.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mini.tableview.exception.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 配置加载器
 * 从 JSON 文件或类路径资源读取 {@link ViewerOptions}
 */
public class ViewerOptionsLoader {
    private static final Logger logger = LoggerFactory.getLogger(ViewerOptionsLoader.class);

    public static final String DEFAULTS_RESOURCE = "tableview-defaults.json";

    private final ObjectMapper objectMapper;

    public ViewerOptionsLoader() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * 读取类路径上的默认配置，资源不存在时使用内置默认值
     */
    public ViewerOptions loadDefaults() {
        try (InputStream in = ViewerOptionsLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on classpath, using built-in defaults", DEFAULTS_RESOURCE);
                return ViewerOptions.defaults();
            }
            ViewerOptions options = read(in, DEFAULTS_RESOURCE);
            logger.info("Loaded viewer options from classpath:{}", DEFAULTS_RESOURCE);
            return options;
        } catch (IOException e) {
            throw new ConfigException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
    }

    /**
     * 读取 JSON 配置文件
     *
     * @throws ConfigException 文件不存在、格式错误或取值非法
     */
    public ViewerOptions load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigException("Config file does not exist: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            ViewerOptions options = read(in, file.toString());
            logger.info("Loaded viewer options from {}", file);
            return options;
        } catch (IOException e) {
            throw new ConfigException("Failed to read config file " + file, e);
        }
    }

    public ViewerOptions parse(String json) {
        try {
            return objectMapper.readValue(json, ViewerOptions.class);
        } catch (IOException e) {
            throw unwrap(e, "inline JSON");
        }
    }

    private ViewerOptions read(InputStream in, String origin) {
        try {
            ViewerOptions options = objectMapper.readValue(in, ViewerOptions.class);
            return options != null ? options : ViewerOptions.defaults();
        } catch (IOException e) {
            throw unwrap(e, origin);
        }
    }

    /**
     * Jackson 把构造函数中的校验异常包装为 JsonMappingException，这里还原
     */
    private static ConfigException unwrap(IOException e, String origin) {
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof ConfigException) {
                return new ConfigException("Invalid config in " + origin + ": " + cause.getMessage(), cause);
            }
            cause = cause.getCause();
        }
        return new ConfigException("Malformed config in " + origin + ": " + e.getMessage(), e);
    }
}
