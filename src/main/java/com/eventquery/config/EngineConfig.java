package com.eventquery.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * 引擎运行时配置
 *
 * 支持从CLI参数或 properties 配置文件注入，覆盖Constants默认值
 */
public class EngineConfig {
    public static final String KEY_TABLE = "engine.table";
    public static final String KEY_FREE_TEXT_FIELD = "engine.freeTextField";
    public static final String KEY_DEFAULT_SIZE = "engine.defaultSize";
    public static final String KEY_DEFAULT_TERMS_SIZE = "engine.defaultTermsSize";
    public static final String KEY_CACHE_TTL_SECONDS = "engine.cacheTtlSeconds";
    public static final String KEY_FUZZY_BASE_THRESHOLD = "engine.fuzzy.baseThreshold";
    public static final String KEY_FUZZY_THRESHOLD_STEP = "engine.fuzzy.thresholdStep";
    public static final String KEY_FUZZY_KEYS = "engine.fuzzy.keys";

    private String tableName = Constants.EVENT_TABLE;
    private String freeTextField = Constants.FREE_TEXT_FIELD;
    private int defaultSize = Constants.DEFAULT_SIZE;
    private int defaultTermsSize = Constants.DEFAULT_TERMS_SIZE;
    private Duration cacheTtl = Constants.DEFAULT_CACHE_TTL;
    private double fuzzyBaseThreshold = Constants.FUZZY_BASE_THRESHOLD;
    private double fuzzyThresholdStep = Constants.FUZZY_THRESHOLD_STEP;
    private List<String> fuzzyKeys = Constants.FUZZY_KEYS;

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public String getFreeTextField() {
        return freeTextField;
    }

    public void setFreeTextField(String freeTextField) {
        this.freeTextField = freeTextField;
    }

    public int getDefaultSize() {
        return defaultSize;
    }

    public void setDefaultSize(int defaultSize) {
        this.defaultSize = defaultSize;
    }

    public int getDefaultTermsSize() {
        return defaultTermsSize;
    }

    public void setDefaultTermsSize(int defaultTermsSize) {
        this.defaultTermsSize = defaultTermsSize;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
    }

    public double getFuzzyBaseThreshold() {
        return fuzzyBaseThreshold;
    }

    public void setFuzzyBaseThreshold(double fuzzyBaseThreshold) {
        this.fuzzyBaseThreshold = fuzzyBaseThreshold;
    }

    public double getFuzzyThresholdStep() {
        return fuzzyThresholdStep;
    }

    public void setFuzzyThresholdStep(double fuzzyThresholdStep) {
        this.fuzzyThresholdStep = fuzzyThresholdStep;
    }

    public List<String> getFuzzyKeys() {
        return fuzzyKeys;
    }

    public void setFuzzyKeys(List<String> fuzzyKeys) {
        this.fuzzyKeys = List.copyOf(fuzzyKeys);
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * 从 properties 读取配置，缺失或无法解析的键保留默认值。
     */
    public static EngineConfig fromProperties(Properties properties) {
        EngineConfig config = defaults();
        config.setTableName(properties.getProperty(KEY_TABLE, config.getTableName()).trim());
        config.setFreeTextField(properties.getProperty(KEY_FREE_TEXT_FIELD, config.getFreeTextField()).trim());
        config.setDefaultSize(readInt(properties, KEY_DEFAULT_SIZE, config.getDefaultSize()));
        config.setDefaultTermsSize(readInt(properties, KEY_DEFAULT_TERMS_SIZE, config.getDefaultTermsSize()));
        config.setCacheTtl(Duration.ofSeconds(readInt(properties, KEY_CACHE_TTL_SECONDS, (int) config.getCacheTtl().toSeconds())));
        config.setFuzzyBaseThreshold(readDouble(properties, KEY_FUZZY_BASE_THRESHOLD, config.getFuzzyBaseThreshold()));
        config.setFuzzyThresholdStep(readDouble(properties, KEY_FUZZY_THRESHOLD_STEP, config.getFuzzyThresholdStep()));

        String keys = properties.getProperty(KEY_FUZZY_KEYS);
        if (keys != null && !keys.isBlank()) {
            List<String> parsedKeys = new ArrayList<>();
            for (String key : keys.split(",")) {
                if (!key.isBlank()) {
                    parsedKeys.add(key.trim());
                }
            }
            if (!parsedKeys.isEmpty()) {
                config.setFuzzyKeys(parsedKeys);
            }
        }
        return config;
    }

    /**
     * 从 properties 文件加载配置。
     */
    public static EngineConfig load(Path propertiesFile) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(propertiesFile, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return fromProperties(properties);
    }

    /**
     * 从 classpath 资源加载配置，资源不存在时返回默认配置。
     */
    public static EngineConfig loadResource(String resourceName) throws IOException {
        try (InputStream inputStream = EngineConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(inputStream);
            return fromProperties(properties);
        }
    }

    private static int readInt(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException exception) {
            return fallback;
        }
    }

    private static double readDouble(Properties properties, String key, double fallback) {
        String value = properties.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException exception) {
            return fallback;
        }
    }
}
