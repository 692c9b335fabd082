package com.eventquery.config;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EngineConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        EngineConfig config = EngineConfig.defaults();

        assertEquals(Constants.EVENT_TABLE, config.getTableName());
        assertEquals("message", config.getFreeTextField());
        assertEquals(100, config.getDefaultSize());
        assertEquals(10, config.getDefaultTermsSize());
        assertEquals(Duration.ofMinutes(5), config.getCacheTtl());
        assertEquals(0.2, config.getFuzzyBaseThreshold());
        assertEquals(0.1, config.getFuzzyThresholdStep());
        assertEquals(List.of("message", "source", "device_id", "category"), config.getFuzzyKeys());
    }

    @Test
    void testFromPropertiesOverridesAndFallsBack() {
        Properties properties = new Properties();
        properties.setProperty(EngineConfig.KEY_DEFAULT_SIZE, "25");
        properties.setProperty(EngineConfig.KEY_CACHE_TTL_SECONDS, "60");
        properties.setProperty(EngineConfig.KEY_FUZZY_KEYS, " message , source ,");
        properties.setProperty(EngineConfig.KEY_DEFAULT_TERMS_SIZE, "not-a-number");

        EngineConfig config = EngineConfig.fromProperties(properties);

        assertEquals(25, config.getDefaultSize());
        assertEquals(Duration.ofSeconds(60), config.getCacheTtl());
        assertEquals(List.of("message", "source"), config.getFuzzyKeys());
        assertEquals(Constants.DEFAULT_TERMS_SIZE, config.getDefaultTermsSize());
    }

    @Test
    void testLoadFromFile() throws IOException {
        Path file = tempDir.resolve("engine.properties");
        Files.writeString(file, "engine.table=audit_events\nengine.fuzzy.baseThreshold=0.35\n");

        EngineConfig config = EngineConfig.load(file);

        assertEquals("audit_events", config.getTableName());
        assertEquals(0.35, config.getFuzzyBaseThreshold());
        assertEquals(Constants.FUZZY_THRESHOLD_STEP, config.getFuzzyThresholdStep());
    }

    @Test
    void testLoadBundledResource() throws IOException {
        EngineConfig bundled = EngineConfig.loadResource("event-query.properties");
        EngineConfig missing = EngineConfig.loadResource("no-such-file.properties");

        assertEquals(Constants.EVENT_TABLE, bundled.getTableName());
        assertEquals(Duration.ofSeconds(300), bundled.getCacheTtl());
        assertEquals(Constants.DEFAULT_SIZE, missing.getDefaultSize());
    }
}
