package com.eventquery.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EventTableTest {
    @TempDir
    Path tempDir;

    @Test
    void testInsertAndQuery() {
        Instant baseTime = Instant.parse("2026-01-01T08:30:00Z");

        try (EventTable table = new EventTable(tempDir.resolve("events.db"))) {
            long firstId = table.insert(new EventRecord(baseTime, "disk full", "error", "db", "dev-1", "storage", "{\"disk\":\"sda\"}"));
            long secondId = table.insert(EventRecord.of(baseTime.plusSeconds(60), "login ok", "info", "api"));

            assertTrue(secondId > firstId);
            assertEquals(2, table.count());

            List<Map<String, Object>> rows = table.query(
                    "SELECT * FROM log_events WHERE severity = ? ORDER BY id", List.of("error"));
            assertEquals(1, rows.size());
            Map<String, Object> row = rows.get(0);
            assertEquals("2026-01-01T08:30:00.000Z", row.get("timestamp"));
            assertEquals("disk full", row.get("message"));
            assertEquals("dev-1", row.get("device_id"));
            assertEquals("{\"disk\":\"sda\"}", row.get("metadata"));
        }
    }

    @Test
    void testCustomTableName() {
        try (EventTable table = new EventTable(tempDir.resolve("custom.db"), "audit_events")) {
            table.insert(EventRecord.of(Instant.parse("2026-01-01T00:00:00Z"), "a", "info", "api"));

            assertEquals("audit_events", table.tableName());
            assertEquals(1, table.count());
            assertEquals(1, table.query("SELECT * FROM audit_events", List.of()).size());
            assertThrows(EventStoreException.class, () -> table.query("SELECT * FROM log_events", List.of()));

            table.clear();
            assertEquals(0, table.count());
        }
    }

    @Test
    void testUnsafeTableNameRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new EventTable(tempDir.resolve("bad.db"), "events; DROP TABLE x"));
    }

    @Test
    void testGetReturnsEmptyWhenNoRow() {
        try (EventTable table = new EventTable(tempDir.resolve("get.db"))) {
            table.insert(EventRecord.of(Instant.parse("2026-02-01T00:00:00Z"), "a", "info", "api"));

            Optional<Map<String, Object>> count = table.get("SELECT COUNT(*) AS total FROM log_events", List.of());
            Optional<Map<String, Object>> none = table.get("SELECT * FROM log_events WHERE source = ?", List.of("nope"));

            assertTrue(count.isPresent());
            assertEquals(1, ((Number) count.get().get("total")).intValue());
            assertFalse(none.isPresent());
        }
    }

    @Test
    void testInsertAllIsTransactional() {
        Instant baseTime = Instant.parse("2026-03-01T00:00:00Z");

        try (EventTable table = new EventTable(tempDir.resolve("batch.db"))) {
            table.insertAll(List.of(
                    EventRecord.of(baseTime, "a", "info", "api"),
                    EventRecord.of(baseTime.plusSeconds(1), "b", "warn", "api")));
            assertEquals(2, table.count());

            EventRecord broken = new EventRecord(null, "c", "info", "api", null, null, null);
            assertThrows(RuntimeException.class, () -> table.insertAll(List.of(
                    EventRecord.of(baseTime.plusSeconds(2), "c", "info", "api"),
                    broken)));
            assertEquals(2, table.count());

            table.clear();
            assertEquals(0, table.count());
        }
    }

    @Test
    void testQueryFailureCarriesSql() {
        try (EventTable table = new EventTable(tempDir.resolve("fail.db"))) {
            String sql = "SELECT no_such_column FROM log_events";
            EventStoreException exception = assertThrows(EventStoreException.class, () -> table.query(sql, List.of()));
            assertEquals(sql, exception.getSql());
        }
    }

    @Test
    void testWalMode() {
        try (EventTable table = new EventTable(tempDir.resolve("wal.db"))) {
            assertEquals("wal", table.getJournalMode().toLowerCase());
        }
    }
}
