package com.eventquery.compile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eventquery.config.EngineConfig;
import com.eventquery.query.Filter;
import com.eventquery.query.NormalizedQuery;
import com.eventquery.query.SortSpec;
import com.eventquery.query.TextSearch;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class QueryCompilerTest {
    private final QueryCompiler compiler = new QueryCompiler(
            EngineConfig.defaults(),
            Clock.fixed(Instant.parse("2026-05-10T12:00:00Z"), ZoneOffset.UTC));

    @Test
    @DisplayName("恶意字符串只作为绑定参数出现")
    void testValuesAreNeverInterpolated() {
        String attack = "'; DROP TABLE logs; --";
        NormalizedQuery query = query(
                List.of(new Filter.Term("severity", attack), new Filter.Wildcard("source", attack)),
                TextSearch.of("message", attack), false, List.of(), 10, 0);

        CompiledQuery compiled = compiler.compile(query);

        assertFalse(compiled.text().contains("DROP"));
        assertFalse(compiled.text().contains(attack));
        assertEquals(attack, compiled.params().get(0));
        assertEquals(3, compiled.params().size());
    }

    @Test
    void testBaseShapeSortAndLimit() {
        NormalizedQuery query = query(
                List.of(new Filter.Term("severity", "error")),
                null, false,
                List.of(SortSpec.desc("timestamp"), new SortSpec("source", SortSpec.Direction.ASC)),
                20, 40);

        CompiledQuery compiled = compiler.compile(query);

        assertEquals("SELECT * FROM log_events WHERE 1=1 AND severity = ? ORDER BY timestamp DESC, source ASC LIMIT 60",
                compiled.text());
        assertEquals(List.of("error"), compiled.params());
    }

    @Test
    void testRangeBounds() {
        CompiledQuery both = compiler.compile(query(
                List.of(new Filter.Range("timestamp", "2025-01-01T00:00:00Z", "2025-02-01T00:00:00Z", null, null)),
                null, false, List.of(), 10, 0));
        CompiledQuery none = compiler.compile(query(
                List.of(new Filter.Range("timestamp", null, null, null, null)),
                null, false, List.of(), 10, 0));

        assertEquals("SELECT * FROM log_events WHERE 1=1 AND timestamp >= ? AND timestamp <= ? LIMIT 10", both.text());
        assertEquals(2, both.params().size());
        assertEquals("SELECT * FROM log_events WHERE 1=1 LIMIT 10", none.text());
        assertTrue(none.params().isEmpty());
    }

    @Test
    void testDateMathResolvedAtCompileTime() {
        CompiledQuery compiled = compiler.compile(query(
                List.of(Filter.Range.atLeast("timestamp", "now-1h")), null, false, List.of(), 10, 0));

        assertEquals(List.of("2026-05-10T11:00:00.000Z"), compiled.params());
    }

    @Test
    void testWildcardAndLikeEscaping() {
        CompiledQuery compiled = compiler.compile(query(
                List.of(new Filter.Wildcard("source", "ap?_10%*")),
                TextSearch.of("message", "50%_off#"), false, List.of(), 10, 0));

        assertTrue(compiled.text().contains("source LIKE ? ESCAPE '#'"));
        assertTrue(compiled.text().contains("message LIKE ? ESCAPE '#'"));
        assertEquals(List.of("ap_#_10#%%", "%50#%#_off##%"), compiled.params());
    }

    @Test
    void testFuzzySkipsTextCondition() {
        CompiledQuery compiled = compiler.compile(query(
                List.of(new Filter.Term("severity", "error")),
                new TextSearch("message", "timout", 2, false), true, List.of(), 10, 0));

        assertFalse(compiled.text().contains("LIKE"));
        assertEquals(List.of("error"), compiled.params());
    }

    @Test
    void testQueryStringTokens() {
        CompiledQuery compiled = compiler.compile(query(
                List.of(), new TextSearch("message", "disk AND source:api OR full", 0, true), false, List.of(), 10, 0));

        assertEquals("SELECT * FROM log_events WHERE 1=1 AND message LIKE ? ESCAPE '#' AND source LIKE ? ESCAPE '#'"
                + " AND message LIKE ? ESCAPE '#' LIMIT 10", compiled.text());
        assertEquals(List.of("%disk%", "%api%", "%full%"), compiled.params());
    }

    @Test
    void testUnsafeIdentifiersAreSkipped() {
        CompiledQuery compiled = compiler.compile(query(
                List.of(new Filter.Term("severity; DROP TABLE x", "error")),
                null, false, List.of(SortSpec.desc("timestamp desc, (SELECT 1)")), 10, 0));

        assertEquals("SELECT * FROM log_events WHERE 1=1 LIMIT 10", compiled.text());
        assertTrue(compiled.params().isEmpty());
    }

    @Test
    void testUnsafeTableNameRejected() {
        EngineConfig config = EngineConfig.defaults();
        config.setTableName("log_events; --");

        assertThrows(IllegalArgumentException.class, () -> new QueryCompiler(config, Clock.systemUTC()));
    }

    private static NormalizedQuery query(List<Filter> filters, TextSearch textSearch, boolean fuzzy,
                                         List<SortSpec> sort, int size, int from) {
        return new NormalizedQuery(filters, textSearch, fuzzy, Map.of(), sort, size, from);
    }
}
