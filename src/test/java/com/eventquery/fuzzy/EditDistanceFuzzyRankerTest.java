package com.eventquery.fuzzy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eventquery.query.TextSearch;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EditDistanceFuzzyRankerTest {
    private final EditDistanceFuzzyRanker ranker = new EditDistanceFuzzyRanker();

    @Test
    void testFiltersAndRanksByDistance() {
        List<Map<String, Object>> rows = List.of(
                Map.of("message", "disk full"),
                Map.of("message", "connection timeout"),
                Map.of("message", "timout reached"));

        List<RankedRow> ranked = ranker.rank(rows, new TextSearch("message", "timout", 2, false));

        assertEquals(2, ranked.size());
        assertEquals(2, ranked.get(0).index());
        assertEquals(1.0, ranked.get(0).score(), 1e-9);
        assertEquals(List.of(new FuzzyMatch("message", "timout reached", List.of(new MatchSpan(0, 5)))),
                ranked.get(0).matches());
        assertEquals(1, ranked.get(1).index());
        assertEquals(1.0 - 1.0 / 6, ranked.get(1).score(), 1e-9);
    }

    @Test
    void testHigherFuzzinessIsLooser() {
        List<Map<String, Object>> rows = List.of(Map.of("source", "abxyz"), Map.of("source", "zzz"));

        assertTrue(ranker.rank(rows, new TextSearch("message", "abcde", 2, false)).isEmpty());

        List<RankedRow> loose = ranker.rank(rows, new TextSearch("message", "abcde", 10, false));
        assertEquals(1, loose.size());
        assertEquals(0, loose.get(0).index());
        assertEquals(0.4, loose.get(0).score(), 1e-9);
        assertEquals(new MatchSpan(0, 1), loose.get(0).matches().get(0).indices().get(0));
    }

    @Test
    void testThresholdIsClamped() {
        assertEquals(0.2, ranker.threshold(0), 1e-9);
        assertEquals(0.4, ranker.threshold(2), 1e-9);
        assertEquals(1.0, ranker.threshold(50), 1e-9);
        assertEquals(0.2, ranker.threshold(-3), 1e-9);
    }

    @Test
    void testIgnoresCaseAndNonSearchableFields() {
        Map<String, Object> withNull = new HashMap<>();
        withNull.put("message", null);
        withNull.put("severity", "timeout");
        List<Map<String, Object>> rows = List.of(withNull, Map.of("category", "TimeOut"));

        List<RankedRow> ranked = ranker.rank(rows, new TextSearch("message", "TIMEOUT", 0, false));

        assertEquals(1, ranked.size());
        assertEquals(1, ranked.get(0).index());
        assertEquals("category", ranked.get(0).matches().get(0).key());
    }

    @Test
    void testCustomKeys() {
        EditDistanceFuzzyRanker severityOnly = new EditDistanceFuzzyRanker(List.of("severity"), 0.2, 0.1);

        List<RankedRow> ranked = severityOnly.rank(
                List.of(Map.of("severity", "eror", "message", "error")), new TextSearch("severity", "error", 1, false));

        assertEquals(1, ranked.size());
        assertEquals("severity", ranked.get(0).matches().get(0).key());
    }

    @Test
    void testBlankQueryRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> ranker.rank(List.of(Map.of("message", "x")), TextSearch.of("message", "  ")));
    }
}
