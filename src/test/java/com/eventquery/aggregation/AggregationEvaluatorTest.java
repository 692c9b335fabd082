package com.eventquery.aggregation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eventquery.config.EngineConfig;
import com.eventquery.event.EventRecord;
import com.eventquery.event.EventTable;
import com.eventquery.query.AggKind;
import com.eventquery.query.AggSpec;
import com.eventquery.query.Filter;
import com.eventquery.query.NormalizedQuery;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AggregationEvaluatorTest {
    @TempDir
    Path tempDir;

    private EventTable table;

    @BeforeEach
    void setUp() {
        table = new EventTable(tempDir.resolve("aggs.db"));
        Instant base = Instant.parse("2025-01-01T10:05:00Z");
        table.insertAll(List.of(
                EventRecord.of(base, "disk full", "error", "api"),
                EventRecord.of(base.plusSeconds(600), "timeout", "error", "api"),
                EventRecord.of(base.plusSeconds(3600), "conn reset", "error", "db"),
                EventRecord.of(base.plusSeconds(3700), "login ok", "info", "web"),
                EventRecord.of(base.plusSeconds(7300), "logout", "info", "web")));
    }

    @AfterEach
    void tearDown() {
        table.close();
    }

    @Test
    void testTermsUseFiltersAndOrderByCount() {
        AggregationEvaluator evaluator = evaluator(Runnable::run);

        Map<String, AggregationResult> results = evaluator.evaluate(
                Map.of("by_source", new AggSpec.Terms("source", 5)),
                query(List.of(new Filter.Term("severity", "error"))));

        AggregationResult.BucketAggregation buckets = assertInstanceOf(
                AggregationResult.BucketAggregation.class, results.get("by_source"));
        assertEquals(List.of(Bucket.of("api", 2), Bucket.of("db", 1)), buckets.buckets());
    }

    @Test
    void testTermsSizeLimitsBuckets() {
        Map<String, AggregationResult> results = evaluator(Runnable::run).evaluate(
                Map.of("top", new AggSpec.Terms("source", 1)), query(List.of()));

        AggregationResult.BucketAggregation buckets = (AggregationResult.BucketAggregation) results.get("top");
        assertEquals(1, buckets.buckets().size());
        // api 与 web 同为 2 条，按键升序决胜
        assertEquals(Bucket.of("api", 2), buckets.buckets().get(0));
    }

    @Test
    void testDateHistogramBuckets() {
        Map<String, AggregationResult> results = evaluator(Runnable::run).evaluate(
                Map.of("per_hour", new AggSpec.DateHistogram("timestamp", AggSpec.Interval.HOUR)), query(List.of()));

        AggregationResult.BucketAggregation buckets = (AggregationResult.BucketAggregation) results.get("per_hour");
        assertEquals(List.of(
                new Bucket("2025-01-01 10", "2025-01-01 10", 2),
                new Bucket("2025-01-01 11", "2025-01-01 11", 2),
                new Bucket("2025-01-01 12", "2025-01-01 12", 1)), buckets.buckets());
    }

    @Test
    void testMetrics() {
        Map<String, AggSpec> specs = new LinkedHashMap<>();
        specs.put("errors", new AggSpec.Metric(AggKind.COUNT, null));
        specs.put("sum_id", new AggSpec.Metric(AggKind.SUM, "id"));
        specs.put("avg_id", new AggSpec.Metric(AggKind.AVG, "id"));

        Map<String, AggregationResult> results = evaluator(Runnable::run).evaluate(
                specs, query(List.of(new Filter.Term("severity", "error"))));

        assertEquals(new AggregationResult.MetricAggregation(3L), results.get("errors"));
        assertEquals(new AggregationResult.MetricAggregation(6L), results.get("sum_id"));
        assertEquals(2.0, ((AggregationResult.MetricAggregation) results.get("avg_id")).value().doubleValue());
    }

    @Test
    void testCountIgnoresNamedField() {
        Map<String, AggSpec> specs = new LinkedHashMap<>();
        specs.put("n_dev", new AggSpec.Metric(AggKind.COUNT, "device_id"));
        specs.put("n_missing", new AggSpec.Metric(AggKind.COUNT, "no_such_field"));
        specs.put("n_bare", new AggSpec.Metric(AggKind.COUNT, null));

        Map<String, AggregationResult> results = evaluator(Runnable::run).evaluate(
                specs, query(List.of(new Filter.Term("severity", "error"))));

        // device_id 在所有行中为 null
        assertEquals(new AggregationResult.MetricAggregation(3L), results.get("n_dev"));
        assertEquals(new AggregationResult.MetricAggregation(3L), results.get("n_missing"));
        assertEquals(new AggregationResult.MetricAggregation(3L), results.get("n_bare"));
    }

    @Test
    void testMetricOverEmptySetIsZero() {
        Map<String, AggregationResult> results = evaluator(Runnable::run).evaluate(
                Map.of("sum_id", new AggSpec.Metric(AggKind.SUM, "id")),
                query(List.of(new Filter.Term("severity", "fatal"))));

        assertEquals(new AggregationResult.MetricAggregation(0L), results.get("sum_id"));
    }

    @Test
    @DisplayName("单个聚合失败不影响其他聚合")
    void testFailingAggregationIsIsolated() throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Map<String, AggSpec> specs = new LinkedHashMap<>();
            specs.put("broken", new AggSpec.Terms("no_such_field", 5));
            specs.put("broken_avg", new AggSpec.Metric(AggKind.AVG, "no_such_field"));
            specs.put("by_source", new AggSpec.Terms("source", 5));

            Map<String, AggregationResult> results = evaluator(executor).evaluate(
                    specs, query(List.of(new Filter.Term("severity", "error"))));

            assertEquals(List.of("broken", "broken_avg", "by_source"), List.copyOf(results.keySet()));
            assertTrue(((AggregationResult.BucketAggregation) results.get("broken")).buckets().isEmpty());
            assertEquals(new AggregationResult.MetricAggregation(0L), results.get("broken_avg"));
            assertEquals(List.of(Bucket.of("api", 2), Bucket.of("db", 1)),
                    ((AggregationResult.BucketAggregation) results.get("by_source")).buckets());
        } finally {
            executor.shutdown();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void testUnsafeFieldYieldsEmptyResult() {
        Map<String, AggregationResult> results = evaluator(Runnable::run).evaluate(
                Map.of("evil", new AggSpec.Terms("source) FROM x; --", 5)), query(List.of()));

        assertEquals(AggregationResult.empty(AggKind.TERMS), results.get("evil"));
    }

    private AggregationEvaluator evaluator(Executor executor) {
        return new AggregationEvaluator(table, EngineConfig.defaults(), Clock.systemUTC(), executor);
    }

    private static NormalizedQuery query(List<Filter> filters) {
        return new NormalizedQuery(filters, null, false, Map.of(), List.of(), 10, 0);
    }
}
