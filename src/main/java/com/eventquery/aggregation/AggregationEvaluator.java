package com.eventquery.aggregation;

import com.eventquery.compile.SqlConditions;
import com.eventquery.config.EngineConfig;
import com.eventquery.event.EventStore;
import com.eventquery.query.AggKind;
import com.eventquery.query.AggSpec;
import com.eventquery.query.Filter;
import com.eventquery.query.NormalizedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 在与检索相同的结构化过滤条件上执行聚合。
 *
 * <p>聚合只使用 filters，不受全文条件或模糊排序影响。每个聚合独立提交到 executor，
 * 任何一个聚合失败只会把自己替换为空结果，不影响其他聚合和整次检索。
 */
public class AggregationEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(AggregationEvaluator.class);

    private final EventStore store;
    private final String tableName;
    private final SqlConditions conditions;
    private final Executor executor;

    public AggregationEvaluator(EventStore store, EngineConfig config, Clock clock, Executor executor) {
        this.store = store;
        this.tableName = SqlConditions.requireSafeIdentifier(config.getTableName());
        this.conditions = new SqlConditions(clock);
        this.executor = executor;
    }

    public Map<String, AggregationResult> evaluate(Map<String, AggSpec> aggregations, NormalizedQuery query) {
        Map<String, CompletableFuture<AggregationResult>> pending = new LinkedHashMap<>();
        for (Map.Entry<String, AggSpec> entry : aggregations.entrySet()) {
            pending.put(entry.getKey(), submit(entry.getKey(), entry.getValue(), query.filters()));
        }

        Map<String, AggregationResult> results = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<AggregationResult>> entry : pending.entrySet()) {
            results.put(entry.getKey(), entry.getValue().join());
        }
        return results;
    }

    private CompletableFuture<AggregationResult> submit(String name, AggSpec spec, List<Filter> filters) {
        try {
            return CompletableFuture.supplyAsync(() -> evaluateSafely(name, spec, filters), executor);
        } catch (RejectedExecutionException exception) {
            logger.warn("聚合任务被拒绝执行: {} - {}", name, exception.getMessage());
            return CompletableFuture.completedFuture(AggregationResult.empty(spec.kind()));
        }
    }

    private AggregationResult evaluateSafely(String name, AggSpec spec, List<Filter> filters) {
        try {
            return evaluateOne(spec, filters);
        } catch (RuntimeException exception) {
            logger.warn("聚合执行失败，返回空结果: {} ({}) - {}", name, spec.kind().key(), exception.getMessage());
            return AggregationResult.empty(spec.kind());
        }
    }

    AggregationResult evaluateOne(AggSpec spec, List<Filter> filters) {
        return switch (spec.kind()) {
            case TERMS -> terms((AggSpec.Terms) spec, filters);
            case DATE_HISTOGRAM -> dateHistogram((AggSpec.DateHistogram) spec, filters);
            case AVG, SUM, COUNT -> metric((AggSpec.Metric) spec, filters);
        };
    }

    private AggregationResult terms(AggSpec.Terms spec, List<Filter> filters) {
        String field = SqlConditions.requireSafeIdentifier(spec.field());
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ").append(field).append(" AS bucket_key, COUNT(*) AS doc_count FROM ")
                .append(tableName).append(" WHERE 1=1");
        conditions.appendFilters(sql, filters, params);
        sql.append(" GROUP BY ").append(field)
                .append(" ORDER BY doc_count DESC, bucket_key ASC LIMIT ").append(spec.size());

        List<Bucket> buckets = new ArrayList<>();
        for (Map<String, Object> row : store.query(sql.toString(), params)) {
            buckets.add(Bucket.of(row.get("bucket_key"), toLong(row.get("doc_count"))));
        }
        return new AggregationResult.BucketAggregation(buckets);
    }

    private AggregationResult dateHistogram(AggSpec.DateHistogram spec, List<Filter> filters) {
        String field = SqlConditions.requireSafeIdentifier(spec.field());
        String bucketExpression = "strftime('" + spec.interval().strftimePattern() + "', " + field + ")";
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ").append(bucketExpression).append(" AS bucket_key, COUNT(*) AS doc_count FROM ")
                .append(tableName).append(" WHERE 1=1");
        conditions.appendFilters(sql, filters, params);
        sql.append(" GROUP BY ").append(bucketExpression).append(" ORDER BY bucket_key");

        List<Bucket> buckets = new ArrayList<>();
        for (Map<String, Object> row : store.query(sql.toString(), params)) {
            Object key = row.get("bucket_key");
            buckets.add(new Bucket(key, key == null ? null : key.toString(), toLong(row.get("doc_count"))));
        }
        return new AggregationResult.BucketAggregation(buckets);
    }

    private AggregationResult metric(AggSpec.Metric spec, List<Filter> filters) {
        // count 统计匹配行数，忽略 field
        String argument = spec.kind() == AggKind.COUNT ? "*" : SqlConditions.requireSafeIdentifier(spec.field());
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ").append(spec.kind().name()).append('(').append(argument)
                .append(") AS value FROM ").append(tableName).append(" WHERE 1=1");
        conditions.appendFilters(sql, filters, params);

        Optional<Map<String, Object>> row = store.get(sql.toString(), params);
        Object value = row.map(columns -> columns.get("value")).orElse(null);
        return new AggregationResult.MetricAggregation(normalizeNumber(value));
    }

    private static long toLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }

    private static Number normalizeNumber(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number number) {
            return number;
        }
        return 0L;
    }
}
