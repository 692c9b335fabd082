package com.eventquery.aggregation;

import com.eventquery.query.AggKind;

import java.util.List;

public sealed interface AggregationResult permits AggregationResult.BucketAggregation, AggregationResult.MetricAggregation {

    record BucketAggregation(List<Bucket> buckets) implements AggregationResult {
        public BucketAggregation {
            buckets = List.copyOf(buckets);
        }
    }

    record MetricAggregation(Number value) implements AggregationResult {
    }

    /**
     * 聚合失败时的替代结果：分桶类为空桶列表，标量类为 0。
     */
    static AggregationResult empty(AggKind kind) {
        return switch (kind) {
            case TERMS, DATE_HISTOGRAM -> new BucketAggregation(List.of());
            case AVG, SUM, COUNT -> new MetricAggregation(0L);
        };
    }
}
