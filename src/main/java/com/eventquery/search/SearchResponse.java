package com.eventquery.search;

import com.eventquery.aggregation.AggregationResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 检索响应，took 单位为毫秒。
 */
public record SearchResponse(Hits hits, Map<String, AggregationResult> aggregations, long took) {
    public SearchResponse {
        aggregations = Collections.unmodifiableMap(new LinkedHashMap<>(aggregations));
    }
}
