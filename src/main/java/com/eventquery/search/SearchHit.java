package com.eventquery.search;

import com.eventquery.fuzzy.FuzzyMatch;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一条命中：事件 id、其余列组成的 _source，以及仅在模糊排序后出现的 _score 与 _matches。
 */
public record SearchHit(
        @JsonProperty("_id") Object id,
        @JsonProperty("_source") Map<String, Object> source,
        @JsonProperty("_score") @JsonInclude(JsonInclude.Include.NON_NULL) Double score,
        @JsonProperty("_matches") @JsonInclude(JsonInclude.Include.NON_NULL) List<FuzzyMatch> matches
) {
    public SearchHit {
        // 列值可能为 null，不能用 Map.copyOf
        source = Collections.unmodifiableMap(new LinkedHashMap<>(source));
        matches = matches == null ? null : List.copyOf(matches);
    }

    public static SearchHit exact(Object id, Map<String, Object> source) {
        return new SearchHit(id, source, null, null);
    }

    public SearchHit ranked(double score, List<FuzzyMatch> matches) {
        return new SearchHit(id, source, score, matches);
    }
}
