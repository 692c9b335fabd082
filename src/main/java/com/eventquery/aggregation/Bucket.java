package com.eventquery.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 聚合结果中的一个桶。date_histogram 的桶额外带 key_as_string。
 */
public record Bucket(
        @JsonProperty("key") Object key,
        @JsonProperty("key_as_string") @JsonInclude(JsonInclude.Include.NON_NULL) String keyAsString,
        @JsonProperty("doc_count") long docCount
) {
    public static Bucket of(Object key, long docCount) {
        return new Bucket(key, null, docCount);
    }
}
