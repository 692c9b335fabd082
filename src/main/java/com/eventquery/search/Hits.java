package com.eventquery.search;

import java.util.List;

/**
 * total 为分页之前的结果集大小，hits 为当前页。
 */
public record Hits(int total, List<SearchHit> hits) {
    public Hits {
        hits = List.copyOf(hits);
    }
}
