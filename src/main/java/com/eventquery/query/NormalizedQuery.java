package com.eventquery.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 解析后的中间表示，是编译、聚合与模糊排序唯一消费的形式。
 *
 * <p>textSearch 可为 null；aggregations 在未声明聚合时为空映射；size/from 总是已物化的非负整数。
 */
public record NormalizedQuery(
        List<Filter> filters,
        TextSearch textSearch,
        boolean fuzzy,
        Map<String, AggSpec> aggregations,
        List<SortSpec> sort,
        int size,
        int from
) {
    public NormalizedQuery {
        filters = List.copyOf(filters);
        aggregations = Collections.unmodifiableMap(new LinkedHashMap<>(aggregations));
        sort = List.copyOf(sort);
        if (size < 0 || from < 0) {
            throw new IllegalArgumentException("size/from 必须为非负数: size=" + size + ", from=" + from);
        }
    }

    public boolean hasTextSearch() {
        return textSearch != null;
    }

    /** 后端需要取回的行数上限，分页在进程内完成 */
    public int fetchLimit() {
        return (int) Math.min(Integer.MAX_VALUE, (long) size + from);
    }
}
