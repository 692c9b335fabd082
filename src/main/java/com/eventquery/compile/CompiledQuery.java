package com.eventquery.compile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 后端可直接执行的查询：SQL 文本与按位置绑定的参数。
 */
public record CompiledQuery(String text, List<Object> params) {
    public CompiledQuery {
        params = Collections.unmodifiableList(new ArrayList<>(params));
    }
}
