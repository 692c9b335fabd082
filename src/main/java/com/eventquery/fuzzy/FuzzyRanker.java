package com.eventquery.fuzzy;

import com.eventquery.query.TextSearch;

import java.util.List;
import java.util.Map;

/**
 * 可替换的近似匹配排序函数。
 *
 * <p>对输入行做过滤加排序：低于阈值的行被丢弃，保留的行按相关度降序返回。
 * 阈值由 {@link TextSearch#fuzziness()} 决定，fuzziness 越大越宽松。
 * 实现可以抛出运行时异常，调用方负责退回精确匹配结果。
 */
public interface FuzzyRanker {

    List<RankedRow> rank(List<Map<String, Object>> rows, TextSearch textSearch);
}
