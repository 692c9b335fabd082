package com.eventquery.fuzzy;

/**
 * 匹配片段在字段值中的位置，start 与 end 都是包含的字符下标。
 */
public record MatchSpan(int start, int end) {
}
