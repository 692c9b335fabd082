package com.eventquery.query;

/**
 * 全文检索描述。queryString 为 true 时 query 是内嵌的 field:value 迷你语法。
 */
public record TextSearch(String field, String query, int fuzziness, boolean queryString) {

    public static TextSearch of(String field, String query) {
        return new TextSearch(field, query, 0, false);
    }
}
