package com.eventquery.query;

public class QueryParseException extends RuntimeException {
    private final int position;
    private final String queryString;
    private final String suggestion;

    public QueryParseException(String message, int position, String queryString, Throwable cause) {
        super(buildMessage(message, position, queryString), cause);
        this.position = position;
        this.queryString = queryString;
        this.suggestion = suggestFix(position, queryString);
    }

    public int getPosition() {
        return position;
    }

    public String getQueryString() {
        return queryString;
    }

    public String getSuggestion() {
        return suggestion;
    }

    private static String buildMessage(String message, int pos, String query) {
        String safeQuery = query == null ? "" : query;
        int caretPos = Math.max(0, Math.min(pos, safeQuery.length()));
        String pointer = " ".repeat(caretPos) + "^";
        return "Parse error at position " + pos + ": " + message + System.lineSeparator()
                + safeQuery + System.lineSeparator() + pointer;
    }

    private static String suggestFix(int pos, String query) {
        if (query == null || query.isBlank()) {
            return "请输入非空查询";
        }
        if (pos >= query.length() - 1) {
            return "查询文档似乎不完整，请检查末尾的括号与引号";
        }
        return "请检查该位置附近的 JSON 语法，例如逗号、冒号或引号";
    }
}
