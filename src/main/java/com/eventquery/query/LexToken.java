package com.eventquery.query;

public record LexToken(TokenType type, String value, int position) {
}

enum TokenType {
    /** 含冒号的 field:value 词 */
    FIELD_VALUE,
    /** AND / OR / NOT，不参与求值 */
    BOOLEAN,
    /** 普通全文检索词 */
    TERM
}
