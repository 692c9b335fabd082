package com.eventquery.query;

import java.util.Optional;

public enum AggKind {
    TERMS("terms"),
    DATE_HISTOGRAM("date_histogram"),
    AVG("avg"),
    SUM("sum"),
    COUNT("count");

    private final String key;

    AggKind(String key) {
        this.key = key;
    }

    /** DSL 中的聚合类型键 */
    public String key() {
        return key;
    }

    public static Optional<AggKind> fromKey(String key) {
        for (AggKind kind : values()) {
            if (kind.key.equals(key)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
