package com.eventquery.event;

public class EventStoreException extends RuntimeException {
    private final String sql;

    public EventStoreException(String message, String sql, Throwable cause) {
        super(message + System.lineSeparator() + "SQL: " + sql, cause);
        this.sql = sql;
    }

    public String getSql() {
        return sql;
    }
}
