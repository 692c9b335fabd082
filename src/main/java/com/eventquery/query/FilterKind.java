package com.eventquery.query;

public enum FilterKind {
    TERM,
    RANGE,
    WILDCARD
}
