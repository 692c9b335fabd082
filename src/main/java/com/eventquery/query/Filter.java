package com.eventquery.query;

import java.util.Objects;

/**
 * 规范化后的结构化过滤条件，与后端无关。
 */
public sealed interface Filter permits Filter.Term, Filter.Range, Filter.Wildcard {

    FilterKind kind();

    String field();

    /** 精确匹配 */
    record Term(String field, Object value) implements Filter {
        public Term {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public FilterKind kind() {
            return FilterKind.TERM;
        }
    }

    /** 区间匹配，只保留声明过的边界，未声明的边界为 null */
    record Range(String field, Object gte, Object lte, Object gt, Object lt) implements Filter {
        public Range {
            Objects.requireNonNull(field, "field");
        }

        public static Range atLeast(String field, Object gte) {
            return new Range(field, gte, null, null, null);
        }

        public boolean hasBounds() {
            return gte != null || lte != null || gt != null || lt != null;
        }

        @Override
        public FilterKind kind() {
            return FilterKind.RANGE;
        }
    }

    /** 通配符匹配，pattern 使用 '*' 与 '?' */
    record Wildcard(String field, String pattern) implements Filter {
        public Wildcard {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(pattern, "pattern");
        }

        @Override
        public FilterKind kind() {
            return FilterKind.WILDCARD;
        }
    }
}
