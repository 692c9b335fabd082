package com.eventquery.query;

public record SortSpec(String field, Direction direction) {

    public enum Direction {
        ASC,
        DESC;

        /**
         * 解析排序方向，无法识别时按降序处理。
         */
        public static Direction parse(String value) {
            return value != null && "asc".equalsIgnoreCase(value.trim()) ? ASC : DESC;
        }
    }

    public static SortSpec desc(String field) {
        return new SortSpec(field, Direction.DESC);
    }
}
