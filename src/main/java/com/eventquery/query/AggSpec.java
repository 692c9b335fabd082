package com.eventquery.query;

import java.util.Locale;
import java.util.Objects;

/**
 * 单个聚合的规范化描述。
 */
public sealed interface AggSpec permits AggSpec.Terms, AggSpec.DateHistogram, AggSpec.Metric {

    AggKind kind();

    record Terms(String field, int size) implements AggSpec {
        public Terms {
            Objects.requireNonNull(field, "field");
        }

        @Override
        public AggKind kind() {
            return AggKind.TERMS;
        }
    }

    record DateHistogram(String field, Interval interval) implements AggSpec {
        public DateHistogram {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(interval, "interval");
        }

        @Override
        public AggKind kind() {
            return AggKind.DATE_HISTOGRAM;
        }
    }

    /** avg、sum、count 三种标量聚合；count 总是统计全部匹配行，field 仅作记录，可为 null */
    record Metric(AggKind kind, String field) implements AggSpec {
        public Metric {
            if (kind != AggKind.AVG && kind != AggKind.SUM && kind != AggKind.COUNT) {
                throw new IllegalArgumentException("不是标量聚合: " + kind);
            }
            if (kind != AggKind.COUNT) {
                Objects.requireNonNull(field, "field");
            }
        }
    }

    /**
     * 直方图时间粒度，无法识别的间隔回退为小时。
     */
    enum Interval {
        MINUTE("%Y-%m-%d %H:%M"),
        HOUR("%Y-%m-%d %H"),
        DAY("%Y-%m-%d");

        private final String strftimePattern;

        Interval(String strftimePattern) {
            this.strftimePattern = strftimePattern;
        }

        public String strftimePattern() {
            return strftimePattern;
        }

        public static Interval parse(String value) {
            if (value == null) {
                return HOUR;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "1m", "minute" -> MINUTE;
                case "1d", "day" -> DAY;
                default -> HOUR;
            };
        }
    }
}
