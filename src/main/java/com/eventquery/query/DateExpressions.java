package com.eventquery.query;

import com.eventquery.event.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 日期值解析与 now 日期运算。
 */
public final class DateExpressions {
    private static final Logger logger = LoggerFactory.getLogger(DateExpressions.class);
    private static final Pattern DATE_MATH = Pattern.compile("^now(?:([+-])(\\d+)([smhdw]))?$");
    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
            Instant::parse,
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private DateExpressions() {
    }

    /**
     * 将 ISO 瞬时、带偏移的日期时间、本地日期时间（UTC）或本地日期（UTC 零点）规范化为事件表格式。
     */
    public static Optional<String> normalizeDate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (Function<String, Instant> parser : DATE_PARSERS) {
            try {
                return Optional.of(Timestamps.format(parser.apply(trimmed)));
            } catch (DateTimeParseException exception) {
                logger.trace("日期格式不匹配: {} - {}", trimmed, exception.getMessage());
            }
        }
        return Optional.empty();
    }

    /**
     * 解析 now、now-1h、now+30m 等表达式；非日期运算的值原样返回。
     */
    public static Object resolve(Object value, Clock clock) {
        if (!(value instanceof String text)) {
            return value;
        }
        Matcher matcher = DATE_MATH.matcher(text.trim());
        if (!matcher.matches()) {
            return value;
        }
        Instant now = clock.instant();
        if (matcher.group(1) == null) {
            return Timestamps.format(now);
        }
        Duration offset = unitDuration(matcher.group(3)).multipliedBy(Long.parseLong(matcher.group(2)));
        Instant resolved = "-".equals(matcher.group(1)) ? now.minus(offset) : now.plus(offset);
        return Timestamps.format(resolved);
    }

    private static Duration unitDuration(String unit) {
        return switch (unit) {
            case "s" -> Duration.ofSeconds(1);
            case "m" -> Duration.ofMinutes(1);
            case "h" -> Duration.ofHours(1);
            case "d" -> Duration.ofDays(1);
            case "w" -> Duration.ofDays(7);
            default -> throw new IllegalArgumentException("不支持的时间单位: " + unit);
        };
    }
}
