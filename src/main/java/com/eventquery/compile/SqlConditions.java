package com.eventquery.compile;

import com.eventquery.config.Constants;
import com.eventquery.query.DateExpressions;
import com.eventquery.query.Filter;
import com.eventquery.query.TextSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 过滤条件到 SQL 条件的翻译，检索查询与聚合查询共用。
 *
 * <p>所有值都以 {@code ?} 占位并追加到参数列表；字段名只有在通过标识符校验后才会写入 SQL 文本。
 */
public final class SqlConditions {
    private static final Logger logger = LoggerFactory.getLogger(SqlConditions.class);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String LIKE_ESCAPE = " ESCAPE '#'";

    private final Clock clock;

    public SqlConditions(Clock clock) {
        this.clock = clock;
    }

    public static boolean isSafeIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    /**
     * 校验标识符，不合法时抛出 IllegalArgumentException。
     */
    public static String requireSafeIdentifier(String name) {
        if (!isSafeIdentifier(name)) {
            throw new IllegalArgumentException("非法字段名: " + name);
        }
        return name;
    }

    /**
     * 按声明顺序为每个过滤条件追加 " AND 条件"。
     */
    public void appendFilters(StringBuilder sql, List<Filter> filters, List<Object> params) {
        for (Filter filter : filters) {
            filterCondition(filter, params).ifPresent(condition -> sql.append(" AND ").append(condition));
        }
    }

    /**
     * 翻译单个过滤条件；没有边界的 range 与字段名不合法的条件不产生任何 SQL。
     */
    public Optional<String> filterCondition(Filter filter, List<Object> params) {
        if (!isSafeIdentifier(filter.field())) {
            logger.warn("字段名不合法，已跳过过滤条件: {}", filter.field());
            return Optional.empty();
        }
        return switch (filter.kind()) {
            case TERM -> {
                Filter.Term term = (Filter.Term) filter;
                params.add(term.value());
                yield Optional.of(term.field() + " = ?");
            }
            case RANGE -> rangeCondition((Filter.Range) filter, params);
            case WILDCARD -> {
                Filter.Wildcard wildcard = (Filter.Wildcard) filter;
                params.add(wildcardToLike(wildcard.pattern()));
                yield Optional.of(wildcard.field() + " LIKE ?" + LIKE_ESCAPE);
            }
        };
    }

    /**
     * 全文检索条件。query_string 形式按空白拆分，每个词独立成条件，布尔关键字被丢弃。
     */
    public Optional<String> textCondition(TextSearch textSearch, List<Object> params) {
        if (textSearch.query() == null) {
            return Optional.empty();
        }
        if (!textSearch.queryString()) {
            return containsCondition(textSearch.field(), textSearch.query(), params);
        }

        List<String> conditions = new ArrayList<>();
        for (String token : textSearch.query().trim().split("\\s+")) {
            if (token.isEmpty() || Constants.BOOLEAN_KEYWORDS.contains(token)) {
                continue;
            }
            int colon = token.indexOf(':');
            Optional<String> condition = colon >= 0
                    ? containsCondition(token.substring(0, colon), token.substring(colon + 1), params)
                    : containsCondition(textSearch.field(), token, params);
            condition.ifPresent(conditions::add);
        }
        return conditions.isEmpty() ? Optional.empty() : Optional.of(String.join(" AND ", conditions));
    }

    private Optional<String> containsCondition(String field, String value, List<Object> params) {
        if (!isSafeIdentifier(field)) {
            logger.warn("字段名不合法，已跳过全文条件: {}", field);
            return Optional.empty();
        }
        params.add("%" + escapeLike(value) + "%");
        return Optional.of(field + " LIKE ?" + LIKE_ESCAPE);
    }

    private Optional<String> rangeCondition(Filter.Range range, List<Object> params) {
        List<String> conditions = new ArrayList<>(4);
        addBound(range.field(), ">=", range.gte(), conditions, params);
        addBound(range.field(), "<=", range.lte(), conditions, params);
        addBound(range.field(), ">", range.gt(), conditions, params);
        addBound(range.field(), "<", range.lt(), conditions, params);
        return conditions.isEmpty() ? Optional.empty() : Optional.of(String.join(" AND ", conditions));
    }

    private void addBound(String field, String operator, Object bound, List<String> conditions, List<Object> params) {
        if (bound == null) {
            return;
        }
        params.add(DateExpressions.resolve(bound, clock));
        conditions.add(field + " " + operator + " ?");
    }

    /**
     * 转义 LIKE 元字符后把 '*' 与 '?' 翻译为 '%' 与 '_'。
     */
    public static String wildcardToLike(String pattern) {
        return escapeLike(pattern).replace('*', '%').replace('?', '_');
    }

    public static String escapeLike(String value) {
        return value
                .replace("#", "##")
                .replace("%", "#%")
                .replace("_", "#_");
    }
}
