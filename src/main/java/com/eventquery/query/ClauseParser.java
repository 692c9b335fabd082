package com.eventquery.query;

import com.eventquery.config.Constants;
import com.eventquery.config.EngineConfig;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 将原始查询转换为 {@link NormalizedQuery}。
 *
 * <p>解析是宽松的：无法识别的子句、聚合类型或格式错误的值会被跳过，不会抛出异常。
 * bool 子句的 must / should / must_not / filter 被同等展开为同一组合取条件，
 * 这是对布尔语义的已知近似，调用方依赖这种行为，不要在这里“修正”。
 */
public class ClauseParser {
    private static final Logger logger = LoggerFactory.getLogger(ClauseParser.class);
    private static final List<String> BOOL_SECTIONS = List.of("must", "should", "must_not", "filter");
    private static final List<String> INTERVAL_KEYS = List.of("interval", "calendar_interval", "fixed_interval");

    private final String freeTextField;
    private final int defaultSize;
    private final int defaultTermsSize;
    private final CompactQueryLexer lexer = new CompactQueryLexer();

    public ClauseParser() {
        this(EngineConfig.defaults());
    }

    public ClauseParser(EngineConfig config) {
        this.freeTextField = config.getFreeTextField();
        this.defaultSize = Math.max(0, config.getDefaultSize());
        this.defaultTermsSize = Math.max(1, config.getDefaultTermsSize());
    }

    public NormalizedQuery parse(RawQuery rawQuery) {
        if (rawQuery instanceof RawQuery.Compact compact) {
            return parseCompact(compact.text());
        }
        return parseStructured(((RawQuery.Structured) rawQuery).document());
    }

    // ==================== 结构化文档 ====================

    private NormalizedQuery parseStructured(JsonNode document) {
        Accumulator accumulator = new Accumulator();
        if (!document.isObject()) {
            logger.debug("查询文档不是 JSON 对象，按空查询处理: {}", document.getNodeType());
            return accumulator.build(Map.of(), List.of(), defaultSize, Constants.DEFAULT_FROM);
        }

        JsonNode queryNode = document.get("query");
        if (queryNode != null) {
            parseClause(queryNode, accumulator);
        }

        JsonNode aggsNode = document.has("aggs") ? document.get("aggs") : document.get("aggregations");
        Map<String, AggSpec> aggregations = parseAggregations(aggsNode);
        List<SortSpec> sort = parseSort(document.get("sort"));
        int size = readNonNegative(document.get("size"), defaultSize);
        int from = readNonNegative(document.get("from"), Constants.DEFAULT_FROM);
        return accumulator.build(aggregations, sort, size, from);
    }

    /**
     * 解析单个子句对象，对象中的每个已知子句类型按出现顺序处理。
     */
    private void parseClause(JsonNode clause, Accumulator accumulator) {
        if (clause == null || !clause.isObject()) {
            logger.debug("跳过非对象子句: {}", clause);
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> entries = clause.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            JsonNode body = entry.getValue();
            switch (entry.getKey()) {
                case "bool" -> parseBool(body, accumulator);
                case "match" -> parseMatch(body, accumulator);
                case "term" -> parseTerm(body, accumulator);
                case "range" -> parseRange(body, accumulator);
                case "wildcard" -> parseWildcard(body, accumulator);
                case "fuzzy" -> parseFuzzy(body, accumulator);
                case "query_string" -> parseQueryString(body, accumulator);
                case "match_all" -> logger.trace("match_all 不产生条件");
                default -> logger.debug("跳过无法识别的子句: {}", entry.getKey());
            }
        }
    }

    private void parseBool(JsonNode body, Accumulator accumulator) {
        if (!body.isObject()) {
            return;
        }
        for (String section : BOOL_SECTIONS) {
            JsonNode clauses = body.get(section);
            if (clauses == null) {
                continue;
            }
            if (clauses.isArray()) {
                for (JsonNode subClause : clauses) {
                    parseClause(subClause, accumulator);
                }
            } else {
                parseClause(clauses, accumulator);
            }
        }
    }

    private void parseMatch(JsonNode body, Accumulator accumulator) {
        forEachField(body, (field, value) -> {
            if (value.isObject()) {
                String query = textOf(value.get("query"));
                if (query == null) {
                    logger.debug("match 子句缺少 query: {}", field);
                    return;
                }
                int fuzziness = readFuzziness(value.get("fuzziness"), 0);
                accumulator.textSearch = new TextSearch(field, query, fuzziness, false);
                if (fuzziness > 0) {
                    accumulator.fuzzy = true;
                }
                return;
            }
            String query = textOf(value);
            if (query != null) {
                accumulator.textSearch = TextSearch.of(field, query);
            }
        });
    }

    private void parseTerm(JsonNode body, Accumulator accumulator) {
        forEachField(body, (field, value) -> {
            Object scalar = value.isObject() ? scalarOf(value.get("value")) : scalarOf(value);
            if (scalar == null) {
                logger.debug("term 子句缺少值: {}", field);
                return;
            }
            accumulator.filters.add(new Filter.Term(field, scalar));
        });
    }

    private void parseRange(JsonNode body, Accumulator accumulator) {
        forEachField(body, (field, bounds) -> {
            if (!bounds.isObject()) {
                return;
            }
            Filter.Range range = new Filter.Range(
                    field,
                    scalarOf(bounds.get("gte")),
                    scalarOf(bounds.get("lte")),
                    scalarOf(bounds.get("gt")),
                    scalarOf(bounds.get("lt")));
            if (range.hasBounds()) {
                accumulator.filters.add(range);
            } else {
                logger.debug("range 子句没有任何边界，已忽略: {}", field);
            }
        });
    }

    private void parseWildcard(JsonNode body, Accumulator accumulator) {
        forEachField(body, (field, value) -> {
            String pattern = value.isObject()
                    ? Optional.ofNullable(textOf(value.get("value"))).orElse(textOf(value.get("wildcard")))
                    : textOf(value);
            if (pattern != null) {
                accumulator.filters.add(new Filter.Wildcard(field, pattern));
            }
        });
    }

    private void parseFuzzy(JsonNode body, Accumulator accumulator) {
        forEachField(body, (field, config) -> {
            String query = config.isObject() ? textOf(config.get("value")) : textOf(config);
            if (query == null) {
                logger.debug("fuzzy 子句缺少值: {}", field);
                return;
            }
            int fuzziness = config.isObject()
                    ? readFuzziness(config.get("fuzziness"), Constants.DEFAULT_FUZZY_CLAUSE_FUZZINESS)
                    : Constants.DEFAULT_FUZZY_CLAUSE_FUZZINESS;
            accumulator.textSearch = new TextSearch(field, query, fuzziness, false);
            accumulator.fuzzy = true;
        });
    }

    private void parseQueryString(JsonNode body, Accumulator accumulator) {
        if (!body.isObject()) {
            return;
        }
        String query = textOf(body.get("query"));
        if (query == null) {
            return;
        }
        String field = textOf(body.get("default_field"));
        JsonNode fields = body.get("fields");
        if (field == null && fields != null && fields.isArray() && !fields.isEmpty()) {
            field = textOf(fields.get(0));
        }
        accumulator.textSearch = new TextSearch(field == null ? freeTextField : field, query, 0, true);
    }

    // ==================== 聚合与排序 ====================

    private Map<String, AggSpec> parseAggregations(JsonNode aggsNode) {
        Map<String, AggSpec> aggregations = new LinkedHashMap<>();
        if (aggsNode == null || !aggsNode.isObject()) {
            return aggregations;
        }
        forEachField(aggsNode, (name, config) -> {
            Optional<AggSpec> spec = parseAggregation(config);
            if (spec.isPresent()) {
                aggregations.put(name, spec.get());
            } else {
                logger.debug("跳过无法识别的聚合: {}", name);
            }
        });
        return aggregations;
    }

    private Optional<AggSpec> parseAggregation(JsonNode config) {
        if (!config.isObject()) {
            return Optional.empty();
        }
        Iterator<Map.Entry<String, JsonNode>> entries = config.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            Optional<AggKind> kind = AggKind.fromKey(entry.getKey());
            if (kind.isEmpty()) {
                continue;
            }
            JsonNode body = entry.getValue();
            String field = body.isObject() ? textOf(body.get("field")) : null;
            switch (kind.get()) {
                case TERMS -> {
                    if (field != null) {
                        return Optional.of(new AggSpec.Terms(field, readPositive(body.get("size"), defaultTermsSize)));
                    }
                }
                case DATE_HISTOGRAM -> {
                    String interval = null;
                    for (String key : INTERVAL_KEYS) {
                        if (interval == null && body.isObject()) {
                            interval = textOf(body.get(key));
                        }
                    }
                    return Optional.of(new AggSpec.DateHistogram(
                            field == null ? Constants.TIMESTAMP_FIELD : field,
                            AggSpec.Interval.parse(interval)));
                }
                case AVG, SUM -> {
                    if (field != null) {
                        return Optional.of(new AggSpec.Metric(kind.get(), field));
                    }
                }
                case COUNT -> {
                    return Optional.of(new AggSpec.Metric(AggKind.COUNT, field));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * 排序项可以是裸字段名（降序）、{field: direction} 或 {field: {order: direction}}。
     */
    private List<SortSpec> parseSort(JsonNode sortNode) {
        List<SortSpec> sort = new ArrayList<>();
        if (sortNode == null || sortNode.isNull()) {
            return sort;
        }
        if (sortNode.isArray()) {
            for (JsonNode item : sortNode) {
                addSortItem(item, sort);
            }
        } else {
            addSortItem(sortNode, sort);
        }
        return sort;
    }

    private void addSortItem(JsonNode item, List<SortSpec> sort) {
        if (item.isTextual()) {
            sort.add(SortSpec.desc(item.asText()));
            return;
        }
        forEachField(item, (field, direction) -> {
            String order = direction.isObject() ? textOf(direction.get("order")) : textOf(direction);
            sort.add(new SortSpec(field, SortSpec.Direction.parse(order)));
        });
    }

    // ==================== 简洁查询串 ====================

    private NormalizedQuery parseCompact(String queryString) {
        Accumulator accumulator = new Accumulator();
        for (LexToken token : lexer.tokenize(queryString)) {
            switch (token.type()) {
                case FIELD_VALUE -> parseFieldValueToken(token, accumulator);
                case TERM -> accumulator.textSearch = TextSearch.of(freeTextField, stripQuotes(token.value()));
                case BOOLEAN -> logger.trace("忽略布尔关键字: {}", token.value());
            }
        }
        return accumulator.build(
                Map.of(),
                List.of(SortSpec.desc(Constants.TIMESTAMP_FIELD)),
                defaultSize,
                Constants.DEFAULT_FROM);
    }

    private void parseFieldValueToken(LexToken token, Accumulator accumulator) {
        String value = token.value();
        int colon = value.indexOf(':');
        String field = value.substring(0, colon);
        String fieldValue = stripQuotes(value.substring(colon + 1));
        if (field.isBlank()) {
            logger.debug("跳过缺少字段名的 token: {}", value);
            return;
        }
        if ("_all".equals(field) || "q".equals(field)) {
            accumulator.textSearch = TextSearch.of(freeTextField, fieldValue);
            return;
        }
        if (Constants.DATE_FIELDS.contains(field)) {
            Optional<String> date = DateExpressions.normalizeDate(fieldValue);
            if (date.isPresent()) {
                accumulator.filters.add(Filter.Range.atLeast(field, date.get()));
            } else {
                logger.debug("无法解析日期，已忽略: {}", value);
            }
            return;
        }
        accumulator.filters.add(new Filter.Term(field, fieldValue));
    }

    // ==================== 工具方法 ====================

    private static String stripQuotes(String value) {
        return value.replace("\"", "").replace("'", "");
    }

    private static void forEachField(JsonNode node, FieldConsumer consumer) {
        if (node == null || !node.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            consumer.accept(entry.getKey(), entry.getValue());
        }
    }

    /**
     * 标量值转换为 Java 值；对象、数组与 null 返回 null。
     */
    static Object scalarOf(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
            return null;
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }

    private static String textOf(JsonNode node) {
        Object scalar = scalarOf(node);
        return scalar == null ? null : scalar.toString();
    }

    /**
     * 解析 fuzziness：数字取非负整数，"AUTO" 等非数字文本按默认值处理。
     */
    private static int readFuzziness(JsonNode node, int fallback) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isNumber()) {
            return clampToInt(node);
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (text.isEmpty()) {
                return fallback;
            }
            try {
                return Math.max(0, Integer.parseInt(text));
            } catch (NumberFormatException exception) {
                return Constants.DEFAULT_FUZZY_CLAUSE_FUZZINESS;
            }
        }
        return fallback;
    }

    private static int readNonNegative(JsonNode node, int fallback) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isNumber()) {
            return clampToInt(node);
        }
        if (node.isTextual()) {
            try {
                long value = Long.parseLong(node.asText().trim());
                return (int) Math.max(0, Math.min(Integer.MAX_VALUE, value));
            } catch (NumberFormatException exception) {
                return fallback;
            }
        }
        return fallback;
    }

    /** 超出 int 范围的数字截断到 [0, Integer.MAX_VALUE]，不做回绕 */
    private static int clampToInt(JsonNode node) {
        if (node.canConvertToInt()) {
            return Math.max(0, node.intValue());
        }
        return node.doubleValue() > 0 ? Integer.MAX_VALUE : 0;
    }

    private static int readPositive(JsonNode node, int fallback) {
        int value = readNonNegative(node, fallback);
        return value > 0 ? value : fallback;
    }

    @FunctionalInterface
    private interface FieldConsumer {
        void accept(String field, JsonNode value);
    }

    /**
     * 解析过程中的可变累积状态，build 时冻结为不可变的 NormalizedQuery。
     */
    private static final class Accumulator {
        private final List<Filter> filters = new ArrayList<>();
        private TextSearch textSearch;
        private boolean fuzzy;

        private NormalizedQuery build(Map<String, AggSpec> aggregations, List<SortSpec> sort, int size, int from) {
            return new NormalizedQuery(filters, textSearch, fuzzy, aggregations, sort, size, from);
        }
    }
}
