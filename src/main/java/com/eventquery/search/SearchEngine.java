package com.eventquery.search;

import com.eventquery.aggregation.AggregationEvaluator;
import com.eventquery.aggregation.AggregationResult;
import com.eventquery.cache.ResultCache;
import com.eventquery.compile.CompiledQuery;
import com.eventquery.compile.QueryCompiler;
import com.eventquery.config.Constants;
import com.eventquery.config.EngineConfig;
import com.eventquery.config.JsonMappers;
import com.eventquery.event.EventStore;
import com.eventquery.fuzzy.EditDistanceFuzzyRanker;
import com.eventquery.fuzzy.FuzzyRanker;
import com.eventquery.fuzzy.RankedRow;
import com.eventquery.query.ClauseParser;
import com.eventquery.query.NormalizedQuery;
import com.eventquery.query.RawQuery;
import com.eventquery.template.QueryTemplates;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * 检索入口：解析 → 查缓存 → 编译并执行命中查询 → 模糊排序 → 聚合 → 分页 → 写缓存。
 *
 * <p>引擎持有自己的缓存，不持有事件库。命中查询失败时异常原样抛给调用方；
 * 聚合失败与模糊排序失败只影响各自的输出。
 */
public class SearchEngine {
    private static final Logger logger = LoggerFactory.getLogger(SearchEngine.class);

    private final EventStore store;
    private final ClauseParser parser;
    private final QueryCompiler compiler;
    private final AggregationEvaluator aggregationEvaluator;
    private final ResultCache<SearchResponse> cache;
    private final FuzzyRanker fuzzyRanker;

    public SearchEngine(EventStore store) {
        this(store, EngineConfig.defaults());
    }

    public SearchEngine(EventStore store, EngineConfig config) {
        this(store, config, new ResultCache<>(config.getCacheTtl()), new EditDistanceFuzzyRanker(config), Runnable::run, Clock.systemUTC());
    }

    /**
     * @param executor 聚合查询的执行器，聚合之间相互独立
     * @param clock    日期表达式（now-1h 等）的求值时钟
     */
    public SearchEngine(EventStore store,
                        EngineConfig config,
                        ResultCache<SearchResponse> cache,
                        FuzzyRanker fuzzyRanker,
                        Executor executor,
                        Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.fuzzyRanker = Objects.requireNonNull(fuzzyRanker, "fuzzyRanker");
        this.parser = new ClauseParser(config);
        this.compiler = new QueryCompiler(config, clock);
        this.aggregationEvaluator = new AggregationEvaluator(store, config, clock, executor);
    }

    public SearchResponse search(RawQuery rawQuery) {
        return search(rawQuery, SearchOptions.defaults());
    }

    /**
     * 执行检索。
     *
     * @throws com.eventquery.event.EventStoreException 命中查询执行失败
     */
    public SearchResponse search(RawQuery rawQuery, SearchOptions options) {
        long startNanos = System.nanoTime();
        NormalizedQuery query = parser.parse(rawQuery);

        if (options.useCache()) {
            Optional<SearchResponse> cached = cache.get(rawQuery);
            if (cached.isPresent()) {
                logger.debug("命中结果缓存: {}", rawQuery.canonicalKey());
                return cached.get();
            }
        }

        CompiledQuery compiled = compiler.compile(query);
        List<Map<String, Object>> rows;
        try {
            rows = store.query(compiled.text(), compiled.params());
        } catch (RuntimeException exception) {
            logger.error("命中查询执行失败, sql={}", compiled.text(), exception);
            throw exception;
        }

        List<SearchHit> hits = shouldRank(query, rows) ? rankOrExact(rows, query) : toHits(rows);

        Map<String, AggregationResult> aggregations = query.aggregations().isEmpty()
                ? Map.of()
                : aggregationEvaluator.evaluate(query.aggregations(), query);

        List<SearchHit> page = slice(hits, query.from(), query.size());
        long tookMs = (System.nanoTime() - startNanos) / 1_000_000;
        SearchResponse response = new SearchResponse(new Hits(hits.size(), page), aggregations, tookMs);

        if (options.useCache()) {
            cache.put(rawQuery, response);
        }
        return response;
    }

    /**
     * 解析后的查询，不访问事件库。
     */
    public NormalizedQuery parse(RawQuery rawQuery) {
        return parser.parse(rawQuery);
    }

    /**
     * 命中查询将要执行的 SQL 与参数，不访问事件库。
     */
    public CompiledQuery explain(RawQuery rawQuery) {
        return compiler.compile(parser.parse(rawQuery));
    }

    public Map<String, RawQuery> listTemplates() {
        return QueryTemplates.all();
    }

    public ResultCache<SearchResponse> cache() {
        return cache;
    }

    private boolean shouldRank(NormalizedQuery query, List<Map<String, Object>> rows) {
        return query.fuzzy()
                && query.hasTextSearch()
                && query.textSearch().query() != null
                && !query.textSearch().query().isBlank()
                && !rows.isEmpty();
    }

    private List<SearchHit> rankOrExact(List<Map<String, Object>> rows, NormalizedQuery query) {
        List<SearchHit> exactHits = toHits(rows);
        try {
            List<RankedRow> ranked = fuzzyRanker.rank(rows, query.textSearch());
            List<SearchHit> hits = new ArrayList<>(ranked.size());
            for (RankedRow row : ranked) {
                hits.add(exactHits.get(row.index()).ranked(row.score(), row.matches()));
            }
            return hits;
        } catch (RuntimeException exception) {
            logger.warn("模糊排序失败，退回精确匹配结果: query={}", query.textSearch().query(), exception);
            return exactHits;
        }
    }

    private List<SearchHit> toHits(List<Map<String, Object>> rows) {
        List<SearchHit> hits = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> source = new LinkedHashMap<>(row);
            Object id = source.remove(Constants.ID_COLUMN);
            Object metadata = source.get(Constants.METADATA_COLUMN);
            if (metadata instanceof String text && !text.isBlank()) {
                source.put(Constants.METADATA_COLUMN, decodeMetadata(text));
            }
            hits.add(SearchHit.exact(id, source));
        }
        return hits;
    }

    private Object decodeMetadata(String text) {
        try {
            return JsonMappers.MAPPER.readValue(text, Object.class);
        } catch (JsonProcessingException exception) {
            logger.debug("metadata 不是合法 JSON，保留原文: {}", exception.getOriginalMessage());
            return text;
        }
    }

    private static List<SearchHit> slice(List<SearchHit> hits, int from, int size) {
        if (from >= hits.size() || size == 0) {
            return List.of();
        }
        int end = (int) Math.min((long) from + size, hits.size());
        return hits.subList(from, end);
    }
}
