package com.eventquery.cache;

import com.eventquery.query.RawQuery;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 按原始查询缓存检索结果，条目在 TTL 之后失效。
 *
 * <p>缓存键为 {@link RawQuery#canonicalKey()}，因此对象键顺序不同的同一查询共享条目。
 * 过期条目在读取时视为未命中，并在每次写入后统一清理。
 * 底层为 Caffeine，时间取自注入的 {@link Clock}，维护任务在调用线程上同步执行。
 */
public class ResultCache<V> {
    private static final Logger logger = LoggerFactory.getLogger(ResultCache.class);

    private final Cache<String, V> entries;
    private final Duration ttl;

    public ResultCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public ResultCache(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("缓存 TTL 不能为负: " + ttl);
        }
        Objects.requireNonNull(clock, "clock");
        this.ttl = ttl;
        // 年龄恰好等于 TTL 的条目仍然有效，Caffeine 在到达时长时即判定过期，故多留 1ns
        this.entries = Caffeine.newBuilder()
                .expireAfterWrite(ttl.plusNanos(1))
                .ticker(clockTicker(clock))
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    /**
     * 读取未过期的缓存结果。
     */
    public Optional<V> get(RawQuery query) {
        return Optional.ofNullable(entries.getIfPresent(query.canonicalKey()));
    }

    /**
     * 写入结果并清理所有过期条目。
     */
    public void put(RawQuery query, V value) {
        entries.put(query.canonicalKey(), value);
        sweep();
    }

    /**
     * 删除过期条目，返回删除数量。
     */
    public int sweep() {
        long before = entries.estimatedSize();
        entries.cleanUp();
        int removed = (int) Math.max(0, before - entries.estimatedSize());
        if (removed > 0) {
            logger.debug("清理过期缓存条目: {}", removed);
        }
        return removed;
    }

    public void clear() {
        entries.invalidateAll();
        entries.cleanUp();
    }

    public int size() {
        return (int) entries.estimatedSize();
    }

    public Duration ttl() {
        return ttl;
    }

    public CacheStats stats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats counters = entries.stats();
        return new CacheStats(size(), counters.hitCount(), counters.missCount());
    }

    private static Ticker clockTicker(Clock clock) {
        return () -> {
            Instant now = clock.instant();
            return Math.addExact(Math.multiplyExact(now.getEpochSecond(), 1_000_000_000L), now.getNano());
        };
    }
}
