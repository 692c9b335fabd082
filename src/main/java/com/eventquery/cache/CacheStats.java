package com.eventquery.cache;

/**
 * 缓存统计快照。
 */
public record CacheStats(int size, long hits, long misses) {

    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
