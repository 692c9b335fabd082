package com.eventquery.search;

/**
 * 单次检索的选项。
 *
 * @param useCache 是否读写结果缓存
 */
public record SearchOptions(boolean useCache) {
    private static final SearchOptions DEFAULTS = new SearchOptions(true);
    private static final SearchOptions NO_CACHE = new SearchOptions(false);

    public static SearchOptions defaults() {
        return DEFAULTS;
    }

    public static SearchOptions noCache() {
        return NO_CACHE;
    }
}
