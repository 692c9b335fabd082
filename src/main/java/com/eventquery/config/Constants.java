package com.eventquery.config;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * 全局常量定义
 *
 * 包含事件表结构、分页默认值、缓存参数与模糊匹配参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 事件表 ====================
    /** 事件表名 */
    public static final String EVENT_TABLE = "log_events";
    /** 规范的全文检索列 */
    public static final String FREE_TEXT_FIELD = "message";
    /** 主键列，映射为命中结果的 _id */
    public static final String ID_COLUMN = "id";
    /** 时间戳列，简洁查询的默认排序字段 */
    public static final String TIMESTAMP_FIELD = "timestamp";
    /** 以 JSON 文本存储的扩展字段列 */
    public static final String METADATA_COLUMN = "metadata";

    // ==================== 查询参数 ====================
    /** 默认返回条数 */
    public static final int DEFAULT_SIZE = 100;
    /** 默认起始偏移 */
    public static final int DEFAULT_FROM = 0;
    /** terms 聚合默认桶数 */
    public static final int DEFAULT_TERMS_SIZE = 10;
    /** 简洁查询中按日期解析的字段 */
    public static final Set<String> DATE_FIELDS = Set.of("timestamp", "created_at", "updated_at", "date");
    /** 简洁查询中被忽略的布尔关键字 */
    public static final Set<String> BOOLEAN_KEYWORDS = Set.of("AND", "OR", "NOT");
    /** fuzzy 子句未声明 fuzziness 时的默认值 */
    public static final int DEFAULT_FUZZY_CLAUSE_FUZZINESS = 2;

    // ==================== 缓存参数 ====================
    /** 结果缓存默认存活时间 */
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);

    // ==================== 模糊匹配参数 ====================
    /** fuzziness 为 0 时的基础匹配阈值（归一化编辑距离上限，越大越宽松） */
    public static final double FUZZY_BASE_THRESHOLD = 0.2;
    /** 每一级 fuzziness 放宽的阈值 */
    public static final double FUZZY_THRESHOLD_STEP = 0.1;
    /** 参与模糊匹配的字段 */
    public static final List<String> FUZZY_KEYS = List.of("message", "source", "device_id", "category");
}
