package com.eventquery.event;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 事件存储的只读查询接口。
 *
 * <p>所有调用方提供的值都通过 {@code params} 按位置绑定，查询文本中只出现 {@code ?} 占位符。
 * 每一行以列名到列值的映射返回，保持列的声明顺序。
 */
public interface EventStore {

    /**
     * 执行参数化查询并返回全部行。
     *
     * @throws EventStoreException 连接、语法或表结构不匹配导致执行失败
     */
    List<Map<String, Object>> query(String sql, List<Object> params);

    /**
     * 执行参数化查询并返回第一行，用于标量聚合。
     *
     * @throws EventStoreException 连接、语法或表结构不匹配导致执行失败
     */
    Optional<Map<String, Object>> get(String sql, List<Object> params);
}
