package com.eventquery.template;

import com.eventquery.config.JsonMappers;
import com.eventquery.query.RawQuery;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 预置的命名查询模板。
 *
 * <p>每次调用都会重新解析模板文本，调用方修改返回的文档不会影响后续调用。
 */
public final class QueryTemplates {
    public static final String ERRORS_LAST_HOUR = "errors_last_hour";
    public static final String SECURITY_EVENTS = "security_events";
    public static final String DEVICE_ACTIVITY = "device_activity";

    private static final Map<String, String> TEMPLATES;

    static {
        Map<String, String> templates = new LinkedHashMap<>();
        templates.put(ERRORS_LAST_HOUR, """
                {
                  "query": {
                    "bool": {
                      "must": [
                        { "term": { "severity": "error" } },
                        { "range": { "timestamp": { "gte": "now-1h" } } }
                      ]
                    }
                  },
                  "aggs": {
                    "by_source": { "terms": { "field": "source", "size": 10 } }
                  }
                }
                """);
        templates.put(SECURITY_EVENTS, """
                {
                  "query": {
                    "bool": {
                      "should": [
                        { "match": { "message": "authentication" } },
                        { "match": { "message": "login" } },
                        { "match": { "category": "security" } }
                      ]
                    }
                  },
                  "sort": [ { "timestamp": "desc" } ]
                }
                """);
        templates.put(DEVICE_ACTIVITY, """
                {
                  "query": { "match_all": {} },
                  "aggs": {
                    "by_device": { "terms": { "field": "device_id", "size": 20 } },
                    "activity_over_time": {
                      "date_histogram": { "field": "timestamp", "interval": "1h" }
                    }
                  }
                }
                """);
        TEMPLATES = Collections.unmodifiableMap(templates);
    }

    private QueryTemplates() {
    }

    /**
     * 返回全部模板，按声明顺序排列。
     */
    public static Map<String, RawQuery> all() {
        Map<String, RawQuery> result = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : TEMPLATES.entrySet()) {
            result.put(entry.getKey(), parseTemplate(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    public static Set<String> names() {
        return TEMPLATES.keySet();
    }

    /**
     * 按名称获取模板。
     *
     * @throws IllegalArgumentException 模板不存在
     */
    public static RawQuery get(String name) {
        String text = TEMPLATES.get(name);
        if (text == null) {
            throw new IllegalArgumentException("未知的查询模板: " + name + "，可选: " + TEMPLATES.keySet());
        }
        return parseTemplate(name, text);
    }

    private static RawQuery parseTemplate(String name, String text) {
        try {
            return RawQuery.structured(JsonMappers.MAPPER.readTree(text));
        } catch (JsonProcessingException exception) {
            throw new IllegalStateException("内置模板格式错误: " + name, exception);
        }
    }
}
