package com.eventquery.query;

import com.eventquery.config.JsonMappers;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * 调用方提交的原始查询：结构化 DSL 文档或简洁的 field:value 字符串。
 */
public sealed interface RawQuery permits RawQuery.Structured, RawQuery.Compact {

    /**
     * 稳定的序列化形式，对象键顺序不同但语义相同的请求得到相同的键。
     */
    String canonicalKey();

    record Structured(JsonNode document) implements RawQuery {
        public Structured {
            Objects.requireNonNull(document, "document");
        }

        @Override
        public String canonicalKey() {
            Object plain = JsonMappers.CANONICAL_MAPPER.convertValue(document, Object.class);
            try {
                return JsonMappers.CANONICAL_MAPPER.writeValueAsString(plain);
            } catch (JsonProcessingException exception) {
                throw new IllegalStateException("序列化查询文档失败", exception);
            }
        }
    }

    record Compact(String text) implements RawQuery {
        public Compact {
            text = text == null ? "" : text;
        }

        @Override
        public String canonicalKey() {
            try {
                return JsonMappers.CANONICAL_MAPPER.writeValueAsString(text);
            } catch (JsonProcessingException exception) {
                throw new IllegalStateException("序列化查询字符串失败", exception);
            }
        }
    }

    static RawQuery compact(String text) {
        return new Compact(text);
    }

    static RawQuery structured(JsonNode document) {
        return new Structured(document);
    }

    /**
     * 以 '{' 开头的输入按 JSON 文档解析，其余按简洁查询字符串处理。
     *
     * @throws QueryParseException 输入看起来是 JSON 但无法解析
     */
    static RawQuery parse(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (!trimmed.startsWith("{")) {
            return new Compact(trimmed);
        }
        try {
            return new Structured(JsonMappers.MAPPER.readTree(trimmed));
        } catch (JsonProcessingException exception) {
            JsonLocation location = exception.getLocation();
            int position = location == null ? 0 : (int) Math.max(0, location.getCharOffset());
            throw new QueryParseException(exception.getOriginalMessage(), position, trimmed, exception);
        }
    }
}
