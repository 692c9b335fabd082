package com.eventquery.fuzzy;

import java.util.List;

/**
 * 某个字段上的近似匹配：字段名、字段原值与匹配位置。
 */
public record FuzzyMatch(String key, String value, List<MatchSpan> indices) {
    public FuzzyMatch {
        indices = List.copyOf(indices);
    }
}
