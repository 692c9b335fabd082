package com.eventquery.fuzzy;

import java.util.List;

/**
 * 模糊排序后保留的一行：index 指向输入列表中的位置，score 越高越相关（1.0 为完全匹配）。
 */
public record RankedRow(int index, double score, List<FuzzyMatch> matches) {
    public RankedRow {
        matches = List.copyOf(matches);
    }
}
