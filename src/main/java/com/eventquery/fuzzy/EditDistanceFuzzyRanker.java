package com.eventquery.fuzzy;

import com.eventquery.config.EngineConfig;
import com.eventquery.query.TextSearch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 基于近似子串编辑距离的默认模糊排序。
 *
 * <p>对每个检索字段求模式串与字段值任意子串之间的最小编辑距离，除以模式串长度得到 0~1 的差异度。
 * 一行的差异度取所有字段中的最小值，差异度不超过阈值的行被保留，score = 1 - 差异度。
 */
public class EditDistanceFuzzyRanker implements FuzzyRanker {
    private final List<String> keys;
    private final double baseThreshold;
    private final double thresholdStep;

    public EditDistanceFuzzyRanker() {
        this(EngineConfig.defaults());
    }

    public EditDistanceFuzzyRanker(EngineConfig config) {
        this(config.getFuzzyKeys(), config.getFuzzyBaseThreshold(), config.getFuzzyThresholdStep());
    }

    public EditDistanceFuzzyRanker(List<String> keys, double baseThreshold, double thresholdStep) {
        this.keys = List.copyOf(keys);
        this.baseThreshold = baseThreshold;
        this.thresholdStep = thresholdStep;
    }

    /**
     * fuzziness 越大阈值越宽松，结果限制在 [0, 1]。
     */
    public double threshold(int fuzziness) {
        double threshold = baseThreshold + Math.max(0, fuzziness) * thresholdStep;
        return Math.max(0.0, Math.min(1.0, threshold));
    }

    @Override
    public List<RankedRow> rank(List<Map<String, Object>> rows, TextSearch textSearch) {
        String pattern = textSearch.query() == null ? "" : textSearch.query().trim();
        if (pattern.isEmpty()) {
            throw new IllegalArgumentException("模糊检索词不能为空");
        }
        double threshold = threshold(textSearch.fuzziness());

        List<Candidate> candidates = new ArrayList<>();
        for (int index = 0; index < rows.size(); index++) {
            Map<String, Object> row = rows.get(index);
            double bestDistance = Double.MAX_VALUE;
            List<FuzzyMatch> matches = new ArrayList<>();
            for (String key : keys) {
                Object value = row.get(key);
                if (value == null) {
                    continue;
                }
                String text = value.toString();
                Alignment alignment = align(pattern, text);
                if (alignment.end() <= alignment.start()) {
                    continue;
                }
                double distance = (double) alignment.errors() / pattern.length();
                if (distance <= threshold) {
                    matches.add(new FuzzyMatch(key, text, List.of(new MatchSpan(alignment.start(), alignment.end() - 1))));
                    bestDistance = Math.min(bestDistance, distance);
                }
            }
            if (!matches.isEmpty()) {
                candidates.add(new Candidate(index, bestDistance, matches));
            }
        }

        candidates.sort(Comparator.comparingDouble(Candidate::distance).thenComparingInt(Candidate::index));
        List<RankedRow> ranked = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            ranked.add(new RankedRow(candidate.index(), 1.0 - candidate.distance(), candidate.matches()));
        }
        return ranked;
    }

    /**
     * 近似子串匹配（Sellers 算法）：文本中任意位置开始的对齐不计代价，
     * 返回最小错误数以及对应子串的 [start, end) 区间。字符比较忽略大小写。
     */
    static Alignment align(String pattern, String text) {
        int patternLength = pattern.length();
        int textLength = text.length();
        int[] previous = new int[textLength + 1];
        int[] previousStart = new int[textLength + 1];
        int[] current = new int[textLength + 1];
        int[] currentStart = new int[textLength + 1];

        for (int column = 0; column <= textLength; column++) {
            previous[column] = 0;
            previousStart[column] = column;
        }

        for (int row = 1; row <= patternLength; row++) {
            current[0] = row;
            currentStart[0] = 0;
            char patternChar = pattern.charAt(row - 1);
            for (int column = 1; column <= textLength; column++) {
                int cost = sameIgnoringCase(patternChar, text.charAt(column - 1)) ? 0 : 1;
                int substitute = previous[column - 1] + cost;
                int skipPattern = previous[column] + 1;
                int skipText = current[column - 1] + 1;

                if (substitute <= skipPattern && substitute <= skipText) {
                    current[column] = substitute;
                    currentStart[column] = previousStart[column - 1];
                } else if (skipPattern <= skipText) {
                    current[column] = skipPattern;
                    currentStart[column] = previousStart[column];
                } else {
                    current[column] = skipText;
                    currentStart[column] = currentStart[column - 1];
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
            swap = previousStart;
            previousStart = currentStart;
            currentStart = swap;
        }

        int bestEnd = 0;
        for (int column = 1; column <= textLength; column++) {
            if (previous[column] < previous[bestEnd]) {
                bestEnd = column;
            }
        }
        return new Alignment(previous[bestEnd], previousStart[bestEnd], bestEnd);
    }

    private static boolean sameIgnoringCase(char left, char right) {
        return left == right
                || Character.toLowerCase(left) == Character.toLowerCase(right)
                || Character.toUpperCase(left) == Character.toUpperCase(right);
    }

    record Alignment(int errors, int start, int end) {
    }

    private record Candidate(int index, double distance, List<FuzzyMatch> matches) {
    }
}
