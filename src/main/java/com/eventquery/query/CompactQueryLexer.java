package com.eventquery.query;

import com.eventquery.config.Constants;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class CompactQueryLexer {
    /**
     * 按空白切分简洁查询串，单引号或双引号包围的片段视为同一个 token 的一部分。
     * 未闭合的引号一直延伸到输入末尾。
     */
    public List<LexToken> tokenize(String query) {
        List<LexToken> tokens = new ArrayList<>();
        if (query == null) {
            return tokens;
        }

        int index = 0;
        while (index < query.length()) {
            if (Character.isWhitespace(query.charAt(index))) {
                index++;
                continue;
            }

            int tokenStart = index;
            while (index < query.length() && !Character.isWhitespace(query.charAt(index))) {
                char currentChar = query.charAt(index);
                if (currentChar == '"' || currentChar == '\'') {
                    index = skipQuotedSpan(query, index, currentChar);
                    continue;
                }
                index++;
            }

            String value = query.substring(tokenStart, index);
            tokens.add(new LexToken(classify(value), value, tokenStart));
        }
        return tokens;
    }

    /**
     * 跳过引号片段，返回闭合引号之后的位置。
     */
    private int skipQuotedSpan(String query, int quoteIndex, char quote) {
        int closing = query.indexOf(quote, quoteIndex + 1);
        return closing < 0 ? query.length() : closing + 1;
    }

    private TokenType classify(String value) {
        if (value.indexOf(':') >= 0) {
            return TokenType.FIELD_VALUE;
        }
        if (Constants.BOOLEAN_KEYWORDS.contains(value.toUpperCase(Locale.ROOT))) {
            return TokenType.BOOLEAN;
        }
        return TokenType.TERM;
    }
}
