package com.stopengine.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 按非字母、非数字、非撇号的字符序列切分文本。
 */
public class WordTokenizer implements Tokenizer {

    private static final Pattern SPLIT_PATTERN = Pattern.compile("[^\\p{L}\\p{M}\\p{N}'’]+");

    /**
     * 对文本分词，并输出原文偏移。
     */
    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        Matcher delimiterMatcher = SPLIT_PATTERN.matcher(text);
        int nextPosition = 0;
        int segmentStart = 0;

        while (delimiterMatcher.find()) {
            nextPosition = appendTokenIfValid(text, segmentStart, delimiterMatcher.start(), nextPosition, tokens);
            segmentStart = delimiterMatcher.end();
        }
        appendTokenIfValid(text, segmentStart, text.length(), nextPosition, tokens);

        return List.copyOf(tokens);
    }

    /**
     * 去除首尾撇号后追加非空词项，返回更新后的下一个位置序号。
     */
    private int appendTokenIfValid(String sourceText, int startOffset, int endOffset, int position, List<Token> tokens) {
        int start = startOffset;
        int end = endOffset;
        while (start < end && isApostrophe(sourceText.charAt(start))) {
            start++;
        }
        while (end > start && isApostrophe(sourceText.charAt(end - 1))) {
            end--;
        }
        if (start >= end) {
            return position;
        }

        tokens.add(new Token(sourceText.substring(start, end), position, start, end));
        return position + 1;
    }

    private boolean isApostrophe(char ch) {
        return ch == '\'' || ch == '’';
    }
}
