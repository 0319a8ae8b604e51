package com.stopengine.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenizerTest {

    @Test
    @DisplayName("WordTokenizer: 保留原文写法")
    void testWordTokenizerKeepsOriginalCase() {
        WordTokenizer tokenizer = new WordTokenizer();

        List<Token> tokens = tokenizer.tokenize("Bu Durak güzel");

        assertEquals(3, tokens.size());
        assertToken(tokens.get(0), "Bu", 0, 0, 2);
        assertToken(tokens.get(1), "Durak", 1, 3, 8);
        assertToken(tokens.get(2), "güzel", 2, 9, 14);
    }

    @Test
    @DisplayName("WordTokenizer: 撇号留在词内，首尾撇号去除")
    void testWordTokenizerApostrophes() {
        WordTokenizer tokenizer = new WordTokenizer();

        List<Token> tokens = tokenizer.tokenize("Ankara'ya 'gidiyoruz'");

        assertEquals(2, tokens.size());
        assertToken(tokens.get(0), "Ankara'ya", 0, 0, 9);
        assertToken(tokens.get(1), "gidiyoruz", 1, 11, 20);
    }

    @Test
    @DisplayName("WordTokenizer: 标点与数字")
    void testWordTokenizerPunctuationAndDigits() {
        WordTokenizer tokenizer = new WordTokenizer();

        List<Token> tokens = tokenizer.tokenize("rt, 2024!  ve...");

        assertEquals(3, tokens.size());
        assertToken(tokens.get(0), "rt", 0, 0, 2);
        assertToken(tokens.get(1), "2024", 1, 4, 8);
        assertToken(tokens.get(2), "ve", 2, 11, 13);
        assertEquals(2, tokens.get(2).length());
    }

    @Test
    @DisplayName("WordTokenizer: 边界情况")
    void testWordTokenizerEdgeCases() {
        WordTokenizer tokenizer = new WordTokenizer();

        assertTrue(tokenizer.tokenize(null).isEmpty());
        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize("...,,,!!! ''").isEmpty());
    }

    private void assertToken(Token token, String term, int position, int startOffset, int endOffset) {
        assertEquals(term, token.term());
        assertEquals(position, token.position());
        assertEquals(startOffset, token.startOffset());
        assertEquals(endOffset, token.endOffset());
    }
}
