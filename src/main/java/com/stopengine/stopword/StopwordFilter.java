package com.stopengine.stopword;

import com.stopengine.text.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * 按停用词管理器过滤词项序列，位置重新编号，原文偏移保持不变。
 */
public class StopwordFilter {

    private final StopwordManager manager;

    public StopwordFilter(StopwordManager manager) {
        this.manager = manager;
    }

    public List<Token> filter(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return List.of();
        }
        List<Token> kept = new ArrayList<>();
        for (Token token : tokens) {
            if (!manager.isStopword(token.term())) {
                kept.add(token.withPosition(kept.size()));
            }
        }
        return List.copyOf(kept);
    }

    public List<String> filterTerms(List<Token> tokens) {
        return filter(tokens).stream().map(Token::term).toList();
    }
}
