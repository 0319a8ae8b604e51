package com.stopengine.text;

import java.util.List;

public interface Tokenizer {

    /**
     * 将输入文本切分为词项列表，词项保留原文大小写。
     */
    List<Token> tokenize(String text);
}
