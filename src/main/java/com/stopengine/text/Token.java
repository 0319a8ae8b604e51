package com.stopengine.text;

/**
 * 保留原文写法的词项，偏移指向原始文本。
 */
public record Token(
    String term,
    int position,
    int startOffset,
    int endOffset
) {

    public int length() {
        return endOffset - startOffset;
    }

    /**
     * 以新的位置序号复制词项，偏移保持不变。
     */
    public Token withPosition(int newPosition) {
        return new Token(term, newPosition, startOffset, endOffset);
    }
}
