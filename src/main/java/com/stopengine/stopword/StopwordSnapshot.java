package com.stopengine.stopword;

import java.util.Set;

/**
 * 停用词管理器在某一时刻的不可变配置视图，可在线程间自由共享。
 */
public record StopwordSnapshot(
    Set<String> stopwords,
    Set<String> keepWords,
    boolean caseSensitive
) {

    public StopwordSnapshot {
        stopwords = Set.copyOf(stopwords);
        keepWords = Set.copyOf(keepWords);
    }
}
