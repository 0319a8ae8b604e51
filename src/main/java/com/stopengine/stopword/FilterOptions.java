package com.stopengine.stopword;

import java.util.Collection;

/**
 * removeStopwords 的可选参数。
 * 
 * 提供 manager 时不能再提供 base/additions/keep，caseSensitive 若给出须与 manager 一致。
 */
public record FilterOptions(
    StopwordManager manager,
    Collection<String> base,
    Collection<String> additions,
    Collection<String> keep,
    Boolean caseSensitive
) {

    public static FilterOptions defaults() {
        return new FilterOptions(null, null, null, null, null);
    }

    public static FilterOptions ofManager(StopwordManager manager) {
        return new FilterOptions(manager, null, null, null, null);
    }

    public FilterOptions withBase(Collection<String> words) {
        return new FilterOptions(manager, words, additions, keep, caseSensitive);
    }

    public FilterOptions withAdditions(Collection<String> words) {
        return new FilterOptions(manager, base, words, keep, caseSensitive);
    }

    public FilterOptions withKeep(Collection<String> words) {
        return new FilterOptions(manager, base, additions, words, caseSensitive);
    }

    public FilterOptions withCaseSensitive(boolean value) {
        return new FilterOptions(manager, base, additions, keep, value);
    }
}
