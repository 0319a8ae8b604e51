package com.stopengine.stopword;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.stopengine.error.ErrorKind;
import com.stopengine.error.StopwordException;
import com.stopengine.resource.WordFileLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 可变停用词集合，支持追加、移除、保留词与导出。
 * 
 * 保留词优先：任何保留词都不会出现在停用词集合中，也不会被判定为停用词。
 * 实例不是线程安全的，并发修改需要调用方自行加锁，
 * 或为每个工作线程从共享的不可变基础集合构造独立实例。
 */
public class StopwordManager {
    private static final Logger logger = LoggerFactory.getLogger(StopwordManager.class);

    private static final ObjectWriter JSON_WRITER = new ObjectMapper()
        .writer(new DefaultPrettyPrinter().withArrayIndenter(DefaultIndenter.SYSTEM_LINEFEED_INSTANCE));

    private final boolean caseSensitive;
    private final Set<String> stopwords = new HashSet<>();
    private final Set<String> keepWords = new HashSet<>();

    /**
     * 以默认资源为基础、大小写不敏感创建管理器。
     */
    public StopwordManager() {
        this(null, null, null, false);
    }

    /**
     * 创建管理器。
     *
     * @param base 基础停用词，为 null 时使用默认资源
     * @param additions 额外停用词，可为 null
     * @param keep 保留词，可为 null
     * @param caseSensitive 是否区分大小写
     */
    public StopwordManager(Collection<String> base, Collection<String> additions,
                           Collection<String> keep, boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
        Collection<String> baseWords = base != null
            ? base
            : Stopwords.defaultInstance().loadResource(Stopwords.defaultInstance().getDefaultResource(), caseSensitive);
        for (String word : baseWords) {
            String normalized = normalize(word);
            if (normalized != null && !normalized.isBlank()) {
                stopwords.add(normalized);
            }
        }
        if (additions != null) {
            add(additions);
        }
        if (keep != null) {
            addKeepWords(keep);
        }
    }

    /**
     * 由文件构建：基础集合为默认资源，additionFiles 追加为停用词，keepFiles 作为保留词。
     */
    public static StopwordManager fromFiles(Collection<Path> additionFiles, Collection<Path> keepFiles,
                                            boolean caseSensitive) {
        StopwordManager manager = new StopwordManager(null, null, null, caseSensitive);
        for (Path additionFile : additionFiles) {
            manager.loadAdditions(additionFile);
        }
        for (Path keepFile : keepFiles) {
            manager.addKeepWords(WordFileLoader.load(keepFile, caseSensitive));
        }
        return manager;
    }

    /**
     * 以默认实例解析资源并合并为基础集合。
     */
    public static StopwordManager fromResources(Collection<String> resourceNames) {
        return fromResources(Stopwords.defaultInstance(), resourceNames, null, null, false);
    }

    /**
     * 解析一个或多个具名资源，合并后作为基础集合；resourceNames 为空时使用默认资源。
     */
    public static StopwordManager fromResources(Stopwords source, Collection<String> resourceNames,
                                                Collection<String> additions, Collection<String> keep,
                                                boolean caseSensitive) {
        List<String> names = resourceNames == null || resourceNames.isEmpty()
            ? List.of(source.getDefaultResource())
            : List.copyOf(resourceNames);
        Set<String> baseWords = source.loadResources(names, caseSensitive);
        return new StopwordManager(baseWords, additions, keep, caseSensitive);
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public Set<String> stopwords() {
        return Set.copyOf(stopwords);
    }

    public Set<String> keepWords() {
        return Set.copyOf(keepWords);
    }

    public boolean isStopword(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        String normalized = normalize(token);
        if (keepWords.contains(normalized)) {
            return false;
        }
        return stopwords.contains(normalized);
    }

    /**
     * 追加停用词，已在保留词中的词被跳过。
     */
    public void add(Iterable<String> words) {
        for (String word : words) {
            String normalized = normalize(word);
            if (normalized != null && !normalized.isBlank() && !keepWords.contains(normalized)) {
                stopwords.add(normalized);
            }
        }
    }

    /**
     * 移除停用词，不存在时忽略。
     */
    public void remove(Iterable<String> words) {
        for (String word : words) {
            String normalized = normalize(word);
            if (normalized != null) {
                stopwords.remove(normalized);
            }
        }
    }

    /**
     * 加入保留词，并从停用词集合中剔除同名词。
     */
    public void addKeepWords(Iterable<String> words) {
        for (String word : words) {
            String normalized = normalize(word);
            if (normalized != null && !normalized.isBlank()) {
                keepWords.add(normalized);
                stopwords.remove(normalized);
            }
        }
    }

    /**
     * 从按行分隔的词表文件追加停用词。
     */
    public void loadAdditions(Path path) {
        add(WordFileLoader.load(path, caseSensitive));
    }

    public StopwordSnapshot snapshot() {
        return new StopwordSnapshot(stopwords, keepWords, caseSensitive);
    }

    /**
     * 以有序 Map 描述当前状态，便于序列化。
     */
    public Map<String, Object> toMap() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("stopwords", sortedStopwords());
        state.put("keep_words", keepWords.stream().sorted().toList());
        state.put("case_sensitive", caseSensitive);
        return state;
    }

    /**
     * 按字典序返回当前停用词，不包含保留词。
     */
    public List<String> sortedStopwords() {
        return stopwords.stream().sorted().toList();
    }

    public void export(Path path, String format) {
        export(path, ExportFormat.parse(format));
    }

    /**
     * 导出排序后的停用词集合，保留词不会被导出。
     *
     * @param path 目标文件
     * @param format txt 为逐行文本，json 为字符串数组
     */
    public void export(Path path, ExportFormat format) {
        List<String> words = sortedStopwords();
        String content;
        try {
            content = switch (format) {
                case TXT -> String.join("\n", words) + "\n";
                case JSON -> JSON_WRITER.writeValueAsString(words) + "\n";
            };
        } catch (JsonProcessingException exception) {
            throw new StopwordException(ErrorKind.IO, "Failed to serialize stopwords for '" + path + "'.", exception);
        }

        try {
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException exception) {
            throw new StopwordException(ErrorKind.IO, "Failed to export stopwords to '" + path + "'.", exception);
        }
        logger.info("已导出 {} 个停用词到 {} (format={})", words.size(), path, format.name().toLowerCase(Locale.ROOT));
    }

    private String normalize(String word) {
        if (word == null) {
            return null;
        }
        return WordFileLoader.normalize(word, caseSensitive);
    }
}
