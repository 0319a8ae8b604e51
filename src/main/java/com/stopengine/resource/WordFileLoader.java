package com.stopengine.resource;

import com.stopengine.config.Constants;
import com.stopengine.error.ErrorKind;
import com.stopengine.error.MissingResourceFileException;
import com.stopengine.error.StopwordException;
import com.stopengine.text.TurkishCaseNormalizer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 读取按行分隔的 UTF-8 词表，忽略空行与 # 注释行。
 */
public final class WordFileLoader {

    private WordFileLoader() {
    }

    /**
     * 加载词表并逐行归一化。
     *
     * @param path 词表文件
     * @param caseSensitive 为 true 时仅去除首尾空白，否则按土耳其语规则转小写
     * @return 不可变词集合
     */
    public static Set<String> load(Path path, boolean caseSensitive) {
        if (!Files.isRegularFile(path)) {
            throw new MissingResourceFileException(path);
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException exception) {
            throw new StopwordException(ErrorKind.IO, "Failed to load stopwords from '" + path + "'.", exception);
        }

        Set<String> entries = new HashSet<>();
        for (String line : lines) {
            String stripped = line.strip();
            if (stripped.isEmpty() || stripped.startsWith(Constants.COMMENT_PREFIX)) {
                continue;
            }
            entries.add(normalize(stripped, caseSensitive));
        }
        return Set.copyOf(entries);
    }

    /**
     * 大小写不敏感模式下按土耳其语规则转小写，否则原样返回。
     */
    public static String normalize(String word, boolean caseSensitive) {
        return caseSensitive ? word : TurkishCaseNormalizer.lower(word);
    }
}
