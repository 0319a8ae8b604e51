package com.stopengine.resource;

import com.stopengine.error.ErrorKind;
import com.stopengine.error.MetadataSchemaException;
import com.stopengine.error.MissingResourceFileException;
import com.stopengine.error.PathEscapeException;
import com.stopengine.error.StopwordException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * 将资源条目中的相对文件引用解析为元数据目录内的绝对路径。
 */
public final class ResourcePathResolver {

    private ResourcePathResolver() {
    }

    /**
     * 解析并校验文件引用。
     *
     * @param reference 条目中的 file 字段
     * @param baseDir 元数据所在目录
     * @return 真实绝对路径
     * @throws PathEscapeException 规范化或跟随符号链接后位于 baseDir 之外
     * @throws MissingResourceFileException 文件不存在或不是普通文件
     */
    public static Path resolve(String reference, Path baseDir) {
        if (reference == null || reference.isBlank()) {
            throw new MetadataSchemaException("Stopword resource entry is missing its 'file'.");
        }

        Path normalizedBase = baseDir.toAbsolutePath().normalize();
        Path candidate;
        try {
            candidate = normalizedBase.resolve(reference).normalize();
        } catch (InvalidPathException exception) {
            throw new MetadataSchemaException("Stopword resource path '" + reference + "' is not a valid path.", exception);
        }

        if (!candidate.startsWith(normalizedBase)) {
            throw new PathEscapeException(reference, baseDir);
        }
        if (!Files.isRegularFile(candidate)) {
            throw new MissingResourceFileException(reference, baseDir, candidate);
        }

        Path realCandidate;
        try {
            realCandidate = candidate.toRealPath();
            if (!realCandidate.startsWith(normalizedBase.toRealPath())) {
                throw new PathEscapeException(reference, baseDir);
            }
        } catch (IOException exception) {
            throw new StopwordException(ErrorKind.IO,
                "Failed to resolve stopword resource path '" + reference + "' under '" + baseDir + "'.", exception);
        }
        return realCandidate;
    }
}
