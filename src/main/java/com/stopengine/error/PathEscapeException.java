package com.stopengine.error;

import java.nio.file.Path;

/**
 * 资源文件引用解析后位于元数据目录之外。
 */
public class PathEscapeException extends StopwordException {
    private final String reference;

    public PathEscapeException(String reference, Path baseDir) {
        super(ErrorKind.PATH_ESCAPE,
            "Stopword resource path '" + reference + "' escapes the data directory '" + baseDir + "'.");
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
