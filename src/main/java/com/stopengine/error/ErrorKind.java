package com.stopengine.error;

/**
 * 停用词错误类别，调用方据此决定降级或继续抛出。
 */
public enum ErrorKind {
    SCHEMA,
    UNKNOWN_RESOURCE,
    CYCLE,
    PATH_ESCAPE,
    MISSING_FILE,
    ALIAS_CONFLICT,
    CONFIG,
    IO
}
