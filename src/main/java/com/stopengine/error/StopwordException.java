package com.stopengine.error;

/**
 * 停用词相关错误的基类，所有子类均为非受检异常。
 */
public class StopwordException extends RuntimeException {
    private final ErrorKind kind;

    public StopwordException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StopwordException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
