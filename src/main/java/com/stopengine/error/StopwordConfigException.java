package com.stopengine.error;

/**
 * 参数组合非法或导出格式不受支持。
 */
public class StopwordConfigException extends StopwordException {

    public StopwordConfigException(String message) {
        super(ErrorKind.CONFIG, message);
    }
}
