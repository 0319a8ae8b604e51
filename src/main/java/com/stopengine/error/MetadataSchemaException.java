package com.stopengine.error;

/**
 * 元数据文档缺失、格式非法或资源条目声明不合法。
 */
public class MetadataSchemaException extends StopwordException {

    public MetadataSchemaException(String message) {
        super(ErrorKind.SCHEMA, message);
    }

    public MetadataSchemaException(String message, Throwable cause) {
        super(ErrorKind.SCHEMA, message, cause);
    }
}
