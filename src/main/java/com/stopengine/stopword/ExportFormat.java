package com.stopengine.stopword;

import com.stopengine.error.StopwordConfigException;

import java.util.Locale;

public enum ExportFormat {
    TXT,
    JSON;

    /**
     * 解析格式名（不区分大小写）。
     *
     * @throws StopwordConfigException 格式不受支持时抛出
     */
    public static ExportFormat parse(String value) {
        if (value != null) {
            switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "txt":
                    return TXT;
                case "json":
                    return JSON;
                default:
                    break;
            }
        }
        throw new StopwordConfigException("Unsupported export format '" + value + "'; use 'txt' or 'json'.");
    }
}
