package com.stopengine.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 停用词运行时配置
 * 
 * 支持从CLI参数、系统属性或环境变量注入，覆盖Constants默认值
 */
public class StopwordConfig {
    private Path metadataPath;
    private String defaultResource = Constants.DEFAULT_RESOURCE;
    private boolean caseSensitive;
    private String exportFormat = Constants.DEFAULT_EXPORT_FORMAT;
    
    /**
     * 元数据路径，为 null 时使用内置资源。
     */
    public Path getMetadataPath() {
        return metadataPath;
    }
    
    public void setMetadataPath(Path metadataPath) {
        this.metadataPath = metadataPath;
    }
    
    public String getDefaultResource() {
        return defaultResource;
    }
    
    public void setDefaultResource(String defaultResource) {
        this.defaultResource = defaultResource;
    }
    
    public boolean isCaseSensitive() {
        return caseSensitive;
    }
    
    public void setCaseSensitive(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
    }
    
    public String getExportFormat() {
        return exportFormat;
    }
    
    public void setExportFormat(String exportFormat) {
        this.exportFormat = exportFormat;
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static StopwordConfig defaults() {
        return new StopwordConfig();
    }

    /**
     * 在默认配置基础上应用系统属性与环境变量，系统属性优先。
     */
    public static StopwordConfig fromEnvironment() {
        StopwordConfig config = defaults();
        String override = System.getProperty(Constants.METADATA_PATH_PROPERTY);
        if (override == null || override.isBlank()) {
            override = System.getenv(Constants.METADATA_PATH_ENV);
        }
        if (override != null && !override.isBlank()) {
            config.setMetadataPath(Paths.get(override.trim()));
        }
        return config;
    }
}
