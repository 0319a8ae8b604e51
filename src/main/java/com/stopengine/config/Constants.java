package com.stopengine.config;

/**
 * 全局常量定义
 * 
 * 包含默认资源名、元数据位置、元数据字段名和导出格式参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }
    
    // ==================== 资源参数 ====================
    /** 默认停用词资源名 */
    public static final String DEFAULT_RESOURCE = "base/turkish";
    /** 内置元数据在 classpath 中的位置 */
    public static final String BUNDLED_METADATA_LOCATION = "stopwords/tr/metadata.json";
    /** 覆盖元数据路径的系统属性 */
    public static final String METADATA_PATH_PROPERTY = "stopengine.metadata";
    /** 覆盖元数据路径的环境变量 */
    public static final String METADATA_PATH_ENV = "STOPENGINE_METADATA";
    
    // ==================== 元数据字段 ====================
    /** 资源集合映射字段 */
    public static final String FIELD_SETS = "sets";
    public static final String FIELD_FILE = "file";
    public static final String FIELD_EXTENDS = "extends";
    public static final String FIELD_ALIAS = "alias";
    public static final String FIELD_DESCRIPTION = "description";
    
    // ==================== 词表文件参数 ====================
    /** 词表注释行前缀 */
    public static final String COMMENT_PREFIX = "#";
    
    // ==================== 导出参数 ====================
    /** 默认导出格式 */
    public static final String DEFAULT_EXPORT_FORMAT = "txt";
}
