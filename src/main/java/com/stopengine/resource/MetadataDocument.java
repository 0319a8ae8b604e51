package com.stopengine.resource;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 已校验的元数据文档，资源条目按声明顺序保存。
 */
public record MetadataDocument(Path path, Map<String, ResourceEntry> sets) {

    public MetadataDocument {
        sets = Collections.unmodifiableMap(new LinkedHashMap<>(sets));
    }

    /**
     * 资源文件引用的根目录。
     */
    public Path baseDir() {
        Path parent = path.getParent();
        return parent != null ? parent : path.toAbsolutePath().getParent();
    }

    public Optional<ResourceEntry> entry(String resourceName) {
        return Optional.ofNullable(sets.get(resourceName));
    }

    public Set<String> resourceNames() {
        return sets.keySet();
    }
}
