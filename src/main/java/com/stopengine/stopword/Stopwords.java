package com.stopengine.stopword;

import com.stopengine.config.StopwordConfig;
import com.stopengine.error.StopwordConfigException;
import com.stopengine.resource.BundledResources;
import com.stopengine.resource.MetadataDocument;
import com.stopengine.resource.ResourceGraphResolver;
import com.stopengine.resource.WordFileLoader;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 停用词入口
 * 
 * 绑定一个资源图解析器与一份元数据，提供资源加载、单词判定、列表与序列过滤。
 * 宿主应用可自行构造并注入；defaultInstance() 提供基于内置资源的惰性单例。
 */
public class Stopwords {
    private static volatile Stopwords defaultInstance;

    private final ResourceGraphResolver resolver;
    private final Path metadataPath;
    private final String defaultResource;

    public Stopwords(ResourceGraphResolver resolver, Path metadataPath, String defaultResource) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.metadataPath = Objects.requireNonNull(metadataPath, "metadataPath");
        this.defaultResource = Objects.requireNonNull(defaultResource, "defaultResource");
    }

    /**
     * 按配置构造；未指定元数据路径时使用内置资源。
     */
    public static Stopwords fromConfig(StopwordConfig config, ResourceGraphResolver resolver) {
        Path path = config.getMetadataPath() != null ? config.getMetadataPath() : BundledResources.metadataPath();
        return new Stopwords(resolver, path, config.getDefaultResource());
    }

    /**
     * 进程级默认实例，首次访问时按系统属性/环境变量/内置资源初始化。
     */
    public static Stopwords defaultInstance() {
        Stopwords instance = defaultInstance;
        if (instance == null) {
            synchronized (Stopwords.class) {
                instance = defaultInstance;
                if (instance == null) {
                    instance = fromConfig(StopwordConfig.fromEnvironment(), new ResourceGraphResolver());
                    defaultInstance = instance;
                }
            }
        }
        return instance;
    }

    /**
     * 共享同一解析器缓存、指向另一份元数据的实例。
     */
    public Stopwords withMetadata(Path otherMetadataPath) {
        return new Stopwords(resolver, otherMetadataPath, defaultResource);
    }

    public ResourceGraphResolver getResolver() {
        return resolver;
    }

    public Path getMetadataPath() {
        return metadataPath;
    }

    public String getDefaultResource() {
        return defaultResource;
    }

    public MetadataDocument metadata() {
        return resolver.metadata(metadataPath);
    }

    public Set<String> loadResource(String resourceName) {
        return loadResource(resourceName, false);
    }

    public Set<String> loadResource(String resourceName, boolean caseSensitive) {
        return resolver.resolve(metadataPath, resourceName, caseSensitive);
    }

    public Set<String> loadResources(Collection<String> resourceNames, boolean caseSensitive) {
        return resolver.resolveAll(metadataPath, resourceNames, caseSensitive);
    }

    /**
     * 默认资源的大小写不敏感词集合。
     */
    public Set<String> baseStopwords() {
        return loadResource(defaultResource, false);
    }

    public boolean isStopword(String token) {
        return isStopword(token, null, false);
    }

    /**
     * 判断单词是否属于所选资源；resources 为空时使用默认资源。
     */
    public boolean isStopword(String token, Collection<String> resources, boolean caseSensitive) {
        if (token == null) {
            return false;
        }
        String normalized = WordFileLoader.normalize(token, caseSensitive);
        if (normalized.isEmpty()) {
            return false;
        }
        return selectWords(resources, caseSensitive).contains(normalized);
    }

    public List<String> listStopwords() {
        return listStopwords(null, false, true);
    }

    public List<String> listStopwords(Collection<String> resources, boolean caseSensitive, boolean sort) {
        Set<String> words = selectWords(resources, caseSensitive);
        return sort ? words.stream().sorted().toList() : List.copyOf(words);
    }

    public List<String> removeStopwords(List<String> tokens) {
        return removeStopwords(tokens, FilterOptions.defaults());
    }

    /**
     * 过滤掉停用词，保留原顺序与原文写法。
     *
     * @throws StopwordConfigException manager 与 base/additions/keep 同时提供，或大小写模式不一致
     */
    public List<String> removeStopwords(List<String> tokens, FilterOptions options) {
        if (tokens == null) {
            return List.of();
        }
        StopwordManager manager = options.manager();
        if (manager == null) {
            boolean caseSensitive = Boolean.TRUE.equals(options.caseSensitive());
            Collection<String> base = options.base() != null
                ? options.base()
                : loadResource(defaultResource, caseSensitive);
            manager = new StopwordManager(base, options.additions(), options.keep(), caseSensitive);
        } else {
            if (options.caseSensitive() != null && options.caseSensitive() != manager.isCaseSensitive()) {
                throw new StopwordConfigException("Provided caseSensitive does not match the supplied manager.");
            }
            if (options.base() != null || options.additions() != null || options.keep() != null) {
                throw new StopwordConfigException(
                    "Cannot provide base/additions/keep when a manager instance is supplied.");
            }
        }

        List<String> filtered = new ArrayList<>();
        for (String token : tokens) {
            if (!manager.isStopword(token)) {
                filtered.add(token);
            }
        }
        return filtered;
    }

    private Set<String> selectWords(Collection<String> resources, boolean caseSensitive) {
        if (resources == null || resources.isEmpty()) {
            return loadResource(defaultResource, caseSensitive);
        }
        return loadResources(resources, caseSensitive);
    }
}
