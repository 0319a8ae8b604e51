package com.stopengine.resource;

import com.stopengine.error.AliasConflictException;
import com.stopengine.error.MetadataSchemaException;
import com.stopengine.error.ResourceCycleException;
import com.stopengine.error.UnknownResourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 资源图解析器
 * 
 * 沿 extends（父资源并集）与 alias（纯重定向）递归计算资源的有效词集合。
 * 使用显式工作栈代替递归，节点状态为 UNVISITED / IN_PROGRESS / RESOLVED，
 * 访问到 IN_PROGRESS 节点即判定为环。
 * 
 * 每个已完成节点的结果立即以不可变集合发布到共享缓存，失败只丢弃尚未完成的节点，
 * 已完成的兄弟节点与依赖保持有效。并发调用可能重复计算同一节点，
 * 但 putIfAbsent 保证所有调用方拿到同一个缓存实例。
 */
public class ResourceGraphResolver {
    private static final Logger logger = LoggerFactory.getLogger(ResourceGraphResolver.class);

    private final MetadataLoader metadataLoader;
    private final Map<ResolutionKey, Set<String>> resolvedSets = new ConcurrentHashMap<>();

    public ResourceGraphResolver() {
        this(new MetadataLoader());
    }

    public ResourceGraphResolver(MetadataLoader metadataLoader) {
        this.metadataLoader = Objects.requireNonNull(metadataLoader, "metadataLoader");
    }

    public MetadataLoader getMetadataLoader() {
        return metadataLoader;
    }

    /**
     * 加载（或取缓存的）元数据文档。
     */
    public MetadataDocument metadata(Path metadataPath) {
        return metadataLoader.load(metadataPath);
    }

    /**
     * 解析单个资源的有效词集合。
     *
     * @param metadataPath 元数据文件
     * @param resourceName 资源名
     * @param caseSensitive 是否区分大小写
     * @return 不可变词集合，相同键重复调用返回同一实例
     */
    public Set<String> resolve(Path metadataPath, String resourceName, boolean caseSensitive) {
        Objects.requireNonNull(resourceName, "resourceName");
        MetadataDocument document = metadataLoader.load(metadataPath);
        Set<String> cached = resolvedSets.get(new ResolutionKey(document.path(), resourceName, caseSensitive));
        if (cached != null) {
            return cached;
        }
        return resolveIteratively(document, resourceName, caseSensitive);
    }

    /**
     * 解析多个资源并合并为一个不可变集合。
     */
    public Set<String> resolveAll(Path metadataPath, Iterable<String> resourceNames, boolean caseSensitive) {
        Set<String> merged = new HashSet<>();
        for (String resourceName : resourceNames) {
            merged.addAll(resolve(metadataPath, resourceName, caseSensitive));
        }
        return Set.copyOf(merged);
    }

    /**
     * 已缓存的解析结果数量。
     */
    public int cachedSetCount() {
        return resolvedSets.size();
    }

    private Set<String> resolveIteratively(MetadataDocument document, String rootName, boolean caseSensitive) {
        Map<String, VisitState> states = new HashMap<>();
        Map<String, Set<String>> resolved = new HashMap<>();
        LinkedHashSet<String> activePath = new LinkedHashSet<>();
        Deque<Frame> workStack = new ArrayDeque<>();
        workStack.push(new Frame(rootName));

        while (!workStack.isEmpty()) {
            Frame frame = workStack.peek();

            if (frame.entry != null) {
                Set<String> words = complete(document, frame.entry, resolved, caseSensitive);
                workStack.pop();
                activePath.remove(frame.name);
                resolved.put(frame.name, publish(document, frame.name, caseSensitive, words));
                states.put(frame.name, VisitState.RESOLVED);
                continue;
            }

            VisitState state = states.getOrDefault(frame.name, VisitState.UNVISITED);
            if (state == VisitState.RESOLVED) {
                workStack.pop();
                continue;
            }
            if (state == VisitState.IN_PROGRESS) {
                List<String> chain = new ArrayList<>(activePath);
                chain.add(frame.name);
                throw new ResourceCycleException(chain);
            }

            Set<String> cached = resolvedSets.get(new ResolutionKey(document.path(), frame.name, caseSensitive));
            if (cached != null) {
                resolved.put(frame.name, cached);
                states.put(frame.name, VisitState.RESOLVED);
                workStack.pop();
                continue;
            }

            ResourceEntry entry = document.entry(frame.name)
                .orElseThrow(() -> new UnknownResourceException(frame.name));
            validate(entry);

            frame.entry = entry;
            states.put(frame.name, VisitState.IN_PROGRESS);
            activePath.add(frame.name);

            List<String> dependencies = entry.dependencies();
            for (int i = dependencies.size() - 1; i >= 0; i--) {
                workStack.push(new Frame(dependencies.get(i)));
            }
        }

        return resolved.get(rootName);
    }

    private void validate(ResourceEntry entry) {
        if (entry.isAlias()) {
            List<String> conflicts = entry.aliasConflicts();
            if (!conflicts.isEmpty()) {
                throw new AliasConflictException(entry.name(), conflicts);
            }
            return;
        }
        if (entry.isEmptyDeclaration()) {
            throw new MetadataSchemaException(
                "Stopword resource '" + entry.name() + "' must declare a 'file', 'extends' or 'alias'.");
        }
    }

    /**
     * 依赖全部完成后计算节点结果；alias 直接复用目标结果，不合并任何其他词。
     */
    private Set<String> complete(MetadataDocument document, ResourceEntry entry,
                                 Map<String, Set<String>> resolved, boolean caseSensitive) {
        if (entry.isAlias()) {
            return resolved.get(entry.alias());
        }

        Set<String> words = new HashSet<>();
        for (String parent : entry.extendsNames()) {
            words.addAll(resolved.get(parent));
        }
        if (entry.hasFile()) {
            Path wordFile = ResourcePathResolver.resolve(entry.file(), document.baseDir());
            words.addAll(WordFileLoader.load(wordFile, caseSensitive));
        }
        return Set.copyOf(words);
    }

    private Set<String> publish(MetadataDocument document, String resourceName, boolean caseSensitive, Set<String> words) {
        ResolutionKey key = new ResolutionKey(document.path(), resourceName, caseSensitive);
        Set<String> existing = resolvedSets.putIfAbsent(key, words);
        if (existing != null) {
            return existing;
        }
        logger.debug("已解析停用词资源 {} (caseSensitive={}, {} 个词)", resourceName, caseSensitive, words.size());
        return words;
    }

    private static final class Frame {
        private final String name;
        private ResourceEntry entry;

        private Frame(String name) {
            this.name = name;
        }
    }
}
