package com.stopengine.resource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stopengine.config.Constants;
import com.stopengine.error.ErrorKind;
import com.stopengine.error.MetadataSchemaException;
import com.stopengine.error.StopwordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 读取并校验元数据文档，按规范化后的绝对路径缓存，缓存不失效。
 */
public class MetadataLoader {
    private static final Logger logger = LoggerFactory.getLogger(MetadataLoader.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Map<Path, MetadataDocument> documents = new ConcurrentHashMap<>();

    /**
     * 加载元数据文档，同一路径只读取一次。
     *
     * @param metadataPath 元数据文件路径
     * @return 已校验的文档
     * @throws MetadataSchemaException 文件缺失或结构非法时抛出
     */
    public MetadataDocument load(Path metadataPath) {
        if (metadataPath == null) {
            throw new MetadataSchemaException("Stopword metadata path must not be null.");
        }
        return documents.computeIfAbsent(canonicalize(metadataPath), this::read);
    }

    /**
     * 已缓存的文档数量。
     */
    public int cachedDocumentCount() {
        return documents.size();
    }

    static Path canonicalize(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        if (!Files.exists(normalized)) {
            return normalized;
        }
        try {
            return normalized.toRealPath();
        } catch (IOException exception) {
            logger.debug("无法获取真实路径，使用规范化路径: {}", normalized, exception);
            return normalized;
        }
    }

    private MetadataDocument read(Path metadataPath) {
        if (!Files.isRegularFile(metadataPath)) {
            throw new MetadataSchemaException("Stopword metadata file not found at '" + metadataPath + "'.");
        }

        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(Files.readString(metadataPath, StandardCharsets.UTF_8));
        } catch (JsonProcessingException exception) {
            throw new MetadataSchemaException(
                "Stopword metadata at '" + metadataPath + "' is not valid JSON.", exception);
        } catch (IOException exception) {
            throw new StopwordException(ErrorKind.IO,
                "Failed to read stopword metadata at '" + metadataPath + "'.", exception);
        }

        if (root == null || !root.isObject()) {
            throw new MetadataSchemaException("Stopword metadata at '" + metadataPath + "' must be a JSON object.");
        }
        JsonNode setsNode = root.get(Constants.FIELD_SETS);
        if (setsNode == null || !setsNode.isObject() || setsNode.isEmpty()) {
            throw new MetadataSchemaException(
                "Stopword metadata 'sets' at '" + metadataPath + "' must be a non-empty map.");
        }

        Map<String, ResourceEntry> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = setsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            entries.put(field.getKey(), parseEntry(field.getKey(), field.getValue()));
        }

        MetadataDocument document = new MetadataDocument(metadataPath, entries);
        logger.info("已加载停用词元数据: {} ({} 个资源)", metadataPath, entries.size());
        return document;
    }

    private ResourceEntry parseEntry(String name, JsonNode node) {
        if (!node.isObject()) {
            throw new MetadataSchemaException("Stopword resource '" + name + "' must be a JSON object.");
        }

        Set<String> declaredFields = new LinkedHashSet<>();
        node.fieldNames().forEachRemaining(declaredFields::add);

        String file = optionalText(name, node, Constants.FIELD_FILE);
        String alias = optionalText(name, node, Constants.FIELD_ALIAS);
        String description = optionalText(name, node, Constants.FIELD_DESCRIPTION);
        List<String> extendsNames = parseExtends(name, node.get(Constants.FIELD_EXTENDS));

        if (file != null && file.isBlank()) {
            throw new MetadataSchemaException("Stopword resource '" + name + "' has an empty 'file'.");
        }
        if (alias != null && alias.isBlank()) {
            throw new MetadataSchemaException("Stopword resource '" + name + "' alias cannot be empty.");
        }
        return new ResourceEntry(name, file, extendsNames, alias, description, declaredFields);
    }

    private String optionalText(String name, JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new MetadataSchemaException(
                "Stopword resource '" + name + "' field '" + field + "' must be a string.");
        }
        return value.asText();
    }

    /**
     * extends 允许单个字符串或字符串数组。
     */
    private List<String> parseExtends(String name, JsonNode value) {
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (value.isTextual()) {
            return List.of(value.asText());
        }
        if (!value.isArray()) {
            throw new MetadataSchemaException(
                "Stopword resource '" + name + "' field 'extends' must be a sequence of strings.");
        }
        List<String> parents = new ArrayList<>();
        for (JsonNode parent : value) {
            if (!parent.isTextual()) {
                throw new MetadataSchemaException(
                    "Stopword resource '" + name + "' field 'extends' must only contain strings.");
            }
            parents.add(parent.asText());
        }
        return parents;
    }
}
