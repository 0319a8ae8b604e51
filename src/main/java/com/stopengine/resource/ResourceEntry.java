package com.stopengine.resource;

import com.stopengine.config.Constants;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 元数据中的单个资源声明。
 *
 * @param name 资源名
 * @param file 相对元数据目录的词表文件，可为 null
 * @param extendsNames 父资源名，声明顺序不影响结果
 * @param alias 重定向目标资源名，可为 null
 * @param description 说明文字，仅供展示
 * @param declaredFields 条目中实际出现的字段名
 */
public record ResourceEntry(
    String name,
    String file,
    List<String> extendsNames,
    String alias,
    String description,
    Set<String> declaredFields
) {

    public ResourceEntry {
        extendsNames = List.copyOf(extendsNames);
        declaredFields = Set.copyOf(declaredFields);
    }

    public boolean isAlias() {
        return alias != null;
    }

    public boolean hasFile() {
        return file != null;
    }

    /**
     * 条目既无文件、父资源也无别名时视为空声明。
     */
    public boolean isEmptyDeclaration() {
        return !isAlias() && !hasFile() && extendsNames.isEmpty();
    }

    /**
     * 返回 alias 条目中除 alias 与 description 外的字段，按字母序排列。
     */
    public List<String> aliasConflicts() {
        Set<String> conflicts = new TreeSet<>(declaredFields);
        conflicts.remove(Constants.FIELD_ALIAS);
        conflicts.remove(Constants.FIELD_DESCRIPTION);
        return List.copyOf(conflicts);
    }

    /**
     * 解析本条目前必须先解析的资源名。
     */
    public List<String> dependencies() {
        return isAlias() ? List.of(alias) : extendsNames;
    }
}
