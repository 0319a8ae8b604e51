package com.stopengine.error;

import java.util.List;

/**
 * alias 条目声明了 description 以外的字段。
 */
public class AliasConflictException extends StopwordException {
    private final String resourceName;
    private final List<String> conflictingFields;

    public AliasConflictException(String resourceName, List<String> conflictingFields) {
        super(ErrorKind.ALIAS_CONFLICT,
            "Stopword alias '" + resourceName + "' cannot define additional fields: "
                + String.join(", ", conflictingFields) + ".");
        this.resourceName = resourceName;
        this.conflictingFields = List.copyOf(conflictingFields);
    }

    public String getResourceName() {
        return resourceName;
    }

    public List<String> getConflictingFields() {
        return conflictingFields;
    }
}
