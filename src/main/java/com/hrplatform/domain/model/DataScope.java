package com.hrplatform.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Breadth of records a caller may see.
 */
public enum DataScope {
    ALL("all"),
    DEPARTMENT("department"),
    SELF("self");

    private final String code;

    DataScope(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<DataScope> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim();
        return Arrays.stream(values())
            .filter(scope -> scope.code.equalsIgnoreCase(normalized))
            .findFirst();
    }
}
