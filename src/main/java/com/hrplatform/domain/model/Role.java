package com.hrplatform.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Fixed set of platform roles.
 *
 * <p>Roles are identifiers only; what a role may do is decided by the permission catalog.
 *
 * @since 1.0.0
 */
public enum Role {
    ADMIN("admin"),
    HR_ADMIN("hr_admin"),
    DEPARTMENT_MANAGER("department_manager"),
    EMPLOYEE("employee");

    private final String code;

    Role(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Look up a role by its stored code.
     *
     * @param code stored role code, may be null
     * @return the role, or empty when the code is missing or unknown
     */
    public static Optional<Role> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim();
        return Arrays.stream(values())
            .filter(role -> role.code.equalsIgnoreCase(normalized))
            .findFirst();
    }
}
