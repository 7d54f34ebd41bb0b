package com.hrplatform.domain.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed enumeration of permissions used by the role/data-scope access model.
 *
 * <p>Codes follow the pattern {@code <resource>.<action>[_<scope>]}, for example
 * {@code employees.view_department}. The resource segment is what resource wildcards
 * ({@code employees.*}) match against.
 *
 * @since 1.0.0
 */
public enum Permission {

    // Employee records
    EMPLOYEES_VIEW_ALL("employees.view_all"),
    EMPLOYEES_VIEW_DEPARTMENT("employees.view_department"),
    EMPLOYEES_VIEW_SELF("employees.view_self"),
    EMPLOYEES_CREATE("employees.create"),
    EMPLOYEES_UPDATE_ALL("employees.update_all"),
    EMPLOYEES_UPDATE_DEPARTMENT("employees.update_department"),
    EMPLOYEES_UPDATE_SELF_LIMITED("employees.update_self_limited"),
    EMPLOYEES_DELETE("employees.delete"),
    EMPLOYEES_EXPORT("employees.export"),
    EMPLOYEES_EXPORT_DEPARTMENT("employees.export_department"),
    EMPLOYEES_IMPORT("employees.import"),

    // Departments
    DEPARTMENTS_VIEW("departments.view"),
    DEPARTMENTS_VIEW_ALL("departments.view_all"),
    DEPARTMENTS_MANAGE("departments.manage"),
    DEPARTMENTS_CREATE("departments.create"),
    DEPARTMENTS_UPDATE("departments.update"),
    DEPARTMENTS_DELETE("departments.delete"),

    // Reports
    REPORTS_VIEW_ALL("reports.view_all"),
    REPORTS_VIEW_DEPARTMENT("reports.view_department"),
    REPORTS_EXPORT_ALL("reports.export_all"),
    REPORTS_EXPORT_DEPARTMENT("reports.export_department"),

    // User accounts
    USERS_MANAGE("users.manage"),
    USERS_CREATE("users.create"),
    USERS_UPDATE("users.update"),
    USERS_DELETE("users.delete"),
    USERS_VIEW_ALL("users.view_all"),
    USERS_ASSIGN_ROLE("users.assign_role"),
    USERS_ASSIGN_DEPARTMENT("users.assign_department"),

    // Onboarding
    ONBOARDING_MANAGE("onboarding.manage"),
    ONBOARDING_CREATE("onboarding.create"),
    ONBOARDING_VIEW_ALL("onboarding.view_all"),
    ONBOARDING_UPDATE("onboarding.update"),
    ONBOARDING_SEND_NOTIFICATION("onboarding.send_notification");

    private static final Map<String, Permission> BY_CODE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(Permission::getCode, Function.identity()));

    private static final Set<String> RESOURCES = Arrays.stream(values())
        .map(Permission::getResource)
        .collect(Collectors.toUnmodifiableSet());

    private final String code;

    Permission(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resource segment of the code, e.g. {@code employees}.
     */
    public String getResource() {
        return code.substring(0, code.indexOf('.'));
    }

    public static Optional<Permission> fromCode(String code) {
        return Optional.ofNullable(code == null ? null : BY_CODE.get(code));
    }

    /**
     * @return true if some permission is declared under the given resource segment
     */
    public static boolean isKnownResource(String resource) {
        return resource != null && RESOURCES.contains(resource);
    }

    @Override
    public String toString() {
        return code;
    }
}
