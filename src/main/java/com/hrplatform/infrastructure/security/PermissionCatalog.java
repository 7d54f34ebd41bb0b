package com.hrplatform.infrastructure.security;

import com.hrplatform.domain.model.Permission;
import com.hrplatform.domain.model.Role;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

import static com.hrplatform.domain.model.Permission.*;

/**
 * Static role-to-permission mapping and the grant matching algorithm.
 *
 * <p>Permission sets are flat: roles never inherit from one another.
 *
 * @since 1.0.0
 */
@Component
public class PermissionCatalog {

    private static final Map<Role, PermissionSet> ROLE_PERMISSIONS = new EnumMap<>(Role.class);

    static {
        ROLE_PERMISSIONS.put(Role.ADMIN, PermissionSet.everything());

        ROLE_PERMISSIONS.put(Role.HR_ADMIN, PermissionSet.of(
            EMPLOYEES_VIEW_ALL,
            EMPLOYEES_CREATE,
            EMPLOYEES_UPDATE_ALL,
            EMPLOYEES_DELETE,
            EMPLOYEES_EXPORT,
            EMPLOYEES_IMPORT,
            DEPARTMENTS_VIEW_ALL,
            REPORTS_VIEW_ALL,
            REPORTS_EXPORT_ALL,
            ONBOARDING_MANAGE,
            ONBOARDING_CREATE,
            ONBOARDING_VIEW_ALL,
            ONBOARDING_UPDATE,
            ONBOARDING_SEND_NOTIFICATION
        ));

        ROLE_PERMISSIONS.put(Role.DEPARTMENT_MANAGER, PermissionSet.of(
            EMPLOYEES_VIEW_DEPARTMENT,
            EMPLOYEES_UPDATE_DEPARTMENT,
            EMPLOYEES_EXPORT_DEPARTMENT,
            DEPARTMENTS_VIEW,
            REPORTS_VIEW_DEPARTMENT,
            REPORTS_EXPORT_DEPARTMENT
        ));

        ROLE_PERMISSIONS.put(Role.EMPLOYEE, PermissionSet.of(
            EMPLOYEES_VIEW_SELF,
            EMPLOYEES_UPDATE_SELF_LIMITED,
            DEPARTMENTS_VIEW
        ));
    }

    /**
     * Default permission set of a role. Unknown or missing roles get nothing.
     */
    public PermissionSet permissionsFor(Role role) {
        if (role == null) {
            return PermissionSet.empty();
        }
        return ROLE_PERMISSIONS.getOrDefault(role, PermissionSet.empty());
    }

    public PermissionSet permissionsFor(String roleCode) {
        return Role.fromCode(roleCode)
            .map(this::permissionsFor)
            .orElse(PermissionSet.empty());
    }

    /**
     * Decide whether the held grants satisfy a required permission.
     *
     * <p>Matches when {@code held} contains {@code *}, contains {@code required} verbatim, or
     * contains {@code resource.*} where {@code required} starts with {@code resource.}. Wildcards
     * only apply to the resource segment; an empty requirement never matches.
     */
    public static boolean matches(String required, Collection<String> held) {
        if (required == null || required.isEmpty() || held == null || held.isEmpty()) {
            return false;
        }
        if (held.contains(PermissionSet.WILDCARD) || held.contains(required)) {
            return true;
        }
        for (String grant : held) {
            if (grant != null && grant.length() > PermissionSet.RESOURCE_WILDCARD_SUFFIX.length()
                    && grant.endsWith(PermissionSet.RESOURCE_WILDCARD_SUFFIX)) {
                String resourcePrefix = grant.substring(0, grant.length() - 1);
                if (required.startsWith(resourcePrefix)) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean matches(Permission required, PermissionSet held) {
        return held != null && held.allows(required);
    }
}
