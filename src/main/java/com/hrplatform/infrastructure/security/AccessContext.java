package com.hrplatform.infrastructure.security;

import com.hrplatform.domain.model.DataScope;
import com.hrplatform.domain.model.Permission;
import com.hrplatform.domain.model.Role;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.UUID;

/**
 * Immutable security identity of one request.
 *
 * <p>Built once after authentication and passed explicitly through every call chain. Never
 * mutated and never shared between requests.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Value
@Builder
public class AccessContext {

    @NonNull
    UUID requestId;

    String userId;

    /** Null when the stored user record carries no recognised role. */
    Role role;

    @NonNull
    DataScope dataScope;

    String departmentId;

    /** The caller's own employee identity, null for accounts without an employee record. */
    String ownerIdentity;

    boolean canViewSensitive;

    @NonNull
    PermissionSet permissions;

    /**
     * Most restrictive context: self scope, no identity, no permissions, no sensitive access.
     */
    public static AccessContext anonymous() {
        return AccessContext.builder()
            .requestId(UUID.randomUUID())
            .dataScope(DataScope.SELF)
            .permissions(PermissionSet.empty())
            .canViewSensitive(false)
            .build();
    }

    public boolean hasPermission(Permission permission) {
        return permissions.allows(permission);
    }

    /**
     * @return true if the given employee identity is the caller's own
     */
    public boolean isOwner(String employeeId) {
        return ownerIdentity != null && ownerIdentity.equals(employeeId);
    }

    public boolean isInDepartment(String otherDepartmentId) {
        return departmentId != null && departmentId.equals(otherDepartmentId);
    }
}
