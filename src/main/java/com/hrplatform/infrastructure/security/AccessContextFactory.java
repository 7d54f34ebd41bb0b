package com.hrplatform.infrastructure.security;

import com.hrplatform.domain.model.DataScope;
import com.hrplatform.domain.model.Role;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Builds the per-request {@link AccessContext} from stored user attributes.
 *
 * <p>Performs no I/O. Anything missing or unrecognised resolves to the restrictive side:
 * <ul>
 *   <li>no role: scope {@code self}, no permissions, no sensitive access</li>
 *   <li>no or unknown scope: {@code self}</li>
 *   <li>unknown explicit grants: dropped</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessContextFactory {

    private final PermissionCatalog permissionCatalog;

    public AccessContext build(UserAttributes attributes) {
        if (attributes == null) {
            return AccessContext.anonymous();
        }

        Optional<Role> role = Role.fromCode(attributes.getRole());
        if (role.isEmpty()) {
            log.warn("User {} has no recognised role; applying most restrictive access", attributes.getUserId());
            return AccessContext.builder()
                .requestId(UUID.randomUUID())
                .userId(attributes.getUserId())
                .dataScope(DataScope.SELF)
                .ownerIdentity(attributes.getEmployeeId())
                .departmentId(attributes.getDepartmentId())
                .canViewSensitive(false)
                .permissions(PermissionSet.empty())
                .build();
        }

        DataScope scope = DataScope.fromCode(attributes.getDataScope()).orElseGet(() -> {
            log.warn("User {} has missing or unknown data scope; defaulting to self", attributes.getUserId());
            return DataScope.SELF;
        });

        PermissionSet permissions = permissionCatalog.permissionsFor(role.get())
            .union(explicitGrants(attributes));

        return AccessContext.builder()
            .requestId(UUID.randomUUID())
            .userId(attributes.getUserId())
            .role(role.get())
            .dataScope(scope)
            .departmentId(attributes.getDepartmentId())
            .ownerIdentity(attributes.getEmployeeId())
            .canViewSensitive(Boolean.TRUE.equals(attributes.getCanViewSensitive()))
            .permissions(permissions)
            .build();
    }

    private PermissionSet explicitGrants(UserAttributes attributes) {
        List<String> raw = attributes.getPermissions();
        if (raw == null || raw.isEmpty()) {
            return PermissionSet.empty();
        }

        List<String> valid = raw.stream()
            .filter(grant -> {
                boolean ok = PermissionSet.isValidGrant(grant);
                if (!ok) {
                    log.warn("Dropping unknown permission grant '{}' for user {}", grant, attributes.getUserId());
                }
                return ok;
            })
            .collect(Collectors.toList());
        return PermissionSet.parse(valid);
    }
}
