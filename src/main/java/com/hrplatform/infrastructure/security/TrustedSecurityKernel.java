package com.hrplatform.infrastructure.security;

import com.hrplatform.domain.model.Permission;
import com.hrplatform.domain.model.SensitiveRecord;
import com.hrplatform.infrastructure.audit.AuditService;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Trusted security kernel: role permissions, data scope and field-level edit rights.
 *
 * <p>Security properties guaranteed by this kernel:
 * <ol>
 *   <li>An operation runs only if the caller's effective permissions allow it</li>
 *   <li>A department outside the caller's data scope is refused, not hidden</li>
 *   <li>Updates touch only the fields the caller's update permission covers</li>
 *   <li>Every decision is written to the audit trail</li>
 * </ol>
 *
 * This class is security-critical and must be reviewed by the security team before any
 * modifications.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrustedSecurityKernel implements SecurityKernel {

    static final Set<String> DEPARTMENT_EDITABLE_FIELDS = orderedSet(
        "phone", "email", "position", "emergency_contact", "emergency_contact_phone", "address");

    static final Set<String> SELF_EDITABLE_FIELDS = orderedSet(
        "phone", "email", "address", "emergency_contact", "emergency_contact_phone");

    static final Set<String> ALL_EDITABLE_FIELDS = orderedSet(
        "name", "phone", "email", "id_card", "bank_account", "birth_date", "department_id",
        "position", "address", "emergency_contact", "emergency_contact_phone", "status", "entry_date");

    private static final String CATEGORY = "AUTHORIZATION";

    private final AuditService auditService;

    @Override
    public void authorize(AccessContext context, Permission permission) {
        log.debug("Authorization check [{}]: user={}, permission={}",
            context.getRequestId(), context.getUserId(), permission);

        if (!context.hasPermission(permission)) {
            deny(context, permission.getCode(), null, "MISSING_PERMISSION",
                "Access denied: missing permission " + permission.getCode());
        }

        grant(context, permission.getCode(), null);
    }

    @Override
    public void authorizeAny(AccessContext context, Permission... permissions) {
        String operation = Arrays.stream(permissions)
            .map(Permission::getCode)
            .collect(Collectors.joining("|"));

        if (!context.getPermissions().allowsAny(permissions)) {
            deny(context, operation, null, "MISSING_PERMISSION",
                "Access denied: requires one of " + operation);
        }

        grant(context, operation, null);
    }

    @Override
    public void authorizeDepartmentAccess(AccessContext context, String departmentId) {
        switch (context.getDataScope()) {
            case ALL:
                break;
            case DEPARTMENT:
            case SELF:
            default:
                if (!context.isInDepartment(departmentId)) {
                    deny(context, "READ_DEPARTMENT", departmentId, "OUT_OF_SCOPE",
                        "Access denied: department is outside your data scope");
                }
        }

        grant(context, "READ_DEPARTMENT", departmentId);
    }

    @Override
    public Set<String> editableFields(AccessContext context, SensitiveRecord record) {
        if (context.hasPermission(Permission.EMPLOYEES_UPDATE_ALL)) {
            return ALL_EDITABLE_FIELDS;
        }
        if (context.hasPermission(Permission.EMPLOYEES_UPDATE_DEPARTMENT)
            && context.isInDepartment(record.getDepartmentId())) {
            return DEPARTMENT_EDITABLE_FIELDS;
        }
        if (context.hasPermission(Permission.EMPLOYEES_UPDATE_SELF_LIMITED)
            && context.isOwner(record.getEmployeeId())) {
            return SELF_EDITABLE_FIELDS;
        }
        return Set.of();
    }

    @Override
    public void authorizeFieldEdit(AccessContext context, SensitiveRecord record, Collection<String> fields) {
        Set<String> editable = editableFields(context, record);
        List<String> rejected = fields.stream()
            .filter(field -> !editable.contains(field))
            .distinct()
            .collect(Collectors.toList());

        if (editable.isEmpty() || !rejected.isEmpty()) {
            log.warn("AUTHORIZATION DENIED [{}]: Field edit refused - user={}, employee={}, fields={}",
                context.getRequestId(), context.getUserId(), record.getEmployeeId(), rejected);
            auditService.record(CATEGORY, "UPDATE_FIELDS", record.getEmployeeId(),
                context.getUserId(), "DENIED reason=FIELDS_NOT_EDITABLE fields=" + rejected);
            throw new PermissionDeniedException("Access denied: you may not modify these fields", rejected);
        }

        grant(context, "UPDATE_FIELDS", record.getEmployeeId());
    }

    private void grant(AccessContext context, String operation, String resourceId) {
        log.info("AUTHORIZATION GRANTED [{}]: user={}, operation={}",
            context.getRequestId(), context.getUserId(), operation);
        auditService.record(CATEGORY, operation, resourceId, context.getUserId(), "GRANTED");
    }

    private void deny(AccessContext context, String operation, String resourceId, String reason, String message) {
        log.warn("AUTHORIZATION DENIED [{}]: user={}, operation={}, reason={}",
            context.getRequestId(), context.getUserId(), operation, reason);
        auditService.record(CATEGORY, operation, resourceId, context.getUserId(), "DENIED reason=" + reason);
        throw new PermissionDeniedException(message);
    }

    private static Set<String> orderedSet(String... fields) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(fields)));
    }

    /**
     * Exception thrown when authorization fails.
     */
    @Getter
    public static class PermissionDeniedException extends RuntimeException {

        private final List<String> rejectedFields;

        public PermissionDeniedException(String message) {
            this(message, List.of());
        }

        public PermissionDeniedException(String message, List<String> rejectedFields) {
            super(message);
            this.rejectedFields = List.copyOf(rejectedFields);
        }
    }
}
