package com.hrplatform.infrastructure.security;

import com.hrplatform.domain.model.Permission;
import com.hrplatform.domain.model.SensitiveRecord;

import java.util.Collection;
import java.util.Set;

/**
 * Central authorization enforcement point for HR operations.
 *
 * <p>Every method either returns normally or throws
 * {@link TrustedSecurityKernel.PermissionDeniedException}. Decisions are audited.
 */
public interface SecurityKernel {

    void authorize(AccessContext context, Permission permission);

    /**
     * Passes if the caller holds at least one of the given permissions.
     */
    void authorizeAny(AccessContext context, Permission... permissions);

    void authorizeDepartmentAccess(AccessContext context, String departmentId);

    /**
     * Fields of the given record the caller may modify; empty if none.
     */
    Set<String> editableFields(AccessContext context, SensitiveRecord record);

    void authorizeFieldEdit(AccessContext context, SensitiveRecord record, Collection<String> fields);
}
