package com.hrplatform.infrastructure.security;

import com.hrplatform.domain.model.DataScope;
import com.hrplatform.domain.model.Permission;
import com.hrplatform.domain.model.Role;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AccessContextFactoryTest {

    private final AccessContextFactory factory = new AccessContextFactory(new PermissionCatalog());

    @Test
    void builds_context_from_stored_attributes() {
        AccessContext context = factory.build(UserAttributes.builder()
            .userId("u-1")
            .role("department_manager")
            .dataScope("department")
            .departmentId("D1")
            .employeeId("E-100")
            .canViewSensitive(true)
            .build());

        assertEquals(Role.DEPARTMENT_MANAGER, context.getRole());
        assertEquals(DataScope.DEPARTMENT, context.getDataScope());
        assertEquals("D1", context.getDepartmentId());
        assertEquals("E-100", context.getOwnerIdentity());
        assertTrue(context.isCanViewSensitive());
        assertTrue(context.hasPermission(Permission.EMPLOYEES_VIEW_DEPARTMENT));
        assertNotNull(context.getRequestId());
    }

    @Test
    void missing_role_yields_most_restrictive_context() {
        AccessContext context = factory.build(UserAttributes.builder()
            .userId("u-2")
            .dataScope("all")
            .employeeId("E-200")
            .canViewSensitive(true)
            .permission("employees.view_all")
            .build());

        assertNull(context.getRole());
        assertEquals(DataScope.SELF, context.getDataScope());
        assertTrue(context.getPermissions().isEmpty());
        assertFalse(context.isCanViewSensitive());
    }

    @Test
    void unknown_role_is_treated_as_missing() {
        AccessContext context = factory.build(UserAttributes.builder().role("root").dataScope("all").build());

        assertEquals(DataScope.SELF, context.getDataScope());
        assertTrue(context.getPermissions().isEmpty());
    }

    @Test
    void missing_or_unknown_scope_defaults_to_self() {
        assertEquals(DataScope.SELF, factory.build(UserAttributes.builder().role("hr_admin").build()).getDataScope());
        assertEquals(DataScope.SELF,
            factory.build(UserAttributes.builder().role("hr_admin").dataScope("company").build()).getDataScope());
    }

    @Test
    void sensitive_flag_defaults_to_false() {
        AccessContext context = factory.build(UserAttributes.builder().role("hr_admin").dataScope("all").build());

        assertFalse(context.isCanViewSensitive());
    }

    @Test
    void explicit_grants_extend_role_permissions_and_unknown_grants_are_dropped() {
        AccessContext context = factory.build(UserAttributes.builder()
            .role("employee")
            .dataScope("self")
            .employeeId("E-300")
            .permissions(List.of("reports.view_department", "reports.view_everything"))
            .build());

        assertTrue(context.hasPermission(Permission.REPORTS_VIEW_DEPARTMENT));
        assertTrue(context.hasPermission(Permission.EMPLOYEES_VIEW_SELF));
        assertEquals(4, context.getPermissions().asStrings().size());
    }

    @Test
    void null_attributes_yield_anonymous_context() {
        AccessContext context = factory.build(null);

        assertEquals(DataScope.SELF, context.getDataScope());
        assertNull(context.getOwnerIdentity());
        assertTrue(context.getPermissions().isEmpty());
    }

    @Test
    void attributes_are_read_from_token_claims() {
        UserAttributes attributes = UserAttributes.fromClaims(Map.of(
            "user_id", "u-9",
            "role", "employee",
            "data_scope", "self",
            "employee_id", "E-9",
            "can_view_sensitive", "true",
            "permissions", List.of("reports.view_department")));

        assertEquals("u-9", attributes.getUserId());
        assertEquals("E-9", attributes.getEmployeeId());
        assertEquals(Boolean.TRUE, attributes.getCanViewSensitive());
        assertEquals(List.of("reports.view_department"), attributes.getPermissions());
        assertNull(attributes.getDepartmentId());
    }
}
