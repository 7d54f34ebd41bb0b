package com.hrplatform.infrastructure.security;

import com.hrplatform.domain.model.SensitiveRecord;
import lombok.NonNull;
import lombok.Value;

import java.util.Map;

/**
 * Declarative row filter produced from a caller's data scope.
 *
 * <p>Exactly three variants exist. None of them means "no rows"; the data layer applies the
 * filter as a query predicate before returning results.
 */
public interface ScopeFilter {

    enum Kind {
        NONE,
        DEPARTMENT,
        SELF
    }

    Kind getKind();

    /**
     * Column equality predicates, e.g. {@code {department_id=D1}}. Empty for {@link NoFilter}.
     */
    Map<String, Object> toCriteria();

    /**
     * Evaluate the filter against a row's owning department and employee.
     */
    boolean admits(String departmentId, String employeeId);

    default boolean admits(SensitiveRecord record) {
        return admits(record.getDepartmentId(), record.getEmployeeId());
    }

    static ScopeFilter none() {
        return NoFilter.INSTANCE;
    }

    final class NoFilter implements ScopeFilter {

        static final NoFilter INSTANCE = new NoFilter();

        private NoFilter() {
        }

        @Override
        public Kind getKind() {
            return Kind.NONE;
        }

        @Override
        public Map<String, Object> toCriteria() {
            return Map.of();
        }

        @Override
        public boolean admits(String departmentId, String employeeId) {
            return true;
        }

        @Override
        public String toString() {
            return "NoFilter";
        }
    }

    @Value
    class DepartmentFilter implements ScopeFilter {

        @NonNull
        String departmentId;

        @Override
        public Kind getKind() {
            return Kind.DEPARTMENT;
        }

        @Override
        public Map<String, Object> toCriteria() {
            return Map.of(SensitiveRecord.DEPARTMENT_ID_KEY, departmentId);
        }

        @Override
        public boolean admits(String rowDepartmentId, String employeeId) {
            return departmentId.equals(rowDepartmentId);
        }
    }

    @Value
    class SelfFilter implements ScopeFilter {

        @NonNull
        String ownerIdentity;

        @Override
        public Kind getKind() {
            return Kind.SELF;
        }

        @Override
        public Map<String, Object> toCriteria() {
            return Map.of(SensitiveRecord.EMPLOYEE_ID_KEY, ownerIdentity);
        }

        @Override
        public boolean admits(String departmentId, String employeeId) {
            return ownerIdentity.equals(employeeId);
        }
    }
}
