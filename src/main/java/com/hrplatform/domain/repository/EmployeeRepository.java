package com.hrplatform.domain.repository;

import com.hrplatform.domain.model.EmployeeRecord;
import com.hrplatform.domain.model.SensitiveFieldType;
import com.hrplatform.infrastructure.security.ScopeFilter;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for employee records.
 *
 * <p>Implementations store records exactly as given: sensitive attributes arrive already
 * encrypted and leave still encrypted. Row filtering is expressed through {@link ScopeFilter}
 * and must be applied before results are returned.
 *
 * @since 1.0.0
 */
public interface EmployeeRepository {

    /**
     * Find an employee by ID without scope filtering.
     *
     * <p>Callers must run the result through {@code SensitiveFieldProcessor} before emitting it.
     */
    Optional<EmployeeRecord> findById(String employeeId);

    /**
     * All employees admitted by the filter, ordered by employee number.
     */
    List<EmployeeRecord> findAll(ScopeFilter filter);

    /**
     * Employees of one department admitted by the filter, ordered by employee number.
     */
    List<EmployeeRecord> findByDepartment(String departmentId, ScopeFilter filter);

    /**
     * Exact-match lookup on a searchable sensitive field.
     *
     * @param type field to match; must be searchable
     * @param digest search digest of the wanted value
     * @param filter row filter of the caller
     */
    List<EmployeeRecord> findBySearchDigest(SensitiveFieldType type, String digest, ScopeFilter filter);

    /**
     * Whether any employee, regardless of scope, stores the given digest for the field.
     */
    boolean existsBySearchDigest(SensitiveFieldType type, String digest);

    /**
     * Save employee (create or update).
     */
    EmployeeRecord save(EmployeeRecord employee);
}
