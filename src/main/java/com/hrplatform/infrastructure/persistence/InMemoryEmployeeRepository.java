package com.hrplatform.infrastructure.persistence;

import com.hrplatform.domain.model.EmployeeRecord;
import com.hrplatform.domain.model.SensitiveFieldType;
import com.hrplatform.domain.repository.EmployeeRepository;
import com.hrplatform.infrastructure.security.ScopeFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Adapter implementing {@link EmployeeRepository} over a concurrent map.
 *
 * <p>Scope filters are applied as predicates before results leave the adapter, the way a SQL
 * adapter would add them to the WHERE clause.
 */
@Repository
@Slf4j
public class InMemoryEmployeeRepository implements EmployeeRepository {

    private static final Comparator<EmployeeRecord> BY_EMPLOYEE_NUMBER =
        Comparator.comparing(EmployeeRecord::getEmployeeNumber, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(EmployeeRecord::getEmployeeId);

    private final Map<String, EmployeeRecord> employees = new ConcurrentHashMap<>();

    @Override
    public Optional<EmployeeRecord> findById(String employeeId) {
        if (employeeId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(employees.get(employeeId));
    }

    @Override
    public List<EmployeeRecord> findAll(ScopeFilter filter) {
        log.debug("Finding employees with filter {}", filter);
        return query(filter::admits);
    }

    @Override
    public List<EmployeeRecord> findByDepartment(String departmentId, ScopeFilter filter) {
        return query(employee -> Objects.equals(employee.getDepartmentId(), departmentId) && filter.admits(employee));
    }

    @Override
    public List<EmployeeRecord> findBySearchDigest(SensitiveFieldType type, String digest, ScopeFilter filter) {
        requireSearchable(type);
        return query(employee -> hasDigest(employee, type, digest) && filter.admits(employee));
    }

    @Override
    public boolean existsBySearchDigest(SensitiveFieldType type, String digest) {
        requireSearchable(type);
        return employees.values().stream().anyMatch(employee -> hasDigest(employee, type, digest));
    }

    @Override
    public EmployeeRecord save(EmployeeRecord employee) {
        Objects.requireNonNull(employee, "Employee must not be null");
        Objects.requireNonNull(employee.getEmployeeId(), "Employee ID must not be null");
        employees.put(employee.getEmployeeId(), employee);
        log.debug("Saved employee {}", employee.getEmployeeId());
        return employee;
    }

    private List<EmployeeRecord> query(Predicate<EmployeeRecord> predicate) {
        return employees.values().stream()
            .filter(predicate)
            .sorted(BY_EMPLOYEE_NUMBER)
            .collect(Collectors.toList());
    }

    private static boolean hasDigest(EmployeeRecord employee, SensitiveFieldType type, String digest) {
        return employee.encrypted(type)
            .map(field -> Objects.equals(field.getSearchDigest(), digest))
            .orElse(false);
    }

    private static void requireSearchable(SensitiveFieldType type) {
        if (!type.isSearchable()) {
            throw new IllegalArgumentException("Field is not searchable: " + type.getFieldName());
        }
    }
}
