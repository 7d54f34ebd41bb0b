package com.hrplatform.infrastructure.persistence;

import com.hrplatform.domain.model.EmployeeRecord;
import com.hrplatform.domain.model.EncryptedField;
import com.hrplatform.domain.model.SensitiveFieldType;
import com.hrplatform.infrastructure.security.ScopeFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEmployeeRepositoryTest {

    private InMemoryEmployeeRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryEmployeeRepository();
        repository.save(employee("E-3", "EMP003", "D1", "digest-c"));
        repository.save(employee("E-1", "EMP001", "D1", "digest-a"));
        repository.save(employee("E-2", "EMP002", "D2", "digest-b"));
    }

    private static EmployeeRecord employee(String id, String number, String departmentId, String phoneDigest) {
        return EmployeeRecord.builder()
            .employeeId(id)
            .employeeNumber(number)
            .departmentId(departmentId)
            .encryptedField(SensitiveFieldType.PHONE, new EncryptedField("v1:opaque-" + id, phoneDigest))
            .build();
    }

    private static List<String> ids(List<EmployeeRecord> employees) {
        return employees.stream().map(EmployeeRecord::getEmployeeId).collect(Collectors.toList());
    }

    @Test
    void find_all_applies_scope_filter_and_orders_by_number() {
        assertEquals(List.of("E-1", "E-3", "E-2"), ids(repository.findAll(ScopeFilter.none())));
        assertEquals(List.of("E-1", "E-3"), ids(repository.findAll(new ScopeFilter.DepartmentFilter("D1"))));
        assertEquals(List.of("E-2"), ids(repository.findAll(new ScopeFilter.SelfFilter("E-2"))));
    }

    @Test
    void find_by_department_combines_with_scope_filter() {
        assertEquals(List.of("E-1", "E-3"), ids(repository.findByDepartment("D1", ScopeFilter.none())));
        assertTrue(repository.findByDepartment("D1", new ScopeFilter.SelfFilter("E-2")).isEmpty());
    }

    @Test
    void digest_lookup_respects_scope_filter() {
        assertEquals(List.of("E-2"), ids(repository.findBySearchDigest(SensitiveFieldType.PHONE, "digest-b", ScopeFilter.none())));
        assertTrue(repository.findBySearchDigest(SensitiveFieldType.PHONE, "digest-b",
            new ScopeFilter.DepartmentFilter("D1")).isEmpty());
        assertTrue(repository.existsBySearchDigest(SensitiveFieldType.PHONE, "digest-b"));
        assertFalse(repository.existsBySearchDigest(SensitiveFieldType.NAME, "digest-b"));
    }

    @Test
    void non_searchable_fields_cannot_be_looked_up() {
        assertThrows(IllegalArgumentException.class,
            () -> repository.existsBySearchDigest(SensitiveFieldType.BIRTH_DATE, "x"));
    }

    @Test
    void save_replaces_existing_record() {
        repository.save(employee("E-1", "EMP001", "D2", "digest-z"));

        assertEquals("D2", repository.findById("E-1").orElseThrow().getDepartmentId());
        assertTrue(repository.findById("missing").isEmpty());
        assertTrue(repository.findById(null).isEmpty());
    }
}
