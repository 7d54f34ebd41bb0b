package com.hrplatform.application;

import com.hrplatform.application.exceptions.DuplicateResourceException;
import com.hrplatform.application.exceptions.EmployeeNotFoundException;
import com.hrplatform.domain.model.EmployeeRecord;
import com.hrplatform.domain.model.Permission;
import com.hrplatform.domain.model.ProcessingMode;
import com.hrplatform.domain.model.ResourceKind;
import com.hrplatform.domain.model.SensitiveFieldType;
import com.hrplatform.domain.repository.EmployeeRepository;
import com.hrplatform.infrastructure.audit.AuditService;
import com.hrplatform.infrastructure.crypto.CryptoService;
import com.hrplatform.infrastructure.security.AccessContext;
import com.hrplatform.infrastructure.security.ScopeFilter;
import com.hrplatform.infrastructure.security.ScopeFilterResolver;
import com.hrplatform.infrastructure.security.SecurityKernel;
import com.hrplatform.infrastructure.security.SensitiveFieldProcessor;
import com.hrplatform.interfaces.api.dto.CreateEmployeeRequest;
import com.hrplatform.interfaces.api.dto.DepartmentRosterResponse;
import com.hrplatform.interfaces.api.dto.UpdateEmployeeRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Application service for employee operations.
 *
 * <p>Orchestrates authorization, encryption and persistence. Every method receives the caller's
 * {@link AccessContext} explicitly. Sensitive attributes are encrypted before they reach the
 * repository and leave this service only as output of {@link SensitiveFieldProcessor}, except
 * for the department roster, which returns stored records for the response boundary to mask.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmployeeApplicationService {

    private static final Permission[] VIEW_PERMISSIONS = {
        Permission.EMPLOYEES_VIEW_ALL,
        Permission.EMPLOYEES_VIEW_DEPARTMENT,
        Permission.EMPLOYEES_VIEW_SELF
    };

    private final EmployeeRepository employeeRepository;
    private final CryptoService cryptoService;
    private final SecurityKernel securityKernel;
    private final ScopeFilterResolver scopeFilterResolver;
    private final SensitiveFieldProcessor sensitiveFieldProcessor;
    private final AuditService auditService;

    /**
     * Create a new employee.
     *
     * @throws DuplicateResourceException if an employee with the same ID card number exists
     */
    public Map<String, Object> createEmployee(CreateEmployeeRequest request, AccessContext context) {
        securityKernel.authorize(context, Permission.EMPLOYEES_CREATE);

        log.info("Creating employee: number={}, department={}", request.getEmployeeNumber(), request.getDepartmentId());

        // Duplicate check runs on the digest; ID numbers are never compared in plaintext
        String idDigest = cryptoService.searchDigest(request.getIdCard());
        if (employeeRepository.existsBySearchDigest(SensitiveFieldType.ID_NUMBER, idDigest)) {
            throw new DuplicateResourceException("Employee already exists with this ID card number");
        }

        EmployeeRecord.EmployeeRecordBuilder builder = EmployeeRecord.builder()
            .employeeId(UUID.randomUUID().toString())
            .employeeNumber(request.getEmployeeNumber())
            .departmentId(request.getDepartmentId())
            .position(request.getPosition())
            .email(request.getEmail())
            .address(request.getAddress())
            .emergencyContact(request.getEmergencyContact())
            .status("active")
            .entryDate(request.getEntryDate() != null ? request.getEntryDate() : LocalDate.now());

        encryptInto(builder, SensitiveFieldType.NAME, request.getName());
        encryptInto(builder, SensitiveFieldType.PHONE, request.getPhone());
        encryptInto(builder, SensitiveFieldType.ID_NUMBER, request.getIdCard());
        encryptInto(builder, SensitiveFieldType.BANK_ACCOUNT, request.getBankAccount());
        encryptInto(builder, SensitiveFieldType.EMERGENCY_CONTACT_PHONE, request.getEmergencyContactPhone());
        if (request.getBirthDate() != null) {
            encryptInto(builder, SensitiveFieldType.BIRTH_DATE, request.getBirthDate().toString());
        }

        EmployeeRecord employee = employeeRepository.save(builder.build());
        auditService.record("EMPLOYEE", "CREATE", employee.getEmployeeId(), context.getUserId(), null);

        log.info("Employee created successfully: id={}", employee.getEmployeeId());

        return sensitiveFieldProcessor.process(employee, context, ProcessingMode.MASK);
    }

    /**
     * Get employee by ID. Records outside the caller's data scope are returned masked.
     *
     * @throws EmployeeNotFoundException if no such employee exists
     */
    public Map<String, Object> getEmployee(String employeeId, AccessContext context) {
        securityKernel.authorizeAny(context, VIEW_PERMISSIONS);

        EmployeeRecord employee = employeeRepository.findById(employeeId)
            .orElseThrow(() -> new EmployeeNotFoundException(employeeId));

        return sensitiveFieldProcessor.process(employee, context, ProcessingMode.MASK);
    }

    /**
     * List employees visible to the caller, optionally narrowed to one department.
     */
    public List<Map<String, Object>> listEmployees(String departmentId, AccessContext context) {
        securityKernel.authorizeAny(context, VIEW_PERMISSIONS);

        ScopeFilter filter = scopeFilterResolver.resolve(context, ResourceKind.EMPLOYEE);
        List<EmployeeRecord> employees = departmentId == null || departmentId.isBlank()
            ? employeeRepository.findAll(filter)
            : employeeRepository.findByDepartment(departmentId, filter);

        log.debug("Listing {} employees with filter {}", employees.size(), filter);

        return sensitiveFieldProcessor.processList(employees, context, ProcessingMode.MASK);
    }

    /**
     * Exact-match search on a searchable sensitive field.
     *
     * @param fieldName public field name: {@code phone}, {@code id_card}, {@code name} or
     *                  {@code bank_account}
     */
    public List<Map<String, Object>> searchEmployees(String fieldName, String value, AccessContext context) {
        securityKernel.authorizeAny(context, VIEW_PERMISSIONS);

        SensitiveFieldType type = SensitiveFieldType.fromFieldName(fieldName)
            .filter(SensitiveFieldType::isSearchable)
            .orElseThrow(() -> new IllegalArgumentException("Field is not searchable: " + fieldName));
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Search value must not be empty");
        }

        ScopeFilter filter = scopeFilterResolver.resolve(context, ResourceKind.EMPLOYEE);
        List<EmployeeRecord> matches = employeeRepository.findBySearchDigest(type, cryptoService.searchDigest(value), filter);

        log.info("Search on {} returned {} employees", type.getFieldName(), matches.size());
        auditService.record("EMPLOYEE", "SEARCH", null, context.getUserId(), "field=" + type.getFieldName());

        return sensitiveFieldProcessor.processList(matches, context, ProcessingMode.MASK);
    }

    /**
     * Update the given fields of an employee. Every field must be editable by the caller.
     */
    public Map<String, Object> updateEmployee(String employeeId, UpdateEmployeeRequest request, AccessContext context) {
        EmployeeRecord employee = employeeRepository.findById(employeeId)
            .orElseThrow(() -> new EmployeeNotFoundException(employeeId));

        Map<String, String> changes = request.getFields();
        securityKernel.authorizeFieldEdit(context, employee, changes.keySet());

        log.info("Updating employee: id={}, fields={}", employeeId, changes.keySet());

        EmployeeRecord updated = employee;
        for (Map.Entry<String, String> change : changes.entrySet()) {
            updated = apply(updated, change.getKey(), change.getValue());
        }

        employeeRepository.save(updated);
        auditService.record("EMPLOYEE", "UPDATE", employeeId, context.getUserId(), "fields=" + changes.keySet());

        return sensitiveFieldProcessor.process(updated, context, ProcessingMode.MASK);
    }

    /**
     * Members of a department as stored records. Callers must not emit the result without
     * passing it through the response boundary.
     */
    public DepartmentRosterResponse departmentRoster(String departmentId, AccessContext context) {
        securityKernel.authorizeAny(context, Permission.DEPARTMENTS_VIEW, Permission.DEPARTMENTS_VIEW_ALL);
        securityKernel.authorizeDepartmentAccess(context, departmentId);

        ScopeFilter filter = scopeFilterResolver.resolve(context, ResourceKind.DEPARTMENT);
        List<EmployeeRecord> members = employeeRepository.findByDepartment(departmentId, filter);

        return DepartmentRosterResponse.builder()
            .departmentId(departmentId)
            .headcount(members.size())
            .members(members)
            .build();
    }

    private EmployeeRecord apply(EmployeeRecord employee, String field, String value) {
        Optional<SensitiveFieldType> sensitive = SensitiveFieldType.fromFieldName(field);
        if (sensitive.isPresent()) {
            SensitiveFieldType type = sensitive.get();
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Sensitive field must not be empty: " + field);
            }
            if (type == SensitiveFieldType.ID_NUMBER) {
                rejectDuplicateIdNumber(employee.getEmployeeId(), value);
            }
            return employee.withEncryptedField(type, cryptoService.encryptField(type, value));
        }

        EmployeeRecord.EmployeeRecordBuilder builder = employee.toBuilder();
        switch (field) {
            case "department_id":
                if (value == null || value.isBlank()) {
                    throw new IllegalArgumentException("Department must not be empty");
                }
                builder.departmentId(value);
                break;
            case "position":
                builder.position(value);
                break;
            case "email":
                builder.email(value);
                break;
            case "address":
                builder.address(value);
                break;
            case "emergency_contact":
                builder.emergencyContact(value);
                break;
            case "status":
                builder.status(value);
                break;
            case "entry_date":
                builder.entryDate(parseDate(value));
                break;
            default:
                throw new IllegalArgumentException("Unknown field: " + field);
        }
        return builder.build();
    }

    private void rejectDuplicateIdNumber(String employeeId, String idNumber) {
        boolean takenByOther = employeeRepository
            .findBySearchDigest(SensitiveFieldType.ID_NUMBER, cryptoService.searchDigest(idNumber), ScopeFilter.none())
            .stream()
            .anyMatch(other -> !other.getEmployeeId().equals(employeeId));
        if (takenByOther) {
            throw new DuplicateResourceException("Employee already exists with this ID card number");
        }
    }

    private void encryptInto(EmployeeRecord.EmployeeRecordBuilder builder, SensitiveFieldType type, String plaintext) {
        if (plaintext != null && !plaintext.isBlank()) {
            builder.encryptedField(type, cryptoService.encryptField(type, plaintext));
        }
    }

    private static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date: expected yyyy-MM-dd");
        }
    }
}
