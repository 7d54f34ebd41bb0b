package com.hrplatform.infrastructure.security;

import com.hrplatform.config.CryptoProperties;
import com.hrplatform.domain.model.DataScope;
import com.hrplatform.domain.model.EmployeeRecord;
import com.hrplatform.domain.model.ProcessingMode;
import com.hrplatform.domain.model.Role;
import com.hrplatform.domain.model.SensitiveFieldType;
import com.hrplatform.infrastructure.crypto.AesGcmCryptoService;
import com.hrplatform.infrastructure.crypto.CryptoService;
import com.hrplatform.infrastructure.crypto.EncryptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SensitiveFieldProcessorTest {

    private final PermissionCatalog catalog = new PermissionCatalog();

    private CryptoService cryptoService;
    private SensitiveFieldProcessor processor;

    @BeforeEach
    void setUp() {
        CryptoProperties properties = new CryptoProperties();
        properties.setEncryptionKey("MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=");
        properties.setSearchKey("ZmVkY2JhOTg3NjU0MzIxMGZlZGNiYTk4NzY1NDMyMTA=");
        cryptoService = new AesGcmCryptoService(properties);
        processor = new SensitiveFieldProcessor(cryptoService);
    }

    private EmployeeRecord employee(String employeeId, String departmentId) {
        return EmployeeRecord.builder()
            .employeeId(employeeId)
            .employeeNumber("EMP" + employeeId)
            .departmentId(departmentId)
            .position("Engineer")
            .entryDate(LocalDate.of(2020, 1, 1))
            .encryptedField(SensitiveFieldType.NAME, cryptoService.encryptField(SensitiveFieldType.NAME, "张三丰"))
            .encryptedField(SensitiveFieldType.PHONE, cryptoService.encryptField(SensitiveFieldType.PHONE, "13800138000"))
            .encryptedField(SensitiveFieldType.ID_NUMBER,
                cryptoService.encryptField(SensitiveFieldType.ID_NUMBER, "110101199003071234"))
            .encryptedField(SensitiveFieldType.BANK_ACCOUNT,
                cryptoService.encryptField(SensitiveFieldType.BANK_ACCOUNT, "6222021234567890"))
            .build();
    }

    private AccessContext context(Role role, DataScope scope, String departmentId, String ownerIdentity, boolean sensitive) {
        return AccessContext.builder()
            .requestId(UUID.randomUUID())
            .userId("u-" + role.getCode())
            .role(role)
            .dataScope(scope)
            .departmentId(departmentId)
            .ownerIdentity(ownerIdentity)
            .canViewSensitive(sensitive)
            .permissions(catalog.permissionsFor(role))
            .build();
    }

    private static void assertNoInternalKeys(Map<String, Object> processed) {
        for (String key : processed.keySet()) {
            assertFalse(key.endsWith("_encrypted") || key.endsWith("_hash"), "internal key leaked: " + key);
        }
    }

    @Test
    void department_manager_sees_masked_fields_outside_own_department() {
        AccessContext manager = context(Role.DEPARTMENT_MANAGER, DataScope.DEPARTMENT, "D1", "E-MGR", true);

        Map<String, Object> processed = processor.process(employee("E-2", "D2"), manager, ProcessingMode.MASK);

        assertEquals("138****8000", processed.get("phone"));
        assertEquals("张**", processed.get("name"));
        assertEquals("110***********1234", processed.get("id_card"));
        assertEquals("**** **** **** 7890", processed.get("bank_account"));
        assertFalse(processed.containsValue("张三丰"));
        assertNoInternalKeys(processed);
    }

    @Test
    void department_manager_sees_plaintext_inside_own_department() {
        AccessContext manager = context(Role.DEPARTMENT_MANAGER, DataScope.DEPARTMENT, "D1", "E-MGR", true);

        Map<String, Object> processed = processor.process(employee("E-1", "D1"), manager, ProcessingMode.MASK);

        assertEquals("13800138000", processed.get("phone"));
        assertEquals("张三丰", processed.get("name"));
        assertNoInternalKeys(processed);
    }

    @Test
    void employee_sees_own_record_in_plaintext() {
        AccessContext self = context(Role.EMPLOYEE, DataScope.SELF, "D2", "E-2", false);

        Map<String, Object> processed = processor.process(employee("E-2", "D2"), self, ProcessingMode.MASK);

        assertEquals("13800138000", processed.get("phone"));
        assertEquals("张三丰", processed.get("name"));
        assertEquals("110101199003071234", processed.get("id_card"));
        assertEquals("6222021234567890", processed.get("bank_account"));
        assertNoInternalKeys(processed);
    }

    @Test
    void employee_sees_colleague_masked() {
        AccessContext self = context(Role.EMPLOYEE, DataScope.SELF, "D2", "E-2", true);

        Map<String, Object> processed = processor.process(employee("E-3", "D2"), self, ProcessingMode.MASK);

        assertEquals("138****8000", processed.get("phone"));
    }

    @Test
    void all_scope_without_sensitive_flag_is_masked() {
        AccessContext hr = context(Role.HR_ADMIN, DataScope.ALL, "D0", "E-HR", false);

        Map<String, Object> processed = processor.process(employee("E-5", "D5"), hr, ProcessingMode.MASK);

        assertEquals("138****8000", processed.get("phone"));
        assertTrue(processor.canReveal(context(Role.HR_ADMIN, DataScope.ALL, "D0", "E-HR", true), "D5", "E-5"));
    }

    @Test
    void omit_mode_drops_fields_not_revealed() {
        AccessContext manager = context(Role.DEPARTMENT_MANAGER, DataScope.DEPARTMENT, "D1", "E-MGR", true);

        Map<String, Object> processed = processor.process(employee("E-2", "D2"), manager, ProcessingMode.OMIT);

        for (SensitiveFieldType type : SensitiveFieldType.values()) {
            assertFalse(processed.containsKey(type.getFieldName()), type.getFieldName());
        }
        assertEquals("Engineer", processed.get("position"));
        assertNoInternalKeys(processed);
    }

    @Test
    void masking_degrades_to_placeholder_when_decryption_fails() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("employee_id", "E-2");
        record.put("department_id", "D2");
        record.put("phone_encrypted", "v1:corrupted");
        record.put("phone_hash", "abc");

        Map<String, Object> processed = processor.process(record,
            context(Role.EMPLOYEE, DataScope.SELF, "D1", "E-1", false), ProcessingMode.MASK);

        assertEquals("***-****-****", processed.get("phone"));
        assertNoInternalKeys(processed);
    }

    @Test
    void reveal_propagates_decryption_failure() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("employee_id", "E-1");
        record.put("phone_encrypted", "v1:corrupted");

        assertThrows(EncryptionException.class, () -> processor.process(record,
            context(Role.EMPLOYEE, DataScope.SELF, "D1", "E-1", false), ProcessingMode.MASK));
    }

    @Test
    void plaintext_copies_under_public_names_are_not_leaked() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("employee_id", "E-2");
        record.put("phone", "13800138000");
        record.put("name_encrypted", cryptoService.encrypt("李四"));

        AccessContext other = context(Role.EMPLOYEE, DataScope.SELF, "D1", "E-1", false);

        assertEquals("138****8000", processor.process(record, other, ProcessingMode.MASK).get("phone"));
        assertFalse(processor.process(record, other, ProcessingMode.OMIT).containsKey("phone"));
    }

    @Test
    void unrecognised_storage_keys_are_stripped() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("employee_id", "E-2");
        record.put("passport_encrypted", "v1:whatever");
        record.put("passport_hash", "deadbeef");
        record.put("status", "active");

        Map<String, Object> processed = processor.process(record,
            context(Role.ADMIN, DataScope.ALL, null, null, true), ProcessingMode.MASK);

        assertEquals(Map.of("employee_id", "E-2", "status", "active"), processed);
    }

    @Test
    void process_does_not_modify_input() {
        Map<String, Object> record = employee("E-2", "D2").toAttributes();
        Map<String, Object> before = new LinkedHashMap<>(record);

        processor.process(record, context(Role.EMPLOYEE, DataScope.SELF, "D1", "E-1", false), ProcessingMode.MASK);

        assertEquals(before, record);
    }

    @Test
    void list_processing_preserves_order() {
        List<EmployeeRecord> employees = List.of(employee("E-3", "D1"), employee("E-1", "D1"), employee("E-2", "D2"));

        List<Map<String, Object>> processed = processor.processList(employees,
            context(Role.DEPARTMENT_MANAGER, DataScope.DEPARTMENT, "D1", "E-MGR", true), ProcessingMode.MASK);

        assertEquals(List.of("E-3", "E-1", "E-2"),
            processed.stream().map(m -> m.get("employee_id")).collect(Collectors.toList()));
        assertEquals("13800138000", processed.get(0).get("phone"));
        assertEquals("138****8000", processed.get(2).get("phone"));
        assertTrue(processor.processList(null, AccessContext.anonymous(), ProcessingMode.MASK).isEmpty());
    }

    @Test
    void masked_fields_fall_back_to_placeholders_when_crypto_fails() {
        CryptoService failing = mock(CryptoService.class);
        when(failing.decrypt(anyString())).thenThrow(new EncryptionException("Encrypted value failed authentication"));
        SensitiveFieldProcessor failingProcessor = new SensitiveFieldProcessor(failing);

        Map<String, Object> processed = failingProcessor.process(employee("E-2", "D2"),
            context(Role.EMPLOYEE, DataScope.SELF, "D1", "E-1", false), ProcessingMode.MASK);

        assertEquals("**", processed.get("name"));
        assertEquals("**** **** **** ****", processed.get("bank_account"));
    }
}
