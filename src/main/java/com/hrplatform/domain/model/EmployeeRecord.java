package com.hrplatform.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Employee as stored: plain HR attributes plus encrypted sensitive attributes.
 */
@Value
@Builder(toBuilder = true)
public class EmployeeRecord implements SensitiveRecord {

    String employeeId;
    String employeeNumber;
    String departmentId;
    String position;
    String email;
    String address;
    String emergencyContact;
    String status;
    LocalDate entryDate;

    @JsonIgnore
    @Singular
    Map<SensitiveFieldType, EncryptedField> encryptedFields;

    public Optional<EncryptedField> encrypted(SensitiveFieldType type) {
        return Optional.ofNullable(encryptedFields.get(type));
    }

    public EmployeeRecord withEncryptedField(SensitiveFieldType type, EncryptedField field) {
        return toBuilder().encryptedField(type, field).build();
    }

    @Override
    public Map<String, Object> toAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(EMPLOYEE_ID_KEY, employeeId);
        attributes.put("employee_number", employeeNumber);
        attributes.put(DEPARTMENT_ID_KEY, departmentId);
        attributes.put("position", position);
        attributes.put("email", email);
        attributes.put("address", address);
        attributes.put("emergency_contact", emergencyContact);
        attributes.put("status", status);
        attributes.put("entry_date", entryDate);
        encryptedFields.forEach((type, field) -> {
            attributes.put(type.getEncryptedKey(), field.getCiphertext());
            if (field.hasSearchDigest()) {
                attributes.put(type.getHashKey(), field.getSearchDigest());
            }
        });
        return attributes;
    }
}
