package com.hrplatform.interfaces.api.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Partial update of an employee, keyed by public field name ({@code phone}, {@code email},
 * {@code department_id}, ...). Only the fields present are changed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateEmployeeRequest {

    @NotEmpty(message = "At least one field must be updated")
    private Map<String, String> fields;
}
