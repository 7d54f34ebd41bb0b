package com.hrplatform.interfaces.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Request DTO for creating an employee. Sensitive attributes arrive in plaintext and are
 * encrypted before storage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateEmployeeRequest {

    @NotBlank(message = "Employee number is required")
    @Size(max = 50, message = "Employee number must not exceed 50 characters")
    private String employeeNumber;

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name must not exceed 100 characters")
    private String name;

    @NotBlank(message = "Phone is required")
    @Pattern(regexp = "^[0-9+\\- ]{6,20}$", message = "Phone must be 6 to 20 digits")
    private String phone;

    @NotBlank(message = "ID card number is required")
    @Size(min = 15, max = 18, message = "ID card number must be 15 to 18 characters")
    private String idCard;

    @Size(max = 32, message = "Bank account must not exceed 32 characters")
    private String bankAccount;

    private LocalDate birthDate;

    @NotBlank(message = "Department is required")
    private String departmentId;

    @Size(max = 100, message = "Position must not exceed 100 characters")
    private String position;

    @Email(message = "Email must be valid")
    @Size(max = 255, message = "Email must not exceed 255 characters")
    private String email;

    @Size(max = 255, message = "Address must not exceed 255 characters")
    private String address;

    @Size(max = 100, message = "Emergency contact must not exceed 100 characters")
    private String emergencyContact;

    @Pattern(regexp = "^[0-9+\\- ]{6,20}$", message = "Emergency contact phone must be 6 to 20 digits")
    private String emergencyContactPhone;

    private LocalDate entryDate;
}
