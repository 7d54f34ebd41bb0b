package com.hrplatform.interfaces.api;

import com.hrplatform.application.AccessContextProvider;
import com.hrplatform.application.EmployeeApplicationService;
import com.hrplatform.interfaces.api.dto.CreateEmployeeRequest;
import com.hrplatform.interfaces.api.dto.DataResponse;
import com.hrplatform.interfaces.api.dto.ErrorResponse;
import com.hrplatform.interfaces.api.dto.UpdateEmployeeRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for employee operations.
 *
 * Security:
 * - All endpoints require authentication (JWT)
 * - Permissions and data scope enforced via SecurityKernel
 * - Sensitive fields masked per caller before serialization
 *
 * @author Security Team
 * @since 1.0.0
 */
@RestController
@RequestMapping("/api/v1/employees")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Employees", description = "Employee records with field-level protection")
@SecurityRequirement(name = "bearerAuth")
public class EmployeeRestController {

    private final EmployeeApplicationService employeeService;
    private final AccessContextProvider accessContextProvider;

    @PostMapping(
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Create employee",
        description = "Creates an employee; sensitive attributes are encrypted before storage"
    )
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Employee created"),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request parameters",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Access denied - missing employees.create",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Employee already exists with this ID card number",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<DataResponse<Map<String, Object>>> createEmployee(
            @Valid @RequestBody CreateEmployeeRequest request) {

        Map<String, Object> employee = employeeService.createEmployee(request, accessContextProvider.getCurrentContext());

        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(DataResponse.ok(employee, "Employee created"));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "List employees",
        description = "Lists employees within the caller's data scope"
    )
    public ResponseEntity<DataResponse<List<Map<String, Object>>>> listEmployees(
            @Parameter(description = "Restrict to one department")
            @RequestParam(value = "departmentId", required = false) String departmentId) {

        return ResponseEntity.ok(DataResponse.ok(
            employeeService.listEmployees(departmentId, accessContextProvider.getCurrentContext())));
    }

    @GetMapping(value = "/search", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Search employees",
        description = "Exact match on phone, id_card, name or bank_account within the caller's data scope"
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Matching employees"),
        @ApiResponse(
            responseCode = "400",
            description = "Field is not searchable",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<DataResponse<List<Map<String, Object>>>> searchEmployees(
            @RequestParam("field") String field,
            @RequestParam("value") String value) {

        return ResponseEntity.ok(DataResponse.ok(
            employeeService.searchEmployees(field, value, accessContextProvider.getCurrentContext())));
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Get employee by ID",
        description = "Sensitive fields are revealed or masked depending on the caller's scope"
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Employee found"),
        @ApiResponse(
            responseCode = "403",
            description = "Caller lacks a view permission",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Employee not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<DataResponse<Map<String, Object>>> getEmployee(@PathVariable("id") String id) {
        return ResponseEntity.ok(DataResponse.ok(
            employeeService.getEmployee(id, accessContextProvider.getCurrentContext())));
    }

    @PatchMapping(
        value = "/{id}",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Update employee fields",
        description = "Updates only the fields the caller's update permission covers"
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Employee updated"),
        @ApiResponse(
            responseCode = "403",
            description = "One or more fields are not editable by the caller",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Employee not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<DataResponse<Map<String, Object>>> updateEmployee(
            @PathVariable("id") String id,
            @Valid @RequestBody UpdateEmployeeRequest request) {

        Map<String, Object> employee = employeeService.updateEmployee(id, request, accessContextProvider.getCurrentContext());
        return ResponseEntity.ok(DataResponse.ok(employee, "Employee updated"));
    }
}
