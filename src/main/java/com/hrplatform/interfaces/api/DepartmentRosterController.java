package com.hrplatform.interfaces.api;

import com.hrplatform.application.AccessContextProvider;
import com.hrplatform.application.EmployeeApplicationService;
import com.hrplatform.interfaces.api.dto.DataResponse;
import com.hrplatform.interfaces.api.dto.DepartmentRosterResponse;
import com.hrplatform.interfaces.api.dto.ErrorResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Department roster. Returns stored employee records unprocessed; sensitive fields are masked
 * at the response boundary by {@code SensitiveDataResponseAdvice}.
 */
@RestController
@RequestMapping("/api/v1/departments")
@RequiredArgsConstructor
@Tag(name = "Departments", description = "Department rosters")
@SecurityRequirement(name = "bearerAuth")
public class DepartmentRosterController {

    private final EmployeeApplicationService employeeService;
    private final AccessContextProvider accessContextProvider;

    @GetMapping(value = "/{departmentId}/roster", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Department roster", description = "Members of a department within the caller's data scope")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Roster"),
        @ApiResponse(
            responseCode = "403",
            description = "Department is outside the caller's data scope",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<DataResponse<DepartmentRosterResponse>> roster(@PathVariable("departmentId") String departmentId) {
        return ResponseEntity.ok(DataResponse.ok(
            employeeService.departmentRoster(departmentId, accessContextProvider.getCurrentContext())));
    }
}
