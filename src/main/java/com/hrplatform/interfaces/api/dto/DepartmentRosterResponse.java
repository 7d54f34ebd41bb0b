package com.hrplatform.interfaces.api.dto;

import com.hrplatform.domain.model.EmployeeRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Employees of one department. Members are stored records; the response advice masks them on
 * the way out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DepartmentRosterResponse {

    private String departmentId;
    private int headcount;
    private List<EmployeeRecord> members;
}
