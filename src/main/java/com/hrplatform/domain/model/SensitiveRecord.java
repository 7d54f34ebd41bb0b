package com.hrplatform.domain.model;

import java.util.Map;

/**
 * Marker for types that carry encrypted attributes.
 *
 * <p>Anything implementing this interface is routed through sensitive-field processing before
 * it leaves the system, whether a controller processes it explicitly or the response boundary
 * catches it.
 *
 * @since 1.0.0
 */
public interface SensitiveRecord {

    String EMPLOYEE_ID_KEY = "employee_id";
    String DEPARTMENT_ID_KEY = "department_id";

    /**
     * Identity of the employee that owns the sensitive data.
     */
    String getEmployeeId();

    /**
     * Department the owning employee belongs to, may be null.
     */
    String getDepartmentId();

    /**
     * Storage-shaped attribute view: plain attributes plus {@code <field>_encrypted} and
     * {@code <field>_hash} entries. Must include {@link #EMPLOYEE_ID_KEY} and
     * {@link #DEPARTMENT_ID_KEY}.
     */
    Map<String, Object> toAttributes();
}
