package com.hrplatform.infrastructure.security;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Raw attributes of the stored user record, as handed over by the authentication layer.
 *
 * <p>Values are untrusted strings; {@link AccessContextFactory} validates them.
 */
@Value
@Builder
public class UserAttributes {

    public static final String USER_ID = "user_id";
    public static final String USERNAME = "username";
    public static final String ROLE = "role";
    public static final String DATA_SCOPE = "data_scope";
    public static final String DEPARTMENT_ID = "department_id";
    public static final String EMPLOYEE_ID = "employee_id";
    public static final String CAN_VIEW_SENSITIVE = "can_view_sensitive";
    public static final String PERMISSIONS = "permissions";

    String userId;
    String username;
    String role;
    String dataScope;
    String departmentId;
    String employeeId;
    Boolean canViewSensitive;

    @Singular
    List<String> permissions;

    /**
     * Read attributes from token claims using the stored column names.
     */
    public static UserAttributes fromClaims(Map<String, Object> claims) {
        UserAttributesBuilder builder = UserAttributes.builder()
            .userId(asString(claims.get(USER_ID)))
            .username(asString(claims.get(USERNAME)))
            .role(asString(claims.get(ROLE)))
            .dataScope(asString(claims.get(DATA_SCOPE)))
            .departmentId(asString(claims.get(DEPARTMENT_ID)))
            .employeeId(asString(claims.get(EMPLOYEE_ID)))
            .canViewSensitive(asBoolean(claims.get(CAN_VIEW_SENSITIVE)));

        Object rawPermissions = claims.get(PERMISSIONS);
        if (rawPermissions instanceof Collection) {
            builder.permissions(((Collection<?>) rawPermissions).stream()
                .filter(p -> p != null)
                .map(Object::toString)
                .collect(Collectors.toList()));
        }
        return builder.build();
    }

    private static String asString(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    private static Boolean asBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue() != 0;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }
}
