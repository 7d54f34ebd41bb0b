package com.hrplatform.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the outbound sensitive-data interceptor.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "hr.sensitive-data")
public class SensitiveDataProperties {

    /** Apply masking to every JSON response body. */
    private boolean enabled = true;

    /** Request path prefixes whose responses are left untouched. */
    private List<String> excludedPaths = new ArrayList<>(List.of(
        "/api/auth/login",
        "/api/health",
        "/actuator",
        "/v3/api-docs"
    ));
}
