package com.hrplatform.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Bearer token settings shared with the authentication service.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "hr.security")
public class JwtProperties {

    /** HMAC-SHA256 secret; at least 32 characters. */
    @NotBlank
    @Size(min = 32, message = "JWT secret must be at least 32 characters")
    private String jwtSecret;
}
