package com.hrplatform.infrastructure.security;

/**
 * Thrown when a caller's stored access attributes are inconsistent, e.g. a department scope
 * without a department. Never resolved by widening access.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
