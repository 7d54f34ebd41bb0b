package com.hrplatform.application.exceptions;

/**
 * Raised when a resource with the same unique key already exists.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }
}
