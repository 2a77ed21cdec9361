package com.shopgrid.common.exception;

/**
 * Exception thrown when a caller tries to create or modify a resource they are not allowed to touch
 * HTTP Status: 403 Forbidden (set in GlobalExceptionHandler)
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
