package com.shopgrid.common.exception;

/**
 * Exception thrown when a unique value (SKU, category name or slug) is already taken
 * HTTP Status: 409 Conflict (set in GlobalExceptionHandler)
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    public DuplicateResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
