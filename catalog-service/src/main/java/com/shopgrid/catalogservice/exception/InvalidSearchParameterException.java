package com.shopgrid.catalogservice.exception;

/**
 * Exception thrown when search query parameters cannot be parsed (non-numeric or out of range lat/lng/radius)
 * HTTP Status: 400 Bad Request (set in GlobalExceptionHandler)
 */
public class InvalidSearchParameterException extends IllegalArgumentException {

    public InvalidSearchParameterException(String message) {
        super(message);
    }
}
