package com.shopgrid.catalogservice.security;

/**
 * Signature, algorithm, expiry or claim shape did not check out.
 */
public class InvalidTokenException extends TokenAuthenticationException {

    static final String MESSAGE = "Invalid or expired token.";

    public InvalidTokenException() {
        super(MESSAGE);
    }

    public InvalidTokenException(Throwable cause) {
        super(MESSAGE, cause);
    }
}
