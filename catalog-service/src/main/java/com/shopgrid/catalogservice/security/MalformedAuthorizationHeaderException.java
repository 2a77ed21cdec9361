package com.shopgrid.catalogservice.security;

/**
 * The credential is empty or not of the form {@code Bearer <token>}.
 */
public class MalformedAuthorizationHeaderException extends TokenAuthenticationException {

    public MalformedAuthorizationHeaderException() {
        super("Invalid Authorization header format.");
    }
}
