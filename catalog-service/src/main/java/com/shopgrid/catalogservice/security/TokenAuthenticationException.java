package com.shopgrid.catalogservice.security;

import org.springframework.security.core.AuthenticationException;

/**
 * Base class for bearer token rejections.
 * HTTP Status: 401 Unauthorized (set in RestAuthenticationEntryPoint and GlobalExceptionHandler)
 */
public abstract class TokenAuthenticationException extends AuthenticationException {

    protected TokenAuthenticationException(String message) {
        super(message);
    }

    protected TokenAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
