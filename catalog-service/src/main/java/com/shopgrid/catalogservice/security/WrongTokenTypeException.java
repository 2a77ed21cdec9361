package com.shopgrid.catalogservice.security;

/**
 * The token is validly signed but is not an access token (refresh token, etc.).
 */
public class WrongTokenTypeException extends TokenAuthenticationException {

    public WrongTokenTypeException() {
        super("Token is not an access token.");
    }
}
