package com.shopgrid.catalogservice.security;

/**
 * Principal installed for requests carrying a valid access token.
 * The raw token is kept so it can be forwarded to other services unchanged.
 */
public record AuthenticatedCaller(TokenClaims claims, String token) {

    public String subjectId() {
        return claims.getSubjectId();
    }
}
