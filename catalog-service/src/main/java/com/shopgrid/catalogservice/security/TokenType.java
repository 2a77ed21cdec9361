package com.shopgrid.catalogservice.security;

public enum TokenType {
    ACCESS,
    OTHER;

    static final String ACCESS_CLAIM = "access";

    static TokenType fromClaim(Object value) {
        return ACCESS_CLAIM.equals(value) ? ACCESS : OTHER;
    }
}
