package com.shopgrid.catalogservice.security;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Identity assertion decoded from a verified access token.
 * Only {@link TokenVerifier} builds these; claims absent from the token surface as empty optionals.
 */
@Value
@Builder
public class TokenClaims {

    String subjectId;

    Role role;

    Set<Long> shopIds;

    TokenType tokenType;

    Instant expiresAt;

    public Optional<Set<Long>> getShopIds() {
        return Optional.ofNullable(shopIds);
    }

    public Optional<TokenType> getTokenType() {
        return Optional.ofNullable(tokenType);
    }

    public Optional<Instant> getExpiresAt() {
        return Optional.ofNullable(expiresAt);
    }

    public boolean isShopOwner() {
        return role == Role.SHOP_OWNER;
    }
}
