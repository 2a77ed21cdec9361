package com.shopgrid.catalogservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Verification settings shared with the identity service.
 * Bound once at startup, never changed afterwards.
 *
 * @param secret    HMAC key the identity service signs access tokens with
 * @param algorithm the only JWS algorithm accepted (HS256, HS384 or HS512)
 */
@Validated
@ConfigurationProperties(prefix = "catalog.security.jwt")
public record JwtProperties(
        @NotBlank String secret,
        @DefaultValue("HS256") String algorithm) {
}
