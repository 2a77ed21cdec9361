package com.shopgrid.catalogservice.security;

import com.shopgrid.catalogservice.config.JwtProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Verifies access tokens issued by the identity service.
 *
 * Verification is local: the HMAC key and the accepted algorithm come from {@link JwtProperties}
 * and are fixed at construction. No network calls are made.
 */
@Slf4j
@Component
public class TokenVerifier {

    static final String USER_ID_CLAIM = "user_id";
    static final String ROLE_CLAIM = "role";
    static final String SHOP_IDS_CLAIM = "shop_ids";
    static final String TYPE_CLAIM = "type";

    private static final Set<String> HMAC_ALGORITHMS = Set.of("HS256", "HS384", "HS512");

    private final JwtParser parser;
    private final String algorithm;

    public TokenVerifier(JwtProperties properties) {
        if (!HMAC_ALGORITHMS.contains(properties.algorithm())) {
            throw new IllegalStateException("Unsupported token algorithm: " + properties.algorithm());
        }
        SecretKey key = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
        this.parser = Jwts.parser().verifyWith(key).build();
        this.algorithm = properties.algorithm();
    }

    /**
     * Verifies the token and decodes its claims.
     *
     * @param rawToken the token without the {@code Bearer} prefix
     * @return the claims carried by the token
     * @throws MalformedAuthorizationHeaderException if the token is null or blank
     * @throws InvalidTokenException                 if the token fails verification or carries malformed claims
     * @throws WrongTokenTypeException               if the token declares a type other than {@code access}
     */
    public TokenClaims verify(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            throw new MalformedAuthorizationHeaderException();
        }

        Jws<Claims> jws;
        try {
            jws = parser.parseSignedClaims(rawToken.trim());
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token verification failed: {}", e.getMessage());
            throw new InvalidTokenException(e);
        }

        String tokenAlgorithm = jws.getHeader().getAlgorithm();
        if (!algorithm.equals(tokenAlgorithm)) {
            log.debug("Token rejected: algorithm {} does not match configured {}", tokenAlgorithm, algorithm);
            throw new InvalidTokenException();
        }

        Claims payload = jws.getPayload();

        Object type = payload.get(TYPE_CLAIM);
        TokenType tokenType = null;
        if (type != null && !"".equals(type)) {
            tokenType = TokenType.fromClaim(type);
            if (tokenType != TokenType.ACCESS) {
                throw new WrongTokenTypeException();
            }
        }

        Date expiration = payload.getExpiration();
        return TokenClaims.builder()
                .subjectId(subjectOf(payload))
                .role(Role.fromClaim(payload.get(ROLE_CLAIM)))
                .shopIds(shopIdsOf(payload.get(SHOP_IDS_CLAIM)))
                .tokenType(tokenType)
                .expiresAt(expiration != null ? expiration.toInstant() : null)
                .build();
    }

    private static String subjectOf(Claims payload) {
        Object userId = payload.get(USER_ID_CLAIM);
        if (userId instanceof String || userId instanceof Number) {
            return userId.toString();
        }
        if (userId != null) {
            throw new InvalidTokenException();
        }
        String subject = payload.getSubject();
        if (subject == null || subject.isBlank()) {
            log.debug("Token rejected: neither user_id nor sub present");
            throw new InvalidTokenException();
        }
        return subject;
    }

    // shop_ids may be a single integer or a list of integers / numeric strings
    private static Set<Long> shopIdsOf(Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Collection<?> values)) {
            return Set.of(toShopId(value));
        }
        Set<Long> shopIds = new LinkedHashSet<>();
        for (Object element : values) {
            shopIds.add(toShopId(element));
        }
        return Collections.unmodifiableSet(shopIds);
    }

    private static long toShopId(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return (long) d;
            }
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                throw new InvalidTokenException(e);
            }
        }
        throw new InvalidTokenException();
    }
}
