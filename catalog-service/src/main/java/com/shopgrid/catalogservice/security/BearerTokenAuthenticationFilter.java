package com.shopgrid.catalogservice.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Authenticates requests carrying {@code Authorization: Bearer <token>}.
 *
 * Requests without the header continue anonymously; the authorization rules in SecurityConfig
 * decide whether anonymous access is allowed. A header that is present but malformed, or a
 * token that fails verification, ends the request with 401 even on public endpoints.
 */
@Slf4j
@RequiredArgsConstructor
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_SCHEME = "bearer";

    private final TokenVerifier tokenVerifier;
    private final AuthenticationEntryPoint authenticationEntryPoint;
    private final WebAuthenticationDetailsSource detailsSource = new WebAuthenticationDetailsSource();

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || header.isEmpty()) {
            chain.doFilter(request, response);
            return;
        }

        try {
            String token = extractToken(header);
            TokenClaims claims = tokenVerifier.verify(token);

            CallerAuthenticationToken authentication =
                    new CallerAuthenticationToken(new AuthenticatedCaller(claims, token));
            authentication.setDetails(detailsSource.buildDetails(request));

            SecurityContext context = SecurityContextHolder.createEmptyContext();
            context.setAuthentication(authentication);
            SecurityContextHolder.setContext(context);
        } catch (TokenAuthenticationException ex) {
            SecurityContextHolder.clearContext();
            log.debug("Bearer authentication failed - Path: {} - Reason: {}", request.getRequestURI(), ex.getMessage());
            authenticationEntryPoint.commence(request, response, ex);
            return;
        }

        chain.doFilter(request, response);
    }

    static String extractToken(String header) {
        String[] parts = header.trim().split("\\s+");
        if (parts.length != 2 || !BEARER_SCHEME.equalsIgnoreCase(parts[0])) {
            throw new MalformedAuthorizationHeaderException();
        }
        return parts[1];
    }
}
