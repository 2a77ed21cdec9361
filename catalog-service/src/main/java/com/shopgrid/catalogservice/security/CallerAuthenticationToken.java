package com.shopgrid.catalogservice.security;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.List;

public class CallerAuthenticationToken extends AbstractAuthenticationToken {

    private final AuthenticatedCaller caller;

    public CallerAuthenticationToken(AuthenticatedCaller caller) {
        super(authoritiesOf(caller.claims()));
        this.caller = caller;
        super.setAuthenticated(true);
    }

    private static List<GrantedAuthority> authoritiesOf(TokenClaims claims) {
        return List.of(new SimpleGrantedAuthority("ROLE_" + claims.getRole().name()));
    }

    @Override
    public Object getCredentials() {
        return caller.token();
    }

    @Override
    public AuthenticatedCaller getPrincipal() {
        return caller;
    }

    @Override
    public String getName() {
        return caller.subjectId();
    }
}
