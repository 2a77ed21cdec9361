package com.shopgrid.catalogservice.security;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("BearerTokenAuthenticationFilter Unit Tests")
class BearerTokenAuthenticationFilterTest {

    @Mock
    private TokenVerifier tokenVerifier;
    @Mock
    private AuthenticationEntryPoint entryPoint;
    @Mock
    private FilterChain chain;

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Nested
    @DisplayName("Header Parsing")
    class HeaderParsingTests {

        @Test
        @DisplayName("should accept the bearer scheme case-insensitively")
        void shouldAcceptBearerScheme() {
            assertThat(BearerTokenAuthenticationFilter.extractToken("Bearer abc.def.ghi")).isEqualTo("abc.def.ghi");
            assertThat(BearerTokenAuthenticationFilter.extractToken("bearer   abc")).isEqualTo("abc");
        }

        @Test
        @DisplayName("should reject other schemes and wrong part counts")
        void shouldRejectMalformedHeaders() {
            assertThatThrownBy(() -> BearerTokenAuthenticationFilter.extractToken("Basic dXNlcjpwYXNz"))
                    .isInstanceOf(MalformedAuthorizationHeaderException.class)
                    .hasMessage("Invalid Authorization header format.");
            assertThatThrownBy(() -> BearerTokenAuthenticationFilter.extractToken("Bearer"))
                    .isInstanceOf(MalformedAuthorizationHeaderException.class);
            assertThatThrownBy(() -> BearerTokenAuthenticationFilter.extractToken("Bearer a b"))
                    .isInstanceOf(MalformedAuthorizationHeaderException.class);
        }
    }

    @Nested
    @DisplayName("Filtering")
    class FilteringTests {

        @Test
        @DisplayName("should continue anonymously without an Authorization header")
        void shouldContinueAnonymously() throws Exception {
            BearerTokenAuthenticationFilter filter = new BearerTokenAuthenticationFilter(tokenVerifier, entryPoint);
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/products");
            MockHttpServletResponse response = new MockHttpServletResponse();

            filter.doFilter(request, response, chain);

            verify(chain).doFilter(request, response);
            verifyNoInteractions(tokenVerifier, entryPoint);
            assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        }

        @Test
        @DisplayName("should install the caller as principal for a valid token")
        void shouldInstallCaller() throws Exception {
            BearerTokenAuthenticationFilter filter = new BearerTokenAuthenticationFilter(tokenVerifier, entryPoint);
            TokenClaims claims = TokenClaims.builder().subjectId("42").role(Role.SHOP_OWNER).build();
            when(tokenVerifier.verify("good")).thenReturn(claims);

            MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/products");
            request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer good");
            MockHttpServletResponse response = new MockHttpServletResponse();

            // the context is checked inside the chain, before the filter returns
            doAnswer(invocation -> {
                Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
                assertThat(authentication.isAuthenticated()).isTrue();
                assertThat(authentication.getAuthorities())
                        .extracting(Object::toString)
                        .containsExactly("ROLE_SHOP_OWNER");
                AuthenticatedCaller caller = (AuthenticatedCaller) authentication.getPrincipal();
                assertThat(caller.subjectId()).isEqualTo("42");
                assertThat(caller.token()).isEqualTo("good");
                return null;
            }).when(chain).doFilter(request, response);

            filter.doFilter(request, response, chain);

            verify(chain).doFilter(request, response);
        }

        @Test
        @DisplayName("should stop the request when the token is rejected")
        void shouldStopOnRejectedToken() throws Exception {
            BearerTokenAuthenticationFilter filter = new BearerTokenAuthenticationFilter(tokenVerifier, entryPoint);
            InvalidTokenException failure = new InvalidTokenException();
            when(tokenVerifier.verify("bad")).thenThrow(failure);

            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/products");
            request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer bad");
            MockHttpServletResponse response = new MockHttpServletResponse();

            filter.doFilter(request, response, chain);

            verify(entryPoint).commence(eq(request), eq(response), eq(failure));
            verify(chain, never()).doFilter(any(), any());
            assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        }
    }
}
