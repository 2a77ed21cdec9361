package com.shopgrid.catalogservice.config;

import com.shopgrid.catalogservice.security.BearerTokenAuthenticationFilter;
import com.shopgrid.catalogservice.security.RestAuthenticationEntryPoint;
import com.shopgrid.catalogservice.security.TokenVerifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                   TokenVerifier tokenVerifier,
                                                   RestAuthenticationEntryPoint authenticationEntryPoint) throws Exception {
        http
                .authorizeHttpRequests(authorize -> authorize
                        // --- PUBLIC ENDPOINTS (GET Requests) ---
                        // listing, retrieval and search are open to anonymous callers
                        .requestMatchers(HttpMethod.GET, "/api/v1/products/**").permitAll()
                        .requestMatchers(HttpMethod.GET, "/api/v1/categories/**").permitAll()
                        .requestMatchers(HttpMethod.GET, "/media/**").permitAll()
                        .requestMatchers("/error").permitAll()

                        // --- PROTECTED ENDPOINTS ---
                        // product/category/image creation, update and deletion need a bearer token.
                        // ownership is checked in the service layer against the loaded product.
                        .requestMatchers("/api/v1/products/**").authenticated()
                        .requestMatchers("/api/v1/categories/**").authenticated()

                        .anyRequest().authenticated()
                )
                .addFilterBefore(new BearerTokenAuthenticationFilter(tokenVerifier, authenticationEntryPoint),
                        UsernamePasswordAuthenticationFilter.class)
                .exceptionHandling(exceptions -> exceptions.authenticationEntryPoint(authenticationEntryPoint))
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .csrf(csrf -> csrf.disable());

        return http.build();
    }
}
