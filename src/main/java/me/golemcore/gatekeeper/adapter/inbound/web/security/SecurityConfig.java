package me.golemcore.gatekeeper.adapter.inbound.web.security;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import me.golemcore.gatekeeper.domain.service.BlocklistService;
import me.golemcore.gatekeeper.domain.service.SecurityAuditService;
import me.golemcore.gatekeeper.domain.service.SessionTokenService;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties;
import me.golemcore.gatekeeper.ratelimit.SourceRateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsConfigurationSource;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.List;

/**
 * Spring Security configuration (WebFlux reactive).
 *
 * <p>
 * Filter order inside the chain: CORS, per-source rate limiting, blocklist
 * gate for {@code /api/admin/**}, bearer token authentication, then
 * authorization. The custom filters are created here rather than declared as
 * beans so that WebFlux does not also register them globally.
 */
@Configuration
@EnableWebFluxSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final GatekeeperProperties properties;
    private final SessionTokenService sessionTokenService;
    private final BlocklistService blocklistService;
    private final SecurityAuditService auditService;
    private final SourceRateLimiter sourceRateLimiter;
    private final ActorResolver actorResolver;
    private final JsonResponseWriter responseWriter;

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http) {
        // CSRF disabled: authentication uses bearer tokens, never cookies
        return http
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .exceptionHandling(exceptionHandlingSpec -> exceptionHandlingSpec
                        .authenticationEntryPoint((exchange, ex) -> {
                            exchange.getResponse().getHeaders().remove(HttpHeaders.WWW_AUTHENTICATE);
                            String error = exchange.getAttributeOrDefault(
                                    JwtAuthenticationFilter.AUTH_ERROR_ATTRIBUTE,
                                    JwtAuthenticationFilter.INVALID_CREDENTIALS);
                            return responseWriter.writeError(exchange, HttpStatus.UNAUTHORIZED, error);
                        })
                        .accessDeniedHandler((exchange, ex) -> {
                            exchange.getResponse().getHeaders().remove(HttpHeaders.WWW_AUTHENTICATE);
                            return responseWriter.writeError(exchange, HttpStatus.FORBIDDEN,
                                    BlocklistWebFilter.ACCESS_DENIED);
                        }))
                .addFilterAfter(new SourceRateLimitWebFilter(sourceRateLimiter, auditService, actorResolver,
                        responseWriter), SecurityWebFiltersOrder.CORS)
                .addFilterBefore(new BlocklistWebFilter(blocklistService, auditService, actorResolver,
                        responseWriter), SecurityWebFiltersOrder.AUTHENTICATION)
                .addFilterBefore(new JwtAuthenticationFilter(sessionTokenService, auditService, actorResolver),
                        SecurityWebFiltersOrder.AUTHENTICATION)
                .authorizeExchange(exchanges -> exchanges
                        .pathMatchers("/api/auth/login", "/api/auth/mfa-status").permitAll()
                        .pathMatchers("/api/auth/verify").hasRole("ADMIN")
                        .pathMatchers("/api/admin/**").hasRole("ADMIN")
                        .anyExchange().permitAll())
                .build();
    }

    @SuppressWarnings("java:S5122") // CORS origins are configurable via gatekeeper.cors-allowed-origins
    private CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration config = new CorsConfiguration();
        String origins = properties.getCorsAllowedOrigins();
        if (origins != null && !origins.isBlank()) {
            config.setAllowedOrigins(Arrays.asList(origins.split(",")));
        } else {
            config.setAllowedOriginPatterns(List.of("*"));
        }
        config.setAllowedMethods(List.of("GET", "POST", "DELETE", "OPTIONS"));
        config.setAllowedHeaders(List.of("*"));
        config.setExposedHeaders(List.of(HttpHeaders.RETRY_AFTER));
        config.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/**", config);
        return source;
    }
}
