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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gatekeeper.domain.model.SecurityEventLevel;
import me.golemcore.gatekeeper.domain.model.SecurityEventType;
import me.golemcore.gatekeeper.domain.model.SessionClaims;
import me.golemcore.gatekeeper.domain.model.TokenError;
import me.golemcore.gatekeeper.domain.model.TokenVerificationResult;
import me.golemcore.gatekeeper.domain.service.SecurityAuditService;
import me.golemcore.gatekeeper.domain.service.SessionTokenService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reactive WebFilter that extracts and verifies the bearer session token from
 * the Authorization header, setting the SecurityContext for downstream
 * handlers.
 *
 * <p>
 * A rejected token does not end the exchange here: the reason is left in
 * {@link #AUTH_ERROR_ATTRIBUTE} for the authentication entry point, and
 * requests to {@code /api/admin/**} are audited.
 */
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter implements WebFilter {

    public static final String CLAIMS_ATTRIBUTE = "gatekeeper.sessionClaims";
    public static final String AUTH_ERROR_ATTRIBUTE = "gatekeeper.authError";
    static final String INVALID_CREDENTIALS = "Invalid credentials";
    static final String ADMIN_PATH_PREFIX = "/api/admin/";
    private static final String BEARER_PREFIX = "Bearer ";

    private final SessionTokenService sessionTokenService;
    private final SecurityAuditService auditService;
    private final ActorResolver actorResolver;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String token = extractToken(exchange.getRequest());
        TokenVerificationResult result = token != null ? sessionTokenService.verify(token) : null;

        if (result != null && result.isValid()) {
            SessionClaims claims = result.getClaims();
            exchange.getAttributes().put(CLAIMS_ATTRIBUTE, claims);
            Authentication auth = new UsernamePasswordAuthenticationToken(
                    claims.getEmail(), null, List.of(new SimpleGrantedAuthority("ROLE_ADMIN")));
            return chain.filter(exchange)
                    .contextWrite(ReactiveSecurityContextHolder.withAuthentication(auth));
        }

        String error = result != null && result.getError() == TokenError.EXPIRED
                ? TokenError.EXPIRED.getDescription()
                : INVALID_CREDENTIALS;
        exchange.getAttributes().put(AUTH_ERROR_ATTRIBUTE, error);

        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        if (path.startsWith(ADMIN_PATH_PREFIX)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("path", path);
            details.put("reason", result != null ? result.getError().name() : "MISSING_TOKEN");
            auditService.record(SecurityEventLevel.WARN, "admin", SecurityEventType.UNAUTHORIZED_ADMIN_ACCESS,
                    actorResolver.resolve(exchange.getRequest()), details);
        }
        return chain.filter(exchange);
    }

    private String extractToken(ServerHttpRequest request) {
        String authHeader = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            String token = authHeader.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }
}
