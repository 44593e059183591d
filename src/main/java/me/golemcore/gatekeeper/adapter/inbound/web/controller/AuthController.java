package me.golemcore.gatekeeper.adapter.inbound.web.controller;

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
import me.golemcore.gatekeeper.adapter.inbound.web.dto.LoginRequest;
import me.golemcore.gatekeeper.adapter.inbound.web.dto.LoginResponse;
import me.golemcore.gatekeeper.adapter.inbound.web.dto.MfaStatusResponse;
import me.golemcore.gatekeeper.adapter.inbound.web.dto.TokenInfoResponse;
import me.golemcore.gatekeeper.adapter.inbound.web.security.ActorResolver;
import me.golemcore.gatekeeper.adapter.inbound.web.security.JwtAuthenticationFilter;
import me.golemcore.gatekeeper.domain.model.LoginAttempt;
import me.golemcore.gatekeeper.domain.model.LoginResult;
import me.golemcore.gatekeeper.domain.model.SessionClaims;
import me.golemcore.gatekeeper.domain.service.AdminLoginService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Authentication endpoints for the admin dashboard.
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final AdminLoginService loginService;
    private final ActorResolver actorResolver;

    @GetMapping("/mfa-status")
    public Mono<ResponseEntity<MfaStatusResponse>> getMfaStatus() {
        MfaStatusResponse response = MfaStatusResponse.builder()
                .totpRequired(loginService.isTotpRequired())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @PostMapping("/login")
    public Mono<ResponseEntity<LoginResponse>> login(@RequestBody LoginRequest request,
            ServerWebExchange exchange) {
        LoginAttempt attempt = LoginAttempt.builder()
                .email(request.getEmail())
                .password(request.getPassword())
                .totp(request.getTotp())
                .actor(actorResolver.resolve(exchange.getRequest()))
                .build();
        return Mono.fromCallable(() -> loginService.login(attempt))
                .subscribeOn(Schedulers.boundedElastic())
                .map(AuthController::toResponse);
    }

    @GetMapping("/verify")
    public Mono<ResponseEntity<TokenInfoResponse>> verify(ServerWebExchange exchange) {
        SessionClaims claims = exchange.getAttribute(JwtAuthenticationFilter.CLAIMS_ATTRIBUTE);
        if (claims == null) {
            return Mono.just(ResponseEntity.status(HttpStatus.UNAUTHORIZED).build());
        }
        TokenInfoResponse response = TokenInfoResponse.builder()
                .valid(true)
                .email(claims.getEmail())
                .role(claims.getRole())
                .expiresAt(claims.getExpiresAt())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    static ResponseEntity<LoginResponse> toResponse(LoginResult result) {
        return switch (result.getStatus()) {
        case SUCCESS -> ResponseEntity.ok(LoginResponse.builder()
                .token(result.getToken())
                .expiresIn(result.getExpiresInSeconds())
                .build());
        case MALFORMED_INPUT -> error(HttpStatus.BAD_REQUEST, "Email and password are required");
        case INVALID_CREDENTIALS -> ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(LoginResponse.builder()
                .error("Invalid credentials")
                .remainingAttempts(result.getRemainingAttempts())
                .build());
        case SECOND_FACTOR_REQUIRED -> ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(LoginResponse.builder()
                .error("TOTP code required")
                .totpRequired(true)
                .build());
        case INVALID_SECOND_FACTOR -> ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(LoginResponse.builder()
                .error("Invalid TOTP code")
                .remainingAttempts(result.getRemainingAttempts())
                .build());
        case RATE_LIMITED -> ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(result.getRetryAfterSeconds()))
                .body(LoginResponse.builder()
                        .error("Too many failed attempts. Try again later.")
                        .retryAfter(result.getRetryAfterSeconds())
                        .build());
        case BLOCKED -> error(HttpStatus.FORBIDDEN, "Access denied");
        case MISCONFIGURED -> error(HttpStatus.INTERNAL_SERVER_ERROR, "Server configuration error");
        };
    }

    private static ResponseEntity<LoginResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(LoginResponse.builder().error(message).build());
    }
}
