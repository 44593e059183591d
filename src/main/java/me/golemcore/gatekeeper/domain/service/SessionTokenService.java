package me.golemcore.gatekeeper.domain.service;

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

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.io.Encoders;
import io.jsonwebtoken.security.SignatureException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gatekeeper.domain.model.SessionClaims;
import me.golemcore.gatekeeper.domain.model.TokenError;
import me.golemcore.gatekeeper.domain.model.TokenVerificationResult;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;

/**
 * Issues and verifies stateless admin session tokens (HS256 JWT).
 *
 * <p>
 * Token layout: {@code base64url(header).base64url(payload).base64url(hmac)}
 * with header {@code {"typ":"JWT","alg":"HS256"}} and payload
 * {@code {sub, email, role, iat, exp}}. There is no server-side session store
 * and no revocation: a token is valid until {@code exp}.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class SessionTokenService {

    private static final int MIN_SECRET_BYTES = 32;
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String CLAIM_EMAIL = "email";
    private static final String CLAIM_ROLE = "role";

    private final GatekeeperProperties properties;
    private final Clock clock;
    private SecretKey signingKey;

    public SessionTokenService(GatekeeperProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        String secret = properties.getJwt().getSecret();
        if (secret == null || secret.isBlank()) {
            byte[] randomBytes = new byte[64];
            new SecureRandom().nextBytes(randomBytes);
            secret = Base64.getEncoder().encodeToString(randomBytes);
            log.warn("[Auth] No JWT secret configured - generated ephemeral secret (tokens won't survive restart)");
        }
        // HMAC zero-pads short keys to the block size, so padding keeps signatures
        // identical to HMAC over the raw secret.
        byte[] keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < MIN_SECRET_BYTES) {
            byte[] padded = new byte[MIN_SECRET_BYTES];
            System.arraycopy(keyBytes, 0, padded, 0, keyBytes.length);
            keyBytes = padded;
        }
        this.signingKey = new SecretKeySpec(keyBytes, HMAC_ALGORITHM);
    }

    public long getTtlSeconds() {
        return properties.getJwt().getTtl().toSeconds();
    }

    /**
     * Issue an admin session token with the configured lifetime.
     */
    public String issue(String email, String role) {
        return issue(email, role, getTtlSeconds());
    }

    public String issue(String email, String role, long ttlSeconds) {
        long now = clock.instant().getEpochSecond();
        return Jwts.builder()
                .header().type("JWT").and()
                .subject(SessionClaims.ADMIN_SUBJECT)
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_ROLE, role)
                .issuedAt(new Date(now * 1000L))
                .expiration(new Date((now + ttlSeconds) * 1000L))
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Check structure, then signature, then expiry, then role.
     */
    public TokenVerificationResult verify(String token) {
        if (token == null || token.isBlank()) {
            return TokenVerificationResult.invalid(TokenError.MALFORMED_TOKEN);
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3 || parts[0].isEmpty() || parts[1].isEmpty() || parts[2].isEmpty()) {
            return TokenVerificationResult.invalid(TokenError.MALFORMED_TOKEN);
        }
        if (!isCanonicalSignature(parts[2])) {
            return TokenVerificationResult.invalid(TokenError.BAD_SIGNATURE);
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .clock(this::nowTruncatedToSeconds)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            return TokenVerificationResult.invalid(TokenError.EXPIRED);
        } catch (SignatureException e) {
            return TokenVerificationResult.invalid(TokenError.BAD_SIGNATURE);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("[Auth] Unparseable token: {}", e.getMessage());
            return TokenVerificationResult.invalid(TokenError.MALFORMED_TOKEN);
        }

        if (claims.getExpiration() == null || claims.getIssuedAt() == null) {
            return TokenVerificationResult.invalid(TokenError.MALFORMED_TOKEN);
        }
        Object role = claims.get(CLAIM_ROLE);
        if (!SessionClaims.ADMIN_ROLE.equals(role)) {
            return TokenVerificationResult.invalid(TokenError.INSUFFICIENT_ROLE);
        }
        Object email = claims.get(CLAIM_EMAIL);

        return TokenVerificationResult.valid(SessionClaims.builder()
                .subject(claims.getSubject())
                .email(email instanceof String ? (String) email : null)
                .role(SessionClaims.ADMIN_ROLE)
                .issuedAt(claims.getIssuedAt().toInstant().getEpochSecond())
                .expiresAt(claims.getExpiration().toInstant().getEpochSecond())
                .build());
    }

    /**
     * Expiry is compared in whole seconds: a token is expired once
     * {@code exp < now}.
     */
    private Date nowTruncatedToSeconds() {
        return Date.from(Instant.ofEpochSecond(clock.instant().getEpochSecond()));
    }

    /**
     * Rejects signature segments that only decode to the right bytes, such as
     * variants differing in the unused trailing bits.
     */
    private static boolean isCanonicalSignature(String segment) {
        try {
            byte[] decoded = Decoders.BASE64URL.decode(segment);
            return Encoders.BASE64URL.encode(decoded).equals(segment);
        } catch (RuntimeException e) {
            return false;
        }
    }
}
