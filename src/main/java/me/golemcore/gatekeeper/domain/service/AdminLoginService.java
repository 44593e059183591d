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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gatekeeper.domain.model.ActorIdentity;
import me.golemcore.gatekeeper.domain.model.AdminAccount;
import me.golemcore.gatekeeper.domain.model.FailureOutcome;
import me.golemcore.gatekeeper.domain.model.LockoutStatus;
import me.golemcore.gatekeeper.domain.model.LoginAttempt;
import me.golemcore.gatekeeper.domain.model.LoginResult;
import me.golemcore.gatekeeper.domain.model.LoginStatus;
import me.golemcore.gatekeeper.domain.model.SecurityEventLevel;
import me.golemcore.gatekeeper.domain.model.SecurityEventType;
import me.golemcore.gatekeeper.domain.model.SessionClaims;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Admin login flow.
 *
 * <p>
 * Order of checks:
 * <ol>
 * <li>blocklist (durable block)</li>
 * <li>attempt tracker (temporary lockout)</li>
 * <li>input shape</li>
 * <li>account configuration</li>
 * <li>email and password, always both evaluated</li>
 * <li>TOTP, when a secret is configured</li>
 * </ol>
 *
 * <p>
 * Every credential failure is counted against the actor. Once the cumulative
 * count reaches {@code gatekeeper.login.auto-block-threshold} the actor is
 * blocked durably. A success clears the actor's counters.
 *
 * <p>
 * Blocking: performs storage and PBKDF2 work on the calling thread. Callers on
 * an event loop must move it to a bounded elastic scheduler.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminLoginService {

    static final String SOURCE = "auth";
    static final String AUTO_BLOCK_REASON = "repeated_failed_login";
    private static final int USER_AGENT_MAX_LENGTH = 100;

    private final AdminAccount adminAccount;
    private final PasswordVerifier passwordVerifier;
    private final TotpVerifier totpVerifier;
    private final SessionTokenService sessionTokenService;
    private final LoginAttemptTracker attemptTracker;
    private final BlocklistService blocklistService;
    private final SecurityAuditService auditService;
    private final GatekeeperProperties properties;
    private final Clock clock;

    public boolean isTotpRequired() {
        return adminAccount.isTotpEnabled();
    }

    public LoginResult login(LoginAttempt attempt) {
        ActorIdentity actor = attempt.getActor();
        String actorKey = actor.getActorKeyHash();

        if (blocklistService.isBlocked(actorKey)) {
            auditService.record(SecurityEventLevel.WARN, SOURCE, SecurityEventType.BLOCKED_IP, actor,
                    Map.of("path", "/api/auth/login"));
            return LoginResult.failure(LoginStatus.BLOCKED);
        }

        LockoutStatus lockout = attemptTracker.checkAllowed(actorKey);
        if (!lockout.isAllowed()) {
            auditService.record(SecurityEventLevel.WARN, SOURCE, SecurityEventType.RATE_LIMITED, actor,
                    Map.of("retryAfter", lockout.getRetryAfterSeconds()));
            return LoginResult.rateLimited(lockout.getRetryAfterSeconds());
        }

        if (isBlank(attempt.getEmail()) || isBlank(attempt.getPassword())) {
            return LoginResult.failure(LoginStatus.MALFORMED_INPUT);
        }

        if (!adminAccount.isConfigured()) {
            log.error("[Auth] Admin account is not configured (email or password hash missing)");
            return LoginResult.failure(LoginStatus.MISCONFIGURED);
        }

        boolean emailMatches = normalizeEmail(attempt.getEmail()).equals(normalizeEmail(adminAccount.getEmail()));
        boolean passwordMatches = passwordVerifier.verify(attempt.getPassword(), adminAccount.getCredential());
        if (!emailMatches || !passwordMatches) {
            String reason = !emailMatches ? "bad_email" : "bad_password";
            int remaining = handleFailure(attempt, reason);
            return LoginResult.failure(LoginStatus.INVALID_CREDENTIALS, remaining);
        }

        if (adminAccount.isTotpEnabled()) {
            if (isBlank(attempt.getTotp())) {
                return LoginResult.failure(LoginStatus.SECOND_FACTOR_REQUIRED);
            }
            if (!totpVerifier.verify(attempt.getTotp().trim(), adminAccount.getTotpSecret())) {
                int remaining = handleFailure(attempt, "bad_totp");
                return LoginResult.failure(LoginStatus.INVALID_SECOND_FACTOR, remaining);
            }
        }

        attemptTracker.clear(actorKey);
        String token = sessionTokenService.issue(adminAccount.getEmail(), SessionClaims.ADMIN_ROLE);
        long ttl = sessionTokenService.getTtlSeconds();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("tokenExpiresIn", ttl);
        if (actor.getUserAgent() != null) {
            details.put("userAgent", SecurityAuditService.truncate(actor.getUserAgent(), USER_AGENT_MAX_LENGTH));
        }
        auditService.record(SecurityEventLevel.INFO, SOURCE, SecurityEventType.ADMIN_LOGIN_SUCCESS, actor, details);
        log.info("[Auth] Admin login succeeded");
        return LoginResult.success(token, ttl);
    }

    private int handleFailure(LoginAttempt attempt, String reason) {
        ActorIdentity actor = attempt.getActor();
        FailureOutcome outcome = attemptTracker.recordFailure(actor.getActorKeyHash());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason);
        details.put("attemptedEmail", SecurityAuditService.sanitizeEmail(attempt.getEmail()));
        details.put("failCount", outcome.windowCount());
        details.put("cumulativeFailures", outcome.cumulativeFailures());
        auditService.record(SecurityEventLevel.WARN, SOURCE, SecurityEventType.FAILED_LOGIN, actor, details);

        if (outcome.cumulativeFailures() >= properties.getLogin().getAutoBlockThreshold()) {
            autoBlock(actor, outcome);
        }
        return outcome.remainingAttempts();
    }

    private void autoBlock(ActorIdentity actor, FailureOutcome outcome) {
        Duration duration = properties.getLogin().getAutoBlockDuration();
        Instant expiresAt = clock.instant().plus(duration);
        boolean persisted = blocklistService.block(actor.getActorKeyHash(), AUTO_BLOCK_REASON, expiresAt);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("failCount", outcome.cumulativeFailures());
        details.put("blockDuration", formatDuration(duration));
        details.put("expiresAt", expiresAt.toString());
        details.put("persisted", persisted);
        auditService.record(SecurityEventLevel.ALERT, SOURCE, SecurityEventType.AUTO_BLOCKED, actor, details);

        if (persisted) {
            attemptTracker.clear(actor.getActorKeyHash());
        } else {
            log.error("[Auth] Auto-block could not be stored; the actor stays under lockout only");
        }
    }

    private static String formatDuration(Duration duration) {
        if (duration.toMinutesPart() == 0 && duration.toSecondsPart() == 0) {
            return duration.toHours() + "h";
        }
        return duration.toMinutes() + "m";
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
