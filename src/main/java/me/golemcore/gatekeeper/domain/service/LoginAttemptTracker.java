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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gatekeeper.domain.model.FailedAttemptRecord;
import me.golemcore.gatekeeper.domain.model.FailureOutcome;
import me.golemcore.gatekeeper.domain.model.LockoutStatus;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties;
import me.golemcore.gatekeeper.port.outbound.FailedAttemptStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Failed login tracking per actor key, with temporary lockout.
 *
 * <p>
 * Per actor the tracker is either clear (no record), tracking failures inside
 * a lockout window, or locked once the window holds {@code maxAttempts}
 * failures. A window older than {@code lockoutDuration} starts over from zero.
 * A success clears the actor entirely.
 *
 * <p>
 * Alongside the window count, {@code cumulativeFailures} keeps counting across
 * window resets (until {@code cumulativeRetention} passes without a failure);
 * {@link AdminLoginService} promotes the actor to a durable block when it
 * reaches the auto-block threshold.
 *
 * <p>
 * State lives in a {@link FailedAttemptStore}, which may lose updates under
 * concurrent requests. Undercounting is tolerated.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoginAttemptTracker {

    private final FailedAttemptStore store;
    private final GatekeeperProperties properties;
    private final Clock clock;

    private ScheduledExecutorService sweeper;

    @PostConstruct
    void startSweeper() {
        long intervalMillis = properties.getLogin().getSweepInterval().toMillis();
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "login-attempt-sweeper");
            t.setDaemon(true);
            return t;
        });
        sweeper.scheduleAtFixedRate(this::sweep, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    void stopSweeper() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
    }

    public LockoutStatus checkAllowed(String actorKey) {
        int maxAttempts = properties.getLogin().getMaxAttempts();
        Optional<FailedAttemptRecord> existing = store.get(actorKey);
        if (existing.isEmpty()) {
            return LockoutStatus.allowed(maxAttempts);
        }

        Instant now = clock.instant();
        FailedAttemptRecord record = existing.get();
        if (isWindowExpired(record, now)) {
            store.update(actorKey, current -> current == null ? null : resetWindow(current, now));
            return LockoutStatus.allowed(maxAttempts);
        }

        if (record.getCount() >= maxAttempts) {
            return LockoutStatus.locked(retryAfterSeconds(record, now));
        }
        return LockoutStatus.allowed(maxAttempts - record.getCount());
    }

    public FailureOutcome recordFailure(String actorKey) {
        Instant now = clock.instant();
        FailedAttemptRecord updated = store.update(actorKey, current -> increment(current, now));
        int maxAttempts = properties.getLogin().getMaxAttempts();
        int remaining = Math.max(0, maxAttempts - updated.getCount());
        log.debug("[RateLimit] Failed login for {}: window={}, cumulative={}",
                actorKey, updated.getCount(), updated.getCumulativeFailures());
        return new FailureOutcome(updated.getCount(), updated.getCumulativeFailures(), remaining);
    }

    public void clear(String actorKey) {
        store.remove(actorKey);
    }

    /**
     * Evict records with no activity for longer than both the lockout window
     * and the cumulative retention.
     */
    public int sweep() {
        try {
            GatekeeperProperties.LoginProperties login = properties.getLogin();
            Duration horizon = login.getLockoutDuration().compareTo(login.getCumulativeRetention()) > 0
                    ? login.getLockoutDuration()
                    : login.getCumulativeRetention();
            return store.evictOlderThan(clock.instant().minus(horizon));
        } catch (RuntimeException e) { // NOSONAR - keep the scheduled task alive
            log.warn("[RateLimit] Attempt sweep failed: {}", e.getMessage());
            return 0;
        }
    }

    private FailedAttemptRecord increment(FailedAttemptRecord current, Instant now) {
        if (current == null) {
            return FailedAttemptRecord.builder()
                    .count(1)
                    .windowStart(now)
                    .cumulativeFailures(1)
                    .lastFailure(now)
                    .build();
        }
        FailedAttemptRecord base = isWindowExpired(current, now) ? resetWindow(current, now) : current;
        int cumulative = isCumulativeExpired(base, now) ? 0 : base.getCumulativeFailures();
        return base.toBuilder()
                .count(base.getCount() + 1)
                .cumulativeFailures(cumulative + 1)
                .lastFailure(now)
                .build();
    }

    private FailedAttemptRecord resetWindow(FailedAttemptRecord record, Instant now) {
        return record.toBuilder()
                .count(0)
                .windowStart(now)
                .build();
    }

    private boolean isWindowExpired(FailedAttemptRecord record, Instant now) {
        return record.getWindowStart() == null
                || Duration.between(record.getWindowStart(), now)
                        .compareTo(properties.getLogin().getLockoutDuration()) > 0;
    }

    private boolean isCumulativeExpired(FailedAttemptRecord record, Instant now) {
        return record.getLastFailure() == null
                || Duration.between(record.getLastFailure(), now)
                        .compareTo(properties.getLogin().getCumulativeRetention()) > 0;
    }

    private long retryAfterSeconds(FailedAttemptRecord record, Instant now) {
        Instant unlockAt = record.getWindowStart().plus(properties.getLogin().getLockoutDuration());
        return Math.max(1, Duration.between(now, unlockAt).toSeconds());
    }
}
