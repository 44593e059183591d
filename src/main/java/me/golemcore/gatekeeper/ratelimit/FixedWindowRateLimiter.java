package me.golemcore.gatekeeper.ratelimit;

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
import me.golemcore.gatekeeper.domain.model.RateLimitResult;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties;
import me.golemcore.gatekeeper.infrastructure.config.GatekeeperProperties.RuleProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-window implementation of {@link SourceRateLimiter}.
 *
 * <p>
 * Keeps one {@link FixedWindow} per {@code source:actor} key in a concurrent
 * map. Windows are rebuilt when a rule's limits change, and ended windows are
 * evicted once a minute.
 *
 * <p>
 * Can be disabled via {@code gatekeeper.rate-limit.enabled=false}.
 *
 * @since 1.0
 * @see FixedWindow
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FixedWindowRateLimiter implements SourceRateLimiter {

    private static final long SWEEP_INTERVAL_SECONDS = 60;

    private final GatekeeperProperties properties;
    private final Clock clock;

    private final Map<String, FixedWindow> windows = new ConcurrentHashMap<>();
    private ScheduledExecutorService sweeper;

    @PostConstruct
    void startSweeper() {
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "rate-limit-sweeper");
            t.setDaemon(true);
            return t;
        });
        sweeper.scheduleAtFixedRate(this::sweep, SWEEP_INTERVAL_SECONDS, SWEEP_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopSweeper() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
    }

    @Override
    public Optional<RuleProperties> findRule(String path) {
        if (!properties.getRateLimit().isEnabled() || path == null) {
            return Optional.empty();
        }
        return properties.getRateLimit().getRules().stream()
                .filter(rule -> rule.getPathPrefix() != null && path.startsWith(rule.getPathPrefix()))
                .max(Comparator.comparingInt(rule -> rule.getPathPrefix().length()));
    }

    @Override
    public RateLimitResult tryAcquire(RuleProperties rule, String actorKey) {
        String key = rule.getSource() + ":" + actorKey;
        Duration window = Duration.ofSeconds(rule.getWindowSeconds());
        FixedWindow fixedWindow = windows.compute(key, (k, existing) -> {
            if (existing == null
                    || existing.getMaxRequests() != rule.getMaxRequests()
                    || !existing.getWindow().equals(window)) {
                return new FixedWindow(rule.getMaxRequests(), window);
            }
            return existing;
        });

        RateLimitResult result = fixedWindow.tryAcquire(clock.instant());
        if (!result.isAllowed()) {
            log.debug("[RateLimit] Limit exceeded for {}", key);
        }
        return result;
    }

    public int sweep() {
        Instant now = clock.instant();
        int before = windows.size();
        windows.values().removeIf(window -> window.isExpired(now));
        return before - windows.size();
    }

    int size() {
        return windows.size();
    }
}
